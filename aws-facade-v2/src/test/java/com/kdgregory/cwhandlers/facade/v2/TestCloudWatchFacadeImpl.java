// Copyright (c) Keith D Gregory
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.kdgregory.cwhandlers.facade.v2;

import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

import static net.sf.kdgcommons.test.StringAsserts.*;

import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.*;

import com.kdgregory.cwhandlers.cloudwatch.CloudWatchHandlerConfig;
import com.kdgregory.cwhandlers.cloudwatch.CloudWatchHandlerStatistics;
import com.kdgregory.cwhandlers.cloudwatch.CloudWatchLogsHandler;
import com.kdgregory.cwhandlers.common.LogEvent;
import com.kdgregory.cwhandlers.common.RecordFormatter;
import com.kdgregory.cwhandlers.common.util.NullInternalLogger;
import com.kdgregory.cwhandlers.facade.CloudWatchFacade;
import com.kdgregory.cwhandlers.facade.DescribeResult;
import com.kdgregory.cwhandlers.facade.LogStreamDescription;
import com.kdgregory.cwhandlers.facade.PutEventsResult;
import com.kdgregory.cwhandlers.facade.ServiceResponse;
import com.kdgregory.cwhandlers.testhelpers.CloudWatchClientMock;


public class TestCloudWatchFacadeImpl
{
    private final static List<String> KNOWN_LOG_GROUPS = Arrays.asList("argle", "bargle", "wargle", "zargle");
    private final static List<String> KNOWN_LOG_STREAMS = Arrays.asList("foo", "bar", "baz", "biff");

    private final static String TEST_LOG_GROUP = "zargle";
    private final static String TEST_LOG_STREAM = "biff";

    // must not appear in the "known" lists above
    private final static String UNKNOWN_LOG_GROUP = "zippy";

    private CloudWatchHandlerConfig config = new CloudWatchHandlerConfig()
                                             .setLogGroupName(TEST_LOG_GROUP)
                                             .setLogStreamName(TEST_LOG_STREAM);

    // default mock has the list of known groups/streams
    private CloudWatchClientMock mock = new CloudWatchClientMock(KNOWN_LOG_GROUPS, KNOWN_LOG_STREAMS);

    // note: can update mock any time before making first call
    private CloudWatchFacade facade = new CloudWatchFacadeImpl(config)
    {
        @Override
        protected CloudWatchLogsClient client()
        {
            if (client == null)
            {
                client = mock.createClient();
            }
            return client;
        }
    };


    // the following variable and function are used by the end-to-end test

    private static CloudWatchClientMock staticFactoryMock;

    public static CloudWatchLogsClient createMockClient()
    {
        return staticFactoryMock.createClient();
    }

//----------------------------------------------------------------------------
//  Helpers
//----------------------------------------------------------------------------

    private static List<LogEvent> events(String... messages)
    {
        LogEvent[] result = new LogEvent[messages.length];
        for (int ii = 0 ; ii < messages.length ; ii++)
        {
            result[ii] = new LogEvent(1000L + ii, messages[ii]);
        }
        return Arrays.asList(result);
    }

//----------------------------------------------------------------------------
//  JUnit stuff
//----------------------------------------------------------------------------

    @Before
    public void setUp()
    {
        staticFactoryMock = null;
    }

//----------------------------------------------------------------------------
//  Testcases
//----------------------------------------------------------------------------

    @Test
    public void testDescribeLogGroups() throws Exception
    {
        DescribeResult<String> result = facade.describeLogGroups("arg", null);

        assertEquals("prefix passed to describeLogGroups",  "arg",                      mock.describeLogGroupsRequest.logGroupNamePrefix());
        assertNull("no token passed to describeLogGroups",                              mock.describeLogGroupsRequest.nextToken());
        assertEquals("returned names",                      Arrays.asList("argle"),     result.getItems());
        assertNull("no next token",                                                     result.getNextToken());
    }


    @Test
    public void testDescribeLogGroupsPaginated() throws Exception
    {
        mock = new CloudWatchClientMock(KNOWN_LOG_GROUPS, 3, KNOWN_LOG_STREAMS, 3);

        DescribeResult<String> page1 = facade.describeLogGroups("", null);
        assertEquals("first page",          Arrays.asList("argle", "bargle", "wargle"),     page1.getItems());
        assertEquals("first page token",    "3",                                            page1.getNextToken());

        DescribeResult<String> page2 = facade.describeLogGroups("", page1.getNextToken());
        assertEquals("token passed to describeLogGroups",  "3",                             mock.describeLogGroupsRequest.nextToken());
        assertEquals("second page",         Arrays.asList("zargle"),                        page2.getItems());
        assertNull("second page token",                                                     page2.getNextToken());
    }


    @Test
    public void testCreateLogGroupHappyPath() throws Exception
    {
        ServiceResponse response = facade.createLogGroup(UNKNOWN_LOG_GROUP);

        assertEquals("createLogGroup: invocation count",    1,                  mock.createLogGroupInvocationCount);
        assertEquals("createLogGroup: group name",          UNKNOWN_LOG_GROUP,  mock.createLogGroupRequest.logGroupName());
        assertEquals("response status",                     200,                response.getStatusCode());
        assertFalse("not a client error",                                       response.isClientError());
        assertFalse("not already exists",                                       response.isAlreadyExists());
    }


    @Test
    public void testCreateLogGroupAlreadyExists() throws Exception
    {
        mock = new CloudWatchClientMock(KNOWN_LOG_GROUPS, KNOWN_LOG_STREAMS)
        {
            @Override
            protected CreateLogGroupResponse createLogGroup(CreateLogGroupRequest request)
            {
                throw ResourceAlreadyExistsException.builder().message("already exists").statusCode(400).build();
            }
        };

        ServiceResponse response = facade.createLogGroup(TEST_LOG_GROUP);

        assertTrue("already exists",                                            response.isAlreadyExists());
        assertFalse("not a client error",                                       response.isClientError());
        assertEquals("response status",                     400,                response.getStatusCode());
    }


    @Test
    public void testCreateLogGroupClientError() throws Exception
    {
        mock = new CloudWatchClientMock(KNOWN_LOG_GROUPS, KNOWN_LOG_STREAMS)
        {
            @Override
            protected CreateLogGroupResponse createLogGroup(CreateLogGroupRequest request)
            {
                throw InvalidParameterException.builder().message("bad name").statusCode(400).build();
            }
        };

        ServiceResponse response = facade.createLogGroup(TEST_LOG_GROUP);

        assertTrue("client error",                                              response.isClientError());
        assertEquals("response status",                     400,                response.getStatusCode());
        assertRegex("response detail",                      ".*bad name.*",     response.getDetail());
    }


    @Test
    public void testCreateLogGroupServerError() throws Exception
    {
        final ServiceUnavailableException cause = (ServiceUnavailableException)
                ServiceUnavailableException.builder().message("try later").statusCode(503).build();
        mock = new CloudWatchClientMock(KNOWN_LOG_GROUPS, KNOWN_LOG_STREAMS)
        {
            @Override
            protected CreateLogGroupResponse createLogGroup(CreateLogGroupRequest request)
            {
                throw cause;
            }
        };

        try
        {
            facade.createLogGroup(TEST_LOG_GROUP);
            fail("should have thrown");
        }
        catch (ServiceUnavailableException ex)
        {
            assertSame("propagated exception", cause, ex);
        }
    }


    @Test
    public void testSetRetentionPolicy() throws Exception
    {
        ServiceResponse response = facade.setRetentionPolicy(TEST_LOG_GROUP, 7);

        assertEquals("putRetentionPolicy: invocation count",    1,                  mock.putRetentionPolicyInvocationCount);
        assertEquals("putRetentionPolicy: group name",          TEST_LOG_GROUP,     mock.putRetentionPolicyRequest.logGroupName());
        assertEquals("putRetentionPolicy: days",                Integer.valueOf(7), mock.putRetentionPolicyRequest.retentionInDays());
        assertFalse("not a client error",                                           response.isClientError());
    }


    @Test
    public void testSetRetentionPolicyInvalidValue() throws Exception
    {
        mock = new CloudWatchClientMock(KNOWN_LOG_GROUPS, KNOWN_LOG_STREAMS)
        {
            @Override
            protected PutRetentionPolicyResponse putRetentionPolicy(PutRetentionPolicyRequest request)
            {
                throw InvalidParameterException.builder().message("invalid retention").statusCode(400).build();
            }
        };

        ServiceResponse response = facade.setRetentionPolicy(TEST_LOG_GROUP, 2);

        assertTrue("client error",                              response.isClientError());
        assertRegex("response detail",  ".*invalid retention.*", response.getDetail());
    }


    @Test
    public void testDescribeLogStreams() throws Exception
    {
        mock.sequenceTokens.put("biff", "12345");

        DescribeResult<LogStreamDescription> result = facade.describeLogStreams(TEST_LOG_GROUP, "b", null);

        assertEquals("group passed to describeLogStreams",      TEST_LOG_GROUP,     mock.describeLogStreamsRequest.logGroupName());
        assertEquals("prefix passed to describeLogStreams",     "b",                mock.describeLogStreamsRequest.logStreamNamePrefix());
        assertEquals("number of streams",                       3,                  result.getItems().size());
        assertEquals("first stream name",                       "bar",              result.getItems().get(0).getName());
        assertNull("first stream token",                                            result.getItems().get(0).getUploadSequenceToken());
        assertEquals("last stream name",                        "biff",             result.getItems().get(2).getName());
        assertEquals("last stream token",                       "12345",            result.getItems().get(2).getUploadSequenceToken());
    }


    @Test
    public void testDescribeLogStreamsMissingGroup() throws Exception
    {
        DescribeResult<LogStreamDescription> result = facade.describeLogStreams(UNKNOWN_LOG_GROUP, "foo", null);

        assertEquals("number of streams",  0,  result.getItems().size());
        assertNull("next token",                result.getNextToken());
    }


    @Test
    public void testCreateLogStreamHappyPath() throws Exception
    {
        ServiceResponse response = facade.createLogStream(TEST_LOG_GROUP, "fribble");

        assertEquals("createLogStream: group name",     TEST_LOG_GROUP,     mock.createLogStreamRequest.logGroupName());
        assertEquals("createLogStream: stream name",    "fribble",          mock.createLogStreamRequest.logStreamName());
        assertFalse("not a client error",                                   response.isClientError());
    }


    @Test
    public void testCreateLogStreamMissingGroup() throws Exception
    {
        mock = new CloudWatchClientMock(KNOWN_LOG_GROUPS, KNOWN_LOG_STREAMS)
        {
            @Override
            protected CreateLogStreamResponse createLogStream(CreateLogStreamRequest request)
            {
                throw ResourceNotFoundException.builder().message("no such group").statusCode(400).build();
            }
        };

        ServiceResponse response = facade.createLogStream(UNKNOWN_LOG_GROUP, "fribble");

        assertTrue("client error",                                          response.isClientError());
        assertRegex("response detail",      ".*no such group.*",            response.getDetail());
    }


    @Test
    public void testCreateLogStreamAlreadyExists() throws Exception
    {
        mock = new CloudWatchClientMock(KNOWN_LOG_GROUPS, KNOWN_LOG_STREAMS)
        {
            @Override
            protected CreateLogStreamResponse createLogStream(CreateLogStreamRequest request)
            {
                throw ResourceAlreadyExistsException.builder().message("already exists").statusCode(400).build();
            }
        };

        ServiceResponse response = facade.createLogStream(TEST_LOG_GROUP, TEST_LOG_STREAM);

        assertTrue("already exists",                                        response.isAlreadyExists());
        assertFalse("not a client error",                                   response.isClientError());
    }


    @Test
    public void testPutEventsToNewStream() throws Exception
    {
        PutEventsResult result = facade.putEvents(TEST_LOG_GROUP, TEST_LOG_STREAM, events("first", "second"), "0");

        PutLogEventsRequest request = mock.putLogEventsRequest;
        assertEquals("putLogEvents: group name",        TEST_LOG_GROUP,     request.logGroupName());
        assertEquals("putLogEvents: stream name",       TEST_LOG_STREAM,    request.logStreamName());
        assertNull("putLogEvents: no sequence token",                       request.sequenceToken());
        assertEquals("putLogEvents: number of events",  2,                  request.logEvents().size());
        assertEquals("first event message",             "first",            request.logEvents().get(0).message());
        assertEquals("first event timestamp",           Long.valueOf(1000), request.logEvents().get(0).timestamp());
        assertEquals("second event message",            "second",           request.logEvents().get(1).message());

        assertEquals("next sequence token",             "1000",             result.getNextSequenceToken());
        assertNull("no rejected events",                                    result.getRejectedInfo());
    }


    @Test
    public void testPutEventsWithSequenceToken() throws Exception
    {
        mock.sequenceTokens.put(TEST_LOG_STREAM, "4321");

        PutEventsResult result = facade.putEvents(TEST_LOG_GROUP, TEST_LOG_STREAM, events("message"), "4321");

        assertEquals("putLogEvents: sequence token",    "4321",             mock.putLogEventsRequest.sequenceToken());
        assertEquals("next sequence token",             "4322",             result.getNextSequenceToken());
    }


    @Test
    public void testPutEventsRejected() throws Exception
    {
        mock = new CloudWatchClientMock(KNOWN_LOG_GROUPS, KNOWN_LOG_STREAMS)
        {
            @Override
            protected PutLogEventsResponse putLogEvents(PutLogEventsRequest request)
            {
                return PutLogEventsResponse.builder()
                       .nextSequenceToken("99")
                       .rejectedLogEventsInfo(RejectedLogEventsInfo.builder()
                                              .tooOldLogEventEndIndex(1)
                                              .expiredLogEventEndIndex(0)
                                              .build())
                       .build();
            }
        };

        PutEventsResult result = facade.putEvents(TEST_LOG_GROUP, TEST_LOG_STREAM, events("first", "second"), "0");

        assertNotNull("rejected info",                                          result.getRejectedInfo());
        assertNull("too new index",                                             result.getRejectedInfo().getTooNewLogEventStartIndex());
        assertEquals("too old index",           Integer.valueOf(1),             result.getRejectedInfo().getTooOldLogEventEndIndex());
        assertEquals("expired index",           Integer.valueOf(0),             result.getRejectedInfo().getExpiredLogEventEndIndex());
    }


    @Test
    public void testPutEventsEmptyResponse() throws Exception
    {
        mock = new CloudWatchClientMock(KNOWN_LOG_GROUPS, KNOWN_LOG_STREAMS)
        {
            @Override
            protected PutLogEventsResponse putLogEvents(PutLogEventsRequest request)
            {
                return null;
            }
        };

        assertNull("result", facade.putEvents(TEST_LOG_GROUP, TEST_LOG_STREAM, events("message"), "0"));
    }


    @Test
    public void testPutEventsInvalidSequenceToken() throws Exception
    {
        mock.sequenceTokens.put(TEST_LOG_STREAM, "4321");

        try
        {
            facade.putEvents(TEST_LOG_GROUP, TEST_LOG_STREAM, events("message"), "1234");
            fail("should have thrown");
        }
        catch (InvalidSequenceTokenException ex)
        {
            assertEquals("expected token in exception", "4321", ex.expectedSequenceToken());
        }
    }


    @Test
    public void testShutdown() throws Exception
    {
        facade.describeLogGroups(TEST_LOG_GROUP, null);
        facade.shutdown();

        assertEquals("close: invocation count", 1, mock.closeInvocationCount);
    }


    @Test
    public void testShutdownWithoutClient() throws Exception
    {
        facade.shutdown();

        assertEquals("close: invocation count", 0, mock.closeInvocationCount);
        assertNull("client not created", ((CloudWatchFacadeImpl)facade).client);
    }


    @Test
    public void testHandlerUsesFacadeViaFactory() throws Exception
    {
        staticFactoryMock = new CloudWatchClientMock(Arrays.asList("argle"), Arrays.<String>asList());

        CloudWatchHandlerConfig handlerConfig = new CloudWatchHandlerConfig()
                                                .setLogGroupName("argle")
                                                .setLogStreamName("bargle")
                                                .setRetentionPeriod(14)
                                                .setClientFactoryMethod(getClass().getName() + ".createMockClient");

        RecordFormatter<String> formatter = new RecordFormatter<String>()
        {
            @Override
            public String format(String record)
            {
                return record;
            }

            @Override
            public long timestamp(String record)
            {
                return 1234L;
            }
        };

        CloudWatchHandlerStatistics stats = new CloudWatchHandlerStatistics();
        CloudWatchLogsHandler<String> handler = new CloudWatchLogsHandler<>(handlerConfig, formatter, stats, NullInternalLogger.INSTANCE);

        handler.emit("hello");
        handler.emit("world");
        handler.close();

        assertEquals("createLogGroup: invocation count",        0,          staticFactoryMock.createLogGroupInvocationCount);
        assertEquals("putRetentionPolicy: invocation count",    0,          staticFactoryMock.putRetentionPolicyInvocationCount);
        assertEquals("createLogStream: invocation count",       1,          staticFactoryMock.createLogStreamInvocationCount);
        assertEquals("putLogEvents: invocation count",          1,          staticFactoryMock.putLogEventsInvocationCount);
        assertNull("putLogEvents: sequence token",                          staticFactoryMock.putLogEventsRequest.sequenceToken());
        assertEquals("putLogEvents: events",                    2,          staticFactoryMock.putLogEventsRequest.logEvents().size());
        assertEquals("close: invocation count",                 1,          staticFactoryMock.closeInvocationCount);
        assertEquals("stats: events sent",                      2,          stats.getEventsSent());
    }
}
