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

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.*;

import com.kdgregory.cwhandlers.cloudwatch.CloudWatchConstants;
import com.kdgregory.cwhandlers.cloudwatch.CloudWatchHandlerConfig;
import com.kdgregory.cwhandlers.common.LogEvent;
import com.kdgregory.cwhandlers.facade.CloudWatchFacade;
import com.kdgregory.cwhandlers.facade.DescribeResult;
import com.kdgregory.cwhandlers.facade.LogStreamDescription;
import com.kdgregory.cwhandlers.facade.PutEventsResult;
import com.kdgregory.cwhandlers.facade.RejectedInfo;
import com.kdgregory.cwhandlers.facade.ServiceResponse;
import com.kdgregory.cwhandlers.facade.v2.internal.ClientFactory;


/**
 *  Provides a facade over the CloudWatch Logs API using the v2 SDK.
 *  <p>
 *  Provisioning calls translate service errors in the 4xx range into a
 *  {@link ServiceResponse}; anything else is propagated unchanged.
 */
public class CloudWatchFacadeImpl
implements CloudWatchFacade
{
    // passed to constructor
    private CloudWatchHandlerConfig config;

    // lazily constructed; protected so that it can be set for testing
    protected CloudWatchLogsClient client;


    public CloudWatchFacadeImpl(CloudWatchHandlerConfig config)
    {
        this.config = config;
    }

//----------------------------------------------------------------------------
//  CloudWatchFacade
//----------------------------------------------------------------------------

    @Override
    public DescribeResult<String> describeLogGroups(String prefix, String nextToken)
    {
        DescribeLogGroupsRequest request = DescribeLogGroupsRequest.builder()
                                           .logGroupNamePrefix(prefix)
                                           .nextToken(nextToken)
                                           .build();
        DescribeLogGroupsResponse response = client().describeLogGroups(request);

        List<String> names = response.logGroups().stream()
                             .map(LogGroup::logGroupName)
                             .collect(Collectors.toList());
        return new DescribeResult<>(names, response.nextToken());
    }


    @Override
    public ServiceResponse createLogGroup(String groupName)
    {
        try
        {
            CreateLogGroupRequest request = CreateLogGroupRequest.builder()
                                            .logGroupName(groupName)
                                            .build();
            return toServiceResponse(client().createLogGroup(request));
        }
        catch (ResourceAlreadyExistsException ex)
        {
            return ServiceResponse.alreadyExists(ex.statusCode(), ex.getMessage());
        }
        catch (CloudWatchLogsException ex)
        {
            return toServiceResponse(ex);
        }
    }


    @Override
    public ServiceResponse setRetentionPolicy(String groupName, int retentionDays)
    {
        try
        {
            PutRetentionPolicyRequest request = PutRetentionPolicyRequest.builder()
                                                .logGroupName(groupName)
                                                .retentionInDays(retentionDays)
                                                .build();
            return toServiceResponse(client().putRetentionPolicy(request));
        }
        catch (CloudWatchLogsException ex)
        {
            return toServiceResponse(ex);
        }
    }


    @Override
    public DescribeResult<LogStreamDescription> describeLogStreams(String groupName, String prefix, String nextToken)
    {
        DescribeLogStreamsRequest request = DescribeLogStreamsRequest.builder()
                                            .logGroupName(groupName)
                                            .logStreamNamePrefix(prefix)
                                            .nextToken(nextToken)
                                            .build();
        try
        {
            DescribeLogStreamsResponse response = client().describeLogStreams(request);
            List<LogStreamDescription> streams = response.logStreams().stream()
                                                 .map(s -> new LogStreamDescription(s.logStreamName(), s.uploadSequenceToken()))
                                                 .collect(Collectors.toList());
            return new DescribeResult<>(streams, response.nextToken());
        }
        catch (ResourceNotFoundException ex)
        {
            // group was deleted; createLogStream will report the problem
            return new DescribeResult<>(Collections.<LogStreamDescription>emptyList(), null);
        }
    }


    @Override
    public ServiceResponse createLogStream(String groupName, String streamName)
    {
        try
        {
            CreateLogStreamRequest request = CreateLogStreamRequest.builder()
                                             .logGroupName(groupName)
                                             .logStreamName(streamName)
                                             .build();
            return toServiceResponse(client().createLogStream(request));
        }
        catch (ResourceAlreadyExistsException ex)
        {
            return ServiceResponse.alreadyExists(ex.statusCode(), ex.getMessage());
        }
        catch (CloudWatchLogsException ex)
        {
            return toServiceResponse(ex);
        }
    }


    @Override
    public PutEventsResult putEvents(String groupName, String streamName, List<LogEvent> events, String sequenceToken)
    {
        List<InputLogEvent> inputEvents
                = events.stream()
                  .map(e -> InputLogEvent.builder().timestamp(e.getTimestamp()).message(e.getMessage()).build())
                  .collect(Collectors.toList());

        // a never-written stream has no token, and the service rejects a made-up one
        String token = CloudWatchConstants.INITIAL_SEQUENCE_TOKEN.equals(sequenceToken) ? null : sequenceToken;

        PutLogEventsRequest request
                = PutLogEventsRequest.builder()
                  .logGroupName(groupName)
                  .logStreamName(streamName)
                  .logEvents(inputEvents)
                  .sequenceToken(token)
                  .build();

        PutLogEventsResponse response = client().putLogEvents(request);
        if (response == null)
            return null;

        RejectedLogEventsInfo rejected = response.rejectedLogEventsInfo();
        RejectedInfo rejectedInfo = (rejected == null)
                                  ? null
                                  : new RejectedInfo(rejected.tooNewLogEventStartIndex(),
                                                     rejected.tooOldLogEventEndIndex(),
                                                     rejected.expiredLogEventEndIndex());
        return new PutEventsResult(response.nextSequenceToken(), rejectedInfo);
    }


    @Override
    public void shutdown()
    {
        // don't create a client just to close it
        if (client != null)
        {
            client.close();
        }
    }

//----------------------------------------------------------------------------
//  Internals
//----------------------------------------------------------------------------

    /**
     *  Returns the CloudWatch Logs client, lazily constructing it if needed.
     *  <p>
     *  This method is not threadsafe; callers must serialize access to the facade.
     */
    protected CloudWatchLogsClient client()
    {
        if (client == null)
        {
            client = new ClientFactory<>(CloudWatchLogsClient.class, config).create();
        }

        return client;
    }


    private static ServiceResponse toServiceResponse(CloudWatchLogsResponse response)
    {
        int statusCode = (response.sdkHttpResponse() != null)
                       ? response.sdkHttpResponse().statusCode()
                       : ServiceResponse.STATUS_OK;
        return new ServiceResponse(statusCode, null, false);
    }


    /**
     *  Converts a client error into a response; rethrows anything else.
     */
    private static ServiceResponse toServiceResponse(CloudWatchLogsException ex)
    {
        int statusCode = ex.statusCode();
        if ((statusCode >= 400) && (statusCode < 500))
            return new ServiceResponse(statusCode, ex.getMessage(), false);

        throw ex;
    }
}
