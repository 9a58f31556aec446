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

package com.kdgregory.cwhandlers.facade;

import java.util.List;

import com.kdgregory.cwhandlers.common.LogEvent;


/**
 *  Exposes the CloudWatch Logs APIs used by <code>CloudWatchLogsHandler</code>.
 *  <p>
 *  Instances are created by {@link FacadeFactory}; they hold a service client
 *  but no knowledge of which group or stream is being written, so every call
 *  takes the names explicitly.
 *  <p>
 *  Provisioning calls report client errors via their {@link ServiceResponse};
 *  all other failures (network, authorization, throttling) are thrown as the
 *  SDK's own exceptions.
 */
public interface CloudWatchFacade
{
    /**
     *  Returns one page of log group names that start with the given prefix.
     *  Pass <code>null</code> as the token to retrieve the first page, and the
     *  prior result's token to retrieve subsequent pages.
     */
    DescribeResult<String> describeLogGroups(String prefix, String nextToken);


    /**
     *  Attempts to create the named log group.
     */
    ServiceResponse createLogGroup(String groupName);


    /**
     *  Sets the retention period, in days, of the named log group.
     */
    ServiceResponse setRetentionPolicy(String groupName, int retentionDays);


    /**
     *  Returns one page of log streams within the given group whose names start
     *  with the given prefix. Token semantics are the same as for
     *  {@link #describeLogGroups}.
     */
    DescribeResult<LogStreamDescription> describeLogStreams(String groupName, String prefix, String nextToken);


    /**
     *  Attempts to create the named log stream.
     */
    ServiceResponse createLogStream(String groupName, String streamName);


    /**
     *  Writes a batch of events.
     *
     *  @param  events          The events to send, in the order they were emitted.
     *                          The caller ensures that the batch is within the
     *                          service's count and size limits.
     *  @param  sequenceToken   The stream's current upload sequence token. The value
     *                          "0" indicates a stream that has never been written.
     *
     *  @return The service response, <code>null</code> if the service did not return one.
     */
    PutEventsResult putEvents(String groupName, String streamName, List<LogEvent> events, String sequenceToken);


    /**
     *  Shuts down the underlying client.
     */
    void shutdown();
}
