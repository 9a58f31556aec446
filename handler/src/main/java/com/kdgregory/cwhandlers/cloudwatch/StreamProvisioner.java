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

package com.kdgregory.cwhandlers.cloudwatch;

import com.kdgregory.cwhandlers.common.ProvisioningException;
import com.kdgregory.cwhandlers.common.util.InternalLogger;
import com.kdgregory.cwhandlers.facade.CloudWatchFacade;
import com.kdgregory.cwhandlers.facade.DescribeResult;
import com.kdgregory.cwhandlers.facade.LogStreamDescription;
import com.kdgregory.cwhandlers.facade.ServiceResponse;


/**
 *  Finds or creates log groups and streams.
 *  <p>
 *  The describe APIs search by prefix, so every page is scanned for an exact
 *  name match; the search stops at the first match or when the service stops
 *  returning a next-page token.
 *  <p>
 *  Nothing here is cached: the stream's sequence token may be advanced by
 *  another writer at any time, so it's retrieved anew for every batch.
 */
public class StreamProvisioner
{
    private CloudWatchFacade facade;
    private InternalLogger logger;


    public StreamProvisioner(CloudWatchFacade facade, InternalLogger logger)
    {
        this.facade = facade;
        this.logger = logger;
    }


    /**
     *  Ensures that the named log group exists, creating it if necessary. The
     *  retention period is only applied to a group created by this call; an
     *  existing group keeps whatever policy it has.
     *
     *  @param  groupName       The log group name.
     *  @param  retentionDays   Retention period in days; <code>null</code> for
     *                          unlimited retention.
     *
     *  @return <code>true</code> if this call created the group.
     *
     *  @throws ProvisioningException if the service reports a client error when
     *          creating the group or setting its retention period.
     */
    public boolean ensureGroup(String groupName, Integer retentionDays)
    {
        logger.debug("checking for existence of CloudWatch log group: " + groupName);
        if (findLogGroup(groupName))
        {
            logger.debug("using existing CloudWatch log group: " + groupName);
            return false;
        }

        logger.debug("creating CloudWatch log group: " + groupName);
        ServiceResponse response = facade.createLogGroup(groupName);
        if (response.isClientError())
            throw new ProvisioningException("createLogGroup", response);

        if (response.isAlreadyExists())
        {
            // another writer got there first; its retention policy wins
            logger.debug("CloudWatch log group created by another writer: " + groupName);
            return false;
        }

        if (retentionDays != null)
        {
            logger.debug("setting retention period to: " + retentionDays);
            response = facade.setRetentionPolicy(groupName, retentionDays.intValue());
            if (response.isClientError())
                throw new ProvisioningException("setRetentionPolicy", response);
        }

        return true;
    }


    /**
     *  Ensures that the named stream exists within the named group, creating it
     *  if necessary, and returns the sequence token for the next write.
     *
     *  @return The stream's upload sequence token, or {@link CloudWatchConstants#INITIAL_SEQUENCE_TOKEN}
     *          if the stream is new or has never been written.
     *
     *  @throws ProvisioningException if the service reports a client error when
     *          creating the stream.
     */
    public String ensureStream(String groupName, String streamName)
    {
        LogStreamDescription stream = findLogStream(groupName, streamName);
        if (stream != null)
        {
            String token = stream.getUploadSequenceToken();
            return (token != null) ? token : CloudWatchConstants.INITIAL_SEQUENCE_TOKEN;
        }

        logger.debug("creating CloudWatch log stream: " + streamName);
        ServiceResponse response = facade.createLogStream(groupName, streamName);
        if (response.isClientError())
            throw new ProvisioningException("createLogStream", response);

        // if another writer created it, we'll lose the race on first write and
        // the caller will see an invalid-token exception
        return CloudWatchConstants.INITIAL_SEQUENCE_TOKEN;
    }


    /**
     *  Determines whether the named log group exists.
     */
    public boolean findLogGroup(String groupName)
    {
        String nextToken = null;
        do
        {
            DescribeResult<String> page = facade.describeLogGroups(groupName, nextToken);
            for (String name : page.getItems())
            {
                if (name.equals(groupName))
                    return true;
            }
            nextToken = page.getNextToken();
        }
        while (nextToken != null);

        return false;
    }


    /**
     *  Returns the description of the named stream, <code>null</code> if it
     *  doesn't exist.
     */
    public LogStreamDescription findLogStream(String groupName, String streamName)
    {
        String nextToken = null;
        do
        {
            DescribeResult<LogStreamDescription> page = facade.describeLogStreams(groupName, streamName, nextToken);
            for (LogStreamDescription stream : page.getItems())
            {
                if (stream.getName().equals(streamName))
                    return stream;
            }
            nextToken = page.getNextToken();
        }
        while (nextToken != null);

        return null;
    }
}
