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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;


/**
 *  Configuration for <code>CloudWatchLogsHandler</code>.
 *  <p>
 *  The handler reads this object only at construction; changing it afterward
 *  has no effect.
 */
public class CloudWatchHandlerConfig
{
    public final static String          DEFAULT_LOG_STREAM_NAME     = null; // derived from current date
    public final static Integer         DEFAULT_CAPACITY            = null; // CloudWatchConstants.DEFAULT_CAPACITY
    public final static Integer         DEFAULT_RETENTION_PERIOD    = null; // unlimited
    public final static String          DEFAULT_TRUNCATION_SUFFIX   = CloudWatchConstants.DEFAULT_TRUNCATION_SUFFIX;
    public final static RejectionPolicy DEFAULT_REJECTION_POLICY    = RejectionPolicy.RETAIN;


    private String                      logGroupName;
    private String                      logStreamName               = DEFAULT_LOG_STREAM_NAME;
    private Integer                     capacity                    = DEFAULT_CAPACITY;
    private Integer                     retentionPeriod             = DEFAULT_RETENTION_PERIOD;
    private String                      truncationSuffix            = DEFAULT_TRUNCATION_SUFFIX;
    private RejectionPolicy             rejectionPolicy             = DEFAULT_REJECTION_POLICY;
    private String                      clientFactoryMethod;
    private String                      clientRegion;
    private String                      clientEndpoint;


    public String getLogGroupName()
    {
        return logGroupName;
    }

    public CloudWatchHandlerConfig setLogGroupName(String value)
    {
        logGroupName = value;
        return this;
    }


    /**
     *  Returns the configured stream name; <code>null</code> means that the
     *  handler will use the current date.
     */
    public String getLogStreamName()
    {
        return logStreamName;
    }

    public CloudWatchHandlerConfig setLogStreamName(String value)
    {
        logStreamName = ((value != null) && value.isEmpty()) ? null : value;
        return this;
    }


    public Integer getCapacity()
    {
        return capacity;
    }

    public CloudWatchHandlerConfig setCapacity(Integer value)
    {
        capacity = value;
        return this;
    }


    /**
     *  Returns the number of events that will be buffered. An unset or zero
     *  capacity is replaced by the default.
     */
    public int getEffectiveCapacity()
    {
        return ((capacity == null) || (capacity.intValue() == 0))
             ? CloudWatchConstants.DEFAULT_CAPACITY
             : capacity.intValue();
    }


    public Integer getRetentionPeriod()
    {
        return retentionPeriod;
    }

    public CloudWatchHandlerConfig setRetentionPeriod(Integer value)
    {
        retentionPeriod = value;
        return this;
    }


    public String getTruncationSuffix()
    {
        return truncationSuffix;
    }

    public CloudWatchHandlerConfig setTruncationSuffix(String value)
    {
        truncationSuffix = (value != null) ? value : "";
        return this;
    }


    public RejectionPolicy getRejectionPolicy()
    {
        return rejectionPolicy;
    }

    public CloudWatchHandlerConfig setRejectionPolicy(RejectionPolicy value)
    {
        rejectionPolicy = (value != null) ? value : DEFAULT_REJECTION_POLICY;
        return this;
    }


    public String getClientFactoryMethod()
    {
        return clientFactoryMethod;
    }

    public CloudWatchHandlerConfig setClientFactoryMethod(String value)
    {
        clientFactoryMethod = value;
        return this;
    }


    public String getClientRegion()
    {
        return clientRegion;
    }

    public CloudWatchHandlerConfig setClientRegion(String value)
    {
        clientRegion = value;
        return this;
    }


    public String getClientEndpoint()
    {
        return clientEndpoint;
    }

    public CloudWatchHandlerConfig setClientEndpoint(String value)
    {
        clientEndpoint = value;
        return this;
    }


    /**
     *  Validates the configuration, returning a list of any validation errors.
     *  An empty list indicates a valid config.
     */
    public List<String> validate()
    {
        List<String> result = new ArrayList<>();

        if (logGroupName == null)
        {
            result.add("missing log group name");
        }
        else if (logGroupName.isEmpty())
        {
            result.add("blank log group name");
        }
        else if (! Pattern.matches(CloudWatchConstants.ALLOWED_GROUP_NAME_REGEX, logGroupName))
        {
            result.add("invalid log group name: " + logGroupName);
        }

        if ((logStreamName != null) && ! Pattern.matches(CloudWatchConstants.ALLOWED_STREAM_NAME_REGEX, logStreamName))
        {
            result.add("invalid log stream name: " + logStreamName);
        }

        if ((capacity != null) && ((capacity.intValue() < 0) || (capacity.intValue() > CloudWatchConstants.MAX_BATCH_COUNT)))
        {
            result.add("capacity not in range 0 ... " + CloudWatchConstants.MAX_BATCH_COUNT + ": " + capacity);
        }

        try
        {
            CloudWatchConstants.validateRetentionPeriod(retentionPeriod);
        }
        catch (IllegalArgumentException ex)
        {
            result.add(ex.getMessage());
        }

        return result;
    }
}
