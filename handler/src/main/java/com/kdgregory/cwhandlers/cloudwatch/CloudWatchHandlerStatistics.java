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

import java.util.concurrent.atomic.AtomicInteger;


/**
 *  Operational statistics for a single handler. These are written by the
 *  handler and may be read from any thread.
 */
public class CloudWatchHandlerStatistics
{
    private volatile String  actualLogGroupName;
    private volatile String  actualLogStreamName;
    private volatile int     lastBatchSize;
    private volatile String  lastErrorMessage;
    private volatile Throwable lastError;

    private AtomicInteger eventsSent = new AtomicInteger(0);
    private AtomicInteger batchesSent = new AtomicInteger(0);
    private AtomicInteger batchesRejected = new AtomicInteger(0);


    public String getActualLogGroupName()
    {
        return actualLogGroupName;
    }

    public void setActualLogGroupName(String value)
    {
        actualLogGroupName = value;
    }


    /**
     *  Returns the name of the stream used by the most recent flush. This may
     *  change over time if the handler derives stream names from the date.
     */
    public String getActualLogStreamName()
    {
        return actualLogStreamName;
    }

    public void setActualLogStreamName(String value)
    {
        actualLogStreamName = value;
    }


    public int getLastBatchSize()
    {
        return lastBatchSize;
    }

    public void setLastBatchSize(int value)
    {
        lastBatchSize = value;
    }


    public int getEventsSent()
    {
        return eventsSent.get();
    }


    public int getBatchesSent()
    {
        return batchesSent.get();
    }


    /**
     *  Records a successful batch.
     */
    public void updateSent(int batchSize)
    {
        eventsSent.addAndGet(batchSize);
        batchesSent.incrementAndGet();
    }


    public int getBatchesRejected()
    {
        return batchesRejected.get();
    }

    public void incrementBatchesRejected()
    {
        batchesRejected.incrementAndGet();
    }


    public String getLastErrorMessage()
    {
        return lastErrorMessage;
    }


    public Throwable getLastError()
    {
        return lastError;
    }


    /**
     *  Records the most recent failure. Message defaults to the exception's
     *  message if null.
     */
    public void setLastError(String message, Throwable ex)
    {
        lastErrorMessage = ((message == null) && (ex != null)) ? ex.getMessage() : message;
        lastError = ex;
    }
}
