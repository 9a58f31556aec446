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

package com.kdgregory.cwhandlers.common;

import com.kdgregory.cwhandlers.facade.RejectedInfo;


/**
 *  Thrown by <code>flush()</code> when the service accepted the request but
 *  rejected some of its events, or returned an empty response.
 *  <p>
 *  Whether the buffered events survive this exception depends on the handler's
 *  rejection policy; with the default policy they're retained and will be
 *  resubmitted by the next flush. A caller that neither retries nor drains the
 *  handler will see its buffer grow.
 */
public class DeliveryException
extends LogsHandlerException
{
    private static final long serialVersionUID = 1L;

    private final transient RejectedInfo rejectedInfo;
    private final int batchSize;


    public DeliveryException(String message, RejectedInfo rejectedInfo, int batchSize)
    {
        super(message);
        this.rejectedInfo = rejectedInfo;
        this.batchSize = batchSize;
    }


    /**
     *  Returns the rejection details reported by the service, <code>null</code>
     *  if the failure was an empty response.
     */
    public RejectedInfo getRejectedInfo()
    {
        return rejectedInfo;
    }


    /**
     *  Returns the number of events in the failed batch.
     */
    public int getBatchSize()
    {
        return batchSize;
    }
}
