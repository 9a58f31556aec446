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


/**
 *  The service's response to a batch write. A successful call may still
 *  report rejected events.
 */
public class PutEventsResult
{
    private final String nextSequenceToken;
    private final RejectedInfo rejectedInfo;


    public PutEventsResult(String nextSequenceToken, RejectedInfo rejectedInfo)
    {
        this.nextSequenceToken = nextSequenceToken;
        this.rejectedInfo = rejectedInfo;
    }


    public String getNextSequenceToken()
    {
        return nextSequenceToken;
    }


    /**
     *  Returns information about rejected events, <code>null</code> if all
     *  events were accepted.
     */
    public RejectedInfo getRejectedInfo()
    {
        return rejectedInfo;
    }
}
