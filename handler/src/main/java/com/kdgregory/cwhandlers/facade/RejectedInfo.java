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
 *  Identifies events that the service refused to accept, by their position
 *  in the submitted batch. Any of the indexes may be <code>null</code>.
 */
public class RejectedInfo
{
    private final Integer tooNewLogEventStartIndex;
    private final Integer tooOldLogEventEndIndex;
    private final Integer expiredLogEventEndIndex;


    public RejectedInfo(Integer tooNewLogEventStartIndex, Integer tooOldLogEventEndIndex, Integer expiredLogEventEndIndex)
    {
        this.tooNewLogEventStartIndex = tooNewLogEventStartIndex;
        this.tooOldLogEventEndIndex = tooOldLogEventEndIndex;
        this.expiredLogEventEndIndex = expiredLogEventEndIndex;
    }


    /**
     *  Index of the first event that was too far in the future.
     */
    public Integer getTooNewLogEventStartIndex()
    {
        return tooNewLogEventStartIndex;
    }


    /**
     *  Index of the last event that was older than the service accepts.
     */
    public Integer getTooOldLogEventEndIndex()
    {
        return tooOldLogEventEndIndex;
    }


    /**
     *  Index of the last event that was older than the group's retention period.
     */
    public Integer getExpiredLogEventEndIndex()
    {
        return expiredLogEventEndIndex;
    }


    @Override
    public String toString()
    {
        return "RejectedInfo[tooNewLogEventStartIndex=" + tooNewLogEventStartIndex
             + ", tooOldLogEventEndIndex=" + tooOldLogEventEndIndex
             + ", expiredLogEventEndIndex=" + expiredLogEventEndIndex
             + "]";
    }
}
