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

import com.kdgregory.cwhandlers.common.LogEvent;


/**
 *  The result of formatting a record: the event, and the number of bytes
 *  that it contributes to a batch (encoded message plus per-event overhead).
 */
public class FormattedEvent
{
    private final int size;
    private final LogEvent event;


    public FormattedEvent(int size, LogEvent event)
    {
        this.size = size;
        this.event = event;
    }


    public int getSize()
    {
        return size;
    }


    public LogEvent getEvent()
    {
        return event;
    }
}
