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

package com.kdgregory.cwhandlers.logback.internal;

import com.kdgregory.cwhandlers.common.RecordFormatter;

import ch.qos.logback.access.spi.IAccessEvent;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Layout;


/**
 *  Formats Logback events using the appender's layout.
 */
public class LayoutRecordFormatter<LogbackEventType>
implements RecordFormatter<LogbackEventType>
{
    private Layout<LogbackEventType> layout;


    public LayoutRecordFormatter(Layout<LogbackEventType> layout)
    {
        this.layout = layout;
    }


    @Override
    public String format(LogbackEventType event)
    {
        return layout.doLayout(event);
    }


    /**
     *  It would be nice if Logback events had a shared superinterface, but
     *  they don't, so we need to get ugly to get the timestamp.
     */
    @Override
    public long timestamp(LogbackEventType event)
    {
        return (event instanceof ILoggingEvent) ? ((ILoggingEvent)event).getTimeStamp()
             : (event instanceof IAccessEvent)  ? ((IAccessEvent)event).getTimeStamp()
             : System.currentTimeMillis();
    }
}
