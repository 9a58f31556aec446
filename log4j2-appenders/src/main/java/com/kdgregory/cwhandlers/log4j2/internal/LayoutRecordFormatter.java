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

package com.kdgregory.cwhandlers.log4j2.internal;

import org.apache.logging.log4j.core.Layout;
import org.apache.logging.log4j.core.LogEvent;

import com.kdgregory.cwhandlers.common.RecordFormatter;


/**
 *  Formats Log4J2 events using the appender's layout.
 */
public class LayoutRecordFormatter
implements RecordFormatter<LogEvent>
{
    private Layout<String> layout;


    public LayoutRecordFormatter(Layout<String> layout)
    {
        this.layout = layout;
    }


    @Override
    public String format(LogEvent event)
    {
        return layout.toSerializable(event);
    }


    @Override
    public long timestamp(LogEvent event)
    {
        return event.getTimeMillis();
    }
}
