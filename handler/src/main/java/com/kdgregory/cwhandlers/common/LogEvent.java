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

import java.nio.charset.StandardCharsets;


/**
 *  Holder for a buffered logging event. Each instance has a timestamp and the
 *  message, stored as both a string and UTF-8 encoded bytes.
 *  <p>
 *  Instances are immutable; they are created by the handler when a record is
 *  formatted, and discarded when the batch containing them has been accepted.
 */
public class LogEvent
{
    private final long timestamp;
    private final String message;
    private final byte[] messageBytes;


    /**
     *  Constructs an instance from a simple string.
     */
    public LogEvent(long timestamp, String message)
    {
        this.timestamp = timestamp;
        this.message = message;
        this.messageBytes = message.getBytes(StandardCharsets.UTF_8);
    }


    /**
     *  Returns the timestamp of the original logging event, as milliseconds
     *  since the epoch.
     */
    public long getTimestamp()
    {
        return timestamp;
    }


    /**
     *  Returns the message string.
     */
    public String getMessage()
    {
        return message;
    }


    /**
     *  Returns the size of the message after conversion to UTF-8.
     */
    public int size()
    {
        return messageBytes.length;
    }


    /**
     *  Returns a copy of the UTF-8 message bytes.
     */
    public byte[] getBytes()
    {
        return messageBytes.clone();
    }


    @Override
    public String toString()
    {
        return "LogEvent[timestamp=" + timestamp + ", size=" + messageBytes.length + "]";
    }
}
