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

package com.kdgregory.cwhandlers.common.util;


/**
 *  Discards all messages. Used when the handler is constructed outside of a
 *  logging framework and the caller doesn't provide a logger.
 */
public class NullInternalLogger
implements InternalLogger
{
    public final static NullInternalLogger INSTANCE = new NullInternalLogger();


    @Override
    public void debug(String message)
    {
        // nothing here
    }


    @Override
    public void warn(String message)
    {
        // nothing here
    }


    @Override
    public void error(String message, Throwable ex)
    {
        // nothing here
    }
}
