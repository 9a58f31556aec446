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

import com.kdgregory.cwhandlers.common.util.InternalLogger;

import ch.qos.logback.core.spi.ContextAware;


/**
 *  Reports diagnostics from the appender and its handler via the Logback
 *  status manager. Handler debug output (provisioning decisions and batch
 *  sizes) is reported at INFO, since the status manager has no lower level;
 *  it's only visible with <code>&lt;configuration debug="true"&gt;</code> or
 *  a status listener.
 */
public class LogbackInternalLogger
implements InternalLogger
{
    private ContextAware destination;


    public LogbackInternalLogger(ContextAware destination)
    {
        this.destination = destination;
    }


    @Override
    public void debug(String message)
    {
        destination.addInfo(message);
    }


    @Override
    public void warn(String message)
    {
        destination.addWarn(message);
    }


    @Override
    public void error(String message, Throwable ex)
    {
        if (ex != null)
            destination.addError(message, ex);
        else
            destination.addError(message);
    }
}
