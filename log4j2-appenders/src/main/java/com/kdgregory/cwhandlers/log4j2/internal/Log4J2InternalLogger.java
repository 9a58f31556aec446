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

import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.status.StatusLogger;

import com.kdgregory.cwhandlers.common.util.InternalLogger;


/**
 *  Reports diagnostics from the appender and its handler.
 *  <p>
 *  Debug and warning messages go to the <code>StatusLogger</code>, prefixed with
 *  the appender's name since the status log is shared by every appender in the
 *  configuration. Errors go to the appender's <code>ErrorHandler</code>, which
 *  limits repetitions; that matters when every flush fails the same way because
 *  the service is unreachable.
 */
public class Log4J2InternalLogger
implements InternalLogger
{
    private AbstractAppender appender;
    private String prefix;


    public Log4J2InternalLogger(AbstractAppender appender)
    {
        this.appender = appender;
        this.prefix = (appender != null) ? appender.getName() + ": " : "";
    }


    @Override
    public void debug(String message)
    {
        StatusLogger.getLogger().debug(prefix + message);
    }


    @Override
    public void warn(String message)
    {
        StatusLogger.getLogger().warn(prefix + message);
    }


    @Override
    public void error(String message, Throwable ex)
    {
        if (appender != null)   appender.error(message, ex);
        else                    StatusLogger.getLogger().error(message, ex);
    }
}
