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

package com.kdgregory.cwhandlers.logback;

import com.kdgregory.cwhandlers.cloudwatch.CloudWatchHandlerConfig;
import com.kdgregory.cwhandlers.cloudwatch.CloudWatchHandlerStatistics;
import com.kdgregory.cwhandlers.cloudwatch.CloudWatchLogsHandler;
import com.kdgregory.cwhandlers.cloudwatch.RejectionPolicy;
import com.kdgregory.cwhandlers.common.util.InternalLogger;
import com.kdgregory.cwhandlers.logback.internal.LayoutRecordFormatter;
import com.kdgregory.cwhandlers.logback.internal.LogbackInternalLogger;

import ch.qos.logback.classic.PatternLayout;
import ch.qos.logback.core.Layout;
import ch.qos.logback.core.UnsynchronizedAppenderBase;


/**
 *  Appender that writes to a CloudWatch log stream, using a {@link CloudWatchLogsHandler}
 *  to buffer events.
 *  <p>
 *  The log group is created (if necessary) when the appender starts; if that fails,
 *  the error is reported to the status buffer and the appender remains stopped.
 *  Events are written on the logging thread, when the buffer fills; remaining events
 *  are written when the appender stops.
 *  <p>
 *  Note: this appender is built on <code>UnsynchronizedAppenderBase</code>, but the
 *  handler is not threadsafe, so all calls to it are protected by an internal lock.
 */
public class CloudWatchAppender<LogbackEventType>
extends UnsynchronizedAppenderBase<LogbackEventType>
{
    public final static String DEFAULT_PATTERN = "%msg%n";

    // used for internal logging: we manage this and expose it to our subclasses
    protected InternalLogger internalLogger;

    // configuration is accumulated here and passed to the handler at start
    protected CloudWatchHandlerConfig appenderConfig = new CloudWatchHandlerConfig();

    protected CloudWatchHandlerStatistics appenderStats = new CloudWatchHandlerStatistics();

    // layout is managed by this class, not superclass
    protected Layout<LogbackEventType> layout;

    // created when the appender starts, closed when it stops
    protected volatile CloudWatchLogsHandler<LogbackEventType> handler;

    // serializes initialization, shutdown, and all calls to the handler
    private Object handlerLock = new Object();


    public CloudWatchAppender()
    {
        internalLogger = new LogbackInternalLogger(this);
    }

//----------------------------------------------------------------------------
//  Configuration
//----------------------------------------------------------------------------

    /**
     *  Sets the layout manager for this appender. Note that we do not use an
     *  <code>Encoder</code>; it is a knob that doesn't need to be turned.
     *  <p>
     *  If not set, logging events are formatted with {@link #DEFAULT_PATTERN}.
     */
    public void setLayout(Layout<LogbackEventType> layout)
    {
        this.layout = layout;
    }


    public Layout<LogbackEventType> getLayout()
    {
        return layout;
    }


    /**
     *  Sets the CloudWatch Log Group associated with this appender.
     *  <p>
     *  There is no default value. If you do not configure the log group, the
     *  appender will not start and will report its misconfiguration.
     */
    public void setLogGroup(String value)
    {
        appenderConfig.setLogGroupName(value);
    }


    /**
     *  Returns the log group name; see {@link #setLogGroup}. Primarily used
     *  for testing.
     */
    public String getLogGroup()
    {
        return appenderConfig.getLogGroupName();
    }


    /**
     *  Sets the CloudWatch Log Stream associated with this appender.
     *  <p>
     *  If not set, the stream is named after the current date, in the form
     *  <code>yyyy-MM-dd</code>; the appender switches streams at midnight.
     */
    public void setLogStream(String value)
    {
        appenderConfig.setLogStreamName(value);
    }


    public String getLogStream()
    {
        return appenderConfig.getLogStreamName();
    }


    /**
     *  Sets the number of events held in memory before they're written to the
     *  stream. Default is 10.
     */
    public void setCapacity(int value)
    {
        appenderConfig.setCapacity(value);
    }


    public Integer getCapacity()
    {
        return appenderConfig.getCapacity();
    }


    /**
     *  Sets the retention period, in days, for a log group created by this
     *  appender. Must be one of the values accepted by CloudWatch; by default
     *  the group retains events forever.
     */
    public void setRetentionPeriod(int value)
    {
        appenderConfig.setRetentionPeriod(value);
    }


    public Integer getRetentionPeriod()
    {
        return appenderConfig.getRetentionPeriod();
    }


    /**
     *  Sets the text appended to messages that are too large to be sent.
     */
    public void setTruncationSuffix(String value)
    {
        appenderConfig.setTruncationSuffix(value);
    }


    public String getTruncationSuffix()
    {
        return appenderConfig.getTruncationSuffix();
    }


    /**
     *  If true, events rejected by the service are dropped. If false (the
     *  default) they're retained and resent with the next batch.
     */
    public void setDiscardRejectedEvents(boolean value)
    {
        appenderConfig.setRejectionPolicy(value ? RejectionPolicy.DISCARD : RejectionPolicy.RETAIN);
    }


    public boolean getDiscardRejectedEvents()
    {
        return appenderConfig.getRejectionPolicy() == RejectionPolicy.DISCARD;
    }


    /**
     *  Sets the fully-qualified name of a static method that will create the
     *  AWS client.
     */
    public void setClientFactory(String value)
    {
        appenderConfig.setClientFactoryMethod(value);
    }


    public String getClientFactory()
    {
        return appenderConfig.getClientFactoryMethod();
    }


    public void setClientRegion(String value)
    {
        appenderConfig.setClientRegion(value);
    }


    public String getClientRegion()
    {
        return appenderConfig.getClientRegion();
    }


    public void setClientEndpoint(String value)
    {
        appenderConfig.setClientEndpoint(value);
    }


    public String getClientEndpoint()
    {
        return appenderConfig.getClientEndpoint();
    }

//----------------------------------------------------------------------------
//  Other accessors
//----------------------------------------------------------------------------

    /**
     *  Returns the appender statistics object.
     */
    public CloudWatchHandlerStatistics getAppenderStatistics()
    {
        return appenderStats;
    }


    public CloudWatchLogsHandler<LogbackEventType> getHandler()
    {
        return handler;
    }

//----------------------------------------------------------------------------
//  Appender implementation
//----------------------------------------------------------------------------

    @Override
    public void start()
    {
        synchronized (handlerLock)
        {
            if (isStarted())
            {
                // someone else already initialized us
                return;
            }

            if (layout == null)
            {
                layout = createDefaultLayout();
            }

            try
            {
                handler = createHandler(appenderConfig);
            }
            catch (Exception ex)
            {
                internalLogger.error("unable to start appender " + getName(), ex);
                return;
            }
        }

        super.start();
    }


    @Override
    public void stop()
    {
        synchronized (handlerLock)
        {
            if (handler != null)
            {
                try
                {
                    handler.close();
                }
                catch (Exception ex)
                {
                    internalLogger.error("failed to write buffered events while stopping appender " + getName(), ex);
                }
                handler = null;
            }
        }

        super.stop();
    }


    /**
     *  Writes any buffered events. Errors are reported, not thrown.
     */
    public void flush()
    {
        synchronized (handlerLock)
        {
            if (handler == null)
                return;

            try
            {
                handler.flush();
            }
            catch (Exception ex)
            {
                internalLogger.error("unable to write buffered events", ex);
            }
        }
    }


    @Override
    protected void append(LogbackEventType event)
    {
        if (! isStarted())
        {
            internalLogger.warn("append called before appender was started");
            return;
        }

        synchronized (handlerLock)
        {
            if (handler == null)
                return;

            try
            {
                handler.emit(event);
            }
            catch (Exception ex)
            {
                internalLogger.error("unable to append event", ex);
            }
        }
    }

//----------------------------------------------------------------------------
//  Subclass hooks
//----------------------------------------------------------------------------

    /**
     *  Creates the handler. This is called from {@link #start}, and may be
     *  overridden by tests to provide a mock service facade.
     */
    protected CloudWatchLogsHandler<LogbackEventType> createHandler(CloudWatchHandlerConfig config)
    {
        return new CloudWatchLogsHandler<>(config, new LayoutRecordFormatter<>(layout), appenderStats, internalLogger);
    }

//----------------------------------------------------------------------------
//  Internals
//----------------------------------------------------------------------------

    /**
     *  The default layout only understands logging events; access events must
     *  configure a layout explicitly.
     */
    @SuppressWarnings("unchecked")
    private Layout<LogbackEventType> createDefaultLayout()
    {
        PatternLayout defaultLayout = new PatternLayout();
        defaultLayout.setContext(getContext());
        defaultLayout.setPattern(DEFAULT_PATTERN);
        defaultLayout.start();
        return (Layout<LogbackEventType>)(Layout<?>)defaultLayout;
    }
}
