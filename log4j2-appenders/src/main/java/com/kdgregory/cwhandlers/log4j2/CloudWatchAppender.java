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

package com.kdgregory.cwhandlers.log4j2;

import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.core.Appender;
import org.apache.logging.log4j.core.Core;
import org.apache.logging.log4j.core.Filter;
import org.apache.logging.log4j.core.Layout;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.apache.logging.log4j.core.config.plugins.Plugin;
import org.apache.logging.log4j.core.config.plugins.PluginBuilderAttribute;
import org.apache.logging.log4j.core.config.plugins.PluginBuilderFactory;
import org.apache.logging.log4j.core.config.plugins.PluginElement;
import org.apache.logging.log4j.core.config.plugins.validation.constraints.Required;
import org.apache.logging.log4j.core.layout.PatternLayout;

import com.kdgregory.cwhandlers.cloudwatch.CloudWatchHandlerConfig;
import com.kdgregory.cwhandlers.cloudwatch.CloudWatchHandlerStatistics;
import com.kdgregory.cwhandlers.cloudwatch.CloudWatchLogsHandler;
import com.kdgregory.cwhandlers.cloudwatch.RejectionPolicy;
import com.kdgregory.cwhandlers.common.util.InternalLogger;
import com.kdgregory.cwhandlers.log4j2.internal.CloudWatchAppenderConfig;
import com.kdgregory.cwhandlers.log4j2.internal.LayoutRecordFormatter;
import com.kdgregory.cwhandlers.log4j2.internal.Log4J2InternalLogger;


/**
 *  An appender that writes to a CloudWatch Logs stream, using a
 *  {@link CloudWatchLogsHandler} to buffer events.
 *  <p>
 *  This appender supports the following configuration parameters:
 *  <p>
 *  <table>
 *  <tr VALIGN="top">
 *      <th> logGroup
 *      <td> Name of the CloudWatch log group where messages are sent; may use
 *           Log4J2 lookups. If this group doesn't exist it will be created.
 *           No default.
 *
 *  <tr VALIGN="top">
 *      <th> logStream
 *      <td> Name of the CloudWatch log stream where messages are sent; may use
 *           Log4J2 lookups. If this stream doesn't exist it will be created.
 *           Defaults to the current date, in the form <code>yyyy-MM-dd</code>.
 *
 *  <tr VALIGN="top">
 *      <th> capacity
 *      <td> The maximum number of events held in memory before they're written
 *           to the stream. Defaults to 10.
 *
 *  <tr VALIGN="top">
 *      <th> retentionPeriod
 *      <td> The retention period, in days, for a log group created by this
 *           appender. Must be one of the values accepted by CloudWatch. Omit
 *           for unlimited retention.
 *
 *  <tr VALIGN="top">
 *      <th> truncationSuffix
 *      <td> Appended to messages that are too large to be sent. Defaults to
 *           <code>" ..."</code>.
 *
 *  <tr VALIGN="top">
 *      <th> discardRejectedEvents
 *      <td> If true, events that the service rejects are dropped. If false (the
 *           default), they remain in the buffer and are resent with the next
 *           batch.
 *
 *  <tr VALIGN="top">
 *      <th> clientFactory
 *      <td> Specifies the fully-qualified name of a static method that will be
 *           invoked to create the AWS service client.
 *
 *  <tr VALIGN="top">
 *      <th> clientRegion
 *      <td> Specifies a non-default region for the client.
 *
 *  <tr VALIGN="top">
 *      <th> clientEndpoint
 *      <td> Specifies a non-default endpoint for the client.
 *  </table>
 *  <p>
 *  If no layout is configured, events are formatted with <code>%m%n</code>.
 *  <p>
 *  The log group is created (if necessary) when the appender starts; if that
 *  fails, the error is reported and the appender remains stopped. Events are
 *  written on the logging thread, when the buffer fills; remaining events are
 *  written when the appender stops.
 */
@Plugin(name = "CloudWatchAppender", category = Core.CATEGORY_NAME, elementType = Appender.ELEMENT_TYPE)
public class CloudWatchAppender
extends AbstractAppender
{

//----------------------------------------------------------------------------
//  Builder
//----------------------------------------------------------------------------

    @PluginBuilderFactory
    public static CloudWatchAppenderBuilder newBuilder()
    {
        return new CloudWatchAppenderBuilder();
    }


    public static class CloudWatchAppenderBuilder
    implements org.apache.logging.log4j.core.util.Builder<CloudWatchAppender>, CloudWatchAppenderConfig
    {
        @PluginBuilderAttribute("name")
        @Required(message = "CloudWatchAppender: no name provided")
        private String name;

        public String getName()
        {
            return name;
        }

        public CloudWatchAppenderBuilder setName(String value)
        {
            this.name = value;
            return this;
        }


        @PluginElement("Layout")
        private Layout<String> layout;

        public CloudWatchAppenderBuilder setLayout(Layout<String> value)
        {
            this.layout = value;
            return this;
        }

        @Override
        public Layout<String> getLayout()
        {
            return layout;
        }


        @PluginElement("Filter")
        private Filter filter;

        public CloudWatchAppenderBuilder setFilter(Filter value)
        {
            this.filter = value;
            return this;
        }

        @Override
        public Filter getFilter()
        {
            return filter;
        }


        @PluginBuilderAttribute("logGroup")
        private String logGroup;

        /**
         *  Sets the CloudWatch Log Group associated with this appender.
         */
        public CloudWatchAppenderBuilder setLogGroup(String value)
        {
            this.logGroup = value;
            return this;
        }

        @Override
        public String getLogGroup()
        {
            return logGroup;
        }


        @PluginBuilderAttribute("logStream")
        private String logStream;

        /**
         *  Sets the CloudWatch Log Stream associated with this appender.
         */
        public CloudWatchAppenderBuilder setLogStream(String value)
        {
            this.logStream = value;
            return this;
        }

        @Override
        public String getLogStream()
        {
            return logStream;
        }


        @PluginBuilderAttribute("capacity")
        private Integer capacity;

        public CloudWatchAppenderBuilder setCapacity(Integer value)
        {
            this.capacity = value;
            return this;
        }

        @Override
        public Integer getCapacity()
        {
            return capacity;
        }


        @PluginBuilderAttribute("retentionPeriod")
        private Integer retentionPeriod;

        /**
         *  Sets the retention period, in days, for a log group created by
         *  this appender.
         */
        public CloudWatchAppenderBuilder setRetentionPeriod(Integer value)
        {
            this.retentionPeriod = value;
            return this;
        }

        @Override
        public Integer getRetentionPeriod()
        {
            return retentionPeriod;
        }


        @PluginBuilderAttribute("truncationSuffix")
        private String truncationSuffix = CloudWatchHandlerConfig.DEFAULT_TRUNCATION_SUFFIX;

        public CloudWatchAppenderBuilder setTruncationSuffix(String value)
        {
            this.truncationSuffix = value;
            return this;
        }

        @Override
        public String getTruncationSuffix()
        {
            return truncationSuffix;
        }


        @PluginBuilderAttribute("discardRejectedEvents")
        private boolean discardRejectedEvents;

        public CloudWatchAppenderBuilder setDiscardRejectedEvents(boolean value)
        {
            this.discardRejectedEvents = value;
            return this;
        }

        @Override
        public boolean isDiscardRejectedEvents()
        {
            return discardRejectedEvents;
        }


        @PluginBuilderAttribute("clientFactory")
        private String clientFactory;

        /**
         *  Sets the fully-qualified name of a static method that will create
         *  the AWS client.
         */
        public CloudWatchAppenderBuilder setClientFactory(String value)
        {
            this.clientFactory = value;
            return this;
        }

        @Override
        public String getClientFactory()
        {
            return clientFactory;
        }


        @PluginBuilderAttribute("clientRegion")
        private String clientRegion;

        public CloudWatchAppenderBuilder setClientRegion(String value)
        {
            this.clientRegion = value;
            return this;
        }

        @Override
        public String getClientRegion()
        {
            return clientRegion;
        }


        @PluginBuilderAttribute("clientEndpoint")
        private String clientEndpoint;

        public CloudWatchAppenderBuilder setClientEndpoint(String value)
        {
            this.clientEndpoint = value;
            return this;
        }

        @Override
        public String getClientEndpoint()
        {
            return clientEndpoint;
        }


        @Override
        public CloudWatchAppender build()
        {
            if (layout == null)
                layout = PatternLayout.createDefaultLayout();

            return new CloudWatchAppender(name, this, null);
        }
    }

//----------------------------------------------------------------------------
//  Appender
//----------------------------------------------------------------------------

    protected CloudWatchAppenderConfig appenderConfig;
    protected InternalLogger internalLogger;
    protected CloudWatchHandlerStatistics appenderStats = new CloudWatchHandlerStatistics();

    // serializes access to the handler
    private final Object handlerLock = new Object();

    // created when the appender starts, closed when it stops
    private volatile CloudWatchLogsHandler<LogEvent> handler;


    protected CloudWatchAppender(String name, CloudWatchAppenderConfig config, InternalLogger providedInternalLogger)
    {
        super(name, config.getFilter(), config.getLayout(), true, Property.EMPTY_ARRAY);

        this.appenderConfig = config;
        this.internalLogger = (providedInternalLogger != null)
                            ? providedInternalLogger
                            : new Log4J2InternalLogger(this);
    }

//----------------------------------------------------------------------------
//  Accessors for testing
//----------------------------------------------------------------------------

    public CloudWatchAppenderConfig getConfig()
    {
        return appenderConfig;
    }


    public CloudWatchHandlerStatistics getAppenderStatistics()
    {
        return appenderStats;
    }


    public CloudWatchLogsHandler<LogEvent> getHandler()
    {
        return handler;
    }

//----------------------------------------------------------------------------
//  Appender
//----------------------------------------------------------------------------

    @Override
    public void start()
    {
        synchronized (handlerLock)
        {
            if (isStarted())
                return;

            try
            {
                handler = createHandler(createHandlerConfig());
            }
            catch (Exception ex)
            {
                internalLogger.error("unable to start appender " + getName(), ex);
                return;
            }
        }

        super.start();
    }


    /**
     *  This is called by the framework when the appender is shutting down. It
     *  writes any buffered events and releases the service client.
     */
    @Override
    public boolean stop(long timeout, TimeUnit timeUnit)
    {
        setStopping();

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

        return super.stop(timeout, timeUnit);
    }


    /**
     *  This is called by the framework when the appender is shutting down, or
     *  removed from a configuration. It is not expected to be invoked by user
     *  code, so delegates to the two-argument form.
     */
    @Override
    public void stop()
    {
        stop(0, TimeUnit.MILLISECONDS);
    }


    @Override
    public void append(LogEvent event)
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

//----------------------------------------------------------------------------
//  Subclass hooks
//----------------------------------------------------------------------------

    /**
     *  Creates the handler. This is called from {@link #start}, and may be
     *  overridden by tests to provide a mock service facade.
     */
    protected CloudWatchLogsHandler<LogEvent> createHandler(CloudWatchHandlerConfig config)
    {
        return new CloudWatchLogsHandler<>(
                config,
                new LayoutRecordFormatter(appenderConfig.getLayout()),
                appenderStats,
                internalLogger);
    }

//----------------------------------------------------------------------------
//  Internals
//----------------------------------------------------------------------------

    private CloudWatchHandlerConfig createHandlerConfig()
    {
        return new CloudWatchHandlerConfig()
               .setLogGroupName(appenderConfig.getLogGroup())
               .setLogStreamName(appenderConfig.getLogStream())
               .setCapacity(appenderConfig.getCapacity())
               .setRetentionPeriod(appenderConfig.getRetentionPeriod())
               .setTruncationSuffix(appenderConfig.getTruncationSuffix())
               .setRejectionPolicy(appenderConfig.isDiscardRejectedEvents() ? RejectionPolicy.DISCARD : RejectionPolicy.RETAIN)
               .setClientFactoryMethod(appenderConfig.getClientFactory())
               .setClientRegion(appenderConfig.getClientRegion())
               .setClientEndpoint(appenderConfig.getClientEndpoint());
    }
}
