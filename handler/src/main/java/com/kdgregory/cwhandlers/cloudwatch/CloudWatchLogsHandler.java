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

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.kdgregory.cwhandlers.common.ConfigurationException;
import com.kdgregory.cwhandlers.common.DeliveryException;
import com.kdgregory.cwhandlers.common.LogEvent;
import com.kdgregory.cwhandlers.common.LogSink;
import com.kdgregory.cwhandlers.common.RecordFormatter;
import com.kdgregory.cwhandlers.common.internal.Utils;
import com.kdgregory.cwhandlers.common.util.InternalLogger;
import com.kdgregory.cwhandlers.common.util.NullInternalLogger;
import com.kdgregory.cwhandlers.facade.CloudWatchFacade;
import com.kdgregory.cwhandlers.facade.FacadeFactory;
import com.kdgregory.cwhandlers.facade.PutEventsResult;
import com.kdgregory.cwhandlers.facade.RejectedInfo;


/**
 *  Buffers log records and writes them to a CloudWatch log stream in batches.
 *  <p>
 *  The log group is created (if necessary) when the handler is constructed.
 *  Records are formatted as they arrive and held in memory; the buffer is
 *  written when adding a record would exceed the configured capacity or the
 *  service's batch size limit, when {@link #flush} is called explicitly, and
 *  when the handler is closed. Each write finds or creates the log stream and
 *  retrieves its current sequence token.
 *  <p>
 *  If a stream name is not configured, one is derived from the current date
 *  each time the buffer is written, so a long-running handler will switch to
 *  a new stream at midnight.
 *  <p>
 *  All operations run on the caller's thread, and all failures are thrown to
 *  the caller; nothing is retried. This class is not threadsafe: callers that
 *  share an instance must serialize access to it.
 */
public class CloudWatchLogsHandler<R>
implements LogSink<R>
{
    // passed into constructor
    private RecordFormatter<R> formatter;
    private CloudWatchFacade facade;
    private CloudWatchHandlerStatistics stats;
    private InternalLogger logger;

    // extracted from config
    private String logGroupName;
    private String logStreamName;
    private int capacity;
    private String truncationSuffix;
    private RejectionPolicy rejectionPolicy;

    private StreamProvisioner provisioner;

    // used to derive stream names; exposed so that tests can change the date
    protected Clock clock = Clock.systemDefaultZone();

    // the buffer, in the order that records were emitted, and its batch size
    private List<LogEvent> buffer = new ArrayList<>();
    private int bufferBytes;

    private boolean closed;


    /**
     *  Creates an instance that uses the facade implementation found on the
     *  classpath, and discards internal log messages.
     */
    public CloudWatchLogsHandler(CloudWatchHandlerConfig config, RecordFormatter<R> formatter)
    {
        this(config, formatter, new CloudWatchHandlerStatistics(), NullInternalLogger.INSTANCE);
    }


    /**
     *  Creates an instance that uses the facade implementation found on the
     *  classpath.
     */
    public CloudWatchLogsHandler(
        CloudWatchHandlerConfig config, RecordFormatter<R> formatter,
        CloudWatchHandlerStatistics stats, InternalLogger logger)
    {
        this(config, formatter, stats, logger, FacadeFactory.createFacade(CloudWatchFacade.class, validate(config)));
    }


    /**
     *  Base constructor.
     *
     *  @throws ConfigurationException if the configuration is invalid.
     *  @throws com.kdgregory.cwhandlers.common.ProvisioningException if unable
     *          to create the log group.
     */
    public CloudWatchLogsHandler(
        CloudWatchHandlerConfig config, RecordFormatter<R> formatter,
        CloudWatchHandlerStatistics stats, InternalLogger logger, CloudWatchFacade facade)
    {
        validate(config);

        this.formatter = formatter;
        this.facade = facade;
        this.stats = stats;
        this.logger = (logger != null) ? logger : NullInternalLogger.INSTANCE;

        this.logGroupName = config.getLogGroupName();
        this.logStreamName = config.getLogStreamName();
        this.capacity = config.getEffectiveCapacity();
        this.truncationSuffix = config.getTruncationSuffix();
        this.rejectionPolicy = config.getRejectionPolicy();

        this.provisioner = new StreamProvisioner(facade, this.logger);

        stats.setActualLogGroupName(logGroupName);
        stats.setActualLogStreamName(logStreamName);

        try
        {
            provisioner.ensureGroup(logGroupName, config.getRetentionPeriod());
        }
        catch (RuntimeException ex)
        {
            stats.setLastError(null, ex);
            try
            {
                facade.shutdown();
            }
            catch (RuntimeException ex2)
            {
                ex.addSuppressed(ex2);
            }
            throw ex;
        }
    }

//----------------------------------------------------------------------------
//  LogSink
//----------------------------------------------------------------------------

    /**
     *  Formats the record and adds it to the buffer, first writing the buffer
     *  if it's full or the new event would push the batch over the service's
     *  size limit.
     */
    @Override
    public void emit(R record)
    {
        ensureOpen();

        FormattedEvent formatted = formatEvent(record);

        boolean bufferFilled = buffer.size() >= capacity;
        boolean bufferOversized = bufferBytes + formatted.getSize() > CloudWatchConstants.MAX_BATCH_BYTES;
        if (bufferFilled || bufferOversized)
        {
            flush();
        }

        buffer.add(formatted.getEvent());
        bufferBytes += formatted.getSize();
    }


    /**
     *  Writes all buffered events to the stream. Does nothing if the buffer is
     *  empty. The buffer is cleared only if the service accepts every event.
     *
     *  @throws DeliveryException if the service rejects events or returns an
     *          empty response. Whether the buffer is cleared in the former case
     *          depends on the configured {@link RejectionPolicy}.
     *  @throws com.kdgregory.cwhandlers.common.ProvisioningException if unable
     *          to create the log stream.
     */
    @Override
    public void flush()
    {
        ensureOpen();

        if (buffer.isEmpty())
            return;

        try
        {
            String streamName = resolveStreamName();
            stats.setActualLogStreamName(streamName);

            String sequenceToken = provisioner.ensureStream(logGroupName, streamName);

            List<LogEvent> batch = Collections.unmodifiableList(new ArrayList<>(buffer));
            stats.setLastBatchSize(batch.size());
            logger.debug("writing batch of " + batch.size() + " event(s) to " + logGroupName + "/" + streamName);

            PutEventsResult result = facade.putEvents(logGroupName, streamName, batch, sequenceToken);
            if (result == null)
            {
                throw new DeliveryException("CloudWatch Logs API call response is empty", null, batch.size());
            }

            RejectedInfo rejected = result.getRejectedInfo();
            if (rejected != null)
            {
                stats.incrementBatchesRejected();
                if (rejectionPolicy == RejectionPolicy.DISCARD)
                {
                    clearBuffer();
                }
                throw new DeliveryException("events rejected: " + rejected, rejected, batch.size());
            }

            clearBuffer();
            stats.updateSent(batch.size());
        }
        catch (RuntimeException ex)
        {
            stats.setLastError(null, ex);
            throw ex;
        }
    }


    /**
     *  Writes any buffered events and shuts down the service client. The client
     *  is shut down even if the write fails; the write's exception is then
     *  propagated. Calling this method more than once has no effect.
     */
    @Override
    public void close()
    {
        if (closed)
            return;

        try
        {
            flush();
        }
        finally
        {
            closed = true;
            logger.debug("shutting down CloudWatch client");
            facade.shutdown();
        }
    }

//----------------------------------------------------------------------------
//  Other public methods
//----------------------------------------------------------------------------

    /**
     *  Formats a record as a CloudWatch event, using the configured truncation
     *  suffix and UTF-8 encoding.
     */
    public FormattedEvent formatEvent(R record)
    {
        return formatEvent(record, truncationSuffix, StandardCharsets.UTF_8);
    }


    /**
     *  Formats a record as a CloudWatch event. Messages that are too large to
     *  fit into a batch by themselves are truncated, without splitting any
     *  character, and the suffix is appended; the final message (including
     *  suffix) is never larger than {@link CloudWatchConstants#MAX_MESSAGE_SIZE}.
     *  The event's timestamp is the record's creation time.
     */
    public FormattedEvent formatEvent(R record, String suffix, Charset charset)
    {
        int byteLimit = CloudWatchConstants.MAX_MESSAGE_SIZE;

        String message = formatter.format(record);
        if (message == null)
            message = "";

        byte[] messageBytes = message.getBytes(charset);
        if (messageBytes.length > byteLimit)
        {
            int originalLength = messageBytes.length;
            int suffixLength = suffix.getBytes(charset).length;
            int keepBytes = Math.max(0, byteLimit - suffixLength);
            message = Utils.decodeDroppingInvalid(messageBytes, keepBytes, charset) + suffix;
            messageBytes = message.getBytes(charset);
            logger.debug("truncated oversize message; original size was " + originalLength + " bytes");
        }

        int size = messageBytes.length + CloudWatchConstants.MESSAGE_OVERHEAD;
        return new FormattedEvent(size, new LogEvent(formatter.timestamp(record), message));
    }


    /**
     *  Returns the name of the stream that will be written by the next flush.
     */
    public String resolveStreamName()
    {
        if (logStreamName != null)
            return logStreamName;

        return LocalDate.now(clock).format(DateTimeFormatter.ofPattern(CloudWatchConstants.DEFAULT_STREAM_NAME_FORMAT));
    }


    /**
     *  Returns a snapshot of the buffered events, in the order they were emitted.
     */
    public List<LogEvent> getBufferedEvents()
    {
        return Collections.unmodifiableList(new ArrayList<>(buffer));
    }


    /**
     *  Returns the number of bytes that the buffered events will contribute to
     *  a batch, including per-event overhead.
     */
    public int getBufferedBytes()
    {
        return bufferBytes;
    }


    public int getCapacity()
    {
        return capacity;
    }


    public String getLogGroupName()
    {
        return logGroupName;
    }


    public CloudWatchHandlerStatistics getStatistics()
    {
        return stats;
    }


    public boolean isClosed()
    {
        return closed;
    }

//----------------------------------------------------------------------------
//  Internals
//----------------------------------------------------------------------------

    private static CloudWatchHandlerConfig validate(CloudWatchHandlerConfig config)
    {
        List<String> problems = config.validate();
        if (! problems.isEmpty())
            throw new ConfigurationException(problems);
        return config;
    }


    private void ensureOpen()
    {
        if (closed)
            throw new IllegalStateException("handler has been closed");
    }


    private void clearBuffer()
    {
        buffer.clear();
        bufferBytes = 0;
    }
}
