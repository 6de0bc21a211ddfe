/*
 * Copyright Walstream Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walstream.postgres;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;

import io.walstream.config.Configuration;
import io.walstream.config.Field;

/**
 * Tuning options of a {@link LogicalStream}: the reader process and the event queue handing changes to the application.
 */
public class StreamConfig {

    public static final Field READER_EXECUTABLE = Field.create("reader.executable")
            .withDisplayName("Reader executable")
            .withType(Type.STRING)
            .withWidth(Width.LONG)
            .withImportance(Importance.HIGH)
            .withDefault("pg_logical_stream")
            .required()
            .withDescription("Path or name of the program that reads the replication slot and writes framed change events to its standard output.");

    public static final Field READ_BUFFER_BYTES = Field.create("reader.read.buffer.bytes")
            .withDisplayName("Read buffer size")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDefault(8192)
            .withValidation(Field::isPositiveInteger)
            .withDescription("Number of bytes requested from the reader output per read.");

    public static final Field MAX_FRAME_BYTES = Field.create("reader.max.frame.bytes")
            .withDisplayName("Maximum frame size")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDefault(64 * 1024 * 1024)
            .withValidation(Field.RangeValidator.between(FrameDecoder.POSITION_BYTES, FrameDecoder.MAX_PAYLOAD_BYTES))
            .withDescription("Largest frame accepted from the reader; a longer frame is treated as corrupt output.");

    public static final Field STOP_TIMEOUT_MS = Field.create("reader.stop.timeout.ms")
            .withDisplayName("Stop timeout (ms)")
            .withType(Type.LONG)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDefault(10_000L)
            .withValidation(Field::isPositiveLong)
            .withDescription("Time in milliseconds the reader is given to exit after a stop request before it is killed.");

    public static final Field MAX_QUEUE_SIZE = Field.create("max.queue.size")
            .withDisplayName("Change event buffer size")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDefault(8192)
            .withValidation(StreamConfig::validateMaxQueueSize)
            .withDescription("Maximum size of the queue for change events read from the reader. "
                    + "Once the queue is full, reading is paused until the application takes events. "
                    + "Must be larger than the maximum batch size.");

    public static final Field MAX_BATCH_SIZE = Field.create("max.batch.size")
            .withDisplayName("Change event batch size")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDefault(2048)
            .withValidation(Field::isPositiveInteger)
            .withDescription("Maximum number of change events handed out by a single batch poll.");

    public static final Field MAX_QUEUE_SIZE_IN_BYTES = Field.create("max.queue.size.in.bytes")
            .withDisplayName("Change event buffer size in bytes")
            .withType(Type.LONG)
            .withWidth(Width.LONG)
            .withImportance(Importance.MEDIUM)
            .withDefault(0L)
            .withValidation(Field::isNonNegativeLong)
            .withDescription("Maximum size in bytes of the change event queue; 0 means unbounded.");

    public static final Field POLL_INTERVAL_MS = Field.create("poll.interval.ms")
            .withDisplayName("Poll interval (ms)")
            .withType(Type.LONG)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDefault(500L)
            .withValidation(Field::isPositiveLong)
            .withDescription("Time in milliseconds a batch poll waits for change events before returning what it has.");

    public static final Field.Set ALL_FIELDS = Field.setOf(READER_EXECUTABLE, READ_BUFFER_BYTES, MAX_FRAME_BYTES, STOP_TIMEOUT_MS,
            MAX_QUEUE_SIZE, MAX_BATCH_SIZE, MAX_QUEUE_SIZE_IN_BYTES, POLL_INTERVAL_MS);

    private final Configuration config;

    public StreamConfig(Configuration config) {
        this.config = config;
    }

    public String readerExecutable() {
        return config.getString(READER_EXECUTABLE);
    }

    public int readBufferBytes() {
        return config.getInteger(READ_BUFFER_BYTES);
    }

    public int maxFrameBytes() {
        return config.getInteger(MAX_FRAME_BYTES);
    }

    public Duration stopTimeout() {
        return config.getDuration(STOP_TIMEOUT_MS, ChronoUnit.MILLIS);
    }

    public int maxQueueSize() {
        return config.getInteger(MAX_QUEUE_SIZE);
    }

    public int maxBatchSize() {
        return config.getInteger(MAX_BATCH_SIZE);
    }

    public long maxQueueSizeInBytes() {
        return config.getLong(MAX_QUEUE_SIZE_IN_BYTES);
    }

    public Duration pollInterval() {
        return config.getDuration(POLL_INTERVAL_MS, ChronoUnit.MILLIS);
    }

    /**
     * Check the tuning options.
     *
     * @throws io.walstream.config.InvalidConfigurationException if any of them is malformed
     */
    public void validate() {
        config.validateAndThrow(ALL_FIELDS, "Invalid stream configuration");
    }

    public static ConfigDef configDef() {
        return Field.group(new ConfigDef(), "Reader", ALL_FIELDS.asArray());
    }

    private static int validateMaxQueueSize(Configuration config, Field field, Field.ValidationOutput problems) {
        int maxQueueSize = config.getInteger(field);
        int maxBatchSize = config.getInteger(MAX_BATCH_SIZE);
        int count = 0;
        if (maxQueueSize <= 0) {
            problems.accept(field, maxQueueSize, "A positive queue size is required");
            ++count;
        }
        if (maxQueueSize <= maxBatchSize) {
            problems.accept(field, maxQueueSize, "Must be larger than the maximum batch size");
            ++count;
        }
        return count;
    }
}
