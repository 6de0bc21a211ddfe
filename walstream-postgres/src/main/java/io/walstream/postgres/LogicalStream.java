/*
 * Copyright Walstream Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walstream.postgres;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntFunction;

import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;
import org.apache.kafka.common.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.walstream.WalStreamException;
import io.walstream.annotation.ThreadSafe;
import io.walstream.annotation.VisibleForTesting;
import io.walstream.config.Configuration;
import io.walstream.config.Field;
import io.walstream.config.InvalidConfigurationException;
import io.walstream.pipeline.ChangeEventQueue;
import io.walstream.util.Clock;
import io.walstream.util.LoggingContext;
import io.walstream.util.LoggingContext.PreviousContext;
import io.walstream.util.Threads;

/**
 * Streams the changes of one logical replication slot.
 * <p>
 * The stream runs an external reader process which attaches to the slot and writes the changes to its standard
 * output as frames (see {@link FrameDecoder}). A dedicated thread decodes the frames and hands the resulting
 * {@link ChangeEvent}s to the application via {@link #data()}. How the stream ended is reported exactly once via
 * {@link #finished()}: normally if it was {@link #stop() stopped} and the reader exited cleanly, exceptionally otherwise.
 * <p>
 * A stream is single use. It is {@link State#IDLE} after construction, {@link State#RUNNING} after {@link #start()}
 * and {@link State#FINISHED} once the reader is gone.
 */
@ThreadSafe
public class LogicalStream {

    private static final Logger LOGGER = LoggerFactory.getLogger(LogicalStream.class);

    /**
     * Exit codes of a reader that ended because it was asked to: success, or death by SIGTERM or SIGINT.
     */
    private static final Set<Integer> CLEAN_EXIT_CODES = Set.of(0, 128 + 15, 128 + 2);

    /**
     * How long a reader that closed its output without being asked to may take to exit on its own.
     */
    private static final Duration UNREQUESTED_EXIT_GRACE = Duration.ofSeconds(1);

    public static final Field SLOT_NAME = Field.create("slot.name")
            .withDisplayName("Slot")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.MEDIUM)
            .required()
            .withValidation(LogicalStream::validateReplicationSlotName)
            .withDescription("The name of the Postgres logical decoding slot to stream changes from.");

    public enum State {
        IDLE,
        RUNNING,
        FINISHED
    }

    private final ConnectionConfig connection;
    private final StreamConfig streamConfig;
    private final String slotName;
    private final Lsn startPosition;
    private final ChangeEventQueue<ChangeEvent> queue;
    private final IntFunction<FrameDecoder> decoderFactory;
    private final CompletableFuture<Void> finished = new CompletableFuture<>();

    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final AtomicBoolean startAttempted = new AtomicBoolean();
    private final AtomicBoolean stopRequested = new AtomicBoolean();

    private volatile Process process;
    private volatile Thread decodeThread;
    private volatile Thread stopWatchdog;
    private volatile Lsn lastReceivedLsn = Lsn.INVALID;

    /**
     * Create a stream; nothing is started or checked until {@link #start()}.
     *
     * @param connection the connection parameters, possibly carrying {@link StreamConfig} options as well
     * @param slotName the replication slot to read
     * @param startPosition the position to request the changes from, passed to the reader as is
     */
    public LogicalStream(ConnectionConfig connection, String slotName, Lsn startPosition) {
        this(connection, slotName, startPosition, FrameDecoder::new);
    }

    @VisibleForTesting
    LogicalStream(ConnectionConfig connection, String slotName, Lsn startPosition, IntFunction<FrameDecoder> decoderFactory) {
        this.decoderFactory = decoderFactory;
        this.connection = connection;
        this.streamConfig = new StreamConfig(connection.getConfig());
        this.slotName = slotName;
        this.startPosition = startPosition;
        this.queue = new ChangeEventQueue.Builder<ChangeEvent>()
                .pollInterval(streamConfig.pollInterval())
                .maxQueueSize(streamConfig.maxQueueSize())
                .maxBatchSize(streamConfig.maxBatchSize())
                .maxQueueSizeInBytes(streamConfig.maxQueueSizeInBytes())
                .loggingContextSupplier(() -> loggingContext("consumer"))
                .build();
    }

    /**
     * Launch the reader and begin decoding its output. Returns as soon as the reader process exists.
     *
     * @throws InvalidConfigurationException if the connection parameters, tuning options, slot name or start position are invalid
     * @throws ReaderSpawnException if the reader process could not be launched
     * @throws IllegalStateException if the stream has been started or stopped before
     */
    public void start() {
        if (state.get() != State.IDLE || !startAttempted.compareAndSet(false, true)) {
            throw new IllegalStateException("Stream of slot '" + slotName + "' cannot be started again, current state is " + state.get());
        }
        validate();

        final ReaderCommand command = new ReaderCommand(streamConfig.readerExecutable(), connection, slotName, startPosition);
        LOGGER.info("Starting reader for slot '{}' at {}: {}", slotName, startPosition.asString(), command);
        final Process reader;
        try {
            reader = command.toProcessBuilder().start();
        }
        catch (IOException e) {
            throw new ReaderSpawnException("Unable to launch reader '" + streamConfig.readerExecutable() + "' for slot '" + slotName + "'", e);
        }
        closeReaderInput(reader);
        process = reader;
        decodeThread = Threads.threadFactory(LogicalStream.class, slotName, "reader", false, true).newThread(this::streamChanges);

        if (!state.compareAndSet(State.IDLE, State.RUNNING)) {
            reader.destroyForcibly();
            throw new IllegalStateException("Stream of slot '" + slotName + "' was stopped while starting");
        }
        LOGGER.info("Stream state has changed from '{}' to '{}'", State.IDLE, State.RUNNING);
        decodeThread.start();
    }

    /**
     * Ask the stream to end. Never blocks; {@link #finished()} completes once the reader is gone. The reader is sent
     * SIGTERM and killed if it is still running after {@link StreamConfig#STOP_TIMEOUT_MS}. Calling this more than
     * once, or on a finished stream, has no effect.
     */
    public void stop() {
        if (state.compareAndSet(State.IDLE, State.FINISHED)) {
            startAttempted.set(true);
            LOGGER.info("Stream state has changed from '{}' to '{}'", State.IDLE, State.FINISHED);
            finished.complete(null);
            return;
        }
        if (state.get() != State.RUNNING || !stopRequested.compareAndSet(false, true)) {
            return;
        }
        final Duration stopTimeout = streamConfig.stopTimeout();
        LOGGER.info("Stopping reader of slot '{}'", slotName);
        process.destroy();
        final Thread watchdog = Threads.timeout(slotName + "-stop", stopTimeout, Clock.SYSTEM, () -> {
            if (process.isAlive()) {
                LOGGER.warn("Reader of slot '{}' did not exit within {} ms, killing it", slotName, stopTimeout.toMillis());
                process.destroyForcibly();
            }
            decodeThread.interrupt();
        });
        stopWatchdog = watchdog;
        watchdog.start();
    }

    /**
     * The change events read from the slot, in log order. The reader is paused while the queue is full.
     */
    public ChangeEventQueue<ChangeEvent> data() {
        return queue;
    }

    /**
     * Get a future that completes once the stream has ended: normally after a requested stop, exceptionally with
     * {@link UnexpectedTerminationException} or {@link DecodeException} otherwise.
     *
     * @return a copy of the completion signal, so completing it does not affect the stream; never null
     */
    public CompletableFuture<Void> finished() {
        return finished.copy();
    }

    public State state() {
        return state.get();
    }

    /**
     * @return the position of the last event put into {@link #data()}, or {@link Lsn#INVALID} if there was none yet
     */
    public Lsn lastReceivedLsn() {
        return lastReceivedLsn;
    }

    public String slotName() {
        return slotName;
    }

    public Lsn startPosition() {
        return startPosition;
    }

    private void validate() {
        final Configuration config = connection.getConfig().edit().with(SLOT_NAME, slotName).build();
        config.validateAndThrow(ConnectionConfig.ALL_FIELDS.with(StreamConfig.ALL_FIELDS).with(SLOT_NAME), "Invalid configuration of stream");
        if (startPosition == null) {
            final ConfigValue value = new ConfigValue("start.position");
            value.addErrorMessage("A start position is required");
            throw new InvalidConfigurationException("Invalid configuration of stream: a start position is required", Collections.singletonList(value));
        }
    }

    private void closeReaderInput(Process reader) {
        try {
            reader.getOutputStream().close();
        }
        catch (IOException e) {
            LOGGER.debug("Could not close the input of the reader", e);
        }
    }

    private void streamChanges() {
        final PreviousContext previousContext = loggingContext("streaming");
        boolean interrupted = false;
        try {
            FrameDecoder decoder = null;
            WalStreamException failure = null;
            try {
                decoder = decoderFactory.apply(streamConfig.maxFrameBytes());
                readFrames(decoder);
            }
            catch (DecodeException e) {
                failure = e;
            }
            catch (IOException e) {
                if (!stopRequested.get()) {
                    failure = new UnexpectedTerminationException("Failed to read the output of the reader of slot '" + slotName + "'", null, e);
                }
                else {
                    LOGGER.debug("Reading the output of the reader failed after stop", e);
                }
            }
            catch (InterruptedException e) {
                interrupted = true;
                LOGGER.warn("Gave up delivering change events of slot '{}', {} undelivered bytes dropped", slotName, bufferedBytes(decoder));
            }
            catch (RuntimeException e) {
                failure = new UnexpectedTerminationException("Streaming the changes of slot '" + slotName + "' failed", null, e);
            }
            if (failure == null && bufferedBytes(decoder) > 0) {
                LOGGER.warn("Discarding {} bytes of an incomplete frame from the reader of slot '{}'", bufferedBytes(decoder), slotName);
            }
            if (failure != null) {
                // nothing after a failed frame can be trusted
                process.destroy();
            }
            final Integer exitCode = awaitReaderExit();
            if (exitCode == null) {
                interrupted = true;
            }
            finish(failure != null ? failure : terminationFailure(exitCode));
        }
        finally {
            if (!finished.isDone()) {
                process.destroyForcibly();
                finish(new UnexpectedTerminationException("Streaming the changes of slot '" + slotName + "' ended abruptly", null));
            }
            final Thread watchdog = stopWatchdog;
            if (watchdog != null) {
                watchdog.interrupt();
            }
            previousContext.restore();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static int bufferedBytes(FrameDecoder decoder) {
        return decoder != null ? decoder.bufferedBytes() : 0;
    }

    private void readFrames(FrameDecoder decoder) throws IOException, InterruptedException {
        final byte[] chunk = new byte[streamConfig.readBufferBytes()];
        try (InputStream input = process.getInputStream()) {
            int read;
            while ((read = input.read(chunk)) != -1) {
                decoder.feed(chunk, 0, read);
                ChangeEvent event;
                while ((event = decoder.next()) != null) {
                    queue.enqueue(event);
                    lastReceivedLsn = event.position();
                }
            }
        }
        LOGGER.debug("Output of the reader of slot '{}' closed, last received position {}", slotName, lastReceivedLsn.asString());
    }

    /**
     * Wait for the reader to exit. A reader that was asked to stop gets the stop timeout, one that closed its output
     * on its own is killed after a short grace period.
     *
     * @return the exit code of the reader, or null if this thread was interrupted before the reader exited
     */
    private Integer awaitReaderExit() {
        final Process reader = process;
        final Duration stopTimeout = streamConfig.stopTimeout();
        try {
            if (stopRequested.get()) {
                if (!reader.waitFor(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    LOGGER.warn("Reader of slot '{}' still running after its output closed, killing it", slotName);
                    reader.destroyForcibly();
                }
            }
            else if (!reader.waitFor(UNREQUESTED_EXIT_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Reader of slot '{}' closed its output but keeps running, killing it", slotName);
                reader.destroyForcibly();
            }
            reader.waitFor(stopTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (InterruptedException e) {
            reader.destroyForcibly();
            LOGGER.debug("Interrupted while waiting for the reader of slot '{}' to exit", slotName);
            return null;
        }
        return reader.isAlive() ? null : reader.exitValue();
    }

    private WalStreamException terminationFailure(Integer exitCode) {
        if (stopRequested.get()) {
            if (exitCode != null && CLEAN_EXIT_CODES.contains(exitCode)) {
                return null;
            }
            return new UnexpectedTerminationException("Reader of slot '" + slotName + "' did not exit cleanly after stop, exit code " + exitCode, exitCode);
        }
        return new UnexpectedTerminationException("Reader of slot '" + slotName + "' terminated unexpectedly"
                + (exitCode != null ? " with exit code " + exitCode : ""), exitCode);
    }

    private void finish(WalStreamException failure) {
        if (!state.compareAndSet(State.RUNNING, State.FINISHED)) {
            LOGGER.warn("Stream of slot '{}' finished in unexpected state '{}'", slotName, state.get());
        }
        else {
            LOGGER.info("Stream state has changed from '{}' to '{}'", State.RUNNING, State.FINISHED);
        }
        if (failure == null) {
            LOGGER.info("Stream of slot '{}' stopped at {}", slotName, lastReceivedLsn.asString());
            finished.complete(null);
        }
        else {
            LOGGER.error("Stream of slot '{}' failed", slotName, failure);
            finished.completeExceptionally(failure);
        }
    }

    private PreviousContext loggingContext(String contextName) {
        if (slotName == null) {
            return LoggingContext.current();
        }
        return LoggingContext.forStream(slotName, connection.databaseName(), contextName);
    }

    private static int validateReplicationSlotName(Configuration config, Field field, Field.ValidationOutput problems) {
        final String name = config.getString(field);
        int errors = 0;
        if (name != null) {
            if (!name.matches("[a-z0-9_]{1,63}")) {
                problems.accept(field, name, "Valid replication slot name must contain only digits, lowercase characters and underscores with length <= 63");
                ++errors;
            }
        }
        return errors;
    }
}
