/*
 * Copyright Walstream Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walstream.pipeline;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.walstream.annotation.ThreadSafe;
import io.walstream.util.Clock;
import io.walstream.util.LoggingContext;
import io.walstream.util.LoggingContext.PreviousContext;
import io.walstream.util.Threads;
import io.walstream.util.Threads.Timer;

/**
 * A queue which serves as handover point between the thread decoding the replication stream and the
 * application consuming change events.
 * <p>
 * The queue is configurable in different aspects, e.g. its maximum size and the
 * time to sleep (block) between two subsequent poll calls. See the
 * {@link Builder} for the different options. The queue applies back-pressure
 * semantics, i.e. if it holds the maximum number of elements, subsequent calls
 * to {@link #enqueue(Sizeable)} will block until elements have been removed from
 * the queue.
 * <p>
 * Elements are handed out in the order they were enqueued, either one at a time via {@link #take()} and
 * {@link #poll(Duration)} or in batches via {@link #poll()}.
 *
 * @param <T> the type of events in this queue
 */
@ThreadSafe
public class ChangeEventQueue<T extends Sizeable> implements ChangeEventQueueMetrics {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChangeEventQueue.class);

    private final Duration pollInterval;
    private final int maxBatchSize;
    private final int maxQueueSize;
    private final long maxQueueSizeInBytes;

    private final Lock lock;
    private final Condition isFull;
    private final Condition isNotFull;
    private final Condition isNotEmpty;

    private final Queue<T> queue;
    private final Supplier<PreviousContext> loggingContextSupplier;
    private final Queue<Long> sizeInBytesQueue;
    private long currentQueueSizeInBytes = 0;

    private ChangeEventQueue(Duration pollInterval, int maxQueueSize, int maxBatchSize, Supplier<PreviousContext> loggingContextSupplier,
                             long maxQueueSizeInBytes) {
        this.pollInterval = pollInterval;
        this.maxBatchSize = maxBatchSize;
        this.maxQueueSize = maxQueueSize;

        this.lock = new ReentrantLock();
        this.isFull = lock.newCondition();
        this.isNotFull = lock.newCondition();
        this.isNotEmpty = lock.newCondition();

        this.queue = new ArrayDeque<>(maxQueueSize);
        this.loggingContextSupplier = loggingContextSupplier != null ? loggingContextSupplier : LoggingContext::current;
        this.sizeInBytesQueue = new ArrayDeque<>(maxQueueSize);
        this.maxQueueSizeInBytes = maxQueueSizeInBytes;
    }

    public static class Builder<T extends Sizeable> {

        private Duration pollInterval = Duration.ofMillis(500);
        private int maxQueueSize = 8192;
        private int maxBatchSize = 2048;
        private Supplier<PreviousContext> loggingContextSupplier;
        private long maxQueueSizeInBytes;

        public Builder<T> pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder<T> maxQueueSize(int maxQueueSize) {
            this.maxQueueSize = maxQueueSize;
            return this;
        }

        public Builder<T> maxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder<T> loggingContextSupplier(Supplier<PreviousContext> loggingContextSupplier) {
            this.loggingContextSupplier = loggingContextSupplier;
            return this;
        }

        public Builder<T> maxQueueSizeInBytes(long maxQueueSizeInBytes) {
            this.maxQueueSizeInBytes = maxQueueSizeInBytes;
            return this;
        }

        public ChangeEventQueue<T> build() {
            return new ChangeEventQueue<T>(pollInterval, maxQueueSize, maxBatchSize, loggingContextSupplier, maxQueueSizeInBytes);
        }
    }

    /**
     * Enqueues a record so that it can be obtained via {@link #take()} or {@link #poll()}. This method
     * will block if the queue is full.
     *
     * @param record
     *            the record to be enqueued
     * @throws InterruptedException
     *             if this thread has been interrupted
     */
    public void enqueue(T record) throws InterruptedException {
        if (record == null) {
            return;
        }

        // The calling thread has been interrupted, let's abort
        if (Thread.interrupted()) {
            throw new InterruptedException();
        }

        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Enqueuing change event '{}'", record);
        }

        this.lock.lockInterruptibly();
        try {
            while (queue.size() >= maxQueueSize || (maxQueueSizeInBytes > 0 && currentQueueSizeInBytes >= maxQueueSizeInBytes)) {
                // signal poll() to drain queue
                this.isFull.signalAll();
                // queue size or queue sizeInBytes threshold reached, so wait a bit
                this.isNotFull.await(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
            }

            queue.add(record);
            if (maxQueueSizeInBytes > 0) {
                long messageSize = record.objectSize();
                sizeInBytesQueue.add(messageSize);
                currentQueueSizeInBytes += messageSize;
            }
            this.isNotEmpty.signalAll();

            // batch size or queue sizeInBytes threshold reached
            if (queue.size() >= maxBatchSize || (maxQueueSizeInBytes > 0 && currentQueueSizeInBytes >= maxQueueSizeInBytes)) {
                // signal poll() to start draining queue and do not wait
                this.isFull.signalAll();
            }
        }
        finally {
            this.lock.unlock();
        }
    }

    /**
     * Returns the next element of this queue, waiting until one arrives.
     *
     * @return the oldest element; never null
     * @throws InterruptedException if this thread has been interrupted while waiting
     */
    public T take() throws InterruptedException {
        this.lock.lockInterruptibly();
        try {
            while (queue.isEmpty()) {
                this.isNotEmpty.await();
            }
            return removeFirst();
        }
        finally {
            this.lock.unlock();
        }
    }

    /**
     * Returns the next element of this queue, waiting at most the given time for one to arrive.
     *
     * @param timeout the maximum time to wait; may not be null
     * @return the oldest element, or null if none arrived within the timeout
     * @throws InterruptedException if this thread has been interrupted while waiting
     */
    public T poll(Duration timeout) throws InterruptedException {
        long remainingNanos = timeout.toNanos();
        this.lock.lockInterruptibly();
        try {
            while (queue.isEmpty()) {
                if (remainingNanos <= 0) {
                    return null;
                }
                remainingNanos = this.isNotEmpty.awaitNanos(remainingNanos);
            }
            return removeFirst();
        }
        finally {
            this.lock.unlock();
        }
    }

    /**
     * Returns the next batch of elements from this queue. May be empty in case no
     * elements have arrived in the maximum waiting time.
     *
     * @throws InterruptedException
     *             if this thread has been interrupted while waiting for more
     *             elements to arrive
     */
    public List<T> poll() throws InterruptedException {
        PreviousContext previousContext = loggingContextSupplier.get();

        try {
            LOGGER.debug("polling change events...");
            final Timer timeout = Threads.timer(Clock.SYSTEM, pollInterval);
            this.lock.lockInterruptibly();
            try {
                List<T> records = new ArrayList<>(Math.min(maxBatchSize, queue.size()));
                while (drainRecords(records, maxBatchSize - records.size()) < maxBatchSize
                        && (maxQueueSizeInBytes == 0 || currentQueueSizeInBytes < maxQueueSizeInBytes)
                        && !timeout.expired()) {
                    LOGGER.debug("no events available or batch size not reached yet, sleeping a bit...");
                    long remainingTimeoutMills = timeout.remaining().toMillis();
                    if (remainingTimeoutMills > 0) {
                        // signal enqueue() to add more records
                        this.isNotFull.signalAll();
                        // no records available or batch size not reached yet, so wait a bit
                        this.isFull.await(remainingTimeoutMills, TimeUnit.MILLISECONDS);
                    }
                    LOGGER.debug("checking for more events...");
                }
                // signal enqueue() to add more records
                this.isNotFull.signalAll();
                return records;
            }
            finally {
                this.lock.unlock();
            }
        }
        finally {
            previousContext.restore();
        }
    }

    /**
     * Returns the number of elements currently held.
     */
    public int size() {
        this.lock.lock();
        try {
            return queue.size();
        }
        finally {
            this.lock.unlock();
        }
    }

    private T removeFirst() {
        final T record = queue.poll();
        if (maxQueueSizeInBytes > 0) {
            currentQueueSizeInBytes -= sizeInBytesQueue.poll();
        }
        this.isNotFull.signalAll();
        return record;
    }

    private int drainRecords(List<T> records, int maxElements) {
        int recordsToDrain = Math.min(queue.size(), maxElements);
        for (int i = 0; i < recordsToDrain; i++) {
            records.add(queue.poll());
            if (maxQueueSizeInBytes > 0) {
                currentQueueSizeInBytes -= sizeInBytesQueue.poll();
            }
        }
        return records.size();
    }

    @Override
    public int totalCapacity() {
        return maxQueueSize;
    }

    @Override
    public int remainingCapacity() {
        return maxQueueSize - size();
    }

    @Override
    public long maxQueueSizeInBytes() {
        return maxQueueSizeInBytes;
    }

    @Override
    public long currentQueueSizeInBytes() {
        this.lock.lock();
        try {
            return currentQueueSizeInBytes;
        }
        finally {
            this.lock.unlock();
        }
    }
}
