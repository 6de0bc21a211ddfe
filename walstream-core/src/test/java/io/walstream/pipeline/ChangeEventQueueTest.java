/*
 * Copyright Walstream Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walstream.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import io.walstream.util.LoggingContext;

public class ChangeEventQueueTest {

    private static final class Event implements Sizeable {
        private final int id;
        private final long size;

        Event(int id) {
            this(id, 10);
        }

        Event(int id, long size) {
            this.id = id;
            this.size = size;
        }

        @Override
        public long objectSize() {
            return size;
        }
    }

    private static ChangeEventQueue<Event> queue(int maxQueueSize, int maxBatchSize, long maxQueueSizeInBytes) {
        return new ChangeEventQueue.Builder<Event>()
                .maxQueueSize(maxQueueSize)
                .maxBatchSize(maxBatchSize)
                .maxQueueSizeInBytes(maxQueueSizeInBytes)
                .pollInterval(Duration.ofMillis(50))
                .loggingContextSupplier(() -> LoggingContext.forStream("slot", "db", "test"))
                .build();
    }

    @Test
    public void shouldHandOutEventsInOrder() throws InterruptedException {
        ChangeEventQueue<Event> queue = queue(10, 5, 0);
        for (int i = 0; i < 3; i++) {
            queue.enqueue(new Event(i));
        }
        assertThat(queue.size()).isEqualTo(3);
        assertThat(queue.take().id).isEqualTo(0);
        assertThat(queue.poll(Duration.ofMillis(10)).id).isEqualTo(1);
        assertThat(queue.take().id).isEqualTo(2);
        assertThat(queue.remainingCapacity()).isEqualTo(10);
    }

    @Test
    public void shouldReturnNullWhenNothingArrivesInTime() throws InterruptedException {
        ChangeEventQueue<Event> queue = queue(10, 5, 0);
        long start = System.nanoTime();
        assertThat(queue.poll(Duration.ofMillis(100))).isNull();
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(90);
    }

    @Test
    public void shouldIgnoreNullEvents() throws InterruptedException {
        ChangeEventQueue<Event> queue = queue(10, 5, 0);
        queue.enqueue(null);
        assertThat(queue.size()).isZero();
    }

    @Test
    public void shouldPollBatchesUpToMaxBatchSize() throws InterruptedException {
        ChangeEventQueue<Event> queue = queue(10, 3, 0);
        for (int i = 0; i < 5; i++) {
            queue.enqueue(new Event(i));
        }
        List<Event> first = queue.poll();
        assertThat(first).extracting(e -> e.id).containsExactly(0, 1, 2);
        List<Event> second = queue.poll();
        assertThat(second).extracting(e -> e.id).containsExactly(3, 4);
        assertThat(queue.poll()).isEmpty();
    }

    @Test
    public void shouldBlockProducerWhileFull() throws InterruptedException {
        ChangeEventQueue<Event> queue = queue(2, 1, 0);
        queue.enqueue(new Event(0));
        queue.enqueue(new Event(1));

        AtomicBoolean enqueued = new AtomicBoolean();
        Thread producer = new Thread(() -> {
            try {
                queue.enqueue(new Event(2));
                enqueued.set(true);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();

        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(2)).untilFalse(enqueued);
        assertThat(queue.take().id).isEqualTo(0);
        await().atMost(Duration.ofSeconds(5)).untilTrue(enqueued);
        assertThat(queue.take().id).isEqualTo(1);
        assertThat(queue.take().id).isEqualTo(2);
        producer.join(1000);
    }

    @Test
    public void shouldBoundQueueBySizeInBytes() throws InterruptedException {
        ChangeEventQueue<Event> queue = queue(100, 50, 100);
        queue.enqueue(new Event(0, 60));
        queue.enqueue(new Event(1, 60));
        assertThat(queue.currentQueueSizeInBytes()).isEqualTo(120);
        assertThat(queue.maxQueueSizeInBytes()).isEqualTo(100);

        AtomicBoolean enqueued = new AtomicBoolean();
        Thread producer = new Thread(() -> {
            try {
                queue.enqueue(new Event(2, 10));
                enqueued.set(true);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();

        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(2)).untilFalse(enqueued);
        queue.take();
        await().atMost(Duration.ofSeconds(5)).untilTrue(enqueued);
        assertThat(queue.currentQueueSizeInBytes()).isEqualTo(70);
        producer.join(1000);
    }

    @Test
    public void shouldWakeUpConsumerWhenEventArrives() throws InterruptedException {
        ChangeEventQueue<Event> queue = queue(10, 5, 0);
        AtomicReference<Event> received = new AtomicReference<>();
        Thread consumer = new Thread(() -> {
            try {
                received.set(queue.take());
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        consumer.start();

        queue.enqueue(new Event(42));
        await().atMost(Duration.ofSeconds(5)).until(() -> received.get() != null);
        assertThat(received.get().id).isEqualTo(42);
    }

    @Test
    public void shouldAbortBlockedProducerOnInterrupt() throws InterruptedException {
        ChangeEventQueue<Event> queue = queue(1, 1, 0);
        queue.enqueue(new Event(0));

        AtomicBoolean interrupted = new AtomicBoolean();
        Thread producer = new Thread(() -> {
            try {
                queue.enqueue(new Event(1));
            }
            catch (InterruptedException e) {
                interrupted.set(true);
            }
        });
        producer.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> producer.getState() == Thread.State.TIMED_WAITING);

        producer.interrupt();
        await().atMost(Duration.ofSeconds(5)).untilTrue(interrupted);
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    public void shouldDeliverEverythingToConcurrentConsumer() throws InterruptedException {
        ChangeEventQueue<Event> queue = queue(64, 16, 0);
        int total = 10_000;
        AtomicLong sum = new AtomicLong();
        AtomicLong count = new AtomicLong();
        Thread consumer = new Thread(() -> {
            int expected = 0;
            try {
                while (count.get() < total) {
                    for (Event event : queue.poll()) {
                        assertThat(event.id).isEqualTo(expected++);
                        sum.addAndGet(event.id);
                        count.incrementAndGet();
                    }
                }
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        consumer.start();
        for (int i = 0; i < total; i++) {
            queue.enqueue(new Event(i));
        }
        consumer.join(TimeUnit.SECONDS.toMillis(10));
        assertThat(count.get()).isEqualTo(total);
        assertThat(sum.get()).isEqualTo((long) total * (total - 1) / 2);
    }
}
