package dev.mars.s3kit.transfer;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Multi-writer, single-reader mailbox of {@link ProgressEvent}s.
 *
 * <p>Workers publish from any thread without blocking. The front end drains on its own
 * thread, either after each unit of work or periodically through
 * {@link #awaitDraining(Future, Duration, Consumer)} while it waits for a transfer.
 * Events published after {@link #close()} are dropped and counted.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ProgressCollector {

    private final ConcurrentLinkedQueue<ProgressEvent> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    /**
     * Enqueues an event. Never blocks and never throws.
     *
     * @return false if the event was dropped
     */
    public boolean publish(ProgressEvent event) {
        if (event == null || closed.get()) {
            dropped.incrementAndGet();
            return false;
        }
        queue.offer(event);
        published.incrementAndGet();
        return true;
    }

    /**
     * Removes and returns every event currently queued, in publication order.
     */
    public List<ProgressEvent> drain() {
        List<ProgressEvent> events = new ArrayList<>();
        ProgressEvent event;
        while ((event = queue.poll()) != null) {
            events.add(event);
        }
        return events;
    }

    /**
     * Hands every queued event to {@code consumer} on the calling thread.
     *
     * @return the number of events delivered
     */
    public int drainTo(Consumer<ProgressEvent> consumer) {
        int count = 0;
        ProgressEvent event;
        while ((event = queue.poll()) != null) {
            consumer.accept(event);
            count++;
        }
        return count;
    }

    /**
     * Waits for {@code future}, draining events to {@code consumer} every {@code interval}
     * and once more after completion.
     */
    public <T> T awaitDraining(Future<T> future, Duration interval, Consumer<ProgressEvent> consumer)
            throws InterruptedException, ExecutionException {
        long intervalMs = Math.max(1, interval.toMillis());
        while (true) {
            try {
                T result = future.get(intervalMs, TimeUnit.MILLISECONDS);
                drainTo(consumer);
                return result;
            } catch (TimeoutException e) {
                drainTo(consumer);
            }
        }
    }

    public void close() {
        closed.set(true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public int getPendingCount() {
        return queue.size();
    }

    public long getPublishedCount() {
        return published.get();
    }

    public long getDroppedCount() {
        return dropped.get();
    }
}
