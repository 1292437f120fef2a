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


import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProgressCollector")
class ProgressCollectorTest {

    private static ProgressEvent event(String transferId, int chunk, long bytes) {
        return ProgressEvent.chunk(ProgressEvent.Kind.CHUNK_PROGRESS, transferId, chunk, bytes, 1000, null);
    }

    @Test
    @DisplayName("Drain returns events in publication order and empties the queue")
    void testDrainOrder() {
        ProgressCollector collector = new ProgressCollector();
        collector.publish(event("t", 0, 10));
        collector.publish(event("t", 0, 20));
        collector.publish(event("t", 1, 30));

        assertEquals(3, collector.getPendingCount());
        List<ProgressEvent> drained = collector.drain();

        assertEquals(List.of(10L, 20L, 30L), drained.stream().map(ProgressEvent::getBytesTransferred).toList());
        assertEquals(0, collector.getPendingCount());
        assertTrue(collector.drain().isEmpty());
    }

    @Test
    @DisplayName("Events published after close are dropped and counted")
    void testClose() {
        ProgressCollector collector = new ProgressCollector();
        assertTrue(collector.publish(event("t", 0, 1)));

        collector.close();

        assertFalse(collector.publish(event("t", 0, 2)));
        assertDoesNotThrow(() -> collector.publish(null));
        assertEquals(2, collector.getDroppedCount());
        assertEquals(1, collector.getPublishedCount());
        assertEquals(1, collector.drain().size());
    }

    @Test
    @DisplayName("Concurrent publishers lose nothing and keep per-thread order")
    void testConcurrentPublishers() throws Exception {
        ProgressCollector collector = new ProgressCollector();
        int threads = 8;
        int perThread = 5000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        List<CompletableFuture<Void>> publishers = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            String id = "worker-" + t;
            publishers.add(CompletableFuture.runAsync(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < perThread; i++) {
                    collector.publish(event(id, 0, i));
                }
            }, pool));
        }

        List<ProgressEvent> received = new ArrayList<>();
        start.countDown();
        CompletableFuture<Void> all = CompletableFuture.allOf(publishers.toArray(new CompletableFuture[0]));
        while (!all.isDone()) {
            collector.drainTo(received::add);
        }
        collector.drainTo(received::add);
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(threads * perThread, received.size());
        Map<String, Long> lastSeen = new HashMap<>();
        for (ProgressEvent e : received) {
            long previous = lastSeen.getOrDefault(e.getTransferId(), -1L);
            assertTrue(e.getBytesTransferred() > previous, "out of order for " + e.getTransferId());
            lastSeen.put(e.getTransferId(), e.getBytesTransferred());
        }
    }

    @Test
    @DisplayName("awaitDraining delivers events while waiting and returns the result")
    void testAwaitDraining() throws Exception {
        ProgressCollector collector = new ProgressCollector();
        CountDownLatch firstDrained = new CountDownLatch(1);
        List<ProgressEvent> received = new ArrayList<>();

        CompletableFuture<String> work = CompletableFuture.supplyAsync(() -> {
            collector.publish(event("t", 0, 1));
            try {
                assertTrue(firstDrained.await(5, TimeUnit.SECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            collector.publish(event("t", 0, 2));
            return "done";
        });

        String result = collector.awaitDraining(work, Duration.ofMillis(10), e -> {
            received.add(e);
            firstDrained.countDown();
        });

        assertEquals("done", result);
        assertEquals(2, received.size());
    }

    @Test
    void testEventPercentage() {
        assertEquals(50.0, event("t", 0, 500).getPercentage(), 0.001);
        ProgressEvent transferLevel = ProgressEvent.transfer(ProgressEvent.Kind.TRANSFER_COMPLETED, "t", 0, 0, null);
        assertTrue(transferLevel.isTransferLevel());
        assertEquals(100.0, transferLevel.getPercentage(), 0.001);
    }
}
