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


import java.time.Clock;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the pending chunks of one transfer on a bounded pool of workers.
 *
 * <p>Workers pull chunk indices from a shared queue. Each chunk is retried according
 * to the {@link RetryPolicy}; once a chunk fails for good, or the transfer is
 * cancelled, no further chunks are picked up while chunks already in flight finish.
 * The state is checkpointed after every chunk outcome.</p>
 */
final class ChunkExecutor {

    private static final Logger logger = Logger.getLogger(ChunkExecutor.class.getName());

    private static final long PAUSE_POLL_MS = 500;

    /**
     * Moves one chunk. {@code progress} takes the cumulative bytes moved within the chunk.
     */
    @FunctionalInterface
    interface ChunkTask {
        ChunkResult transfer(ChunkRecord chunk, LongConsumer progress) throws Exception;
    }

    @FunctionalInterface
    interface Checkpointer {
        void checkpoint(TransferState state);
    }

    static final class ChunkResult {
        final String eTag;
        final String checksum;

        ChunkResult(String eTag, String checksum) {
            this.eTag = eTag;
            this.checksum = checksum;
        }
    }

    static final class Outcome {
        private final int completedChunks;
        private final Throwable failure;
        private final boolean cancelled;

        Outcome(int completedChunks, Throwable failure, boolean cancelled) {
            this.completedChunks = completedChunks;
            this.failure = failure;
            this.cancelled = cancelled;
        }

        int getCompletedChunks() { return completedChunks; }
        Throwable getFailure() { return failure; }
        boolean isCancelled() { return cancelled; }

        boolean isSuccessful() {
            return failure == null && !cancelled;
        }
    }

    private final String threadPrefix;
    private final Clock clock;

    ChunkExecutor(String threadPrefix, Clock clock) {
        this.threadPrefix = threadPrefix;
        this.clock = clock;
    }

    Outcome run(TransferState state, List<Integer> indices, int parallelism, RetryPolicy retryPolicy,
                TransferContext context, ProgressTracker tracker, ProgressCollector collector,
                ChunkTask task, Checkpointer checkpointer) throws InterruptedException {
        if (indices.isEmpty()) {
            return new Outcome(0, null, context.isCancelled());
        }

        BlockingQueue<Integer> work = new ArrayBlockingQueue<>(indices.size(), false, indices);
        AtomicBoolean stop = new AtomicBoolean(false);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        AtomicInteger completed = new AtomicInteger();
        Object checkpointLock = new Object();

        int workers = Math.max(1, Math.min(parallelism, indices.size()));
        ExecutorService pool = Executors.newFixedThreadPool(workers, threadFactory(state.getTransferId()));
        logger.fine("Running " + indices.size() + " chunks of transfer " + state.getTransferId()
                + " on " + workers + " workers");

        for (int w = 0; w < workers; w++) {
            pool.execute(() -> {
                while (!stop.get()) {
                    if (!context.waitForResumeOrCancel(PAUSE_POLL_MS)) {
                        break;
                    }
                    if (!context.shouldContinue()) {
                        continue;
                    }
                    Integer index = work.poll();
                    if (index == null) {
                        break;
                    }
                    boolean done = runChunk(state, state.chunk(index), retryPolicy, context, tracker,
                            collector, task, stop, failure);
                    if (done) {
                        completed.incrementAndGet();
                    }
                    synchronized (checkpointLock) {
                        checkpointer.checkpoint(state);
                    }
                }
            });
        }

        pool.shutdown();
        try {
            while (!pool.awaitTermination(1, TimeUnit.SECONDS)) {
                logger.finest("Waiting for chunk workers of transfer " + state.getTransferId());
            }
        } catch (InterruptedException e) {
            stop.set(true);
            context.cancel();
            pool.shutdownNow();
            throw e;
        }

        return new Outcome(completed.get(), failure.get(), context.isCancelled() && failure.get() == null
                && !state.isAllCompleted());
    }

    private boolean runChunk(TransferState state, ChunkRecord chunk, RetryPolicy retryPolicy,
                             TransferContext context, ProgressTracker tracker, ProgressCollector collector,
                             ChunkTask task, AtomicBoolean stop, AtomicReference<Throwable> failure) {
        String transferId = state.getTransferId();
        int index = chunk.getIndex();
        int attempt = 0;

        while (true) {
            attempt++;
            state.markChunkInFlight(index);
            collector.publish(ProgressEvent.chunk(ProgressEvent.Kind.CHUNK_STARTED, transferId, index,
                    tracker.getOverallBytes(), state.getTotalSize(), "attempt " + attempt));

            long[] reported = new long[1];
            LongConsumer progress = bytesInChunk -> {
                long delta = bytesInChunk - reported[0];
                reported[0] = bytesInChunk;
                long overall = tracker.addBytesTransferred(delta);
                collector.publish(ProgressEvent.chunk(ProgressEvent.Kind.CHUNK_PROGRESS, transferId, index,
                        overall, state.getTotalSize(), null));
            };

            try {
                ChunkResult result = task.transfer(chunk, progress);
                long missing = chunk.length() - reported[0];
                long overall = missing != 0 ? tracker.addBytesTransferred(missing) : tracker.getOverallBytes();
                state.markChunkCompleted(index, result.eTag, result.checksum, clock.instant());
                collector.publish(ProgressEvent.chunk(ProgressEvent.Kind.CHUNK_COMPLETED, transferId, index,
                        overall, state.getTotalSize(), result.eTag));
                logger.fine("Chunk " + index + " of transfer " + transferId + " completed");
                return true;
            } catch (Exception e) {
                tracker.addBytesTransferred(-reported[0]);
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();

                if (retryPolicy.shouldRetry(e, attempt) && !stop.get() && !context.isCancelled()) {
                    state.recordChunkAttemptFailure(index, message);
                    logger.log(Level.WARNING, String.format("Chunk %d of transfer %s failed on attempt %d, retrying: %s",
                            index, transferId, attempt, message));
                    try {
                        retryPolicy.backoff(attempt);
                        continue;
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        context.cancel();
                        message = "Interrupted during retry backoff";
                    }
                }

                state.markChunkFailed(index, message, clock.instant());
                collector.publish(ProgressEvent.chunk(ProgressEvent.Kind.CHUNK_FAILED, transferId, index,
                        tracker.getOverallBytes(), state.getTotalSize(), message));
                failure.compareAndSet(null, e);
                stop.set(true);
                logger.severe("Chunk " + index + " of transfer " + transferId + " failed after " + attempt
                        + " attempt(s): " + message);
                return false;
            }
        }
    }

    private ThreadFactory threadFactory(String transferId) {
        AtomicInteger counter = new AtomicInteger();
        String shortId = transferId.length() > 8 ? transferId.substring(0, 8) : transferId;
        return r -> {
            Thread t = new Thread(r, threadPrefix + "-" + shortId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
