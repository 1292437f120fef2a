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


import dev.mars.s3kit.client.S3StorageClient;
import dev.mars.s3kit.config.S3KitConfiguration;
import dev.mars.s3kit.core.DownloadResult;
import dev.mars.s3kit.core.ObjectDescriptor;
import dev.mars.s3kit.core.TransferDirection;
import dev.mars.s3kit.core.TransferPhase;
import dev.mars.s3kit.core.exceptions.ResumeDataInvalidException;
import dev.mars.s3kit.core.exceptions.S3KitException;
import dev.mars.s3kit.core.exceptions.StorageException;
import dev.mars.s3kit.core.exceptions.TransferException;
import dev.mars.s3kit.storage.ResumeStore;
import dev.mars.s3kit.util.SizeFormatter;

import java.io.IOException;
import java.io.InputStream;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.LongConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Downloads objects with parallel ranged GETs written straight into a preallocated
 * destination file.
 *
 * <p>Each worker writes its range at absolute offsets, so chunks may finish in any
 * order. Progress is checkpointed to the {@link ResumeStore}; a later call for the same
 * object and destination continues with the missing ranges as long as the remote object
 * is unchanged.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class MultipartDownloadManager {

    private static final Logger logger = Logger.getLogger(MultipartDownloadManager.class.getName());

    private final S3StorageClient storage;
    private final ResumeStore resumeStore;
    private final S3KitConfiguration configuration;
    private final Clock clock;
    private final ChunkExecutor executor;

    public MultipartDownloadManager(S3StorageClient storage, ResumeStore resumeStore,
                                    S3KitConfiguration configuration) {
        this(storage, resumeStore, configuration, Clock.systemUTC());
    }

    public MultipartDownloadManager(S3StorageClient storage, ResumeStore resumeStore,
                                    S3KitConfiguration configuration, Clock clock) {
        this.storage = storage;
        this.resumeStore = resumeStore;
        this.configuration = configuration;
        this.clock = clock;
        this.executor = new ChunkExecutor("s3kit-download", clock);
    }

    /**
     * Downloads {@code bucket/key} into {@code destination}.
     *
     * @throws TransferException if the object does not exist or the destination cannot be prepared
     * @throws S3KitException if the object metadata cannot be fetched
     */
    public DownloadResult download(String bucket, String key, Path destination, TransferOptions options,
                                   ProgressCollector collector) throws S3KitException {
        if (bucket == null || key == null || destination == null) {
            throw new IllegalArgumentException("Bucket, key and destination are required");
        }
        TransferOptions opts = options != null ? options : TransferOptions.defaults();
        ProgressCollector events = collector != null ? collector : new ProgressCollector();

        ObjectDescriptor object = storage.headObject(bucket, key)
                .orElseThrow(() -> new TransferException(null, "Object not found: " + bucket + "/" + key));
        long size = object.getSize();
        String fingerprint = object.fingerprint();

        long requested = opts.getChunkSize() > 0 ? opts.getChunkSize() : configuration.getDownloadChunkSize();
        long minimum = opts.getMinimumChunkSize() > 0 ? opts.getMinimumChunkSize()
                : configuration.getMinimumDownloadChunkSize();
        long chunkSize = ChunkPartitioner.effectiveChunkSize(requested, minimum, size, 0);
        int parallelism = TransferOptions.clampParallelism(
                opts.getMaxParallel() > 0 ? opts.getMaxParallel() : configuration.getMaxParallelDownloads(),
                TransferOptions.MAX_DOWNLOAD_PARALLELISM);
        RetryPolicy retryPolicy = new RetryPolicy(
                opts.getMaxRetries() >= 0 ? opts.getMaxRetries() : configuration.getMaxRetries(),
                opts.getRetryDelayMs() >= 0 ? opts.getRetryDelayMs() : configuration.getRetryDelayMs());

        try {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new TransferException(null, "Cannot create destination directory for " + destination, e);
        }

        if (size == 0) {
            return downloadEmpty(object, destination, chunkSize, events);
        }

        TransferState state = null;
        if (opts.isResume()) {
            state = loadResumable(bucket, key, destination, size, chunkSize, fingerprint);
        } else {
            resumeStore.delete(bucket, key, destination, TransferDirection.DOWNLOAD);
        }

        int resumedChunks = 0;
        if (state == null) {
            state = TransferState.create(bucket, key, destination, TransferDirection.DOWNLOAD, size, chunkSize,
                    fingerprint, clock);
            preallocate(state, destination, size);
            state.transitionTo(TransferPhase.INITIATED, clock.instant());
            checkpoint(state);
            logger.info(String.format("Starting download %s of %s/%s (%s) to %s: %d ranges of %s, %d workers",
                    state.getTransferId(), bucket, key, SizeFormatter.formatBytes(size), destination,
                    state.getChunkCount(), SizeFormatter.formatBytes(chunkSize), parallelism));
        } else {
            resumedChunks = state.completedCount();
            logger.info(String.format("Resuming download %s of %s/%s: %d of %d ranges already written",
                    state.getTransferId(), bucket, key, resumedChunks, state.getChunkCount()));
        }

        return runRanges(state, object, destination, parallelism, retryPolicy, opts.getContext(), events,
                resumedChunks);
    }

    private DownloadResult runRanges(TransferState state, ObjectDescriptor object, Path destination,
                                     int parallelism, RetryPolicy retryPolicy, TransferContext context,
                                     ProgressCollector events, int resumedChunks) {
        Instant startTime = clock.instant();
        String bucket = state.getBucket();
        String key = state.getKey();
        int bufferSize = configuration.getBufferSize();

        ProgressTracker tracker = new ProgressTracker(state.getTransferId());
        tracker.setTotalBytes(state.getTotalSize());
        tracker.setBaseline(state.completedBytes());
        tracker.start();

        state.transitionTo(TransferPhase.TRANSFERRING, clock.instant());
        checkpoint(state);

        Throwable failure;
        try (FileChannel channel = FileChannel.open(destination, StandardOpenOption.WRITE)) {
            ChunkExecutor.Outcome outcome = executor.run(state, state.pendingIndices(), parallelism, retryPolicy,
                    context, tracker, events,
                    (chunk, progress) -> {
                        long received = storage.getObjectRange(bucket, key, chunk.getStart(), chunk.getEnd(),
                                (response, body) -> writeRange(body, channel, chunk, bufferSize, progress));
                        if (received != chunk.length()) {
                            throw new StorageException("Range " + chunk.getStart() + "-" + chunk.getEnd() + " of "
                                    + bucket + "/" + key + " returned " + received + " bytes, expected "
                                    + chunk.length(), null);
                        }
                        return new ChunkExecutor.ChunkResult(null, null);
                    },
                    this::checkpoint);
            if (outcome.isSuccessful()) {
                channel.force(true);
                failure = null;
            } else {
                failure = outcome.getFailure() != null ? outcome.getFailure()
                        : new TransferException(state.getTransferId(), "Download cancelled");
            }
        } catch (IOException e) {
            failure = new TransferException(state.getTransferId(), "Cannot write destination file " + destination, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = new TransferException(state.getTransferId(), "Download interrupted", e);
        }

        if (failure != null) {
            return fail(state, object, destination, resumedChunks, startTime, failure, events);
        }

        state.transitionTo(TransferPhase.COMPLETING, clock.instant());
        state.transitionTo(TransferPhase.COMPLETED, clock.instant());
        resumeStore.delete(state);
        events.publish(ProgressEvent.transfer(ProgressEvent.Kind.TRANSFER_COMPLETED, state.getTransferId(),
                state.getTotalSize(), state.getTotalSize(), object.getETag()));
        logger.info(String.format("Download %s of %s/%s completed (%s, %s)",
                state.getTransferId(), bucket, key, SizeFormatter.formatBytes(state.getTotalSize()),
                SizeFormatter.formatRate(tracker.getAverageRateBytesPerSecond())));
        return resultOf(state, object, destination, resumedChunks, startTime).build();
    }

    /**
     * Copies one range body to its offset in the destination. Bytes beyond the range are
     * counted but not written.
     */
    private static long writeRange(InputStream body, FileChannel channel, ChunkRecord chunk, int bufferSize,
                                   LongConsumer progress) throws IOException {
        byte[] buffer = new byte[bufferSize];
        long limit = chunk.length();
        long count = 0;
        int read;
        while ((read = body.read(buffer)) != -1) {
            int toWrite = (int) Math.max(0, Math.min(read, limit - count));
            if (toWrite > 0) {
                ByteBuffer data = ByteBuffer.wrap(buffer, 0, toWrite);
                long position = chunk.getStart() + count;
                while (data.hasRemaining()) {
                    position += channel.write(data, position);
                }
            }
            count += read;
            progress.accept(Math.min(count, limit));
        }
        return count;
    }

    private DownloadResult downloadEmpty(ObjectDescriptor object, Path destination, long chunkSize,
                                         ProgressCollector events) throws S3KitException {
        TransferState state = TransferState.create(object.getBucket(), object.getKey(), destination,
                TransferDirection.DOWNLOAD, 0, chunkSize, object.fingerprint(), clock);
        Instant startTime = clock.instant();
        preallocate(state, destination, 0);
        state.transitionTo(TransferPhase.INITIATED, clock.instant());
        state.transitionTo(TransferPhase.TRANSFERRING, clock.instant());
        state.transitionTo(TransferPhase.COMPLETING, clock.instant());
        state.transitionTo(TransferPhase.COMPLETED, clock.instant());
        resumeStore.delete(state);
        events.publish(ProgressEvent.transfer(ProgressEvent.Kind.TRANSFER_COMPLETED, state.getTransferId(),
                0, 0, object.getETag()));
        logger.info("Downloaded empty object " + object.getBucket() + "/" + object.getKey() + " to " + destination);
        return resultOf(state, object, destination, 0, startTime).build();
    }

    private DownloadResult fail(TransferState state, ObjectDescriptor object, Path destination, int resumedChunks,
                                Instant startTime, Throwable failure, ProgressCollector events) {
        if (state.getPhase() != TransferPhase.FAILED) {
            state.transitionTo(TransferPhase.FAILED, clock.instant());
        }
        checkpoint(state);
        String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        events.publish(ProgressEvent.transfer(ProgressEvent.Kind.TRANSFER_FAILED, state.getTransferId(),
                state.completedBytes(), state.getTotalSize(), message));
        logger.severe(String.format("Download %s of %s/%s failed with %d of %d ranges written: %s",
                state.getTransferId(), state.getBucket(), state.getKey(), state.completedCount(),
                state.getChunkCount(), message));
        return resultOf(state, object, destination, resumedChunks, startTime)
                .errorMessage(message)
                .cause(failure)
                .build();
    }

    private DownloadResult.Builder resultOf(TransferState state, ObjectDescriptor object, Path destination,
                                            int resumedChunks, Instant startTime) {
        return DownloadResult.builder()
                .transferId(state.getTransferId())
                .bucket(state.getBucket())
                .key(state.getKey())
                .localPath(destination)
                .finalPhase(state.getPhase())
                .totalSize(state.getTotalSize())
                .bytesTransferred(state.completedBytes())
                .chunkSize(state.getChunkSize())
                .chunkCount(state.getChunkCount())
                .completedChunks(state.completedCount())
                .resumedChunks(resumedChunks)
                .startTime(startTime)
                .endTime(clock.instant())
                .eTag(object.getETag())
                .sourceLastModified(object.getLastModified());
    }

    private void preallocate(TransferState state, Path destination, long size) throws TransferException {
        try (RandomAccessFile file = new RandomAccessFile(destination.toFile(), "rw")) {
            file.setLength(size);
        } catch (IOException e) {
            throw new TransferException(state.getTransferId(), "Cannot preallocate destination file " + destination, e);
        }
    }

    private TransferState loadResumable(String bucket, String key, Path destination, long size, long chunkSize,
                                        String fingerprint) {
        Optional<TransferState> saved = resumeStore.load(bucket, key, destination, TransferDirection.DOWNLOAD);
        if (saved.isEmpty()) {
            return null;
        }
        TransferState state = saved.get();
        try {
            validateResumable(state, destination, size, chunkSize, fingerprint);
        } catch (ResumeDataInvalidException e) {
            logger.warning("Discarding saved download " + state.getTransferId() + " of " + bucket + "/" + key
                    + ": " + e.getMessage());
            resumeStore.delete(state);
            return null;
        }

        state.resetIncompleteChunks();
        if (state.getPhase() != TransferPhase.FAILED) {
            state.transitionTo(TransferPhase.FAILED, clock.instant());
        }
        state.transitionTo(TransferPhase.INITIATED, clock.instant());
        return state;
    }

    private void validateResumable(TransferState state, Path destination, long size, long chunkSize,
                                   String fingerprint) throws ResumeDataInvalidException {
        if (state.isOlderThan(configuration.getResumeMaxAge(), clock.instant())) {
            throw new ResumeDataInvalidException(state.getFingerprint(), "expired after "
                    + SizeFormatter.formatDuration(configuration.getResumeMaxAge()));
        }
        if (!fingerprint.equals(state.getFingerprint()) || state.getTotalSize() != size) {
            throw new ResumeDataInvalidException(state.getFingerprint(), fingerprint);
        }
        if (state.getChunkSize() != chunkSize) {
            throw new ResumeDataInvalidException("chunkSize=" + state.getChunkSize(), "chunkSize=" + chunkSize);
        }
        if (state.getPhase().isTerminal()) {
            throw new ResumeDataInvalidException(state.getFingerprint(), "transfer already " + state.getPhase());
        }
        long actualLength;
        try {
            actualLength = Files.exists(destination) ? Files.size(destination) : -1;
        } catch (IOException e) {
            actualLength = -1;
        }
        if (actualLength != size) {
            throw new ResumeDataInvalidException(state.getFingerprint(),
                    "destination length " + actualLength + " instead of " + size);
        }
    }

    private void checkpoint(TransferState state) {
        try {
            resumeStore.save(state);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not save resume state for transfer " + state.getTransferId(), e);
        }
    }
}
