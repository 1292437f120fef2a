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


import dev.mars.s3kit.client.CompletedPart;
import dev.mars.s3kit.client.S3StorageClient;
import dev.mars.s3kit.config.S3KitConfiguration;
import dev.mars.s3kit.core.TransferDirection;
import dev.mars.s3kit.core.TransferPhase;
import dev.mars.s3kit.core.UploadResult;
import dev.mars.s3kit.core.exceptions.ResumeDataInvalidException;
import dev.mars.s3kit.core.exceptions.S3KitException;
import dev.mars.s3kit.core.exceptions.StorageException;
import dev.mars.s3kit.core.exceptions.TransferException;
import dev.mars.s3kit.storage.ChecksumCalculator;
import dev.mars.s3kit.storage.FileRangeInputStream;
import dev.mars.s3kit.storage.ResumeStore;
import dev.mars.s3kit.util.SizeFormatter;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Uploads local files, using a resumable multipart upload when the file is larger
 * than one chunk.
 *
 * <p>The transfer state is checkpointed to the {@link ResumeStore} after the upload is
 * initiated, after every part and on failure, and is deleted once the upload has been
 * completed. A failed upload is never aborted automatically, so a later call with the
 * same bucket, key and file continues with the parts that are still missing.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class MultipartUploadManager {

    private static final Logger logger = Logger.getLogger(MultipartUploadManager.class.getName());

    private final S3StorageClient storage;
    private final ResumeStore resumeStore;
    private final S3KitConfiguration configuration;
    private final Clock clock;
    private final ChunkExecutor executor;

    public MultipartUploadManager(S3StorageClient storage, ResumeStore resumeStore,
                                  S3KitConfiguration configuration) {
        this(storage, resumeStore, configuration, Clock.systemUTC());
    }

    public MultipartUploadManager(S3StorageClient storage, ResumeStore resumeStore,
                                  S3KitConfiguration configuration, Clock clock) {
        this.storage = storage;
        this.resumeStore = resumeStore;
        this.configuration = configuration;
        this.clock = clock;
        this.executor = new ChunkExecutor("s3kit-upload", clock);
    }

    /**
     * Uploads {@code file} to {@code bucket/key}.
     *
     * <p>Chunk failures do not throw: they are reported through the returned result, whose
     * final phase is then {@link TransferPhase#FAILED}.</p>
     *
     * @throws TransferException if the source file cannot be used
     * @throws S3KitException if the upload cannot be initiated
     */
    public UploadResult upload(String bucket, String key, Path file, TransferOptions options,
                               ProgressCollector collector) throws S3KitException {
        if (bucket == null || key == null || file == null) {
            throw new IllegalArgumentException("Bucket, key and file are required");
        }
        TransferOptions opts = options != null ? options : TransferOptions.defaults();
        ProgressCollector events = collector != null ? collector : new ProgressCollector();

        long size;
        String fingerprint;
        try {
            if (!Files.isRegularFile(file)) {
                throw new TransferException(null, "Source is not a regular file: " + file);
            }
            size = Files.size(file);
            fingerprint = fingerprintOf(file, size);
        } catch (IOException e) {
            throw new TransferException(null, "Cannot read source file " + file, e);
        }

        long requested = opts.getChunkSize() > 0 ? opts.getChunkSize() : configuration.getUploadChunkSize();
        long minimum = opts.getMinimumChunkSize() > 0 ? opts.getMinimumChunkSize() : configuration.getMinimumPartSize();
        long chunkSize = ChunkPartitioner.effectiveChunkSize(requested, minimum, size, ChunkPartitioner.MAX_PARTS);
        RetryPolicy retryPolicy = retryPolicyFor(opts);

        if (size <= chunkSize) {
            return singlePut(bucket, key, file, size, chunkSize, opts, retryPolicy, events);
        }

        int parallelism = TransferOptions.clampParallelism(
                opts.getMaxParallel() > 0 ? opts.getMaxParallel() : configuration.getMaxParallelUploads(),
                TransferOptions.MAX_UPLOAD_PARALLELISM);

        TransferState state = null;
        if (opts.isResume()) {
            state = loadResumable(bucket, key, file, size, chunkSize, fingerprint);
        } else {
            discardExisting(bucket, key, file);
        }

        int resumedChunks = 0;
        boolean resumed = state != null;
        if (state == null) {
            state = TransferState.create(bucket, key, file, TransferDirection.UPLOAD, size, chunkSize,
                    fingerprint, clock);
            initiate(state, opts);
            logger.info(String.format("Starting multipart upload %s of %s (%s) to %s/%s: %d parts of %s, %d workers",
                    state.getTransferId(), file, SizeFormatter.formatBytes(size), bucket, key,
                    state.getChunkCount(), SizeFormatter.formatBytes(chunkSize), parallelism));
        } else {
            resumedChunks = state.completedCount();
            logger.info(String.format("Resuming multipart upload %s of %s to %s/%s: %d of %d parts already uploaded",
                    state.getTransferId(), file, bucket, key, resumedChunks, state.getChunkCount()));
        }

        return runMultipart(state, file, opts, parallelism, retryPolicy, events, resumedChunks, resumed);
    }

    /**
     * Aborts the multipart upload recorded for {@code bucket/key/file} and forgets it.
     *
     * @return true if a recorded upload was found
     */
    public boolean abort(String bucket, String key, Path file) throws S3KitException {
        Optional<TransferState> existing = resumeStore.load(bucket, key, file, TransferDirection.UPLOAD);
        if (existing.isEmpty()) {
            return false;
        }
        TransferState state = existing.get();
        if (state.getUploadId() != null) {
            storage.abortMultipartUpload(bucket, key, state.getUploadId());
        }
        state.transitionTo(TransferPhase.ABORTED, clock.instant());
        resumeStore.delete(state);
        logger.info("Aborted multipart upload " + state.getTransferId() + " of " + bucket + "/" + key);
        return true;
    }

    private void initiate(TransferState state, TransferOptions opts) throws S3KitException {
        String uploadId = storage.initiateMultipartUpload(state.getBucket(), state.getKey(),
                opts.getContentType(), opts.getMetadata(), opts.getObjectHeaders());
        state.setUploadId(uploadId, clock.instant());
        state.transitionTo(TransferPhase.INITIATED, clock.instant());
        checkpoint(state);
    }

    /**
     * Uploads the pending parts and completes the upload. A resumed upload whose id the
     * server no longer knows is started again once under a new upload id.
     */
    private UploadResult runMultipart(TransferState state, Path file, TransferOptions opts, int parallelism,
                                      RetryPolicy retryPolicy, ProgressCollector events, int resumedChunks,
                                      boolean resumed) {
        TransferContext context = opts.getContext();
        Instant startTime = clock.instant();
        String bucket = state.getBucket();
        String key = state.getKey();
        String uploadId = state.getUploadId();

        ProgressTracker tracker = new ProgressTracker(state.getTransferId());
        tracker.setTotalBytes(state.getTotalSize());
        tracker.setBaseline(state.completedBytes());
        tracker.start();

        state.transitionTo(TransferPhase.TRANSFERRING, clock.instant());
        checkpoint(state);

        Throwable failure;
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            ChunkExecutor.Outcome outcome = executor.run(state, state.pendingIndices(), parallelism, retryPolicy,
                    context, tracker, events,
                    (chunk, progress) -> {
                        String md5 = ChecksumCalculator.md5Base64(channel, chunk.getStart(), chunk.length());
                        InputStream part = new FileRangeInputStream(channel, chunk.getStart(), chunk.length());
                        String eTag = storage.uploadPart(bucket, key, uploadId, chunk.partNumber(), part,
                                chunk.length(), md5, progress);
                        return new ChunkExecutor.ChunkResult(eTag, md5);
                    },
                    this::checkpoint);
            failure = outcome.isSuccessful() ? null
                    : outcome.getFailure() != null ? outcome.getFailure()
                    : new TransferException(state.getTransferId(), "Upload cancelled");
        } catch (IOException e) {
            failure = new TransferException(state.getTransferId(), "Cannot read source file " + file, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = new TransferException(state.getTransferId(), "Upload interrupted", e);
        }

        if (failure == null) {
            try {
                state.transitionTo(TransferPhase.COMPLETING, clock.instant());
                checkpoint(state);
                String eTag = completeWithRetry(state, retryPolicy);
                state.transitionTo(TransferPhase.COMPLETED, clock.instant());
                resumeStore.delete(state);
                events.publish(ProgressEvent.transfer(ProgressEvent.Kind.TRANSFER_COMPLETED, state.getTransferId(),
                        state.getTotalSize(), state.getTotalSize(), eTag));
                logger.info(String.format("Multipart upload %s of %s/%s completed (%s, %s)",
                        state.getTransferId(), bucket, key, SizeFormatter.formatBytes(state.getTotalSize()),
                        SizeFormatter.formatRate(tracker.getAverageRateBytesPerSecond())));
                return resultOf(state, file, resumedChunks, startTime).eTag(eTag).build();
            } catch (S3KitException e) {
                failure = e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failure = new TransferException(state.getTransferId(), "Upload interrupted", e);
            }
        }

        if (resumed && isUnknownUpload(failure)) {
            logger.warning(String.format("Saved upload id %s of transfer %s is no longer known to the server, "
                    + "uploading %s/%s again", uploadId, state.getTransferId(), bucket, key));
            state.invalidate(state.getFingerprint(), clock.instant());
            try {
                initiate(state, opts);
                return runMultipart(state, file, opts, parallelism, retryPolicy, events, 0, false);
            } catch (S3KitException e) {
                failure = e;
            }
        }

        return fail(state, file, resumedChunks, startTime, failure, events);
    }

    private static boolean isUnknownUpload(Throwable failure) {
        return failure instanceof StorageException
                && "NoSuchUpload".equals(((StorageException) failure).getErrorCode());
    }

    private String completeWithRetry(TransferState state, RetryPolicy retryPolicy)
            throws S3KitException, InterruptedException {
        List<CompletedPart> parts = new ArrayList<>();
        for (ChunkRecord chunk : state.getChunks()) {
            parts.add(new CompletedPart(chunk.partNumber(), chunk.getETag()));
        }
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return storage.completeMultipartUpload(state.getBucket(), state.getKey(), state.getUploadId(), parts);
            } catch (S3KitException e) {
                if (!retryPolicy.shouldRetry(e, attempt)) {
                    throw e;
                }
                logger.log(Level.WARNING, String.format("Completing upload %s failed on attempt %d, retrying: %s",
                        state.getTransferId(), attempt, e.getMessage()));
                retryPolicy.backoff(attempt);
            }
        }
    }

    private UploadResult fail(TransferState state, Path file, int resumedChunks, Instant startTime,
                              Throwable failure, ProgressCollector events) {
        if (!state.getPhase().isTerminal() && state.getPhase() != TransferPhase.FAILED) {
            state.transitionTo(TransferPhase.FAILED, clock.instant());
        }
        checkpoint(state);
        String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        events.publish(ProgressEvent.transfer(ProgressEvent.Kind.TRANSFER_FAILED, state.getTransferId(),
                state.completedBytes(), state.getTotalSize(), message));
        logger.severe(String.format("Multipart upload %s of %s/%s failed with %d of %d parts uploaded: %s",
                state.getTransferId(), state.getBucket(), state.getKey(), state.completedCount(),
                state.getChunkCount(), message));
        return resultOf(state, file, resumedChunks, startTime)
                .errorMessage(message)
                .cause(failure)
                .build();
    }

    private UploadResult.Builder resultOf(TransferState state, Path file, int resumedChunks, Instant startTime) {
        return UploadResult.builder()
                .transferId(state.getTransferId())
                .bucket(state.getBucket())
                .key(state.getKey())
                .localPath(file)
                .finalPhase(state.getPhase())
                .totalSize(state.getTotalSize())
                .bytesTransferred(state.completedBytes())
                .chunkSize(state.getChunkSize())
                .chunkCount(state.getChunkCount())
                .completedChunks(state.completedCount())
                .resumedChunks(resumedChunks)
                .startTime(startTime)
                .endTime(clock.instant())
                .uploadId(state.getUploadId())
                .multipart(true);
    }

    private UploadResult singlePut(String bucket, String key, Path file, long size, long chunkSize,
                                   TransferOptions opts, RetryPolicy retryPolicy, ProgressCollector events)
            throws S3KitException {
        TransferState state = TransferState.create(bucket, key, file, TransferDirection.UPLOAD, size,
                chunkSize, null, clock);
        Instant startTime = clock.instant();
        logger.fine("Uploading " + file + " to " + bucket + "/" + key + " in a single request");

        int attempt = 0;
        while (true) {
            attempt++;
            if (opts.getContext().isCancelled()) {
                return cancelledPut(state, file, startTime, events);
            }
            events.publish(ProgressEvent.chunk(ProgressEvent.Kind.CHUNK_STARTED, state.getTransferId(), 0,
                    0, size, "attempt " + attempt));
            try (InputStream in = Files.newInputStream(file)) {
                String eTag = storage.putObject(bucket, key, in, size, opts.getContentType(), opts.getMetadata(),
                        opts.getObjectHeaders(),
                        bytes -> events.publish(ProgressEvent.chunk(ProgressEvent.Kind.CHUNK_PROGRESS,
                                state.getTransferId(), 0, bytes, size, null)));
                events.publish(ProgressEvent.chunk(ProgressEvent.Kind.CHUNK_COMPLETED, state.getTransferId(), 0,
                        size, size, eTag));
                events.publish(ProgressEvent.transfer(ProgressEvent.Kind.TRANSFER_COMPLETED, state.getTransferId(),
                        size, size, eTag));
                logger.info("Uploaded " + file + " to " + bucket + "/" + key + " ("
                        + SizeFormatter.formatBytes(size) + ")");
                return UploadResult.builder()
                        .transferId(state.getTransferId())
                        .bucket(bucket)
                        .key(key)
                        .localPath(file)
                        .finalPhase(TransferPhase.COMPLETED)
                        .totalSize(size)
                        .bytesTransferred(size)
                        .chunkSize(chunkSize)
                        .chunkCount(state.getChunkCount())
                        .completedChunks(state.getChunkCount())
                        .startTime(startTime)
                        .endTime(clock.instant())
                        .eTag(eTag)
                        .multipart(false)
                        .build();
            } catch (S3KitException e) {
                if (!retryPolicy.shouldRetry(e, attempt)) {
                    return failedPut(state, file, startTime, e, events);
                }
                logger.log(Level.WARNING, String.format("Upload of %s failed on attempt %d, retrying: %s",
                        file, attempt, e.getMessage()));
                try {
                    retryPolicy.backoff(attempt);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return failedPut(state, file, startTime, e, events);
                }
            } catch (IOException e) {
                throw new TransferException(state.getTransferId(), "Cannot read source file " + file, e);
            }
        }
    }

    private UploadResult cancelledPut(TransferState state, Path file, Instant startTime, ProgressCollector events) {
        return failedPut(state, file, startTime, new TransferException(state.getTransferId(), "Upload cancelled"),
                events);
    }

    private UploadResult failedPut(TransferState state, Path file, Instant startTime, Exception failure,
                                   ProgressCollector events) {
        events.publish(ProgressEvent.chunk(ProgressEvent.Kind.CHUNK_FAILED, state.getTransferId(), 0,
                0, state.getTotalSize(), failure.getMessage()));
        events.publish(ProgressEvent.transfer(ProgressEvent.Kind.TRANSFER_FAILED, state.getTransferId(),
                0, state.getTotalSize(), failure.getMessage()));
        logger.severe("Upload of " + file + " to " + state.getBucket() + "/" + state.getKey() + " failed: "
                + failure.getMessage());
        return UploadResult.builder()
                .transferId(state.getTransferId())
                .bucket(state.getBucket())
                .key(state.getKey())
                .localPath(file)
                .finalPhase(TransferPhase.FAILED)
                .totalSize(state.getTotalSize())
                .chunkSize(state.getChunkSize())
                .chunkCount(state.getChunkCount())
                .startTime(startTime)
                .endTime(clock.instant())
                .errorMessage(failure.getMessage())
                .cause(failure)
                .multipart(false)
                .build();
    }

    /**
     * Returns a saved state that can be continued, or null. Stale or mismatching records
     * are discarded and their multipart uploads aborted on a best-effort basis.
     */
    private TransferState loadResumable(String bucket, String key, Path file, long size, long chunkSize,
                                        String fingerprint) {
        Optional<TransferState> saved = resumeStore.load(bucket, key, file, TransferDirection.UPLOAD);
        if (saved.isEmpty()) {
            return null;
        }
        TransferState state = saved.get();
        try {
            validateResumable(state, size, chunkSize, fingerprint);
        } catch (ResumeDataInvalidException e) {
            logger.warning("Discarding saved upload " + state.getTransferId() + " of " + file + ": " + e.getMessage());
            abortQuietly(state);
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

    private void validateResumable(TransferState state, long size, long chunkSize, String fingerprint)
            throws ResumeDataInvalidException {
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
        if (state.getUploadId() == null || state.getPhase().isTerminal()) {
            throw new ResumeDataInvalidException(state.getFingerprint(), "no active upload");
        }
    }

    private void discardExisting(String bucket, String key, Path file) {
        resumeStore.load(bucket, key, file, TransferDirection.UPLOAD).ifPresent(state -> {
            abortQuietly(state);
            resumeStore.delete(state);
        });
    }

    private void abortQuietly(TransferState state) {
        if (state.getUploadId() == null) {
            return;
        }
        try {
            storage.abortMultipartUpload(state.getBucket(), state.getKey(), state.getUploadId());
        } catch (S3KitException e) {
            logger.log(Level.WARNING, "Could not abort stale multipart upload " + state.getUploadId(), e);
        }
    }

    private void checkpoint(TransferState state) {
        try {
            resumeStore.save(state);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not save resume state for transfer " + state.getTransferId(), e);
        }
    }

    private RetryPolicy retryPolicyFor(TransferOptions opts) {
        return new RetryPolicy(
                opts.getMaxRetries() >= 0 ? opts.getMaxRetries() : configuration.getMaxRetries(),
                opts.getRetryDelayMs() >= 0 ? opts.getRetryDelayMs() : configuration.getRetryDelayMs());
    }

    static String fingerprintOf(Path file, long size) throws IOException {
        return "size=" + size + ";modified=" + Files.getLastModifiedTime(file).toMillis();
    }
}
