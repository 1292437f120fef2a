package dev.mars.s3kit.core;

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


import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable outcome of a chunked file transfer.
 *
 * <p>Holds the final phase, size and timing information, the chunk accounting needed
 * to judge a resume, and error details when the transfer did not complete. Failed
 * transfers still report the chunks that did complete, because that progress is kept
 * in the resume store for the next attempt.</p>
 *
 * <h3>Calculated metrics:</h3>
 * <ul>
 *   <li>{@link #getDuration()} - end time minus start time</li>
 *   <li>{@link #getAverageThroughput()} - bytes moved in this run per second</li>
 * </ul>
 *
 * <p>Instances are created through the concrete builders of {@link UploadResult}
 * and {@link DownloadResult}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @see UploadResult
 * @see DownloadResult
 */
public abstract class TransferResult {

    private final String transferId;
    private final String bucket;
    private final String key;
    private final Path localPath;
    private final TransferPhase finalPhase;
    private final long totalSize;
    private final long bytesTransferred;
    private final long chunkSize;
    private final int chunkCount;
    private final int completedChunks;
    private final int resumedChunks;
    private final String eTag;
    private final Instant startTime;
    private final Instant endTime;
    private final String errorMessage;
    private final Throwable cause;

    protected TransferResult(Builder<?, ?> builder) {
        this.transferId = Objects.requireNonNull(builder.transferId, "Transfer ID cannot be null");
        this.finalPhase = Objects.requireNonNull(builder.finalPhase, "Final phase cannot be null");
        this.bucket = builder.bucket;
        this.key = builder.key;
        this.localPath = builder.localPath;
        this.totalSize = builder.totalSize;
        this.bytesTransferred = builder.bytesTransferred;
        this.chunkSize = builder.chunkSize;
        this.chunkCount = builder.chunkCount;
        this.completedChunks = builder.completedChunks;
        this.resumedChunks = builder.resumedChunks;
        this.eTag = builder.eTag;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.errorMessage = builder.errorMessage;
        this.cause = builder.cause;
    }

    public String getTransferId() { return transferId; }
    public String getBucket() { return bucket; }
    public String getKey() { return key; }
    public Path getLocalPath() { return localPath; }
    public TransferPhase getFinalPhase() { return finalPhase; }
    public long getTotalSize() { return totalSize; }

    /**
     * Bytes moved over the network during this run. Chunks skipped on resume are not counted.
     */
    public long getBytesTransferred() { return bytesTransferred; }

    public long getChunkSize() { return chunkSize; }
    public int getChunkCount() { return chunkCount; }
    public int getCompletedChunks() { return completedChunks; }

    /**
     * Chunks that were already complete in the saved state and were not transferred again.
     */
    public int getResumedChunks() { return resumedChunks; }

    public boolean wasResumed() { return resumedChunks > 0; }

    public Optional<String> getETag() { return Optional.ofNullable(eTag); }
    public Optional<Instant> getStartTime() { return Optional.ofNullable(startTime); }
    public Optional<Instant> getEndTime() { return Optional.ofNullable(endTime); }
    public Optional<String> getErrorMessage() { return Optional.ofNullable(errorMessage); }
    public Optional<Throwable> getCause() { return Optional.ofNullable(cause); }

    public boolean isSuccessful() {
        return finalPhase == TransferPhase.COMPLETED;
    }

    public Duration getDuration() {
        if (startTime != null && endTime != null) {
            return Duration.between(startTime, endTime);
        }
        return Duration.ZERO;
    }

    /**
     * Average throughput of this run in bytes per second, 0 when no time elapsed.
     */
    public double getAverageThroughput() {
        long millis = getDuration().toMillis();
        if (millis <= 0) {
            return 0.0;
        }
        return (double) bytesTransferred / millis * 1000.0;
    }

    public double getCompletionPercentage() {
        return chunkCount > 0 ? (double) completedChunks / chunkCount * 100.0 : 0.0;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "transferId='" + transferId + '\'' +
                ", bucket='" + bucket + '\'' +
                ", key='" + key + '\'' +
                ", phase=" + finalPhase +
                ", size=" + totalSize +
                ", chunks=" + completedChunks + "/" + chunkCount +
                (errorMessage != null ? ", error='" + errorMessage + '\'' : "") +
                '}';
    }

    /**
     * Shared builder for the concrete result types.
     */
    @SuppressWarnings("unchecked")
    public abstract static class Builder<R extends TransferResult, B extends Builder<R, B>> {
        private String transferId;
        private String bucket;
        private String key;
        private Path localPath;
        private TransferPhase finalPhase;
        private long totalSize;
        private long bytesTransferred;
        private long chunkSize;
        private int chunkCount;
        private int completedChunks;
        private int resumedChunks;
        private String eTag;
        private Instant startTime;
        private Instant endTime;
        private String errorMessage;
        private Throwable cause;

        public B transferId(String transferId) {
            this.transferId = transferId;
            return (B) this;
        }

        public B bucket(String bucket) {
            this.bucket = bucket;
            return (B) this;
        }

        public B key(String key) {
            this.key = key;
            return (B) this;
        }

        public B localPath(Path localPath) {
            this.localPath = localPath;
            return (B) this;
        }

        public B finalPhase(TransferPhase finalPhase) {
            this.finalPhase = finalPhase;
            return (B) this;
        }

        public B totalSize(long totalSize) {
            this.totalSize = totalSize;
            return (B) this;
        }

        public B bytesTransferred(long bytesTransferred) {
            this.bytesTransferred = bytesTransferred;
            return (B) this;
        }

        public B chunkSize(long chunkSize) {
            this.chunkSize = chunkSize;
            return (B) this;
        }

        public B chunkCount(int chunkCount) {
            this.chunkCount = chunkCount;
            return (B) this;
        }

        public B completedChunks(int completedChunks) {
            this.completedChunks = completedChunks;
            return (B) this;
        }

        public B resumedChunks(int resumedChunks) {
            this.resumedChunks = resumedChunks;
            return (B) this;
        }

        public B eTag(String eTag) {
            this.eTag = eTag;
            return (B) this;
        }

        public B startTime(Instant startTime) {
            this.startTime = startTime;
            return (B) this;
        }

        public B endTime(Instant endTime) {
            this.endTime = endTime;
            return (B) this;
        }

        public B errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return (B) this;
        }

        public B cause(Throwable cause) {
            this.cause = cause;
            return (B) this;
        }

        public abstract R build();
    }
}
