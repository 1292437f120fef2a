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


import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.mars.s3kit.core.TransferDirection;
import dev.mars.s3kit.core.TransferPhase;
import dev.mars.s3kit.core.exceptions.InvalidTransitionException;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Serializable description of an in-flight or interrupted chunked transfer.
 *
 * <p>The chunk records tile {@code [0, totalSize)} without gaps or overlaps and there is
 * exactly one record per index. Chunk updates lock the individual record; phase changes
 * and the upload id lock the state itself. {@link #snapshot()} produces a consistent
 * copy for persisting while workers keep running.</p>
 *
 * <p>The fingerprint captured at start identifies the content being transferred:
 * local size and modification time for uploads, remote ETag, size and modification
 * time for downloads. A resumed transfer whose fingerprint no longer matches must
 * start over.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransferState {

    static final int FORMAT_VERSION = 1;

    private int version = FORMAT_VERSION;
    private String transferId;
    private String bucket;
    private String key;
    private String localPath;
    private TransferDirection direction;
    private long totalSize;
    private long chunkSize;
    private TransferPhase phase = TransferPhase.NOT_STARTED;
    private String uploadId;
    private String fingerprint;
    private List<ChunkRecord> chunks = new ArrayList<>();
    private Instant createdAt;
    private Instant lastUpdated;

    private TransferState() {
    }

    public static TransferState create(String bucket, String key, Path localPath, TransferDirection direction,
                                       long totalSize, long chunkSize, String fingerprint, Clock clock) {
        TransferState state = new TransferState();
        state.transferId = UUID.randomUUID().toString();
        state.bucket = Objects.requireNonNull(bucket, "Bucket cannot be null");
        state.key = Objects.requireNonNull(key, "Key cannot be null");
        state.localPath = localPath.toAbsolutePath().normalize().toString();
        state.direction = Objects.requireNonNull(direction, "Direction cannot be null");
        state.totalSize = totalSize;
        state.chunkSize = chunkSize;
        state.fingerprint = fingerprint;
        for (ChunkRange range : ChunkPartitioner.partition(totalSize, chunkSize)) {
            state.chunks.add(new ChunkRecord(range));
        }
        state.createdAt = clock.instant();
        state.lastUpdated = state.createdAt;
        return state;
    }

    public int getVersion() { return version; }
    public String getTransferId() { return transferId; }
    public String getBucket() { return bucket; }
    public String getKey() { return key; }
    public Path getLocalPath() { return Paths.get(localPath); }
    public TransferDirection getDirection() { return direction; }
    public long getTotalSize() { return totalSize; }
    public long getChunkSize() { return chunkSize; }
    public String getFingerprint() { return fingerprint; }
    public Instant getCreatedAt() { return createdAt; }

    public synchronized TransferPhase getPhase() { return phase; }
    public synchronized String getUploadId() { return uploadId; }
    public synchronized Instant getLastUpdated() { return lastUpdated; }

    public List<ChunkRecord> getChunks() {
        return Collections.unmodifiableList(chunks);
    }

    public ChunkRecord chunk(int index) {
        return chunks.get(index);
    }

    public int getChunkCount() {
        return chunks.size();
    }

    /**
     * Moves to {@code target}. Moving to the current phase is a no-op.
     *
     * @throws InvalidTransitionException if the transition is not allowed
     */
    public synchronized void transitionTo(TransferPhase target, Instant when) {
        if (phase == target) {
            return;
        }
        if (!phase.canTransitionTo(target)) {
            throw new InvalidTransitionException(transferId, phase, target, phase.getValidTransitions());
        }
        phase = target;
        lastUpdated = when;
    }

    public synchronized void setUploadId(String uploadId, Instant when) {
        this.uploadId = uploadId;
        this.lastUpdated = when;
    }

    public void markChunkInFlight(int index) {
        chunks.get(index).markInFlight();
    }

    public void markChunkCompleted(int index, String eTag, String checksum, Instant when) {
        chunks.get(index).markCompleted(eTag, checksum, when);
        touch(when);
    }

    public void recordChunkAttemptFailure(int index, String error) {
        chunks.get(index).recordAttemptFailure(error);
    }

    public void markChunkFailed(int index, String error, Instant when) {
        chunks.get(index).markFailed(error);
        touch(when);
    }

    /**
     * Returns incomplete chunks to PENDING before a resume. Completed chunks are kept.
     */
    public void resetIncompleteChunks() {
        chunks.forEach(ChunkRecord::resetForRetry);
    }

    /**
     * Discards all chunk progress and the upload id.
     */
    public synchronized void invalidate(String newFingerprint, Instant when) {
        chunks.forEach(ChunkRecord::resetCompletely);
        uploadId = null;
        fingerprint = newFingerprint;
        phase = TransferPhase.NOT_STARTED;
        lastUpdated = when;
    }

    public List<Integer> pendingIndices() {
        List<Integer> pending = new ArrayList<>();
        for (ChunkRecord chunk : chunks) {
            if (!chunk.isCompleted()) {
                pending.add(chunk.getIndex());
            }
        }
        return pending;
    }

    public int completedCount() {
        int count = 0;
        for (ChunkRecord chunk : chunks) {
            if (chunk.isCompleted()) {
                count++;
            }
        }
        return count;
    }

    public long completedBytes() {
        long bytes = 0;
        for (ChunkRecord chunk : chunks) {
            if (chunk.isCompleted()) {
                bytes += chunk.length();
            }
        }
        return bytes;
    }

    public boolean isAllCompleted() {
        return completedCount() == chunks.size();
    }

    public boolean isOlderThan(Duration maxAge, Instant now) {
        Instant reference = getLastUpdated() != null ? getLastUpdated() : createdAt;
        return reference != null && reference.plus(maxAge).isBefore(now);
    }

    /**
     * Consistent deep copy suitable for serialization while workers update this state.
     */
    public TransferState snapshot() {
        TransferState copy = new TransferState();
        copy.version = version;
        copy.transferId = transferId;
        copy.bucket = bucket;
        copy.key = key;
        copy.localPath = localPath;
        copy.direction = direction;
        copy.totalSize = totalSize;
        copy.chunkSize = chunkSize;
        copy.fingerprint = fingerprint;
        copy.createdAt = createdAt;
        synchronized (this) {
            copy.phase = phase;
            copy.uploadId = uploadId;
            copy.lastUpdated = lastUpdated;
        }
        for (ChunkRecord chunk : chunks) {
            copy.chunks.add(chunk.copy());
        }
        return copy;
    }

    /**
     * Checks the structural invariants of a state loaded from disk: one record per
     * index and ranges that tile the total size.
     */
    public boolean isConsistent() {
        if (transferId == null || bucket == null || key == null || localPath == null || direction == null
                || phase == null || chunkSize <= 0 || totalSize < 0) {
            return false;
        }
        long expectedStart = 0;
        for (int i = 0; i < chunks.size(); i++) {
            ChunkRecord chunk = chunks.get(i);
            if (chunk.getIndex() != i || chunk.getStart() != expectedStart || chunk.getEnd() < chunk.getStart()) {
                return false;
            }
            expectedStart = chunk.getEnd() + 1;
        }
        return expectedStart == totalSize
                && chunks.size() == ChunkPartitioner.chunkCount(totalSize, chunkSize);
    }

    private synchronized void touch(Instant when) {
        lastUpdated = when;
    }

    @Override
    public String toString() {
        return "TransferState{" +
                "transferId='" + transferId + '\'' +
                ", " + direction +
                ", " + bucket + "/" + key +
                ", phase=" + getPhase() +
                ", chunks=" + completedCount() + "/" + chunks.size() +
                '}';
    }
}
