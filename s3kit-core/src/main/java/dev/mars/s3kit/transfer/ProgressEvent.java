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


import java.time.Instant;

/**
 * A progress notification published by transfer workers.
 *
 * <p>{@code bytesTransferred} is cumulative for the whole transfer at the time of the
 * event. Transfer-level events carry chunk index -1.</p>
 */
public final class ProgressEvent {

    public enum Kind {
        CHUNK_STARTED,
        CHUNK_PROGRESS,
        CHUNK_COMPLETED,
        CHUNK_FAILED,
        TRANSFER_COMPLETED,
        TRANSFER_FAILED
    }

    private final Kind kind;
    private final String transferId;
    private final int chunkIndex;
    private final long bytesTransferred;
    private final long totalBytes;
    private final String message;
    private final Instant timestamp;

    public ProgressEvent(Kind kind, String transferId, int chunkIndex, long bytesTransferred,
                         long totalBytes, String message, Instant timestamp) {
        this.kind = kind;
        this.transferId = transferId;
        this.chunkIndex = chunkIndex;
        this.bytesTransferred = bytesTransferred;
        this.totalBytes = totalBytes;
        this.message = message;
        this.timestamp = timestamp;
    }

    public static ProgressEvent chunk(Kind kind, String transferId, int chunkIndex, long bytesTransferred,
                                      long totalBytes, String message) {
        return new ProgressEvent(kind, transferId, chunkIndex, bytesTransferred, totalBytes, message, Instant.now());
    }

    public static ProgressEvent transfer(Kind kind, String transferId, long bytesTransferred,
                                         long totalBytes, String message) {
        return new ProgressEvent(kind, transferId, -1, bytesTransferred, totalBytes, message, Instant.now());
    }

    public Kind getKind() { return kind; }
    public String getTransferId() { return transferId; }
    public int getChunkIndex() { return chunkIndex; }
    public long getBytesTransferred() { return bytesTransferred; }
    public long getTotalBytes() { return totalBytes; }
    public String getMessage() { return message; }
    public Instant getTimestamp() { return timestamp; }

    public boolean isTransferLevel() {
        return chunkIndex < 0;
    }

    public double getPercentage() {
        return totalBytes > 0 ? Math.min(100.0, bytesTransferred * 100.0 / totalBytes) : 100.0;
    }

    @Override
    public String toString() {
        return String.format("ProgressEvent{%s, transfer=%s, chunk=%d, %d/%d%s}",
                kind, transferId, chunkIndex, bytesTransferred, totalBytes,
                message != null ? ", " + message : "");
    }
}
