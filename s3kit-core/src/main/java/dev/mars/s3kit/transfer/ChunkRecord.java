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

import java.time.Instant;

/**
 * Progress of one chunk: its byte range, status, retry count and the ETag or checksum
 * recorded when it completed.
 *
 * <p>Mutators are package-private and synchronized on the record; {@link TransferState}
 * is the only writer.</p>
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChunkRecord {

    private int index;
    private long start;
    private long end;
    private ChunkStatus status = ChunkStatus.PENDING;
    private int retryCount;
    private String eTag;
    private String checksum;
    private long bytesTransferred;
    private String lastError;
    private Instant completedAt;

    private ChunkRecord() {
    }

    ChunkRecord(ChunkRange range) {
        this.index = range.getIndex();
        this.start = range.getStart();
        this.end = range.getEnd();
    }

    synchronized ChunkRecord copy() {
        ChunkRecord copy = new ChunkRecord();
        copy.index = index;
        copy.start = start;
        copy.end = end;
        copy.status = status;
        copy.retryCount = retryCount;
        copy.eTag = eTag;
        copy.checksum = checksum;
        copy.bytesTransferred = bytesTransferred;
        copy.lastError = lastError;
        copy.completedAt = completedAt;
        return copy;
    }

    public int getIndex() { return index; }
    public long getStart() { return start; }
    public long getEnd() { return end; }
    public synchronized ChunkStatus getStatus() { return status; }
    public synchronized int getRetryCount() { return retryCount; }
    public synchronized String getETag() { return eTag; }
    public synchronized String getChecksum() { return checksum; }
    public synchronized long getBytesTransferred() { return bytesTransferred; }
    public synchronized String getLastError() { return lastError; }
    public synchronized Instant getCompletedAt() { return completedAt; }

    public long length() {
        return end - start + 1;
    }

    public ChunkRange toRange() {
        return new ChunkRange(index, start, end);
    }

    public int partNumber() {
        return index + 1;
    }

    public synchronized boolean isCompleted() {
        return status == ChunkStatus.COMPLETED;
    }

    synchronized void markInFlight() {
        status = ChunkStatus.IN_FLIGHT;
        bytesTransferred = 0;
    }

    synchronized void markCompleted(String eTag, String checksum, Instant when) {
        this.status = ChunkStatus.COMPLETED;
        this.eTag = eTag;
        this.checksum = checksum;
        this.bytesTransferred = length();
        this.lastError = null;
        this.completedAt = when;
    }

    synchronized void recordAttemptFailure(String error) {
        retryCount++;
        lastError = error;
        bytesTransferred = 0;
    }

    synchronized void markFailed(String error) {
        status = ChunkStatus.FAILED;
        lastError = error;
        bytesTransferred = 0;
    }

    synchronized void resetForRetry() {
        if (status != ChunkStatus.COMPLETED) {
            status = ChunkStatus.PENDING;
            bytesTransferred = 0;
            retryCount = 0;
        }
    }

    synchronized void resetCompletely() {
        status = ChunkStatus.PENDING;
        retryCount = 0;
        eTag = null;
        checksum = null;
        bytesTransferred = 0;
        lastError = null;
        completedAt = null;
    }

    @Override
    public synchronized String toString() {
        return "ChunkRecord{" + index + ": " + start + "-" + end + ", " + status
                + (retryCount > 0 ? ", retries=" + retryCount : "")
                + (eTag != null ? ", eTag=" + eTag : "") + '}';
    }
}
