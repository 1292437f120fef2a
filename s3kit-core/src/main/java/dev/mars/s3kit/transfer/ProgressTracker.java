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


import dev.mars.s3kit.util.SizeFormatter;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Byte counter for one transfer with a smoothed rate and an ETA.
 *
 * <p>Several chunk workers add to the same tracker. Bytes already present from a
 * previous run are registered with {@link #setBaseline(long)} so that the percentage
 * reflects the whole object while the rate only counts bytes moved now.</p>
 */
public class ProgressTracker {
    private final String transferId;
    private final AtomicLong totalBytes;
    private final AtomicLong baselineBytes;
    private final AtomicLong transferredBytes;
    private final AtomicReference<Instant> startTime;
    private final AtomicReference<Instant> lastRateUpdate;
    private final AtomicLong lastRateBytes;
    private final AtomicReference<Double> currentRate;

    private static final long RATE_UPDATE_INTERVAL_MS = 1000;

    public ProgressTracker(String transferId) {
        this.transferId = transferId;
        this.totalBytes = new AtomicLong(-1);
        this.baselineBytes = new AtomicLong(0);
        this.transferredBytes = new AtomicLong(0);
        this.startTime = new AtomicReference<>();
        this.lastRateUpdate = new AtomicReference<>();
        this.lastRateBytes = new AtomicLong(0);
        this.currentRate = new AtomicReference<>(0.0);
    }

    public String getTransferId() {
        return transferId;
    }

    public void start() {
        Instant now = Instant.now();
        startTime.set(now);
        lastRateUpdate.set(now);
    }

    public void setTotalBytes(long totalBytes) {
        this.totalBytes.set(totalBytes);
    }

    public long getTotalBytes() {
        return totalBytes.get();
    }

    public void setBaseline(long bytes) {
        baselineBytes.set(bytes);
    }

    /**
     * Adds (or, for a failed attempt, removes) bytes moved in this run.
     *
     * @return bytes of the whole object accounted for so far
     */
    public long addBytesTransferred(long delta) {
        long moved = transferredBytes.addAndGet(delta);
        updateTransferRate(moved, Instant.now());
        return baselineBytes.get() + moved;
    }

    /**
     * Bytes moved during this run.
     */
    public long getTransferredBytes() {
        return transferredBytes.get();
    }

    public long getOverallBytes() {
        return baselineBytes.get() + transferredBytes.get();
    }

    public double getProgressPercentage() {
        long total = totalBytes.get();
        if (total <= 0) {
            return 0.0;
        }
        return Math.min(1.0, (double) getOverallBytes() / total);
    }

    public double getCurrentRateBytesPerSecond() {
        return currentRate.get();
    }

    public long getEstimatedRemainingSeconds() {
        long total = totalBytes.get();
        double rate = currentRate.get();
        if (total <= 0 || rate <= 0) {
            return -1;
        }
        return (long) (Math.max(0, total - getOverallBytes()) / rate);
    }

    public String getEstimatedRemainingTime() {
        long seconds = getEstimatedRemainingSeconds();
        if (seconds < 0) {
            return "Unknown";
        }
        if (seconds < 60) {
            return seconds + "s";
        } else if (seconds < 3600) {
            return (seconds / 60) + "m " + (seconds % 60) + "s";
        } else {
            long hours = seconds / 3600;
            long minutes = (seconds % 3600) / 60;
            return hours + "h " + minutes + "m";
        }
    }

    public Instant getStartTime() {
        return startTime.get();
    }

    public double getAverageRateBytesPerSecond() {
        Instant start = startTime.get();
        if (start == null) {
            return 0.0;
        }
        long elapsedMs = Duration.between(start, Instant.now()).toMillis();
        if (elapsedMs <= 0) {
            return 0.0;
        }
        return (double) transferredBytes.get() / elapsedMs * 1000.0;
    }

    private void updateTransferRate(long currentBytes, Instant now) {
        Instant lastUpdate = lastRateUpdate.get();
        if (lastUpdate == null) {
            return;
        }
        long timeDiffMs = Duration.between(lastUpdate, now).toMillis();
        if (timeDiffMs < RATE_UPDATE_INTERVAL_MS) {
            return;
        }
        if (!lastRateUpdate.compareAndSet(lastUpdate, now)) {
            return;
        }
        long bytesDiff = currentBytes - lastRateBytes.getAndSet(currentBytes);
        if (bytesDiff > 0) {
            double instantRate = (double) bytesDiff / timeDiffMs * 1000.0;
            double previous = currentRate.get();
            currentRate.set(previous == 0.0 ? instantRate : previous * 0.7 + instantRate * 0.3);
        }
    }

    @Override
    public String toString() {
        return String.format("ProgressTracker{transferId='%s', progress=%.1f%%, rate=%s, ETA=%s}",
                transferId,
                getProgressPercentage() * 100,
                SizeFormatter.formatRate(getCurrentRateBytesPerSecond()),
                getEstimatedRemainingTime());
    }
}
