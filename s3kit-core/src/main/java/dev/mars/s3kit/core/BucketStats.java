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


import dev.mars.s3kit.util.SizeFormatter;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Object count and total size of one bucket.
 *
 * <p>When the listing was capped the figures cover only the objects counted and
 * {@link #isTruncated()} is set. A bucket that could not be listed carries the error
 * message and zero counts.</p>
 */
public final class BucketStats {

    private final String name;
    private final Instant creationDate;
    private final long objectCount;
    private final long totalSize;
    private final boolean truncated;
    private final String error;

    private BucketStats(String name, Instant creationDate, long objectCount, long totalSize,
                        boolean truncated, String error) {
        this.name = Objects.requireNonNull(name, "Bucket name cannot be null");
        this.creationDate = creationDate;
        this.objectCount = objectCount;
        this.totalSize = totalSize;
        this.truncated = truncated;
        this.error = error;
    }

    public static BucketStats counted(String name, Instant creationDate, long objectCount, long totalSize,
                                      boolean truncated) {
        return new BucketStats(name, creationDate, objectCount, totalSize, truncated, null);
    }

    public static BucketStats failed(String name, Instant creationDate, String error) {
        return new BucketStats(name, creationDate, 0, 0, false, Objects.requireNonNull(error, "Error cannot be null"));
    }

    public String getName() { return name; }
    public Instant getCreationDate() { return creationDate; }
    public long getObjectCount() { return objectCount; }
    public long getTotalSize() { return totalSize; }
    public boolean isTruncated() { return truncated; }
    public Optional<String> getError() { return Optional.ofNullable(error); }

    public boolean isSuccessful() {
        return error == null;
    }

    public double getAverageObjectSize() {
        return objectCount > 0 ? (double) totalSize / objectCount : 0.0;
    }

    @Override
    public String toString() {
        if (error != null) {
            return "BucketStats{name='" + name + "', error='" + error + "'}";
        }
        return "BucketStats{name='" + name + "', objects=" + objectCount
                + (truncated ? "+" : "") + ", size=" + SizeFormatter.formatBytes(totalSize) + '}';
    }
}
