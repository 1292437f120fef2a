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
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Usage summary of every bucket visible to the configured credentials.
 *
 * <h3>Calculated metrics:</h3>
 * <ul>
 *   <li>{@link #getTotalObjects()} and {@link #getTotalSize()} - sums over the buckets that could be listed</li>
 *   <li>{@link #getAverageObjectSize()} - total size divided by total objects</li>
 *   <li>{@link #getAverageObjectsPerBucket()} - total objects divided by bucket count</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class StorageStats {

    private final String endpoint;
    private final boolean secure;
    private final List<BucketStats> buckets;
    private final Instant lastUpdated;

    public StorageStats(String endpoint, boolean secure, List<BucketStats> buckets, Instant lastUpdated) {
        this.endpoint = endpoint;
        this.secure = secure;
        this.buckets = List.copyOf(Objects.requireNonNull(buckets, "Buckets cannot be null"));
        this.lastUpdated = lastUpdated;
    }

    public String getEndpoint() { return endpoint; }
    public boolean isSecure() { return secure; }
    public List<BucketStats> getBuckets() { return buckets; }
    public Instant getLastUpdated() { return lastUpdated; }

    public int getTotalBuckets() {
        return buckets.size();
    }

    public long getTotalObjects() {
        return buckets.stream().mapToLong(BucketStats::getObjectCount).sum();
    }

    public long getTotalSize() {
        return buckets.stream().mapToLong(BucketStats::getTotalSize).sum();
    }

    public double getAverageObjectSize() {
        long objects = getTotalObjects();
        return objects > 0 ? (double) getTotalSize() / objects : 0.0;
    }

    public double getAverageObjectsPerBucket() {
        return buckets.isEmpty() ? 0.0 : (double) getTotalObjects() / buckets.size();
    }

    /**
     * True when at least one bucket hit the object cap.
     */
    public boolean isTruncated() {
        return buckets.stream().anyMatch(BucketStats::isTruncated);
    }

    public Optional<BucketStats> bucket(String name) {
        return buckets.stream().filter(b -> b.getName().equals(name)).findFirst();
    }

    @Override
    public String toString() {
        return "StorageStats{endpoint='" + endpoint + "', buckets=" + getTotalBuckets()
                + ", objects=" + getTotalObjects()
                + ", size=" + SizeFormatter.formatBytes(getTotalSize()) + '}';
    }
}
