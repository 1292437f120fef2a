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


import dev.mars.s3kit.core.ObjectHeaders;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call overrides for a chunked transfer. Unset values fall back to the
 * configuration the manager was built with.
 */
public final class TransferOptions {

    public static final int MAX_UPLOAD_PARALLELISM = 10;
    public static final int MAX_DOWNLOAD_PARALLELISM = 8;

    private final long chunkSize;
    private final long minimumChunkSize;
    private final int maxParallel;
    private final int maxRetries;
    private final long retryDelayMs;
    private final boolean resume;
    private final String contentType;
    private final Map<String, String> metadata;
    private final ObjectHeaders objectHeaders;
    private final TransferContext context;

    private TransferOptions(Builder builder) {
        this.chunkSize = builder.chunkSize;
        this.minimumChunkSize = builder.minimumChunkSize;
        this.maxParallel = builder.maxParallel;
        this.maxRetries = builder.maxRetries;
        this.retryDelayMs = builder.retryDelayMs;
        this.resume = builder.resume;
        this.contentType = builder.contentType;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.objectHeaders = builder.objectHeaders != null ? builder.objectHeaders : ObjectHeaders.none();
        this.context = builder.context != null ? builder.context : new TransferContext();
    }

    public static TransferOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Requested chunk size, or 0 for the configured default. */
    public long getChunkSize() { return chunkSize; }
    /** Minimum chunk size, or -1 for the configured default. */
    public long getMinimumChunkSize() { return minimumChunkSize; }
    /** Worker count, or 0 for the configured default. */
    public int getMaxParallel() { return maxParallel; }
    /** Extra attempts per chunk, or -1 for the configured default. */
    public int getMaxRetries() { return maxRetries; }
    /** Base retry delay, or -1 for the configured default. */
    public long getRetryDelayMs() { return retryDelayMs; }
    public boolean isResume() { return resume; }
    public String getContentType() { return contentType; }
    public Map<String, String> getMetadata() { return metadata; }
    /** Upload only: headers stored with the object. */
    public ObjectHeaders getObjectHeaders() { return objectHeaders; }
    public TransferContext getContext() { return context; }

    /**
     * Builder seeded with these options, sharing the same context.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.chunkSize = chunkSize;
        builder.minimumChunkSize = minimumChunkSize;
        builder.maxParallel = maxParallel;
        builder.maxRetries = maxRetries;
        builder.retryDelayMs = retryDelayMs;
        builder.resume = resume;
        builder.contentType = contentType;
        builder.metadata.putAll(metadata);
        builder.objectHeaders = objectHeaders;
        builder.context = context;
        return builder;
    }

    static int clampParallelism(int requested, int upperBound) {
        return Math.max(1, Math.min(requested, upperBound));
    }

    public static final class Builder {
        private long chunkSize;
        private long minimumChunkSize = -1;
        private int maxParallel;
        private int maxRetries = -1;
        private long retryDelayMs = -1;
        private boolean resume = true;
        private String contentType;
        private final Map<String, String> metadata = new LinkedHashMap<>();
        private ObjectHeaders objectHeaders;
        private TransferContext context;

        private Builder() {
        }

        public Builder chunkSize(long chunkSize) {
            if (chunkSize < 0) {
                throw new IllegalArgumentException("Chunk size must not be negative: " + chunkSize);
            }
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder minimumChunkSize(long minimumChunkSize) {
            if (minimumChunkSize <= 0) {
                throw new IllegalArgumentException("Minimum chunk size must be positive: " + minimumChunkSize);
            }
            this.minimumChunkSize = minimumChunkSize;
            return this;
        }

        public Builder maxParallel(int maxParallel) {
            if (maxParallel < 1) {
                throw new IllegalArgumentException("Parallelism must be at least 1: " + maxParallel);
            }
            this.maxParallel = maxParallel;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("Max retries must not be negative: " + maxRetries);
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelayMs(long retryDelayMs) {
            if (retryDelayMs < 0) {
                throw new IllegalArgumentException("Retry delay must not be negative: " + retryDelayMs);
            }
            this.retryDelayMs = retryDelayMs;
            return this;
        }

        public Builder resume(boolean resume) {
            this.resume = resume;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder metadata(String name, String value) {
            this.metadata.put(name, value);
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder objectHeaders(ObjectHeaders objectHeaders) {
            this.objectHeaders = objectHeaders;
            return this;
        }

        public Builder context(TransferContext context) {
            this.context = context;
            return this;
        }

        public TransferOptions build() {
            return new TransferOptions(this);
        }
    }
}
