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


import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only snapshot of an object taken from a list or head call.
 *
 * <p>ETags are stored without the surrounding quotes the wire format uses. When a
 * listing is non-recursive, common prefixes come back as descriptors with
 * {@link #isPrefix()} set and no size, ETag or timestamp.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class ObjectDescriptor {

    private final String bucket;
    private final String key;
    private final long size;
    private final String eTag;
    private final Instant lastModified;
    private final String contentType;
    private final String storageClass;
    private final Map<String, String> userMetadata;
    private final ObjectHeaders headers;
    private final int tagCount;
    private final boolean prefix;

    private ObjectDescriptor(Builder builder) {
        this.bucket = Objects.requireNonNull(builder.bucket, "Bucket cannot be null");
        this.key = Objects.requireNonNull(builder.key, "Key cannot be null");
        this.size = builder.size;
        this.eTag = builder.eTag;
        this.lastModified = builder.lastModified;
        this.contentType = builder.contentType;
        this.storageClass = builder.storageClass;
        this.userMetadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.userMetadata));
        this.headers = builder.headers != null ? builder.headers : ObjectHeaders.none();
        this.tagCount = builder.tagCount;
        this.prefix = builder.prefix;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getBucket() { return bucket; }
    public String getKey() { return key; }
    public long getSize() { return size; }
    public String getETag() { return eTag; }
    public Instant getLastModified() { return lastModified; }
    public String getContentType() { return contentType; }
    public String getStorageClass() { return storageClass; }
    public Map<String, String> getUserMetadata() { return userMetadata; }
    /** Stored object headers; only filled in by a head call. Tags are not echoed back. */
    public ObjectHeaders getHeaders() { return headers; }
    /** Number of tags reported by a head call. */
    public int getTagCount() { return tagCount; }
    public boolean isPrefix() { return prefix; }

    /**
     * Identity of the object content, used to detect that a remote object changed
     * between an interrupted download and its resume.
     */
    public String fingerprint() {
        return "etag=" + eTag + ";size=" + size + ";modified="
                + (lastModified != null ? lastModified.toEpochMilli() : -1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ObjectDescriptor that = (ObjectDescriptor) o;
        return size == that.size && prefix == that.prefix
                && bucket.equals(that.bucket) && key.equals(that.key)
                && Objects.equals(eTag, that.eTag)
                && Objects.equals(lastModified, that.lastModified);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bucket, key, size, eTag, lastModified, prefix);
    }

    @Override
    public String toString() {
        return "ObjectDescriptor{" +
                "bucket='" + bucket + '\'' +
                ", key='" + key + '\'' +
                ", size=" + size +
                ", eTag='" + eTag + '\'' +
                ", lastModified=" + lastModified +
                (prefix ? ", prefix=true" : "") +
                '}';
    }

    public static class Builder {
        private String bucket;
        private String key;
        private long size;
        private String eTag;
        private Instant lastModified;
        private String contentType;
        private String storageClass;
        private final Map<String, String> userMetadata = new LinkedHashMap<>();
        private ObjectHeaders headers;
        private int tagCount;
        private boolean prefix;

        public Builder bucket(String bucket) {
            this.bucket = bucket;
            return this;
        }

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder size(long size) {
            this.size = size;
            return this;
        }

        public Builder eTag(String eTag) {
            this.eTag = stripQuotes(eTag);
            return this;
        }

        public Builder lastModified(Instant lastModified) {
            this.lastModified = lastModified;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder storageClass(String storageClass) {
            this.storageClass = storageClass;
            return this;
        }

        public Builder userMetadata(Map<String, String> metadata) {
            if (metadata != null) {
                this.userMetadata.putAll(metadata);
            }
            return this;
        }

        public Builder headers(ObjectHeaders headers) {
            this.headers = headers;
            return this;
        }

        public Builder tagCount(int tagCount) {
            this.tagCount = tagCount;
            return this;
        }

        public Builder prefix(boolean prefix) {
            this.prefix = prefix;
            return this;
        }

        public ObjectDescriptor build() {
            return new ObjectDescriptor(this);
        }
    }

    static String stripQuotes(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }
}
