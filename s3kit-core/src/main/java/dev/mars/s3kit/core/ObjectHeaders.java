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


import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Standard HTTP and {@code x-amz-} object headers sent when an object is created.
 *
 * <p>These sit alongside user metadata ({@code x-amz-meta-*}) and are stored with the
 * object by the backend. Tags are sent once as the URL-encoded {@code x-amz-tagging}
 * header; a head call only reports their count.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class ObjectHeaders {

    public static final String CACHE_CONTROL = "Cache-Control";
    public static final String CONTENT_DISPOSITION = "Content-Disposition";
    public static final String CONTENT_ENCODING = "Content-Encoding";
    public static final String CONTENT_LANGUAGE = "Content-Language";
    public static final String EXPIRES = "Expires";
    public static final String STORAGE_CLASS = "x-amz-storage-class";
    public static final String SERVER_SIDE_ENCRYPTION = "x-amz-server-side-encryption";
    public static final String KMS_KEY_ID = "x-amz-server-side-encryption-aws-kms-key-id";
    public static final String TAGGING = "x-amz-tagging";

    public static final Set<String> STORAGE_CLASSES = Set.of(
            "STANDARD", "REDUCED_REDUNDANCY", "STANDARD_IA", "ONEZONE_IA",
            "INTELLIGENT_TIERING", "GLACIER", "GLACIER_IR", "DEEP_ARCHIVE");

    private static final Set<String> ENCRYPTION_ALGORITHMS = Set.of("AES256", "aws:kms");

    private static final ObjectHeaders NONE = builder().build();

    private final String cacheControl;
    private final String contentDisposition;
    private final String contentEncoding;
    private final String contentLanguage;
    private final Instant expires;
    private final String storageClass;
    private final String serverSideEncryption;
    private final String kmsKeyId;
    private final Map<String, String> tags;

    private ObjectHeaders(Builder builder) {
        this.cacheControl = builder.cacheControl;
        this.contentDisposition = builder.contentDisposition;
        this.contentEncoding = builder.contentEncoding;
        this.contentLanguage = builder.contentLanguage;
        this.expires = builder.expires;
        this.storageClass = builder.storageClass;
        this.serverSideEncryption = builder.serverSideEncryption;
        this.kmsKeyId = builder.kmsKeyId;
        this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tags));
    }

    public static ObjectHeaders none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getCacheControl() { return cacheControl; }
    public String getContentDisposition() { return contentDisposition; }
    public String getContentEncoding() { return contentEncoding; }
    public String getContentLanguage() { return contentLanguage; }
    public Instant getExpires() { return expires; }
    public String getStorageClass() { return storageClass; }
    public String getServerSideEncryption() { return serverSideEncryption; }
    public String getKmsKeyId() { return kmsKeyId; }
    public Map<String, String> getTags() { return tags; }

    public boolean isEmpty() {
        return toHeaders().isEmpty();
    }

    /**
     * Request headers for this set, in a stable order. Unset values are left out.
     */
    public Map<String, String> toHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        putIfSet(headers, CACHE_CONTROL, cacheControl);
        putIfSet(headers, CONTENT_DISPOSITION, contentDisposition);
        putIfSet(headers, CONTENT_ENCODING, contentEncoding);
        putIfSet(headers, CONTENT_LANGUAGE, contentLanguage);
        if (expires != null) {
            headers.put(EXPIRES, DateTimeFormatter.RFC_1123_DATE_TIME.format(expires.atOffset(ZoneOffset.UTC)));
        }
        putIfSet(headers, STORAGE_CLASS, storageClass);
        putIfSet(headers, SERVER_SIDE_ENCRYPTION, serverSideEncryption);
        putIfSet(headers, KMS_KEY_ID, kmsKeyId);
        if (!tags.isEmpty()) {
            headers.put(TAGGING, encodeTags(tags));
        }
        return headers;
    }

    static String encodeTags(Map<String, String> tags) {
        StringBuilder encoded = new StringBuilder();
        tags.forEach((key, value) -> {
            if (encoded.length() > 0) {
                encoded.append('&');
            }
            encoded.append(encode(key)).append('=').append(encode(value != null ? value : ""));
        });
        return encoded.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static void putIfSet(Map<String, String> headers, String name, String value) {
        if (value != null && !value.isBlank()) {
            headers.put(name, value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ObjectHeaders that = (ObjectHeaders) o;
        return toHeaders().equals(that.toHeaders());
    }

    @Override
    public int hashCode() {
        return Objects.hash(toHeaders());
    }

    @Override
    public String toString() {
        return "ObjectHeaders" + toHeaders();
    }

    public static final class Builder {
        private String cacheControl;
        private String contentDisposition;
        private String contentEncoding;
        private String contentLanguage;
        private Instant expires;
        private String storageClass;
        private String serverSideEncryption;
        private String kmsKeyId;
        private final Map<String, String> tags = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder cacheControl(String cacheControl) {
            this.cacheControl = cacheControl;
            return this;
        }

        public Builder contentDisposition(String contentDisposition) {
            this.contentDisposition = contentDisposition;
            return this;
        }

        /**
         * Sets {@code Content-Disposition} to the given type with a quoted file name,
         * for example {@code attachment; filename="report.pdf"}.
         */
        public Builder contentDisposition(String type, String filename) {
            Objects.requireNonNull(type, "Disposition type cannot be null");
            if (filename == null || filename.isBlank()) {
                this.contentDisposition = type;
            } else {
                this.contentDisposition = type + "; filename=\"" + filename.replace("\"", "\\\"") + "\"";
            }
            return this;
        }

        public Builder contentEncoding(String contentEncoding) {
            this.contentEncoding = contentEncoding;
            return this;
        }

        public Builder contentLanguage(String contentLanguage) {
            this.contentLanguage = contentLanguage;
            return this;
        }

        public Builder expires(Instant expires) {
            this.expires = expires;
            return this;
        }

        public Builder storageClass(String storageClass) {
            if (storageClass != null && !STORAGE_CLASSES.contains(storageClass)) {
                throw new IllegalArgumentException("Unknown storage class: " + storageClass);
            }
            this.storageClass = storageClass;
            return this;
        }

        /**
         * @param algorithm {@code AES256} or {@code aws:kms}
         */
        public Builder serverSideEncryption(String algorithm) {
            if (algorithm != null && !ENCRYPTION_ALGORITHMS.contains(algorithm)) {
                throw new IllegalArgumentException("Unsupported server-side encryption: " + algorithm);
            }
            this.serverSideEncryption = algorithm;
            return this;
        }

        /**
         * Selects a KMS key; implies {@code aws:kms} encryption.
         */
        public Builder kmsKeyId(String kmsKeyId) {
            this.kmsKeyId = kmsKeyId;
            if (kmsKeyId != null) {
                this.serverSideEncryption = "aws:kms";
            }
            return this;
        }

        public Builder tag(String key, String value) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("Tag key is required");
            }
            this.tags.put(key, value);
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            if (tags != null) {
                tags.forEach(this::tag);
            }
            return this;
        }

        public ObjectHeaders build() {
            return new ObjectHeaders(this);
        }
    }
}
