package dev.mars.s3kit.http;

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


import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.LongConsumer;

/**
 * An unsigned request against a path-style S3 endpoint.
 *
 * <p>The body is either absent, a byte array (hashed and signed), or a stream of known
 * length (sent with {@code UNSIGNED-PAYLOAD}). Progress for streamed bodies is
 * reported to {@link #getOnProgress()} with the cumulative byte count.</p>
 */
public final class S3Request {

    private final String method;
    private final String bucket;
    private final String key;
    private final Map<String, String> queryParameters;
    private final Map<String, String> headers;
    private final byte[] body;
    private final InputStream bodyStream;
    private final long contentLength;
    private final LongConsumer onProgress;

    private S3Request(Builder builder) {
        this.method = builder.method;
        this.bucket = builder.bucket;
        this.key = builder.key;
        this.queryParameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.queryParameters));
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.body = builder.body;
        this.bodyStream = builder.bodyStream;
        this.contentLength = builder.body != null ? builder.body.length : builder.contentLength;
        this.onProgress = builder.onProgress;
    }

    public static Builder builder(String method) {
        return new Builder(method);
    }

    public String getMethod() { return method; }
    public String getBucket() { return bucket; }
    public String getKey() { return key; }
    public Map<String, String> getQueryParameters() { return queryParameters; }
    public Map<String, String> getHeaders() { return headers; }
    public byte[] getBody() { return body; }
    public InputStream getBodyStream() { return bodyStream; }
    public long getContentLength() { return contentLength; }
    public LongConsumer getOnProgress() { return onProgress; }

    public boolean hasBody() {
        return body != null || bodyStream != null;
    }

    public boolean isStreaming() {
        return bodyStream != null;
    }

    @Override
    public String toString() {
        return method + " /" + (bucket != null ? bucket : "") + (key != null ? "/" + key : "")
                + (queryParameters.isEmpty() ? "" : " " + queryParameters.keySet());
    }

    public static class Builder {
        private final String method;
        private String bucket;
        private String key;
        private final Map<String, String> queryParameters = new LinkedHashMap<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body;
        private InputStream bodyStream;
        private long contentLength;
        private LongConsumer onProgress;

        private Builder(String method) {
            this.method = method;
        }

        public Builder bucket(String bucket) {
            this.bucket = bucket;
            return this;
        }

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder query(String name, String value) {
            this.queryParameters.put(name, value == null ? "" : value);
            return this;
        }

        public Builder header(String name, String value) {
            if (value != null) {
                this.headers.put(name, value);
            }
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            if (headers != null) {
                headers.forEach(this::header);
            }
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            this.bodyStream = null;
            return this;
        }

        public Builder body(InputStream bodyStream, long contentLength) {
            this.bodyStream = bodyStream;
            this.contentLength = contentLength;
            this.body = null;
            return this;
        }

        public Builder onProgress(LongConsumer onProgress) {
            this.onProgress = onProgress;
            return this;
        }

        public S3Request build() {
            if (method == null || method.isBlank()) {
                throw new IllegalArgumentException("HTTP method is required");
            }
            if (bodyStream != null && contentLength < 0) {
                throw new IllegalArgumentException("Content length is required for streamed bodies");
            }
            return new S3Request(this);
        }
    }
}
