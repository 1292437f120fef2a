package dev.mars.s3kit.signer;

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


import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input to {@link RequestSigner#sign}. The canonical URI must already be URI-encoded;
 * query parameters and headers are given raw and encoded by the signer.
 */
public final class SigningRequest {

    private final String method;
    private final String canonicalUri;
    private final Map<String, String> queryParameters;
    private final Map<String, String> headers;
    private final String payloadHash;

    private SigningRequest(Builder builder) {
        this.method = builder.method;
        this.canonicalUri = builder.canonicalUri;
        this.queryParameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.queryParameters));
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.payloadHash = builder.payloadHash;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getMethod() { return method; }
    public String getCanonicalUri() { return canonicalUri; }
    public Map<String, String> getQueryParameters() { return queryParameters; }
    public Map<String, String> getHeaders() { return headers; }
    public String getPayloadHash() { return payloadHash; }

    public static class Builder {
        private String method;
        private String canonicalUri;
        private final Map<String, String> queryParameters = new LinkedHashMap<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String payloadHash;

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder canonicalUri(String canonicalUri) {
            this.canonicalUri = canonicalUri;
            return this;
        }

        public Builder queryParameter(String name, String value) {
            this.queryParameters.put(name, value == null ? "" : value);
            return this;
        }

        public Builder queryParameters(Map<String, String> parameters) {
            parameters.forEach(this::queryParameter);
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers.putAll(headers);
            return this;
        }

        public Builder payloadHash(String payloadHash) {
            this.payloadHash = payloadHash;
            return this;
        }

        public SigningRequest build() {
            return new SigningRequest(this);
        }
    }
}
