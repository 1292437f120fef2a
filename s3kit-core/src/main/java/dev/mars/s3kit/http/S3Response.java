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


import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Status, headers and (for buffered calls) body of a successful response.
 * Header lookup is case-insensitive.
 */
public final class S3Response {

    private static final byte[] EMPTY = new byte[0];

    private final int statusCode;
    private final Map<String, String> headers;
    private final byte[] body;

    public S3Response(int statusCode, Map<String, String> headers, byte[] body) {
        this.statusCode = statusCode;
        TreeMap<String, String> sorted = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            sorted.putAll(headers);
        }
        this.headers = Collections.unmodifiableMap(sorted);
        this.body = body != null ? body : EMPTY;
    }

    public int getStatusCode() { return statusCode; }
    public Map<String, String> getHeaders() { return headers; }
    public byte[] getBody() { return body; }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    public long getContentLength() {
        return header("Content-Length").map(value -> {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                return -1L;
            }
        }).orElse(-1L);
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "S3Response{status=" + statusCode + ", bodyLength=" + body.length + '}';
    }
}
