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


import java.net.URI;
import java.time.Duration;
import java.time.Instant;

/**
 * A query-string signed URL that grants time-limited access to one object.
 */
public final class PresignedUrl {

    private final URI url;
    private final String method;
    private final String bucket;
    private final String key;
    private final Instant createdAt;
    private final Duration expiresIn;

    public PresignedUrl(URI url, String method, String bucket, String key, Instant createdAt, Duration expiresIn) {
        this.url = url;
        this.method = method;
        this.bucket = bucket;
        this.key = key;
        this.createdAt = createdAt;
        this.expiresIn = expiresIn;
    }

    public URI getUrl() { return url; }
    public String getMethod() { return method; }
    public String getBucket() { return bucket; }
    public String getKey() { return key; }
    public Instant getCreatedAt() { return createdAt; }
    public Duration getExpiresIn() { return expiresIn; }

    public Instant getExpiresAt() {
        return createdAt.plus(expiresIn);
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(getExpiresAt());
    }

    @Override
    public String toString() {
        return method + " " + url + " (expires " + getExpiresAt() + ")";
    }
}
