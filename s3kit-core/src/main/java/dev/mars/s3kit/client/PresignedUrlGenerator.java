package dev.mars.s3kit.client;

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


import dev.mars.s3kit.core.Credentials;
import dev.mars.s3kit.core.PresignedUrl;
import dev.mars.s3kit.core.exceptions.SigningException;
import dev.mars.s3kit.signer.RequestSigner;
import dev.mars.s3kit.signer.SignedRequest;
import dev.mars.s3kit.signer.SigningUtils;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds query-string signed URLs for a single object.
 */
public class PresignedUrlGenerator {

    private static final Set<String> SUPPORTED_METHODS = Set.of("GET", "PUT", "HEAD", "DELETE");

    private final Credentials credentials;
    private final RequestSigner signer;
    private final Clock clock;

    public PresignedUrlGenerator(Credentials credentials, RequestSigner signer, Clock clock) {
        this.credentials = credentials;
        this.signer = signer;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException for a blank bucket or key, an unsupported method,
     *         or an expiry outside one second to seven days
     */
    public PresignedUrl generate(String method, String bucket, String key, Duration expiry) throws SigningException {
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("Bucket name is required");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Object key is required");
        }
        String normalizedMethod = method == null ? "" : method.toUpperCase(Locale.ROOT);
        if (!SUPPORTED_METHODS.contains(normalizedMethod)) {
            throw new IllegalArgumentException("Unsupported presign method: " + method);
        }

        Instant now = clock.instant();
        String canonicalUri = SigningUtils.canonicalUri(bucket, key);
        SignedRequest signed = signer.presign(normalizedMethod, canonicalUri, Map.of(),
                credentials, now, expiry);

        URI url = URI.create(credentials.getBaseUrl() + canonicalUri + "?" + signed.getCanonicalQueryString());
        return new PresignedUrl(url, normalizedMethod, bucket, key, now, expiry);
    }
}
