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


import dev.mars.s3kit.config.S3KitConfiguration;
import dev.mars.s3kit.core.Credentials;
import dev.mars.s3kit.http.HttpS3Transport;
import dev.mars.s3kit.storage.ResumeStore;

import java.util.logging.Logger;

/**
 * Entry point: builds a fully wired {@link S3KitClient} for one endpoint.
 *
 * <pre>
 * try (S3KitClient client = S3Kit.connect("localhost:9000", accessKey, secretKey,
 *         ConnectionOptions.builder().region("eu-west-1").build())) {
 *     client.uploadFile("backups", "db.tar", Paths.get("/var/backups/db.tar"));
 * }
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class S3Kit {

    private static final Logger logger = Logger.getLogger(S3Kit.class.getName());

    private S3Kit() {
    }

    public static S3KitClient connect(String endpoint, String accessKey, String secretKey) {
        return connect(endpoint, accessKey, secretKey, ConnectionOptions.defaults());
    }

    /**
     * Creates a client. No request is sent until the first operation.
     *
     * @param endpoint {@code host[:port]}, optionally with an http or https scheme; null uses the configured endpoint
     * @throws IllegalArgumentException if either key is blank
     */
    public static S3KitClient connect(String endpoint, String accessKey, String secretKey,
                                      ConnectionOptions options) {
        ConnectionOptions opts = options != null ? options : ConnectionOptions.defaults();
        S3KitConfiguration configuration = opts.getConfiguration() != null
                ? opts.getConfiguration() : new S3KitConfiguration();

        String resolvedEndpoint = endpoint != null && !endpoint.isBlank() ? endpoint : configuration.getEndpoint();
        boolean secure = opts.getSecure() != null ? opts.getSecure()
                : resolvedEndpoint.startsWith("https://") || configuration.isSecure();
        String region = opts.getRegion() != null ? opts.getRegion() : configuration.getRegion();

        Credentials credentials = new Credentials(resolvedEndpoint, accessKey, secretKey, region, secure);
        if (!credentials.hasKeys()) {
            throw new IllegalArgumentException("Access key and secret key are required");
        }

        HttpS3Transport transport = new HttpS3Transport(credentials, configuration);
        S3StorageClient storage = new S3StorageClient(transport, configuration);
        ResumeStore resumeStore = opts.getResumeDirectory() != null
                ? new ResumeStore(opts.getResumeDirectory())
                : new ResumeStore(configuration);

        logger.info("Connected S3 client to " + credentials.getBaseUrl() + " (region " + credentials.getRegion() + ")");
        return new S3KitClient(storage, resumeStore, configuration);
    }
}
