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

import java.nio.file.Path;

/**
 * Optional settings for {@link S3Kit#connect}. Values left unset come from the
 * {@link S3KitConfiguration}.
 */
public final class ConnectionOptions {

    private final String region;
    private final Boolean secure;
    private final S3KitConfiguration configuration;
    private final Path resumeDirectory;

    private ConnectionOptions(Builder builder) {
        this.region = builder.region;
        this.secure = builder.secure;
        this.configuration = builder.configuration;
        this.resumeDirectory = builder.resumeDirectory;
    }

    public static ConnectionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getRegion() { return region; }
    public Boolean getSecure() { return secure; }
    public S3KitConfiguration getConfiguration() { return configuration; }
    public Path getResumeDirectory() { return resumeDirectory; }

    public static final class Builder {
        private String region;
        private Boolean secure;
        private S3KitConfiguration configuration;
        private Path resumeDirectory;

        private Builder() {
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder secure(boolean secure) {
            this.secure = secure;
            return this;
        }

        public Builder configuration(S3KitConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder resumeDirectory(Path resumeDirectory) {
            this.resumeDirectory = resumeDirectory;
            return this;
        }

        public ConnectionOptions build() {
            return new ConnectionOptions(this);
        }
    }
}
