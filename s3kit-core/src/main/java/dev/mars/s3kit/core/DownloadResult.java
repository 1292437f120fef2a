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
import java.util.Optional;

/**
 * Result of {@code downloadFile}. The ETag is the one of the source object at the
 * moment the transfer started.
 */
public final class DownloadResult extends TransferResult {

    private final Instant sourceLastModified;

    private DownloadResult(Builder builder) {
        super(builder);
        this.sourceLastModified = builder.sourceLastModified;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Instant> getSourceLastModified() {
        return Optional.ofNullable(sourceLastModified);
    }

    public static final class Builder extends TransferResult.Builder<DownloadResult, Builder> {
        private Instant sourceLastModified;

        public Builder sourceLastModified(Instant sourceLastModified) {
            this.sourceLastModified = sourceLastModified;
            return this;
        }

        @Override
        public DownloadResult build() {
            return new DownloadResult(this);
        }
    }
}
