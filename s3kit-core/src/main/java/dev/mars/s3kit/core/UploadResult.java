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


import java.util.Optional;

/**
 * Result of {@code uploadFile}. On failure the upload id is still reported so the
 * multipart upload can be resumed or aborted explicitly.
 */
public final class UploadResult extends TransferResult {

    private final String uploadId;
    private final boolean multipart;

    private UploadResult(Builder builder) {
        super(builder);
        this.uploadId = builder.uploadId;
        this.multipart = builder.multipart;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> getUploadId() {
        return Optional.ofNullable(uploadId);
    }

    public boolean isMultipart() {
        return multipart;
    }

    public static final class Builder extends TransferResult.Builder<UploadResult, Builder> {
        private String uploadId;
        private boolean multipart;

        public Builder uploadId(String uploadId) {
            this.uploadId = uploadId;
            return this;
        }

        public Builder multipart(boolean multipart) {
            this.multipart = multipart;
            return this;
        }

        @Override
        public UploadResult build() {
            return new UploadResult(this);
        }
    }
}
