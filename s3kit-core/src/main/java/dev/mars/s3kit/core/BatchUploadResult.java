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


import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of uploading a collection of files.
 *
 * <p>Every file either produced an {@link UploadResult}, possibly a failed one, or
 * raised an exception before a transfer could start. One file failing never stops the
 * rest of the collection.</p>
 */
public final class BatchUploadResult {

    private final String bucket;
    private final List<UploadResult> results;
    private final Map<Path, Exception> errors;
    private final boolean cancelled;

    private BatchUploadResult(Builder builder) {
        this.bucket = builder.bucket;
        this.results = Collections.unmodifiableList(new ArrayList<>(builder.results));
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(builder.errors));
        this.cancelled = builder.cancelled;
    }

    public static Builder builder(String bucket) {
        return new Builder(bucket);
    }

    public String getBucket() { return bucket; }

    /** Results of every file that reached the transfer stage, in upload order. */
    public List<UploadResult> getResults() { return results; }

    /** Files that could not be uploaded at all, with the reason. */
    public Map<Path, Exception> getErrors() { return errors; }

    /** True when the shared context was cancelled before every file was attempted. */
    public boolean isCancelled() { return cancelled; }

    public int getFileCount() {
        return results.size() + errors.size();
    }

    public int getSuccessCount() {
        return (int) results.stream().filter(TransferResult::isSuccessful).count();
    }

    public int getFailureCount() {
        return getFileCount() - getSuccessCount();
    }

    public boolean isSuccessful() {
        return !cancelled && getFailureCount() == 0;
    }

    public long getTotalBytes() {
        return results.stream().filter(TransferResult::isSuccessful).mapToLong(TransferResult::getTotalSize).sum();
    }

    public Optional<UploadResult> resultFor(String key) {
        return results.stream().filter(r -> key.equals(r.getKey())).findFirst();
    }

    @Override
    public String toString() {
        return "BatchUploadResult{bucket='" + bucket + "', files=" + getFileCount()
                + ", succeeded=" + getSuccessCount() + ", failed=" + getFailureCount()
                + (cancelled ? ", cancelled" : "") + '}';
    }

    public static final class Builder {
        private final String bucket;
        private final List<UploadResult> results = new ArrayList<>();
        private final Map<Path, Exception> errors = new LinkedHashMap<>();
        private boolean cancelled;

        private Builder(String bucket) {
            this.bucket = bucket;
        }

        public Builder result(UploadResult result) {
            this.results.add(result);
            return this;
        }

        public Builder error(Path file, Exception error) {
            this.errors.put(file, error);
            return this;
        }

        public Builder cancelled(boolean cancelled) {
            this.cancelled = cancelled;
            return this;
        }

        public BatchUploadResult build() {
            return new BatchUploadResult(this);
        }
    }
}
