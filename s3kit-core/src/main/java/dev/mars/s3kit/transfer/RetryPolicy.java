package dev.mars.s3kit.transfer;

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


import dev.mars.s3kit.core.exceptions.StorageException;

/**
 * Per-chunk retry rules: only transient storage failures are retried, up to
 * {@code maxRetries} extra attempts, with a linearly growing delay.
 */
public class RetryPolicy {

    private final int maxRetries;
    private final long retryDelayMs;

    public RetryPolicy(int maxRetries, long retryDelayMs) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries must not be negative: " + maxRetries);
        }
        if (retryDelayMs < 0) {
            throw new IllegalArgumentException("Retry delay must not be negative: " + retryDelayMs);
        }
        this.maxRetries = maxRetries;
        this.retryDelayMs = retryDelayMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    /**
     * Network failures, throttling and 5xx responses are transient. Local I/O errors,
     * signing problems and other 4xx responses are not.
     */
    public boolean isRetryable(Throwable error) {
        return error instanceof StorageException && ((StorageException) error).isRetryable();
    }

    /**
     * @param attempt the 1-based attempt that just failed
     */
    public boolean shouldRetry(Throwable error, int attempt) {
        return attempt <= maxRetries && isRetryable(error);
    }

    public long delayFor(int attempt) {
        return retryDelayMs * attempt;
    }

    public void backoff(int attempt) throws InterruptedException {
        long delay = delayFor(attempt);
        if (delay > 0) {
            Thread.sleep(delay);
        }
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxRetries=" + maxRetries + ", retryDelayMs=" + retryDelayMs + "}";
    }
}
