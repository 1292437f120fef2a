package dev.mars.s3kit.core.exceptions;

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


import java.util.Set;

/**
 * Exception raised when the storage backend answers with a non-2xx status, or when the
 * request never produced a response at all (connection refused, timeout, reset).
 *
 * <p>Carries the HTTP status, the backend error code from the S3 {@code <Error>} document
 * and the request id, so callers can correlate failures with server logs. A status of
 * {@code 0} means no HTTP response was received.</p>
 *
 * <h3>Retry classification:</h3>
 * <ul>
 *   <li>Network failures (status 0), 5xx and 429 are retryable</li>
 *   <li>Throttling codes such as {@code SlowDown} are retryable regardless of status</li>
 *   <li>Every other 4xx (signature, permission, missing bucket) fails immediately</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class StorageException extends S3KitException {

    private static final Set<String> RETRYABLE_CODES = Set.of(
            "SlowDown", "RequestTimeout", "InternalError", "ServiceUnavailable",
            "Throttling", "ThrottlingException", "RequestTimeTooSkewed");

    private final int statusCode;
    private final String errorCode;
    private final String requestId;

    public StorageException(int statusCode, String errorCode, String message, String requestId) {
        super(message);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
        this.requestId = requestId;
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.errorCode = null;
        this.requestId = null;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getRequestId() {
        return requestId;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isRetryable() {
        if (statusCode == 0 || statusCode >= 500 || statusCode == 429) {
            return true;
        }
        return errorCode != null && RETRYABLE_CODES.contains(errorCode);
    }

    @Override
    public String getMessage() {
        if (statusCode == 0) {
            return super.getMessage();
        }
        return String.format("HTTP %d %s: %s (request id: %s)",
                statusCode, errorCode != null ? errorCode : "-", super.getMessage(),
                requestId != null ? requestId : "-");
    }
}
