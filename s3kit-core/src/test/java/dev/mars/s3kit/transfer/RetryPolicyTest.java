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


import dev.mars.s3kit.core.exceptions.S3KitException;
import dev.mars.s3kit.core.exceptions.SigningException;
import dev.mars.s3kit.core.exceptions.StorageException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(3, 100);

    @ParameterizedTest
    @CsvSource({
            "500, InternalError, true",
            "503, SlowDown, true",
            "429, TooManyRequests, true",
            "400, RequestTimeout, true",
            "403, AccessDenied, false",
            "404, NoSuchKey, false",
            "400, BadDigest, false"
    })
    void testClassification(int status, String code, boolean retryable) {
        assertEquals(retryable, policy.isRetryable(new StorageException(status, code, "x", null)));
    }

    @Test
    void testNetworkFailuresAreRetryable() {
        assertTrue(policy.isRetryable(new StorageException("connection reset", new IOException("reset"))));
    }

    @Test
    void testLocalFailuresAreFatal() {
        assertFalse(policy.isRetryable(new S3KitException("disk full", new IOException("No space left"))));
        assertFalse(policy.isRetryable(new SigningException("no keys")));
        assertFalse(policy.isRetryable(new IOException("local")));
    }

    @Test
    void testAttemptLimit() {
        StorageException transient503 = new StorageException(503, "ServiceUnavailable", "busy", null);
        assertTrue(policy.shouldRetry(transient503, 1));
        assertTrue(policy.shouldRetry(transient503, 3));
        assertFalse(policy.shouldRetry(transient503, 4));
    }

    @Test
    void testLinearBackoff() {
        assertEquals(100, policy.delayFor(1));
        assertEquals(200, policy.delayFor(2));
        assertEquals(300, policy.delayFor(3));
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, -1));
    }
}
