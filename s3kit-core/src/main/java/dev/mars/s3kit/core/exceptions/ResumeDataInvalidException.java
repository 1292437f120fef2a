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


/**
 * Raised when a stored transfer state no longer matches its source: the local file or
 * the remote object changed since the interrupted transfer began, or the chunk layout differs.
 *
 * <p>Transfer managers catch this, log it as a warning and start a fresh transfer.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ResumeDataInvalidException extends S3KitException {

    private final String expectedFingerprint;
    private final String actualFingerprint;

    public ResumeDataInvalidException(String expectedFingerprint, String actualFingerprint) {
        super(String.format("Resume data is stale - recorded fingerprint: %s, current: %s",
                expectedFingerprint, actualFingerprint));
        this.expectedFingerprint = expectedFingerprint;
        this.actualFingerprint = actualFingerprint;
    }

    public String getExpectedFingerprint() {
        return expectedFingerprint;
    }

    public String getActualFingerprint() {
        return actualFingerprint;
    }
}
