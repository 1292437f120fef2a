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
 * Base exception class for all S3Kit exceptions.
 * Provides a common hierarchy for error handling across signing, transport and transfers.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class S3KitException extends Exception {

    public S3KitException(String message) {
        super(message);
    }

    public S3KitException(String message, Throwable cause) {
        super(message, cause);
    }

    public S3KitException(Throwable cause) {
        super(cause);
    }
}
