package dev.mars.s3kit.http;

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


import dev.mars.s3kit.core.Credentials;
import dev.mars.s3kit.core.exceptions.S3KitException;

/**
 * Issues signed requests against one S3-compatible endpoint.
 *
 * <p>Implementations must be safe for concurrent use: the transfer managers call
 * {@code execute} from several worker threads at once.</p>
 *
 * <p>Failure contract:</p>
 * <ul>
 *   <li>{@link dev.mars.s3kit.core.exceptions.StorageException} for non-2xx responses
 *       and network failures (status 0, retryable)</li>
 *   <li>{@link dev.mars.s3kit.core.exceptions.SigningException} when the request cannot be signed</li>
 *   <li>plain {@link S3KitException} for local I/O failures while reading the request
 *       body or writing the response body</li>
 * </ul>
 */
public interface S3Transport {

    /**
     * Executes a request and buffers the whole response body.
     */
    S3Response execute(S3Request request) throws S3KitException;

    /**
     * Executes a request and hands the response body to {@code consumer} as a stream.
     * The returned response carries status and headers but no body.
     */
    S3Response execute(S3Request request, ResponseBodyConsumer consumer) throws S3KitException;

    Credentials getCredentials();
}
