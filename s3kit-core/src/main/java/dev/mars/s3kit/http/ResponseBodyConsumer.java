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


import java.io.IOException;
import java.io.InputStream;

/**
 * Receives the body of a successful streamed response on the calling thread.
 *
 * <p>The stream is closed by the transport once the consumer returns. Read failures on
 * {@code body} are network failures; any other {@link IOException} thrown by the
 * consumer is treated as a local failure.</p>
 */
@FunctionalInterface
public interface ResponseBodyConsumer {

    /**
     * @return the number of body bytes consumed
     */
    long consume(S3Response response, InputStream body) throws IOException;
}
