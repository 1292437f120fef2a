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


import dev.mars.s3kit.config.S3KitConfiguration;
import dev.mars.s3kit.core.Credentials;
import dev.mars.s3kit.core.exceptions.S3KitException;
import dev.mars.s3kit.core.exceptions.StorageException;
import dev.mars.s3kit.signer.RequestSigner;
import dev.mars.s3kit.signer.SignedRequest;
import dev.mars.s3kit.signer.SigningRequest;
import dev.mars.s3kit.signer.SigningUtils;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link S3Transport} over {@link HttpURLConnection}.
 *
 * <p>Each call opens its own connection, so one instance can be shared by the transfer
 * workers. Requests are signed at the time of the call using the injected clock.
 * Request bodies with a length use fixed-length streaming so nothing is buffered in
 * memory; streamed bodies are copied through a fixed buffer and progress is reported on
 * the calling thread after every write.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class HttpS3Transport implements S3Transport {
    private static final Logger logger = Logger.getLogger(HttpS3Transport.class.getName());

    private static final String USER_AGENT = "S3Kit/1.0";

    private final Credentials credentials;
    private final RequestSigner signer;
    private final Clock clock;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;
    private final int bufferSize;

    public HttpS3Transport(Credentials credentials, S3KitConfiguration configuration) {
        this(credentials, configuration, new RequestSigner(), Clock.systemUTC());
    }

    public HttpS3Transport(Credentials credentials, S3KitConfiguration configuration,
                           RequestSigner signer, Clock clock) {
        this.credentials = credentials;
        this.signer = signer;
        this.clock = clock;
        this.connectTimeoutMs = configuration.getConnectTimeoutMs();
        this.readTimeoutMs = configuration.getReadTimeoutMs();
        this.bufferSize = Math.max(4096, configuration.getBufferSize());
    }

    @Override
    public Credentials getCredentials() {
        return credentials;
    }

    @Override
    public S3Response execute(S3Request request) throws S3KitException {
        return execute(request, null);
    }

    @Override
    public S3Response execute(S3Request request, ResponseBodyConsumer consumer) throws S3KitException {
        SignedRequest signed = sign(request);
        String url = credentials.getBaseUrl() + signed.getCanonicalUri()
                + (signed.getCanonicalQueryString().isEmpty() ? "" : "?" + signed.getCanonicalQueryString());

        logger.fine("Executing " + request + " -> " + url);

        try {
            HttpURLConnection connection = (HttpURLConnection) new URL(url).openConnection();
            connection.setConnectTimeout(connectTimeoutMs);
            connection.setReadTimeout(readTimeoutMs);
            connection.setInstanceFollowRedirects(false);
            connection.setUseCaches(false);
            connection.setRequestMethod(request.getMethod());
            connection.setRequestProperty("User-Agent", USER_AGENT);
            for (Map.Entry<String, String> header : signed.getHeaders().entrySet()) {
                connection.setRequestProperty(header.getKey(), header.getValue());
            }

            if (request.hasBody() || isWriteMethod(request.getMethod())) {
                writeBody(connection, request);
            }

            int status = connection.getResponseCode();
            Map<String, String> headers = collectHeaders(connection);

            if (status < 200 || status >= 300) {
                throw toStorageException(status, headers, connection);
            }

            if (consumer == null) {
                byte[] body = readBody(connection, request.getMethod());
                return new S3Response(status, headers, body);
            }

            S3Response head = new S3Response(status, headers, null);
            try (InputStream raw = connection.getInputStream();
                 InputStream body = new NetworkInputStream(raw)) {
                consumer.consume(head, body);
            } catch (NetworkReadException e) {
                throw e;
            } catch (IOException e) {
                throw new S3KitException("Failed to store response body of " + request, e);
            }
            return head;

        } catch (NetworkReadException e) {
            throw new StorageException("Network failure reading response of " + request + ": "
                    + e.getCause().getMessage(), e.getCause());
        } catch (LocalReadException e) {
            throw new S3KitException("Failed to read request body for " + request, e.getCause());
        } catch (IOException e) {
            logger.log(Level.FINE, "Network failure for " + request, e);
            throw new StorageException("Network failure for " + request + ": " + e.getMessage(), e);
        }
    }

    private SignedRequest sign(S3Request request) throws S3KitException {
        String payloadHash;
        if (request.isStreaming()) {
            payloadHash = RequestSigner.UNSIGNED_PAYLOAD;
        } else if (request.getBody() != null) {
            payloadHash = SigningUtils.sha256Hex(request.getBody());
        } else {
            payloadHash = SigningUtils.EMPTY_PAYLOAD_SHA256;
        }

        SigningRequest signingRequest = SigningRequest.builder()
                .method(request.getMethod())
                .canonicalUri(SigningUtils.canonicalUri(request.getBucket(), request.getKey()))
                .queryParameters(request.getQueryParameters())
                .headers(request.getHeaders())
                .payloadHash(payloadHash)
                .build();
        return signer.sign(signingRequest, credentials, clock.instant());
    }

    private void writeBody(HttpURLConnection connection, S3Request request) throws IOException {
        long length = request.hasBody() ? request.getContentLength() : 0;
        connection.setDoOutput(true);
        connection.setFixedLengthStreamingMode(length);

        LongConsumer onProgress = request.getOnProgress();
        try (OutputStream out = connection.getOutputStream()) {
            if (request.getBody() != null) {
                out.write(request.getBody());
                if (onProgress != null) {
                    onProgress.accept(request.getBody().length);
                }
            } else if (request.getBodyStream() != null) {
                copyBody(request.getBodyStream(), out, length, onProgress);
            }
        }
    }

    private void copyBody(InputStream source, OutputStream out, long length, LongConsumer onProgress)
            throws IOException {
        byte[] buffer = new byte[bufferSize];
        long written = 0;
        while (written < length) {
            int toRead = (int) Math.min(buffer.length, length - written);
            int read;
            try {
                read = source.read(buffer, 0, toRead);
            } catch (IOException e) {
                throw new LocalReadException(e);
            }
            if (read < 0) {
                throw new LocalReadException(new IOException(
                        "Request body ended after " + written + " of " + length + " bytes"));
            }
            out.write(buffer, 0, read);
            written += read;
            if (onProgress != null) {
                onProgress.accept(written);
            }
        }
    }

    private byte[] readBody(HttpURLConnection connection, String method) throws IOException {
        if ("HEAD".equals(method)) {
            return new byte[0];
        }
        try (InputStream in = connection.getInputStream()) {
            return in.readAllBytes();
        }
    }

    private StorageException toStorageException(int status, Map<String, String> headers,
                                                HttpURLConnection connection) {
        String requestId = headers.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase("x-amz-request-id"))
                .map(Map.Entry::getValue)
                .findFirst().orElse(null);
        String code = null;
        String message = connection.getHeaderField(0);

        byte[] errorBody = new byte[0];
        try (InputStream err = connection.getErrorStream()) {
            if (err != null) {
                errorBody = err.readAllBytes();
            }
        } catch (IOException e) {
            logger.fine("Could not read error body: " + e.getMessage());
        }

        if (errorBody.length > 0) {
            try {
                S3ErrorDocument document = S3Xml.read(errorBody, S3ErrorDocument.class);
                code = document.code;
                if (document.message != null) {
                    message = document.message;
                }
                if (document.requestId != null) {
                    requestId = document.requestId;
                }
            } catch (IOException e) {
                logger.fine("Error body is not an S3 error document: " + e.getMessage());
            }
        }
        if (code == null) {
            code = defaultErrorCode(status);
        }
        return new StorageException(status, code, message != null ? message : "HTTP " + status, requestId);
    }

    private static String defaultErrorCode(int status) {
        switch (status) {
            case 403:
                return "AccessDenied";
            case 404:
                return "NotFound";
            case 409:
                return "Conflict";
            case 429:
                return "SlowDown";
            case 503:
                return "ServiceUnavailable";
            default:
                return status >= 500 ? "InternalError" : "BadRequest";
        }
    }

    private static Map<String, String> collectHeaders(HttpURLConnection connection) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : connection.getHeaderFields().entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null && !entry.getValue().isEmpty()) {
                headers.put(entry.getKey(), entry.getValue().get(0));
            }
        }
        return headers;
    }

    private static boolean isWriteMethod(String method) {
        return "PUT".equals(method) || "POST".equals(method);
    }

    /**
     * Tags read failures on the response body so they are reported as network failures.
     */
    private static final class NetworkInputStream extends FilterInputStream {
        NetworkInputStream(InputStream in) {
            super(in);
        }

        @Override
        public int read() throws IOException {
            try {
                return super.read();
            } catch (IOException e) {
                throw new NetworkReadException(e);
            }
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            try {
                return super.read(b, off, len);
            } catch (IOException e) {
                throw new NetworkReadException(e);
            }
        }
    }

    private static final class NetworkReadException extends IOException {
        NetworkReadException(IOException cause) {
            super(cause);
        }
    }

    private static final class LocalReadException extends IOException {
        LocalReadException(IOException cause) {
            super(cause);
        }
    }
}
