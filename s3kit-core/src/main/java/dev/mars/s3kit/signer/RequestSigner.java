package dev.mars.s3kit.signer;

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
import dev.mars.s3kit.core.exceptions.SigningException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * AWS Signature Version 4 signer for the {@code s3} service.
 *
 * <p>The signer is stateless: the result depends only on the request, the credentials
 * and the timestamp passed in, so signing the same input twice yields the same
 * {@code Authorization} header. It never touches the network.</p>
 *
 * <h3>Header signing</h3>
 * <p>{@code host}, {@code x-amz-content-sha256}, {@code x-amz-date} and every header
 * supplied with the request are signed. Bodies that are streamed from an
 * {@code InputStream} are signed with {@link #UNSIGNED_PAYLOAD}.</p>
 *
 * <h3>Query signing</h3>
 * <p>{@link #presign} produces the {@code X-Amz-*} query parameters of a presigned URL,
 * signing only the {@code host} header. Expiry must lie between one second and seven days.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class RequestSigner {

    public static final String ALGORITHM = "AWS4-HMAC-SHA256";
    public static final String UNSIGNED_PAYLOAD = "UNSIGNED-PAYLOAD";
    public static final String SERVICE = "s3";
    public static final String AUTHORIZATION = "Authorization";
    public static final String X_AMZ_DATE = "x-amz-date";
    public static final String X_AMZ_CONTENT_SHA256 = "x-amz-content-sha256";

    public static final Duration MIN_PRESIGN_EXPIRY = Duration.ofSeconds(1);
    public static final Duration MAX_PRESIGN_EXPIRY = Duration.ofDays(7);

    private static final DateTimeFormatter AMZ_DATE_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'", Locale.ROOT).withZone(ZoneOffset.UTC);

    /**
     * Signs a request with an {@code Authorization} header.
     *
     * @throws SigningException when the credentials have no keys, the endpoint has no host
     *         or the request lacks a method, URI or payload hash
     */
    public SignedRequest sign(SigningRequest request, Credentials credentials, Instant timestamp)
            throws SigningException {
        validate(request.getMethod(), request.getCanonicalUri(), credentials, timestamp);
        if (request.getPayloadHash() == null || request.getPayloadHash().isBlank()) {
            throw new SigningException("Payload hash is required for " + request.getMethod() + " "
                    + request.getCanonicalUri());
        }

        String amzDate = AMZ_DATE_FORMAT.format(timestamp);
        String scope = scope(amzDate, credentials.getRegion());

        SortedMap<String, String> canonicalHeaders = new TreeMap<>();
        Map<String, String> wireHeaders = new LinkedHashMap<>();
        canonicalHeaders.put("host", credentials.getHost());
        for (Map.Entry<String, String> header : request.getHeaders().entrySet()) {
            String name = header.getKey().toLowerCase(Locale.ROOT).trim();
            if (name.equals("host") || name.equals("authorization") || header.getValue() == null) {
                continue;
            }
            canonicalHeaders.put(name, normalizeHeaderValue(header.getValue()));
            wireHeaders.put(header.getKey(), header.getValue());
        }
        canonicalHeaders.put(X_AMZ_CONTENT_SHA256, request.getPayloadHash());
        canonicalHeaders.put(X_AMZ_DATE, amzDate);
        wireHeaders.put(X_AMZ_CONTENT_SHA256, request.getPayloadHash());
        wireHeaders.put(X_AMZ_DATE, amzDate);

        String signedHeaders = String.join(";", canonicalHeaders.keySet());
        SortedMap<String, String> query = encodeQuery(request.getQueryParameters());
        String canonicalQuery = joinQuery(query);

        String canonicalRequest = request.getMethod() + "\n"
                + request.getCanonicalUri() + "\n"
                + canonicalQuery + "\n"
                + canonicalHeaders.entrySet().stream()
                    .map(e -> e.getKey() + ":" + e.getValue() + "\n")
                    .collect(Collectors.joining()) + "\n"
                + signedHeaders + "\n"
                + request.getPayloadHash();

        String stringToSign = stringToSign(amzDate, scope, canonicalRequest);
        String signature = signature(credentials, amzDate, stringToSign);

        wireHeaders.put(AUTHORIZATION, ALGORITHM
                + " Credential=" + credentials.getAccessKey() + "/" + scope
                + ", SignedHeaders=" + signedHeaders
                + ", Signature=" + signature);

        return new SignedRequest(request.getMethod(), request.getCanonicalUri(), query, wireHeaders,
                canonicalQuery, canonicalRequest, stringToSign, signature);
    }

    /**
     * Produces the query-string signature for a presigned URL.
     *
     * @param extraQuery additional query parameters to sign, may be empty
     * @throws IllegalArgumentException when the expiry is outside [1 s, 7 d]
     */
    public SignedRequest presign(String method, String canonicalUri, Map<String, String> extraQuery,
                                 Credentials credentials, Instant timestamp, Duration expiry)
            throws SigningException {
        if (expiry == null || expiry.compareTo(MIN_PRESIGN_EXPIRY) < 0 || expiry.compareTo(MAX_PRESIGN_EXPIRY) > 0) {
            throw new IllegalArgumentException("Presigned URL expiry must be between 1 second and 7 days, got " + expiry);
        }
        validate(method, canonicalUri, credentials, timestamp);

        String amzDate = AMZ_DATE_FORMAT.format(timestamp);
        String scope = scope(amzDate, credentials.getRegion());

        Map<String, String> raw = new LinkedHashMap<>();
        if (extraQuery != null) {
            raw.putAll(extraQuery);
        }
        raw.put("X-Amz-Algorithm", ALGORITHM);
        raw.put("X-Amz-Credential", credentials.getAccessKey() + "/" + scope);
        raw.put("X-Amz-Date", amzDate);
        raw.put("X-Amz-Expires", String.valueOf(expiry.getSeconds()));
        raw.put("X-Amz-SignedHeaders", "host");

        SortedMap<String, String> query = encodeQuery(raw);
        String canonicalQuery = joinQuery(query);

        String canonicalRequest = method + "\n"
                + canonicalUri + "\n"
                + canonicalQuery + "\n"
                + "host:" + credentials.getHost() + "\n\n"
                + "host\n"
                + UNSIGNED_PAYLOAD;

        String stringToSign = stringToSign(amzDate, scope, canonicalRequest);
        String signature = signature(credentials, amzDate, stringToSign);

        query.put("X-Amz-Signature", signature);
        return new SignedRequest(method, canonicalUri, query, Map.of("host", credentials.getHost()),
                joinQuery(query), canonicalRequest, stringToSign, signature);
    }

    /**
     * Derives the signing key: HMAC chain over date, region, service and terminator.
     */
    byte[] signingKey(String secretKey, String dateStamp, String region) {
        byte[] kDate = SigningUtils.hmacSha256(("AWS4" + secretKey).getBytes(StandardCharsets.UTF_8), dateStamp);
        byte[] kRegion = SigningUtils.hmacSha256(kDate, region);
        byte[] kService = SigningUtils.hmacSha256(kRegion, SERVICE);
        return SigningUtils.hmacSha256(kService, "aws4_request");
    }

    public static String formatAmzDate(Instant timestamp) {
        return AMZ_DATE_FORMAT.format(timestamp);
    }

    private void validate(String method, String canonicalUri, Credentials credentials, Instant timestamp)
            throws SigningException {
        if (credentials == null || !credentials.hasKeys()) {
            throw new SigningException("Credentials are missing an access key or secret key");
        }
        if (credentials.getHost() == null || credentials.getHost().isBlank()) {
            throw new SigningException("Endpoint host is required for signing");
        }
        if (method == null || method.isBlank()) {
            throw new SigningException("HTTP method is required for signing");
        }
        if (canonicalUri == null || !canonicalUri.startsWith("/")) {
            throw new SigningException("Canonical URI must start with '/': " + canonicalUri);
        }
        if (timestamp == null) {
            throw new SigningException("Signing timestamp is required");
        }
    }

    private String scope(String amzDate, String region) {
        return amzDate.substring(0, 8) + "/" + region + "/" + SERVICE + "/aws4_request";
    }

    private String stringToSign(String amzDate, String scope, String canonicalRequest) {
        return ALGORITHM + "\n" + amzDate + "\n" + scope + "\n" + SigningUtils.sha256Hex(canonicalRequest);
    }

    private String signature(Credentials credentials, String amzDate, String stringToSign) {
        byte[] key = signingKey(credentials.getSecretKey(), amzDate.substring(0, 8), credentials.getRegion());
        return SigningUtils.toHex(SigningUtils.hmacSha256(key, stringToSign));
    }

    private static SortedMap<String, String> encodeQuery(Map<String, String> parameters) {
        SortedMap<String, String> encoded = new TreeMap<>();
        parameters.forEach((name, value) ->
                encoded.put(SigningUtils.uriEncode(name, false), SigningUtils.uriEncode(value, false)));
        return encoded;
    }

    private static String joinQuery(SortedMap<String, String> encoded) {
        return encoded.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("&"));
    }

    private static String normalizeHeaderValue(String value) {
        return value.trim().replaceAll("\\s+", " ");
    }
}
