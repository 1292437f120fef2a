package dev.mars.s3kit.client;

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
import dev.mars.s3kit.core.BucketDescriptor;
import dev.mars.s3kit.core.BucketStats;
import dev.mars.s3kit.core.Credentials;
import dev.mars.s3kit.core.ObjectDescriptor;
import dev.mars.s3kit.core.ObjectHeaders;
import dev.mars.s3kit.core.PresignedUrl;
import dev.mars.s3kit.core.StorageStats;
import dev.mars.s3kit.core.exceptions.S3KitException;
import dev.mars.s3kit.core.exceptions.StorageException;
import dev.mars.s3kit.http.ResponseBodyConsumer;
import dev.mars.s3kit.http.S3ErrorDocument;
import dev.mars.s3kit.http.S3Request;
import dev.mars.s3kit.http.S3Response;
import dev.mars.s3kit.http.S3Transport;
import dev.mars.s3kit.http.S3Xml;
import dev.mars.s3kit.signer.RequestSigner;
import dev.mars.s3kit.signer.SigningUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bucket and object primitives on top of an {@link S3Transport}.
 *
 * <p>Existence checks ({@link #bucketExists}, {@link #objectExists}, {@link #headObject},
 * {@link #getBucketPolicy}) map a 404 response to {@code false} or an empty
 * {@link Optional}; every other non-2xx response surfaces as a {@link StorageException}
 * carrying the HTTP status, the backend error code and the request id.</p>
 *
 * <p>Streaming operations report cumulative byte counts to the supplied progress
 * callback on the calling thread.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class S3StorageClient {
    private static final Logger logger = Logger.getLogger(S3StorageClient.class.getName());

    private static final String USER_METADATA_PREFIX = "x-amz-meta-";
    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";
    private static final int LIST_PAGE_SIZE = 1000;

    private final S3Transport transport;
    private final PresignedUrlGenerator presignedUrlGenerator;
    private final int bufferSize;

    public S3StorageClient(S3Transport transport, S3KitConfiguration configuration) {
        this(transport, configuration,
                new PresignedUrlGenerator(transport.getCredentials(), new RequestSigner(), Clock.systemUTC()));
    }

    public S3StorageClient(S3Transport transport, S3KitConfiguration configuration,
                           PresignedUrlGenerator presignedUrlGenerator) {
        this.transport = transport;
        this.presignedUrlGenerator = presignedUrlGenerator;
        this.bufferSize = Math.max(4096, configuration.getBufferSize());
    }

    public Credentials getCredentials() {
        return transport.getCredentials();
    }

    // Buckets

    public List<BucketDescriptor> listBuckets() throws S3KitException {
        S3Response response = transport.execute(S3Request.builder("GET").build());
        S3XmlModels.ListAllMyBucketsResult result = readXml(response, S3XmlModels.ListAllMyBucketsResult.class);
        List<BucketDescriptor> buckets = new ArrayList<>();
        if (result.buckets != null) {
            for (S3XmlModels.Bucket bucket : result.buckets) {
                buckets.add(new BucketDescriptor(bucket.name, S3XmlModels.parseTimestamp(bucket.creationDate)));
            }
        }
        logger.fine("Listed " + buckets.size() + " buckets");
        return buckets;
    }

    public boolean bucketExists(String bucket) throws S3KitException {
        validateBucket(bucket);
        try {
            transport.execute(S3Request.builder("HEAD").bucket(bucket).build());
            return true;
        } catch (StorageException e) {
            if (e.isNotFound()) {
                return false;
            }
            throw e;
        }
    }

    /**
     * Creates a bucket. Outside {@code us-east-1} the region is sent as location constraint.
     */
    public void createBucket(String bucket) throws S3KitException {
        validateBucket(bucket);
        S3Request.Builder request = S3Request.builder("PUT").bucket(bucket);
        String region = transport.getCredentials().getRegion();
        if (!Credentials.DEFAULT_REGION.equals(region)) {
            request.header("Content-Type", "application/xml")
                    .body(toXml(new S3XmlModels.CreateBucketConfiguration(region)));
        }
        transport.execute(request.build());
        logger.info("Created bucket " + bucket);
    }

    public void deleteBucket(String bucket) throws S3KitException {
        validateBucket(bucket);
        transport.execute(S3Request.builder("DELETE").bucket(bucket).build());
        logger.info("Deleted bucket " + bucket);
    }

    // Listing

    /**
     * Lists objects with ListObjectsV2, following continuation tokens.
     *
     * @param prefix key prefix, may be null
     * @param recursive when false, keys are grouped on {@code /} and common prefixes are
     *        returned as descriptors with {@link ObjectDescriptor#isPrefix()} set
     * @param max maximum number of entries to return, 0 for no limit
     */
    public List<ObjectDescriptor> listObjects(String bucket, String prefix, boolean recursive, int max)
            throws S3KitException {
        validateBucket(bucket);
        if (max < 0) {
            throw new IllegalArgumentException("max must not be negative: " + max);
        }

        List<ObjectDescriptor> objects = new ArrayList<>();
        String continuationToken = null;
        do {
            int pageSize = max > 0 ? Math.min(LIST_PAGE_SIZE, max - objects.size()) : LIST_PAGE_SIZE;
            S3Request.Builder request = S3Request.builder("GET").bucket(bucket)
                    .query("list-type", "2")
                    .query("max-keys", String.valueOf(pageSize));
            if (prefix != null && !prefix.isEmpty()) {
                request.query("prefix", prefix);
            }
            if (!recursive) {
                request.query("delimiter", "/");
            }
            if (continuationToken != null) {
                request.query("continuation-token", continuationToken);
            }

            S3XmlModels.ListBucketResult page = readXml(transport.execute(request.build()),
                    S3XmlModels.ListBucketResult.class);
            if (page.contents != null) {
                for (S3XmlModels.Contents contents : page.contents) {
                    objects.add(ObjectDescriptor.builder()
                            .bucket(bucket)
                            .key(contents.key)
                            .size(contents.size)
                            .eTag(contents.eTag)
                            .lastModified(S3XmlModels.parseTimestamp(contents.lastModified))
                            .storageClass(contents.storageClass)
                            .build());
                }
            }
            if (page.commonPrefixes != null) {
                for (S3XmlModels.CommonPrefix common : page.commonPrefixes) {
                    if (common.prefix != null) {
                        objects.add(ObjectDescriptor.builder().bucket(bucket).key(common.prefix).prefix(true).build());
                    }
                }
            }
            continuationToken = page.truncated ? page.nextContinuationToken : null;
        } while (continuationToken != null && (max == 0 || objects.size() < max));

        if (max > 0 && objects.size() > max) {
            return new ArrayList<>(objects.subList(0, max));
        }
        return objects;
    }

    // Statistics

    /**
     * Counts objects and bytes in every bucket.
     *
     * <p>A bucket that cannot be listed is reported with its error instead of failing the
     * whole call; only a failure to list the buckets themselves is thrown.</p>
     *
     * @param maxObjectsPerBucket cap on the objects counted per bucket, 0 for no limit
     */
    public StorageStats getStats(int maxObjectsPerBucket) throws S3KitException {
        if (maxObjectsPerBucket < 0) {
            throw new IllegalArgumentException("maxObjectsPerBucket must not be negative: " + maxObjectsPerBucket);
        }
        List<BucketStats> stats = new ArrayList<>();
        for (BucketDescriptor bucket : listBuckets()) {
            try {
                stats.add(countBucket(bucket.getName(), bucket.getCreationDate(), maxObjectsPerBucket));
            } catch (S3KitException e) {
                logger.log(Level.WARNING, "Could not collect statistics for bucket " + bucket.getName(), e);
                stats.add(BucketStats.failed(bucket.getName(), bucket.getCreationDate(), e.getMessage()));
            }
        }
        Credentials credentials = transport.getCredentials();
        StorageStats result = new StorageStats(credentials.getEndpoint(), credentials.isSecure(), stats, Instant.now());
        logger.info("Collected statistics: " + result);
        return result;
    }

    /**
     * Counts objects and bytes in one bucket.
     *
     * @param maxObjects cap on the objects counted, 0 for no limit
     */
    public BucketStats getBucketStats(String bucket, int maxObjects) throws S3KitException {
        validateBucket(bucket);
        if (maxObjects < 0) {
            throw new IllegalArgumentException("maxObjects must not be negative: " + maxObjects);
        }
        return countBucket(bucket, null, maxObjects);
    }

    private BucketStats countBucket(String bucket, Instant creationDate, int maxObjects) throws S3KitException {
        // one extra entry tells a capped listing from a bucket that holds exactly the cap
        List<ObjectDescriptor> objects = listObjects(bucket, null, true, maxObjects > 0 ? maxObjects + 1 : 0);
        boolean truncated = maxObjects > 0 && objects.size() > maxObjects;
        List<ObjectDescriptor> counted = truncated ? objects.subList(0, maxObjects) : objects;
        long totalSize = counted.stream().mapToLong(ObjectDescriptor::getSize).sum();
        logger.fine("Bucket " + bucket + " holds " + counted.size() + (truncated ? "+" : "") + " objects");
        return BucketStats.counted(bucket, creationDate, counted.size(), totalSize, truncated);
    }

    // Objects

    public Optional<ObjectDescriptor> headObject(String bucket, String key) throws S3KitException {
        validateBucket(bucket);
        validateKey(key);
        S3Response response;
        try {
            response = transport.execute(S3Request.builder("HEAD").bucket(bucket).key(key).build());
        } catch (StorageException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        response.getHeaders().forEach((name, value) -> {
            if (name.toLowerCase(Locale.ROOT).startsWith(USER_METADATA_PREFIX)) {
                metadata.put(name.substring(USER_METADATA_PREFIX.length()).toLowerCase(Locale.ROOT), value);
            }
        });

        return Optional.of(ObjectDescriptor.builder()
                .bucket(bucket)
                .key(key)
                .size(Math.max(0, response.getContentLength()))
                .eTag(response.header("ETag").orElse(null))
                .lastModified(response.header("Last-Modified").map(S3StorageClient::parseHttpDate).orElse(null))
                .contentType(response.header("Content-Type").orElse(null))
                .storageClass(response.header(ObjectHeaders.STORAGE_CLASS).orElse(null))
                .userMetadata(metadata)
                .headers(objectHeadersOf(response))
                .tagCount(response.header("x-amz-tagging-count").map(S3StorageClient::parseCount).orElse(0))
                .build());
    }

    public boolean objectExists(String bucket, String key) throws S3KitException {
        return headObject(bucket, key).isPresent();
    }

    /**
     * Uploads an object in a single request.
     *
     * @return the ETag of the stored object, without quotes
     */
    public String putObject(String bucket, String key, InputStream data, long length, String contentType,
                            Map<String, String> metadata, LongConsumer onProgress) throws S3KitException {
        return putObject(bucket, key, data, length, contentType, metadata, ObjectHeaders.none(), onProgress);
    }

    /**
     * Uploads an object in a single request, storing the given object headers with it.
     *
     * @return the ETag of the stored object, without quotes
     */
    public String putObject(String bucket, String key, InputStream data, long length, String contentType,
                            Map<String, String> metadata, ObjectHeaders objectHeaders, LongConsumer onProgress)
            throws S3KitException {
        validateBucket(bucket);
        validateKey(key);
        if (data == null) {
            throw new IllegalArgumentException("Data stream cannot be null");
        }
        if (length < 0) {
            throw new IllegalArgumentException("Length must not be negative: " + length);
        }

        S3Response response = transport.execute(S3Request.builder("PUT")
                .bucket(bucket)
                .key(key)
                .header("Content-Type", contentType != null ? contentType : DEFAULT_CONTENT_TYPE)
                .headers(metadataHeaders(metadata))
                .headers(objectHeaders != null ? objectHeaders.toHeaders() : Map.of())
                .body(data, length)
                .onProgress(onProgress)
                .build());
        logger.fine("Put " + bucket + "/" + key + " (" + length + " bytes)");
        return eTagOf(response);
    }

    public String putObject(String bucket, String key, byte[] data, String contentType) throws S3KitException {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        return putObject(bucket, key, new ByteArrayInputStream(data), data.length, contentType, Map.of(), null);
    }

    /**
     * Streams the whole object into {@code destination}.
     *
     * @return the number of bytes written
     */
    public long getObject(String bucket, String key, OutputStream destination, LongConsumer onProgress)
            throws S3KitException {
        validateBucket(bucket);
        validateKey(key);
        if (destination == null) {
            throw new IllegalArgumentException("Destination stream cannot be null");
        }
        long[] copied = new long[1];
        transport.execute(S3Request.builder("GET").bucket(bucket).key(key).build(),
                (response, body) -> copied[0] = copy(body, destination, onProgress));
        return copied[0];
    }

    /**
     * Fetches the inclusive byte range {@code [start, end]} and hands the body to {@code sink}.
     *
     * @return the number of bytes the sink consumed
     */
    public long getObjectRange(String bucket, String key, long start, long end, ResponseBodyConsumer sink)
            throws S3KitException {
        validateBucket(bucket);
        validateKey(key);
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid byte range " + start + "-" + end);
        }
        long[] consumed = new long[1];
        transport.execute(S3Request.builder("GET").bucket(bucket).key(key)
                        .header("Range", "bytes=" + start + "-" + end)
                        .build(),
                (response, body) -> {
                    if (response.getStatusCode() != 206 && ignoredRange(response, start, end)) {
                        throw new IOException("Server ignored range request for " + bucket + "/" + key
                                + " (HTTP " + response.getStatusCode() + ")");
                    }
                    consumed[0] = sink.consume(response, body);
                    return consumed[0];
                });
        return consumed[0];
    }

    /**
     * A plain 200 answers a range request with the whole object. That is only the
     * requested range when the range starts at zero and covers the entire body.
     */
    private static boolean ignoredRange(S3Response response, long start, long end) {
        long length = response.getContentLength();
        return start > 0 || (length >= 0 && length != end - start + 1);
    }

    public void deleteObject(String bucket, String key) throws S3KitException {
        validateBucket(bucket);
        validateKey(key);
        transport.execute(S3Request.builder("DELETE").bucket(bucket).key(key).build());
        logger.fine("Deleted " + bucket + "/" + key);
    }

    /**
     * Server-side copy.
     *
     * @return the ETag of the new object
     */
    public String copyObject(String sourceBucket, String sourceKey, String targetBucket, String targetKey)
            throws S3KitException {
        validateBucket(sourceBucket);
        validateKey(sourceKey);
        validateBucket(targetBucket);
        validateKey(targetKey);

        S3Response response = transport.execute(S3Request.builder("PUT")
                .bucket(targetBucket)
                .key(targetKey)
                .header("x-amz-copy-source", SigningUtils.canonicalUri(sourceBucket, sourceKey))
                .build());
        failOnEmbeddedError(response);
        S3XmlModels.CopyObjectResult result = readXml(response, S3XmlModels.CopyObjectResult.class);
        logger.fine("Copied " + sourceBucket + "/" + sourceKey + " to " + targetBucket + "/" + targetKey);
        return unquote(result.eTag);
    }

    // Folders

    /**
     * Creates the zero-byte {@code prefix/} marker object.
     */
    public void createFolder(String bucket, String prefix) throws S3KitException {
        String marker = folderKey(prefix);
        putObject(bucket, marker, new ByteArrayInputStream(new byte[0]), 0, "application/x-directory", Map.of(), null);
        logger.info("Created folder " + bucket + "/" + marker);
    }

    /**
     * Deletes every object under {@code prefix/} including the folder marker.
     *
     * @return the number of objects deleted
     */
    public int deleteFolder(String bucket, String prefix) throws S3KitException {
        String marker = folderKey(prefix);
        List<ObjectDescriptor> objects = listObjects(bucket, marker, true, 0);
        int deleted = 0;
        boolean markerListed = false;
        for (ObjectDescriptor object : objects) {
            deleteObject(bucket, object.getKey());
            markerListed |= object.getKey().equals(marker);
            deleted++;
        }
        if (!markerListed && objectExists(bucket, marker)) {
            deleteObject(bucket, marker);
            deleted++;
        }
        logger.info("Deleted folder " + bucket + "/" + marker + " (" + deleted + " objects)");
        return deleted;
    }

    // Policies

    public Optional<String> getBucketPolicy(String bucket) throws S3KitException {
        validateBucket(bucket);
        try {
            S3Response response = transport.execute(S3Request.builder("GET").bucket(bucket).query("policy", "").build());
            return Optional.of(response.bodyAsString());
        } catch (StorageException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    public void setBucketPolicy(String bucket, String policyJson) throws S3KitException {
        validateBucket(bucket);
        if (policyJson == null || policyJson.isBlank()) {
            throw new IllegalArgumentException("Policy cannot be null or empty");
        }
        transport.execute(S3Request.builder("PUT").bucket(bucket).query("policy", "")
                .header("Content-Type", "application/json")
                .body(policyJson.getBytes(StandardCharsets.UTF_8))
                .build());
        logger.info("Set policy on bucket " + bucket);
    }

    public void deleteBucketPolicy(String bucket) throws S3KitException {
        validateBucket(bucket);
        transport.execute(S3Request.builder("DELETE").bucket(bucket).query("policy", "").build());
        logger.info("Deleted policy of bucket " + bucket);
    }

    public PresignedUrl generatePresignedUrl(String method, String bucket, String key, Duration expiry)
            throws S3KitException {
        return presignedUrlGenerator.generate(method, bucket, key, expiry);
    }

    // Multipart primitives

    public String initiateMultipartUpload(String bucket, String key, String contentType,
                                          Map<String, String> metadata) throws S3KitException {
        return initiateMultipartUpload(bucket, key, contentType, metadata, ObjectHeaders.none());
    }

    /**
     * Starts a multipart upload. Content type, metadata and object headers apply to the
     * object assembled on completion.
     *
     * @return the upload id
     */
    public String initiateMultipartUpload(String bucket, String key, String contentType,
                                          Map<String, String> metadata, ObjectHeaders objectHeaders)
            throws S3KitException {
        validateBucket(bucket);
        validateKey(key);
        S3Response response = transport.execute(S3Request.builder("POST")
                .bucket(bucket)
                .key(key)
                .query("uploads", "")
                .header("Content-Type", contentType != null ? contentType : DEFAULT_CONTENT_TYPE)
                .headers(metadataHeaders(metadata))
                .headers(objectHeaders != null ? objectHeaders.toHeaders() : Map.of())
                .build());
        S3XmlModels.InitiateMultipartUploadResult result =
                readXml(response, S3XmlModels.InitiateMultipartUploadResult.class);
        if (result.uploadId == null || result.uploadId.isBlank()) {
            throw new StorageException(response.getStatusCode(), "MalformedResponse",
                    "Initiate multipart upload returned no upload id", null);
        }
        logger.fine("Initiated multipart upload " + result.uploadId + " for " + bucket + "/" + key);
        return result.uploadId;
    }

    /**
     * Uploads one part.
     *
     * @param contentMd5 base64 MD5 of the part, sent as {@code Content-MD5}; may be null
     * @return the part ETag, without quotes
     */
    public String uploadPart(String bucket, String key, String uploadId, int partNumber, InputStream data,
                             long length, String contentMd5, LongConsumer onProgress) throws S3KitException {
        validateBucket(bucket);
        validateKey(key);
        validateUploadId(uploadId);
        if (partNumber < 1 || partNumber > 10000) {
            throw new IllegalArgumentException("Part number must be between 1 and 10000: " + partNumber);
        }
        S3Response response = transport.execute(S3Request.builder("PUT")
                .bucket(bucket)
                .key(key)
                .query("partNumber", String.valueOf(partNumber))
                .query("uploadId", uploadId)
                .header("Content-MD5", contentMd5)
                .body(data, length)
                .onProgress(onProgress)
                .build());
        return eTagOf(response);
    }

    /**
     * Completes a multipart upload. Parts are sent in ascending part number order.
     *
     * @return the ETag of the assembled object
     */
    public String completeMultipartUpload(String bucket, String key, String uploadId, List<CompletedPart> parts)
            throws S3KitException {
        validateBucket(bucket);
        validateKey(key);
        validateUploadId(uploadId);
        if (parts == null || parts.isEmpty()) {
            throw new IllegalArgumentException("At least one part is required");
        }

        List<CompletedPart> sorted = new ArrayList<>(parts);
        Collections.sort(sorted);
        S3XmlModels.CompleteMultipartUpload document = new S3XmlModels.CompleteMultipartUpload();
        for (CompletedPart part : sorted) {
            document.parts.add(new S3XmlModels.Part(part.getPartNumber(), "\"" + part.getETag() + "\""));
        }

        S3Response response = transport.execute(S3Request.builder("POST")
                .bucket(bucket)
                .key(key)
                .query("uploadId", uploadId)
                .header("Content-Type", "application/xml")
                .body(toXml(document))
                .build());
        failOnEmbeddedError(response);
        S3XmlModels.CompleteMultipartUploadResult result =
                readXml(response, S3XmlModels.CompleteMultipartUploadResult.class);
        logger.fine("Completed multipart upload " + uploadId + " with " + sorted.size() + " parts");
        return unquote(result.eTag);
    }

    public void abortMultipartUpload(String bucket, String key, String uploadId) throws S3KitException {
        validateBucket(bucket);
        validateKey(key);
        validateUploadId(uploadId);
        transport.execute(S3Request.builder("DELETE").bucket(bucket).key(key).query("uploadId", uploadId).build());
        logger.info("Aborted multipart upload " + uploadId + " for " + bucket + "/" + key);
    }

    // Helpers

    private long copy(InputStream body, OutputStream destination, LongConsumer onProgress) throws IOException {
        byte[] buffer = new byte[bufferSize];
        long total = 0;
        int read;
        while ((read = body.read(buffer)) != -1) {
            destination.write(buffer, 0, read);
            total += read;
            if (onProgress != null) {
                onProgress.accept(total);
            }
        }
        destination.flush();
        return total;
    }

    private static ObjectHeaders objectHeadersOf(S3Response response) {
        ObjectHeaders.Builder headers = ObjectHeaders.builder()
                .cacheControl(response.header(ObjectHeaders.CACHE_CONTROL).orElse(null))
                .contentDisposition(response.header(ObjectHeaders.CONTENT_DISPOSITION).orElse(null))
                .contentEncoding(response.header(ObjectHeaders.CONTENT_ENCODING).orElse(null))
                .contentLanguage(response.header(ObjectHeaders.CONTENT_LANGUAGE).orElse(null));
        response.header(ObjectHeaders.EXPIRES).ifPresent(value -> {
            try {
                headers.expires(parseHttpDate(value));
            } catch (DateTimeParseException e) {
                logger.fine("Ignoring unparseable Expires header: " + value);
            }
        });
        response.header(ObjectHeaders.STORAGE_CLASS)
                .filter(ObjectHeaders.STORAGE_CLASSES::contains)
                .ifPresent(headers::storageClass);
        response.header(ObjectHeaders.KMS_KEY_ID).ifPresent(headers::kmsKeyId);
        response.header(ObjectHeaders.SERVER_SIDE_ENCRYPTION)
                .filter(value -> value.equals("AES256") || value.equals("aws:kms"))
                .ifPresent(headers::serverSideEncryption);
        return headers.build();
    }

    private static int parseCount(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.fine("Ignoring invalid tag count: " + value);
            return 0;
        }
    }

    private static Map<String, String> metadataHeaders(Map<String, String> metadata) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (metadata != null) {
            metadata.forEach((name, value) -> {
                String lower = name.toLowerCase(Locale.ROOT);
                headers.put(lower.startsWith(USER_METADATA_PREFIX) ? lower : USER_METADATA_PREFIX + lower, value);
            });
        }
        return headers;
    }

    private static String eTagOf(S3Response response) throws StorageException {
        return response.header("ETag").map(S3StorageClient::unquote).orElseThrow(() ->
                new StorageException(response.getStatusCode(), "MalformedResponse", "Response carries no ETag",
                        response.header("x-amz-request-id").orElse(null)));
    }

    private static String unquote(String eTag) {
        if (eTag == null) {
            return null;
        }
        String trimmed = eTag.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }

    /**
     * Copy and complete calls can fail after the status line was sent as 200.
     */
    private static void failOnEmbeddedError(S3Response response) throws StorageException {
        String body = response.bodyAsString();
        if (body.contains("<Error>")) {
            try {
                S3ErrorDocument error = S3Xml.read(response.getBody(), S3ErrorDocument.class);
                throw new StorageException(500, error.code, error.message, error.requestId);
            } catch (IOException e) {
                throw new StorageException(500, "InternalError", "Unparseable error document", null);
            }
        }
    }

    private static <T> T readXml(S3Response response, Class<T> type) throws StorageException {
        try {
            return S3Xml.read(response.getBody(), type);
        } catch (IOException e) {
            throw new StorageException(response.getStatusCode(), "MalformedResponse",
                    "Cannot parse " + type.getSimpleName() + ": " + e.getMessage(),
                    response.header("x-amz-request-id").orElse(null));
        }
    }

    private static byte[] toXml(Object document) throws S3KitException {
        try {
            return S3Xml.write(document);
        } catch (IOException e) {
            throw new S3KitException("Cannot serialize " + document.getClass().getSimpleName(), e);
        }
    }

    static Instant parseHttpDate(String value) {
        try {
            return ZonedDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            return S3XmlModels.parseTimestamp(value);
        }
    }

    private static String folderKey(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Folder prefix is required");
        }
        String trimmed = prefix.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Folder prefix is required");
        }
        return trimmed.endsWith("/") ? trimmed : trimmed + "/";
    }

    private static void validateBucket(String bucket) {
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("Bucket name is required");
        }
        if (bucket.length() < 3 || bucket.length() > 63) {
            throw new IllegalArgumentException("Bucket name must be between 3 and 63 characters: " + bucket);
        }
    }

    private static void validateKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Object key is required");
        }
    }

    private static void validateUploadId(String uploadId) {
        if (uploadId == null || uploadId.isBlank()) {
            throw new IllegalArgumentException("Upload id is required");
        }
    }
}
