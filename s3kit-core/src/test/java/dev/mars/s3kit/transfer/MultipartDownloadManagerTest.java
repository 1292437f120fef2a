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


import dev.mars.s3kit.client.S3StorageClient;
import dev.mars.s3kit.config.S3KitConfiguration;
import dev.mars.s3kit.core.Credentials;
import dev.mars.s3kit.core.DownloadResult;
import dev.mars.s3kit.core.TransferDirection;
import dev.mars.s3kit.core.TransferPhase;
import dev.mars.s3kit.core.exceptions.S3KitException;
import dev.mars.s3kit.core.exceptions.TransferException;
import dev.mars.s3kit.http.HttpS3Transport;
import dev.mars.s3kit.simulator.InMemoryS3ServerSimulator;
import dev.mars.s3kit.simulator.InMemoryS3ServerSimulator.RecordedRequest;
import dev.mars.s3kit.storage.ResumeStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MultipartDownloadManager against the in-memory S3 server")
class MultipartDownloadManagerTest {

    private static final String ACCESS_KEY = "AKIATESTKEY";
    private static final String BUCKET = "downloads";
    private static final int CHUNK = 1024;

    @TempDir
    Path tempDir;

    private InMemoryS3ServerSimulator server;
    private ResumeStore resumeStore;
    private MultipartDownloadManager manager;

    @BeforeEach
    void setUp() throws IOException {
        server = new InMemoryS3ServerSimulator(ACCESS_KEY);
        server.createBucket(BUCKET);

        Properties props = new Properties();
        props.setProperty(S3KitConfiguration.DOWNLOAD_CHUNK_SIZE, String.valueOf(CHUNK));
        props.setProperty(S3KitConfiguration.DOWNLOAD_MIN_CHUNK_SIZE, String.valueOf(CHUNK));
        props.setProperty(S3KitConfiguration.DOWNLOAD_MAX_PARALLEL, "4");
        props.setProperty(S3KitConfiguration.MAX_RETRIES, "2");
        props.setProperty(S3KitConfiguration.RETRY_DELAY_MS, "0");
        S3KitConfiguration configuration = new S3KitConfiguration(props);

        Credentials credentials = new Credentials(server.getEndpoint(), ACCESS_KEY, "secret", "us-east-1", false);
        S3StorageClient storage = new S3StorageClient(new HttpS3Transport(credentials, configuration), configuration);
        resumeStore = new ResumeStore(tempDir.resolve("resume"));
        manager = new MultipartDownloadManager(storage, resumeStore, configuration);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private byte[] storeObject(String key, int size, long seed) {
        byte[] data = new byte[size];
        new Random(seed).nextBytes(data);
        server.putObject(BUCKET, key, data);
        return data;
    }

    private List<Long> rangeStarts() {
        return server.requestsMatching(RecordedRequest::isRangedGet).stream()
                .map(RecordedRequest::rangeStart).sorted().collect(Collectors.toList());
    }

    private DownloadResult failOnRange(String key, Path destination, long rangeStart) throws S3KitException {
        server.injectFault(r -> r.isRangedGet() && r.rangeStart() == rangeStart, 1, 500, "InternalError");
        DownloadResult failed = manager.download(BUCKET, key, destination,
                TransferOptions.builder().maxParallel(1).maxRetries(0).build(), null);
        server.clearFaults();
        return failed;
    }

    @Test
    @DisplayName("Ranges are fetched in parallel and written at their offsets")
    void testDownload() throws Exception {
        byte[] data = storeObject("photo.raw", 10 * CHUNK + 17, 1);
        Path destination = tempDir.resolve("out/photo.raw");
        ProgressCollector collector = new ProgressCollector();

        DownloadResult result = manager.download(BUCKET, "photo.raw", destination, null, collector);

        assertTrue(result.isSuccessful(), () -> result.getErrorMessage().orElse(""));
        assertEquals(11, result.getChunkCount());
        assertEquals(data.length, result.getBytesTransferred());
        assertEquals(InMemoryS3ServerSimulator.md5Hex(data), result.getETag().orElseThrow().replace("\"", ""));
        assertTrue(result.getSourceLastModified().isPresent());
        assertArrayEquals(data, Files.readAllBytes(destination));
        assertTrue(resumeStore.list().isEmpty());

        List<ProgressEvent> events = collector.drain();
        assertEquals(11, events.stream().filter(e -> e.getKind() == ProgressEvent.Kind.CHUNK_COMPLETED).count());
        assertEquals(ProgressEvent.Kind.TRANSFER_COMPLETED, events.get(events.size() - 1).getKind());
    }

    @Test
    @DisplayName("10 KiB in 4 KiB ranges starts at 0, 4096 and 8192")
    void testScaledRangeLayout() throws Exception {
        byte[] data = storeObject("ten.bin", 10 * 1024, 2);
        Path destination = tempDir.resolve("ten.bin");

        DownloadResult result = manager.download(BUCKET, "ten.bin", destination,
                TransferOptions.builder().chunkSize(4 * 1024).build(), null);

        assertTrue(result.isSuccessful());
        assertEquals(List.of(0L, 4096L, 8192L), rangeStarts());
        assertArrayEquals(data, Files.readAllBytes(destination));
    }

    @Test
    void testEmptyObject() throws Exception {
        server.putObject(BUCKET, "empty.txt", new byte[0]);
        Path destination = tempDir.resolve("empty.txt");

        DownloadResult result = manager.download(BUCKET, "empty.txt", destination, null, null);

        assertTrue(result.isSuccessful());
        assertEquals(TransferPhase.COMPLETED, result.getFinalPhase());
        assertTrue(Files.exists(destination));
        assertEquals(0, Files.size(destination));
        assertTrue(rangeStarts().isEmpty());
    }

    @Test
    void testMissingObject() {
        TransferException e = assertThrows(TransferException.class, () ->
                manager.download(BUCKET, "missing.bin", tempDir.resolve("missing.bin"), null, null));
        assertTrue(e.getMessage().contains("missing.bin"));
    }

    @Test
    @DisplayName("A short range body is retried")
    void testTruncatedRangeIsRetried() throws Exception {
        byte[] data = storeObject("data.bin", 4 * CHUNK, 3);
        server.injectTruncation(r -> r.isRangedGet() && r.rangeStart() == CHUNK, 1);
        Path destination = tempDir.resolve("data.bin");

        DownloadResult result = manager.download(BUCKET, "data.bin", destination, null, null);

        assertTrue(result.isSuccessful(), () -> result.getErrorMessage().orElse(""));
        assertEquals(2, server.requestsMatching(r -> r.isRangedGet() && r.rangeStart() == CHUNK).size());
        assertArrayEquals(data, Files.readAllBytes(destination));
    }

    @Test
    @DisplayName("A server that ignores ranges fails the download")
    void testIgnoredRangesFail() throws Exception {
        storeObject("data.bin", 4 * CHUNK, 4);
        server.setIgnoreRanges(true);

        DownloadResult result = manager.download(BUCKET, "data.bin", tempDir.resolve("data.bin"),
                TransferOptions.builder().maxRetries(0).build(), null);

        assertFalse(result.isSuccessful());
        assertEquals(TransferPhase.FAILED, result.getFinalPhase());
    }

    @Test
    @DisplayName("An ignored leading range fails without retrying")
    void testIgnoredLeadingRangeIsNotRetried() throws Exception {
        storeObject("data.bin", 4 * CHUNK, 10);
        server.setIgnoreRanges(true);

        DownloadResult result = manager.download(BUCKET, "data.bin", tempDir.resolve("data.bin"),
                TransferOptions.builder().maxParallel(1).maxRetries(2).build(), null);

        assertFalse(result.isSuccessful());
        assertEquals(List.of(0L), rangeStarts());
    }

    @Test
    @DisplayName("A range failing on every attempt spends its retries, then fails the download")
    void testRetriesExhausted() throws Exception {
        storeObject("data.bin", 4 * CHUNK, 11);
        Path destination = tempDir.resolve("data.bin");
        server.injectFault(r -> r.isRangedGet() && r.rangeStart() == 2L * CHUNK, 10, 503, "SlowDown");

        DownloadResult result = manager.download(BUCKET, "data.bin", destination,
                TransferOptions.builder().maxParallel(1).maxRetries(2).build(), null);

        assertFalse(result.isSuccessful());
        assertEquals(TransferPhase.FAILED, result.getFinalPhase());
        assertEquals(2, result.getCompletedChunks());
        assertEquals(3, server.requestsMatching(r -> r.isRangedGet() && r.rangeStart() == 2L * CHUNK).size());
        assertTrue(server.requestsMatching(r -> r.isRangedGet() && r.rangeStart() == 3L * CHUNK).isEmpty());

        TransferState saved = resumeStore.load(BUCKET, "data.bin", destination, TransferDirection.DOWNLOAD)
                .orElseThrow();
        assertEquals(TransferPhase.FAILED, saved.getPhase());
        assertEquals(ChunkStatus.COMPLETED, saved.chunk(0).getStatus());
        assertEquals(ChunkStatus.COMPLETED, saved.chunk(1).getStatus());
        assertEquals(ChunkStatus.FAILED, saved.chunk(2).getStatus());
        assertEquals(2, saved.chunk(2).getRetryCount());
        assertEquals(2L * CHUNK, saved.completedBytes());
    }

    @Test
    @DisplayName("A second run fetches only the ranges that are missing")
    void testResume() throws Exception {
        byte[] data = storeObject("data.bin", 4 * CHUNK, 5);
        Path destination = tempDir.resolve("data.bin");

        DownloadResult failed = failOnRange("data.bin", destination, 2L * CHUNK);
        assertFalse(failed.isSuccessful());
        assertEquals(2, failed.getCompletedChunks());
        assertEquals(data.length, Files.size(destination));
        TransferState saved = resumeStore.load(BUCKET, "data.bin", destination, TransferDirection.DOWNLOAD)
                .orElseThrow();
        assertEquals(TransferPhase.FAILED, saved.getPhase());
        server.clearRequests();

        DownloadResult resumed = manager.download(BUCKET, "data.bin", destination, null, null);

        assertTrue(resumed.isSuccessful(), () -> resumed.getErrorMessage().orElse(""));
        assertEquals(2, resumed.getResumedChunks());
        assertEquals(failed.getTransferId(), resumed.getTransferId());
        assertEquals(List.of(2L * CHUNK, 3L * CHUNK), rangeStarts());
        assertArrayEquals(data, Files.readAllBytes(destination));
        assertTrue(resumeStore.list().isEmpty());
    }

    @Test
    @DisplayName("A changed remote object invalidates the saved download")
    void testChangedObjectStartsOver() throws Exception {
        storeObject("data.bin", 4 * CHUNK, 6);
        Path destination = tempDir.resolve("data.bin");
        failOnRange("data.bin", destination, 2L * CHUNK);

        byte[] replaced = storeObject("data.bin", 4 * CHUNK, 7);
        server.clearRequests();

        DownloadResult result = manager.download(BUCKET, "data.bin", destination, null, null);

        assertTrue(result.isSuccessful());
        assertEquals(0, result.getResumedChunks());
        assertEquals(4, rangeStarts().size());
        assertArrayEquals(replaced, Files.readAllBytes(destination));
    }

    @Test
    @DisplayName("A destination truncated between runs is downloaded again in full")
    void testTruncatedDestinationStartsOver() throws Exception {
        byte[] data = storeObject("data.bin", 4 * CHUNK, 8);
        Path destination = tempDir.resolve("data.bin");
        failOnRange("data.bin", destination, 3L * CHUNK);

        try (RandomAccessFile file = new RandomAccessFile(destination.toFile(), "rw")) {
            file.setLength(CHUNK);
        }
        server.clearRequests();

        DownloadResult result = manager.download(BUCKET, "data.bin", destination, null, null);

        assertTrue(result.isSuccessful());
        assertEquals(4, rangeStarts().size());
        assertArrayEquals(data, Files.readAllBytes(destination));
    }

    @Test
    void testResumeDisabled() throws Exception {
        byte[] data = storeObject("data.bin", 4 * CHUNK, 9);
        Path destination = tempDir.resolve("data.bin");
        failOnRange("data.bin", destination, 3L * CHUNK);
        server.clearRequests();

        DownloadResult result = manager.download(BUCKET, "data.bin", destination,
                TransferOptions.builder().resume(false).build(), null);

        assertTrue(result.isSuccessful());
        assertEquals(0, result.getResumedChunks());
        assertEquals(4, rangeStarts().size());
        assertArrayEquals(data, Files.readAllBytes(destination));
    }
}
