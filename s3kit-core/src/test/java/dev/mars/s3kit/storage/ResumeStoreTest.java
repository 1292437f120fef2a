package dev.mars.s3kit.storage;

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


import dev.mars.s3kit.core.TransferDirection;
import dev.mars.s3kit.core.TransferPhase;
import dev.mars.s3kit.transfer.ChunkStatus;
import dev.mars.s3kit.transfer.TransferState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ResumeStoreTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private Path storeDir;
    private Path localFile;
    private ResumeStore store;
    private Clock clock;

    @BeforeEach
    void setUp() {
        storeDir = tempDir.resolve("resume");
        localFile = tempDir.resolve("data.bin");
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new ResumeStore(storeDir, clock);
    }

    private TransferState newState(String key, TransferDirection direction) {
        return TransferState.create("backups", key, localFile, direction, 100, 40, "size=100;modified=5", clock);
    }

    @Test
    @DisplayName("Saved state loads back with chunk progress and upload id")
    void testSaveAndLoad() throws IOException {
        TransferState state = newState("db/dump.sql", TransferDirection.UPLOAD);
        state.setUploadId("upload-123", NOW);
        state.transitionTo(TransferPhase.INITIATED, NOW);
        state.markChunkCompleted(0, "etag-0", "md5-0", NOW);
        state.markChunkFailed(2, "timeout", NOW);

        store.save(state);
        Optional<TransferState> loaded = store.load("backups", "db/dump.sql", localFile, TransferDirection.UPLOAD);

        assertTrue(loaded.isPresent());
        TransferState copy = loaded.get();
        assertEquals(state.getTransferId(), copy.getTransferId());
        assertEquals("upload-123", copy.getUploadId());
        assertEquals(TransferPhase.INITIATED, copy.getPhase());
        assertEquals(3, copy.getChunkCount());
        assertEquals("etag-0", copy.chunk(0).getETag());
        assertEquals(ChunkStatus.FAILED, copy.chunk(2).getStatus());
        assertEquals(localFile.toAbsolutePath().normalize(), copy.getLocalPath());
    }

    @Test
    @DisplayName("Upload and download records of the same object are kept apart")
    void testDirectionIsPartOfIdentity() throws IOException {
        store.save(newState("a.bin", TransferDirection.UPLOAD));

        assertTrue(store.load("backups", "a.bin", localFile, TransferDirection.UPLOAD).isPresent());
        assertTrue(store.load("backups", "a.bin", localFile, TransferDirection.DOWNLOAD).isEmpty());
        assertNotEquals(store.resolveFile("backups", "a.bin", localFile, TransferDirection.UPLOAD),
                store.resolveFile("backups", "a.bin", localFile, TransferDirection.DOWNLOAD));
    }

    @Test
    @DisplayName("Saving again replaces the record and leaves no temporary files")
    void testOverwrite() throws IOException {
        TransferState state = newState("a.bin", TransferDirection.UPLOAD);
        store.save(state);
        state.markChunkCompleted(1, "etag-1", null, NOW);
        store.save(state);

        assertEquals(1, store.load("backups", "a.bin", localFile, TransferDirection.UPLOAD).orElseThrow()
                .completedCount());
        try (Stream<Path> files = Files.list(storeDir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void testDelete() throws IOException {
        TransferState state = newState("a.bin", TransferDirection.DOWNLOAD);
        store.save(state);

        assertTrue(store.delete(state));
        assertFalse(store.delete(state));
        assertTrue(store.load("backups", "a.bin", localFile, TransferDirection.DOWNLOAD).isEmpty());
    }

    @Test
    @DisplayName("Corrupt records are ignored rather than failing the load")
    void testCorruptRecord() throws IOException {
        Path file = store.resolveFile("backups", "a.bin", localFile, TransferDirection.UPLOAD);
        Files.createDirectories(storeDir);
        Files.write(file, "{ not json".getBytes(StandardCharsets.UTF_8));

        assertTrue(store.load("backups", "a.bin", localFile, TransferDirection.UPLOAD).isEmpty());
        assertTrue(store.list().isEmpty());
    }

    @Test
    void testListAndCleanup() throws IOException {
        store.save(newState("old.bin", TransferDirection.UPLOAD));

        ResumeStore later = new ResumeStore(storeDir, Clock.fixed(NOW.plus(Duration.ofDays(10)), ZoneOffset.UTC));
        TransferState fresh = TransferState.create("backups", "new.bin", localFile, TransferDirection.UPLOAD, 100, 40,
                "size=100;modified=5", Clock.fixed(NOW.plus(Duration.ofDays(10)), ZoneOffset.UTC));
        later.save(fresh);

        List<TransferState> all = later.list();
        assertEquals(2, all.size());

        assertEquals(1, later.cleanupOlderThan(Duration.ofDays(7)));
        assertEquals(1, later.list().size());
        assertEquals("new.bin", later.list().get(0).getKey());
    }

    @Test
    void testFileNamesAreSafe() {
        Path file = store.resolveFile("my.bucket", "some dir/with:odd*chars?.txt", localFile, TransferDirection.UPLOAD);
        String name = file.getFileName().toString();

        assertTrue(name.startsWith("my.bucket_with_odd_chars_.txt_upload_"));
        assertTrue(name.endsWith(ResumeStore.FILE_SUFFIX));
        assertEquals(storeDir, file.getParent());
    }

    @Test
    void testSafeName() {
        assertEquals("a_b-c.d", ResumeStore.safeName("a/b-c.d"));
        assertEquals(40, ResumeStore.safeName("x".repeat(100)).length());
    }
}
