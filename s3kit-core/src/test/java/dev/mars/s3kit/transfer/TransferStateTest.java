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


import dev.mars.s3kit.core.TransferDirection;
import dev.mars.s3kit.core.TransferPhase;
import dev.mars.s3kit.core.exceptions.InvalidTransitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TransferState")
class TransferStateTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private TransferState state;

    @BeforeEach
    void setUp() {
        state = TransferState.create("photos", "2025/album.zip", Paths.get("album.zip"), TransferDirection.UPLOAD,
                100, 30, "size=100;modified=1", Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("A new state has one pending chunk per range")
    void testCreate() {
        assertNotNull(state.getTransferId());
        assertEquals(TransferPhase.NOT_STARTED, state.getPhase());
        assertEquals(4, state.getChunkCount());
        assertEquals(List.of(0, 1, 2, 3), state.pendingIndices());
        assertEquals(10, state.chunk(3).length());
        assertEquals(0, state.completedBytes());
        assertTrue(state.getLocalPath().isAbsolute());
        assertTrue(state.isConsistent());
    }

    @Nested
    @DisplayName("Chunk bookkeeping")
    class ChunkBookkeeping {

        @Test
        void testCompletion() {
            state.markChunkInFlight(1);
            assertEquals(ChunkStatus.IN_FLIGHT, state.chunk(1).getStatus());

            state.markChunkCompleted(1, "etag-1", "md5-1", NOW.plusSeconds(5));

            assertTrue(state.chunk(1).isCompleted());
            assertEquals("etag-1", state.chunk(1).getETag());
            assertEquals(1, state.completedCount());
            assertEquals(30, state.completedBytes());
            assertEquals(List.of(0, 2, 3), state.pendingIndices());
            assertEquals(NOW.plusSeconds(5), state.getLastUpdated());
        }

        @Test
        void testAttemptFailuresCountRetries() {
            state.markChunkInFlight(0);
            state.recordChunkAttemptFailure(0, "timeout");
            state.recordChunkAttemptFailure(0, "timeout again");
            state.markChunkFailed(0, "gave up", NOW);

            assertEquals(ChunkStatus.FAILED, state.chunk(0).getStatus());
            assertEquals(2, state.chunk(0).getRetryCount());
            assertEquals("gave up", state.chunk(0).getLastError());
        }

        @Test
        @DisplayName("Resetting incomplete chunks keeps completed ones")
        void testResetIncomplete() {
            state.markChunkCompleted(0, "etag-0", null, NOW);
            state.markChunkFailed(1, "boom", NOW);
            state.markChunkInFlight(2);

            state.resetIncompleteChunks();

            assertTrue(state.chunk(0).isCompleted());
            assertEquals(ChunkStatus.PENDING, state.chunk(1).getStatus());
            assertEquals(ChunkStatus.PENDING, state.chunk(2).getStatus());
            assertEquals(0, state.chunk(1).getRetryCount());
        }

        @Test
        @DisplayName("Invalidation discards every chunk and the upload id")
        void testInvalidate() {
            state.setUploadId("upload-1", NOW);
            state.transitionTo(TransferPhase.INITIATED, NOW);
            state.markChunkCompleted(0, "etag-0", null, NOW);

            state.invalidate("size=100;modified=2", NOW.plusSeconds(1));

            assertEquals(TransferPhase.NOT_STARTED, state.getPhase());
            assertNull(state.getUploadId());
            assertEquals("size=100;modified=2", state.getFingerprint());
            assertEquals(0, state.completedCount());
            assertNull(state.chunk(0).getETag());
        }
    }

    @Nested
    @DisplayName("Phase transitions")
    class PhaseTransitions {

        @Test
        void testHappyPath() {
            state.transitionTo(TransferPhase.INITIATED, NOW);
            state.transitionTo(TransferPhase.TRANSFERRING, NOW);
            state.transitionTo(TransferPhase.COMPLETING, NOW);
            state.transitionTo(TransferPhase.COMPLETED, NOW.plusSeconds(9));

            assertEquals(TransferPhase.COMPLETED, state.getPhase());
            assertEquals(NOW.plusSeconds(9), state.getLastUpdated());
        }

        @Test
        void testSamePhaseIsNoOp() {
            state.transitionTo(TransferPhase.INITIATED, NOW);
            assertDoesNotThrow(() -> state.transitionTo(TransferPhase.INITIATED, NOW));
        }

        @Test
        void testIllegalTransition() {
            InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
                    () -> state.transitionTo(TransferPhase.COMPLETED, NOW));
            assertEquals(TransferPhase.NOT_STARTED, e.getCurrentState());
            assertEquals(TransferPhase.COMPLETED, e.getRequestedState());
        }

        @Test
        void testFailedCanBeResumed() {
            state.transitionTo(TransferPhase.INITIATED, NOW);
            state.transitionTo(TransferPhase.TRANSFERRING, NOW);
            state.transitionTo(TransferPhase.FAILED, NOW);
            state.transitionTo(TransferPhase.INITIATED, NOW);
            assertEquals(TransferPhase.INITIATED, state.getPhase());
        }
    }

    @Test
    @DisplayName("Snapshots are independent of later updates")
    void testSnapshot() {
        state.markChunkCompleted(0, "etag-0", null, NOW);
        TransferState snapshot = state.snapshot();

        state.markChunkCompleted(1, "etag-1", null, NOW);

        assertEquals(1, snapshot.completedCount());
        assertEquals(2, state.completedCount());
        assertEquals(state.getTransferId(), snapshot.getTransferId());
    }

    @Test
    void testAge() {
        assertFalse(state.isOlderThan(Duration.ofHours(1), NOW.plus(Duration.ofMinutes(59))));
        assertTrue(state.isOlderThan(Duration.ofHours(1), NOW.plus(Duration.ofMinutes(61))));
    }
}
