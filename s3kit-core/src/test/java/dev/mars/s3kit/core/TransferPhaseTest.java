package dev.mars.s3kit.core;

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


import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TransferPhase")
class TransferPhaseTest {

    @Nested
    @DisplayName("Valid transitions")
    class ValidTransitions {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "NOT_STARTED, INITIATED",
                "INITIATED, TRANSFERRING",
                "TRANSFERRING, COMPLETING",
                "COMPLETING, COMPLETED",
                "TRANSFERRING, FAILED",
                "COMPLETING, FAILED",
                "FAILED, INITIATED",
                "FAILED, ABORTED",
                "INITIATED, ABORTED"
        })
        void testAllowed(TransferPhase from, TransferPhase to) {
            assertTrue(from.canTransitionTo(to));
        }
    }

    @Nested
    @DisplayName("Invalid transitions")
    class InvalidTransitions {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "NOT_STARTED, TRANSFERRING",
                "NOT_STARTED, COMPLETED",
                "INITIATED, COMPLETED",
                "TRANSFERRING, INITIATED",
                "COMPLETING, TRANSFERRING",
                "FAILED, TRANSFERRING",
                "FAILED, COMPLETED"
        })
        void testRejected(TransferPhase from, TransferPhase to) {
            assertFalse(from.canTransitionTo(to));
        }

        @ParameterizedTest
        @EnumSource(value = TransferPhase.class, names = {"COMPLETED", "ABORTED"})
        void testTerminalPhasesHaveNoExits(TransferPhase terminal) {
            assertTrue(terminal.isTerminal());
            assertEquals(0, terminal.getValidTransitions().length);
            for (TransferPhase target : TransferPhase.values()) {
                assertFalse(terminal.canTransitionTo(target));
            }
        }
    }

    @ParameterizedTest
    @EnumSource(TransferPhase.class)
    @DisplayName("getValidTransitions agrees with canTransitionTo")
    void testTransitionTableConsistency(TransferPhase phase) {
        List<TransferPhase> valid = Arrays.asList(phase.getValidTransitions());
        for (TransferPhase target : TransferPhase.values()) {
            assertEquals(valid.contains(target), phase.canTransitionTo(target), phase + " -> " + target);
        }
    }

    @Test
    void testResumablePhases() {
        assertTrue(TransferPhase.FAILED.isResumable());
        assertTrue(TransferPhase.TRANSFERRING.isResumable());
        assertFalse(TransferPhase.COMPLETED.isResumable());
        assertFalse(TransferPhase.NOT_STARTED.isResumable());
    }
}
