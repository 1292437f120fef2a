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


/**
 * Lifecycle phase of a chunked transfer.
 *
 * <h3>State Transition Flow:</h3>
 * <pre>
 * NOT_STARTED → INITIATED → TRANSFERRING → COMPLETING → COMPLETED
 *       ↓            ↓            ↓             ↓
 *       └──────── FAILED | ABORTED ─────────────┘
 * </pre>
 *
 * <ul>
 *   <li>INITIATED means an upload id exists (uploads) or the destination is preallocated (downloads)</li>
 *   <li>FAILED keeps completed chunks and the upload id so the transfer can be resumed;
 *       a resume moves FAILED back to INITIATED</li>
 *   <li>COMPLETED and ABORTED are terminal</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum TransferPhase {

    NOT_STARTED,

    INITIATED,

    TRANSFERRING,

    COMPLETING,

    COMPLETED,

    FAILED,

    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }

    /**
     * A transfer in one of these phases may be picked up again from its saved state.
     */
    public boolean isResumable() {
        return this == INITIATED || this == TRANSFERRING || this == FAILED;
    }

    public boolean canTransitionTo(TransferPhase target) {
        switch (this) {
            case NOT_STARTED:
                return target == INITIATED || target == FAILED || target == ABORTED;
            case INITIATED:
                return target == TRANSFERRING || target == FAILED || target == ABORTED;
            case TRANSFERRING:
                return target == COMPLETING || target == FAILED || target == ABORTED;
            case COMPLETING:
                return target == COMPLETED || target == FAILED || target == ABORTED;
            case FAILED:
                return target == INITIATED || target == ABORTED;
            default:
                return false;
        }
    }

    public TransferPhase[] getValidTransitions() {
        switch (this) {
            case NOT_STARTED:
                return new TransferPhase[]{INITIATED, FAILED, ABORTED};
            case INITIATED:
                return new TransferPhase[]{TRANSFERRING, FAILED, ABORTED};
            case TRANSFERRING:
                return new TransferPhase[]{COMPLETING, FAILED, ABORTED};
            case COMPLETING:
                return new TransferPhase[]{COMPLETED, FAILED, ABORTED};
            case FAILED:
                return new TransferPhase[]{INITIATED, ABORTED};
            default:
                return new TransferPhase[0];
        }
    }
}
