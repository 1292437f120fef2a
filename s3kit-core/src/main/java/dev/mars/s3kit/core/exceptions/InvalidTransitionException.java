package dev.mars.s3kit.core.exceptions;

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


import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Thrown when a transfer phase change is not allowed by the phase state machine.
 *
 * <p>Unchecked: an illegal transition is a programming error inside the transfer
 * managers, not a condition callers can recover from.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class InvalidTransitionException extends IllegalStateException {

    private final String entityId;
    private final Enum<?> currentState;
    private final Enum<?> requestedState;

    public InvalidTransitionException(String entityId, Enum<?> currentState,
                                      Enum<?> requestedState, Enum<?>[] validTransitions) {
        super(String.format("Invalid transition for '%s': %s -> %s. Valid targets: %s",
                entityId, currentState, requestedState, formatTransitions(validTransitions)));
        this.entityId = entityId;
        this.currentState = currentState;
        this.requestedState = requestedState;
    }

    public String getEntityId() {
        return entityId;
    }

    public Enum<?> getCurrentState() {
        return currentState;
    }

    public Enum<?> getRequestedState() {
        return requestedState;
    }

    private static String formatTransitions(Enum<?>[] transitions) {
        if (transitions == null || transitions.length == 0) {
            return "[]";
        }
        return Arrays.stream(transitions).map(Enum::name).collect(Collectors.joining(", ", "[", "]"));
    }
}
