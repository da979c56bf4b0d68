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

package dev.mars.conveyor.core.exceptions;

import dev.mars.conveyor.core.QueueItemStatus;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Thrown when a queue item is asked to move to a status that is not reachable from its
 * current one.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public class InvalidTransitionException extends ConveyorException {

    private final String itemId;
    private final QueueItemStatus currentState;
    private final QueueItemStatus requestedState;
    private final QueueItemStatus[] validTransitions;

    /**
     * @param itemId           the item whose transition was rejected
     * @param currentState     the status the item is in
     * @param requestedState   the status that was requested
     * @param validTransitions the statuses reachable from {@code currentState}
     */
    public InvalidTransitionException(String itemId, QueueItemStatus currentState,
                                      QueueItemStatus requestedState, QueueItemStatus[] validTransitions) {
        super(String.format("Invalid transition for '%s': %s -> %s. Valid targets: %s",
                itemId, currentState, requestedState, format(validTransitions)));
        this.itemId = itemId;
        this.currentState = currentState;
        this.requestedState = requestedState;
        this.validTransitions = validTransitions.clone();
    }

    public String getItemId() {
        return itemId;
    }

    public QueueItemStatus getCurrentState() {
        return currentState;
    }

    public QueueItemStatus getRequestedState() {
        return requestedState;
    }

    public QueueItemStatus[] getValidTransitions() {
        return validTransitions.clone();
    }

    private static String format(QueueItemStatus[] transitions) {
        return Arrays.stream(transitions)
                .map(Enum::name)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
