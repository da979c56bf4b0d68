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

package dev.mars.conveyor.core;

import dev.mars.conveyor.core.exceptions.InvalidTransitionException;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a {@link QueueItem}.
 *
 * <h3>State Transition Flow:</h3>
 * <pre>
 * QUEUED → UPLOADING → {COMPLETED | FAILED | PAUSED}
 *             ↓             ↑          ↓
 *         PROCESSING ───────┘       QUEUED (resume)
 *
 * FAILED → QUEUED (automatic or manual retry)
 * any non-terminal → CANCELLED
 * </pre>
 *
 * <p>{@link #PROCESSING} covers the window in which every byte has been acknowledged but the
 * receiver has not yet confirmed the upload, for example while a chunked upload is being
 * finalized. {@link #FAILED} is terminal only once no automatic retry is pending; it can
 * always be retried manually or cancelled.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum QueueItemStatus {
    QUEUED,
    UPLOADING,
    PROCESSING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    /**
     * Whether no control operation can move the item any further.
     * FAILED is excluded because a failed item can be retried.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /**
     * Whether the item currently holds a transfer slot.
     */
    public boolean isActive() {
        return this == UPLOADING || this == PROCESSING;
    }

    /**
     * Whether an explicit cancel is accepted from this state.
     */
    public boolean isCancellable() {
        return !isTerminal();
    }

    /**
     * The set of states reachable from this one.
     */
    public Set<QueueItemStatus> getValidTransitions() {
        switch (this) {
            case QUEUED:
                return EnumSet.of(UPLOADING, CANCELLED);
            case UPLOADING:
                return EnumSet.of(PROCESSING, COMPLETED, FAILED, PAUSED, CANCELLED);
            case PROCESSING:
                return EnumSet.of(COMPLETED, FAILED, CANCELLED);
            case PAUSED:
                return EnumSet.of(QUEUED, CANCELLED);
            case FAILED:
                return EnumSet.of(QUEUED, CANCELLED);
            case COMPLETED:
            case CANCELLED:
            default:
                return EnumSet.noneOf(QueueItemStatus.class);
        }
    }

    public boolean canTransitionTo(QueueItemStatus target) {
        return target != null && getValidTransitions().contains(target);
    }

    /**
     * Check a transition and fail with full context when it is not allowed.
     *
     * @param itemId the item the transition applies to, used in the error message
     * @param target the requested state
     * @throws InvalidTransitionException if {@code target} is not reachable from this state
     */
    public void validateTransition(String itemId, QueueItemStatus target) throws InvalidTransitionException {
        if (!canTransitionTo(target)) {
            throw new InvalidTransitionException(itemId, this, target,
                    getValidTransitions().toArray(new QueueItemStatus[0]));
        }
    }
}
