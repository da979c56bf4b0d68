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

package dev.mars.conveyor.transfer;

import dev.mars.conveyor.core.QueueError;

/**
 * Callbacks from an executor back to the scheduler for one transfer attempt.
 *
 * <p>The scheduler drops callbacks that arrive after the attempt has been superseded, so
 * executors may call these freely.</p>
 */
public interface TransferListener {

    /**
     * @param uploadedBytes cumulative bytes of the file acknowledged so far
     * @param elapsedMs     milliseconds since the attempt started
     */
    void onProgress(long uploadedBytes, long elapsedMs);

    default void onChunkStarted(int index) {
    }

    default void onChunkCompleted(int index, String checksum) {
    }

    /**
     * A chunk attempt failed and will be tried again.
     *
     * @param failedAttempts attempts used on this chunk so far
     */
    default void onChunkRetry(int index, int failedAttempts, QueueError error) {
    }

    /**
     * Every byte is acknowledged and the receiver is finalizing the upload.
     */
    default void onProcessing() {
    }
}
