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

package dev.mars.conveyor.transport;

import dev.mars.conveyor.core.UploadResponse;
import dev.mars.conveyor.transfer.CancellationToken;
import io.vertx.core.Future;

/**
 * Moves bytes to the receiving side.
 *
 * <p>The scheduler never assumes a wire protocol; it only needs these two calls. Implementations
 * must not block the calling thread, must report progress as cumulative bytes of the payload,
 * and should abort the call and fail the returned future once {@code token} fires. Failures are
 * classified by {@link dev.mars.conveyor.transfer.ErrorClassifier}, so an implementation should
 * surface receiver statuses through {@link dev.mars.conveyor.core.exceptions.UploadException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface UploadTransport {

    /**
     * Send one payload.
     *
     * @param payload  the bytes and their placement
     * @param progress receives cumulative bytes sent for this payload
     * @param token    fires when the transfer is paused, cancelled or timed out
     * @return the receiver's acknowledgement
     */
    Future<UploadResponse> upload(UploadPayload payload, ProgressListener progress, CancellationToken token);

    /**
     * Ask the receiver to assemble a chunked upload.
     */
    Future<UploadResponse> finalizeUpload(FinalizeRequest request, CancellationToken token);

    /**
     * Release connections and other resources. The default does nothing.
     */
    default void close() {
    }
}
