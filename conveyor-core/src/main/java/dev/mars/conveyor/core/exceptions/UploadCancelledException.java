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

import dev.mars.conveyor.transfer.CancellationToken.Reason;

/**
 * Raised inside a transfer once its cancellation token has fired. The scheduler has already
 * moved the item on by then, so this failure is discarded rather than classified.
 */
public class UploadCancelledException extends UploadException {

    private final Reason reason;

    public UploadCancelledException(String itemId, Reason reason) {
        super(itemId, "transfer aborted (" + reason + ")");
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
