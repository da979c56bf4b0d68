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

import java.time.Duration;

/**
 * An admitted upload made no progress within the configured bound.
 */
public class UploadTimeoutException extends UploadException {

    private final Duration idle;

    public UploadTimeoutException(String itemId, Duration idle) {
        super(itemId, "no progress for " + idle.toMillis() + " ms", null, TIMEOUT);
        this.idle = idle;
    }

    public Duration getIdle() {
        return idle;
    }
}
