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

import java.util.Locale;

/**
 * Classified category of an upload failure.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum ErrorType {

    /** Connectivity to the receiver was lost or never established. */
    NETWORK,

    /** The receiver reported an internal fault (5xx). */
    SERVER,

    /** The receiver rejected the request (4xx) or the failure is unrecognised. */
    CLIENT,

    /** A local precondition failed, such as a malformed chunk plan. Never retried. */
    VALIDATION,

    /** No progress was made within the configured bound. */
    TIMEOUT;

    /**
     * Whether failures of this category are worth retrying regardless of status code.
     */
    public boolean isTransient() {
        return this == NETWORK || this == SERVER || this == TIMEOUT;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
