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

import java.io.IOException;

/**
 * The bytes behind a queue item.
 *
 * <p>Reads may block and are always issued off the event loop.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface FileSource {

    String getName();

    /**
     * @return size in bytes, fixed for the lifetime of the source
     */
    long getSize();

    String getMimeType();

    /**
     * Read {@code length} bytes starting at {@code offset}.
     *
     * @throws IOException if the bytes cannot be read
     * @throws IllegalArgumentException if the range falls outside {@code [0, size)}
     */
    byte[] read(long offset, int length) throws IOException;
}
