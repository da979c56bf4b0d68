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

import java.util.Arrays;
import java.util.Objects;

/**
 * {@link FileSource} over bytes already held in memory.
 */
public class BufferFileSource implements FileSource {

    private final String name;
    private final String mimeType;
    private final byte[] data;

    public BufferFileSource(String name, String mimeType, byte[] data) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.mimeType = mimeType != null ? mimeType : PathFileSource.DEFAULT_MIME_TYPE;
        this.data = Objects.requireNonNull(data, "Data cannot be null");
    }

    public BufferFileSource(String name, byte[] data) {
        this(name, null, data);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public long getSize() {
        return data.length;
    }

    @Override
    public String getMimeType() {
        return mimeType;
    }

    @Override
    public byte[] read(long offset, int length) {
        if (offset < 0 || length < 0 || offset + length > data.length) {
            throw new IllegalArgumentException("Range [" + offset + ", " + (offset + length)
                    + ") outside " + name + " of size " + data.length);
        }
        return Arrays.copyOfRange(data, (int) offset, (int) offset + length);
    }

    @Override
    public String toString() {
        return "BufferFileSource{" + name + ", " + data.length + " bytes}";
    }
}
