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
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * {@link FileSource} backed by a file on the local file system.
 */
public class PathFileSource implements FileSource {

    static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    private final Path path;
    private final long size;
    private final String mimeType;

    /**
     * @throws UncheckedIOException if the file size cannot be read
     */
    public PathFileSource(Path path) {
        this.path = Objects.requireNonNull(path, "Path cannot be null");
        try {
            this.size = Files.size(path);
            String detected = Files.probeContentType(path);
            this.mimeType = detected != null ? detected : DEFAULT_MIME_TYPE;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot stat " + path, e);
        }
    }

    public Path getPath() {
        return path;
    }

    @Override
    public String getName() {
        return path.getFileName().toString();
    }

    @Override
    public long getSize() {
        return size;
    }

    @Override
    public String getMimeType() {
        return mimeType;
    }

    @Override
    public byte[] read(long offset, int length) throws IOException {
        if (offset < 0 || length < 0 || offset + length > size) {
            throw new IllegalArgumentException("Range [" + offset + ", " + (offset + length)
                    + ") outside " + getName() + " of size " + size);
        }
        ByteBuffer buffer = ByteBuffer.allocate(length);
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, offset + buffer.position());
                if (read < 0) {
                    throw new IOException("Unexpected end of " + path + " at " + (offset + buffer.position()));
                }
            }
        }
        return buffer.array();
    }

    @Override
    public String toString() {
        return "PathFileSource{" + path + ", " + size + " bytes}";
    }
}
