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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PathFileSource} against real files.
 */
@DisplayName("PathFileSource Tests")
class PathFileSourceTest {

    @TempDir
    Path dir;

    private Path write(String name, byte[] content) throws IOException {
        return Files.write(dir.resolve(name), content);
    }

    private static byte[] sequence(int size) {
        byte[] data = new byte[size];
        for (int i = 0; i < size; i++) {
            data[i] = (byte) i;
        }
        return data;
    }

    @Test
    @DisplayName("Should describe the file it wraps")
    void testDescribe() throws Exception {
        Path path = write("photo.raw", sequence(300));

        PathFileSource source = new PathFileSource(path);

        assertThat(source.getName()).isEqualTo("photo.raw");
        assertThat(source.getSize()).isEqualTo(300);
        assertThat(source.getPath()).isEqualTo(path);
        assertThat(source.getMimeType()).isNotBlank();
    }

    @Test
    @DisplayName("Should fall back to a generic type when none can be detected")
    void testMimeTypeFallback() throws Exception {
        PathFileSource source = new PathFileSource(write("blob", new byte[4]));

        assertThat(source.getMimeType()).isEqualTo(PathFileSource.DEFAULT_MIME_TYPE);
    }

    @Test
    @DisplayName("Should read exactly the requested range")
    void testReadRange() throws Exception {
        byte[] content = sequence(200_000);
        PathFileSource source = new PathFileSource(write("range.bin", content));

        assertThat(source.read(0, 10)).isEqualTo(Arrays.copyOfRange(content, 0, 10));
        assertThat(source.read(65_530, 70_000)).isEqualTo(Arrays.copyOfRange(content, 65_530, 135_530));
        assertThat(source.read(199_990, 10)).isEqualTo(Arrays.copyOfRange(content, 199_990, 200_000));
        assertThat(source.read(0, 200_000)).isEqualTo(content);
        assertThat(source.read(200_000, 0)).isEmpty();
    }

    @Test
    @DisplayName("Should reject ranges outside the file")
    void testRangeOutsideFile() throws Exception {
        PathFileSource source = new PathFileSource(write("small.bin", sequence(100)));

        assertThatThrownBy(() -> source.read(-1, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> source.read(0, -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> source.read(95, 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("small.bin");
    }

    @Test
    @DisplayName("Should fail when the file shrinks under a read")
    void testTruncatedFile() throws Exception {
        Path path = write("shrinking.bin", sequence(100));
        PathFileSource source = new PathFileSource(path);
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE)) {
            channel.truncate(10);
        }

        assertThatThrownBy(() -> source.read(0, 50))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Unexpected end");
    }

    @Test
    @DisplayName("Should refuse a missing file")
    void testMissingFile() {
        assertThatThrownBy(() -> new PathFileSource(dir.resolve("absent.bin")))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("absent.bin");
    }
}
