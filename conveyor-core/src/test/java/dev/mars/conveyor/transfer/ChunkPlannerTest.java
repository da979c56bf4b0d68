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

import dev.mars.conveyor.core.ChunkStatus;
import dev.mars.conveyor.core.UploadChunk;
import dev.mars.conveyor.core.exceptions.UploadValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ChunkPlanner Tests")
class ChunkPlannerTest {

    private static final long MB = 1024 * 1024;

    @Test
    @DisplayName("Should plan contiguous chunks with a short last chunk")
    void testPlan() {
        List<UploadChunk> chunks = ChunkPlanner.plan(25 * MB, 10 * MB);

        assertThat(chunks).hasSize(3);
        assertThat(chunks).extracting(UploadChunk::getStart).containsExactly(0L, 10 * MB, 20 * MB);
        assertThat(chunks).extracting(UploadChunk::getSize).containsExactly(10 * MB, 10 * MB, 5 * MB);
        assertThat(chunks).allMatch(c -> c.getStatus() == ChunkStatus.PENDING);
        assertThat(chunks.get(2).getEnd()).isEqualTo(25 * MB);
    }

    @Test
    @DisplayName("Should plan exact multiples without a remainder chunk")
    void testExactMultiple() {
        assertThat(ChunkPlanner.plan(4 * MB, MB)).hasSize(4);
        assertThat(ChunkPlanner.chunkCount(4 * MB, MB)).isEqualTo(4);
        assertThat(ChunkPlanner.chunkCount(4 * MB + 1, MB)).isEqualTo(5);
    }

    @Test
    @DisplayName("An empty file has no chunks")
    void testEmpty() {
        assertThat(ChunkPlanner.plan(0, MB)).isEmpty();
    }

    @Test
    @DisplayName("Should reject a non-positive chunk size or negative file size")
    void testInvalidInput() {
        assertThatThrownBy(() -> ChunkPlanner.plan(MB, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ChunkPlanner.plan(-1, MB)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should accept its own plans and reject gaps")
    void testValidate() {
        assertThatCode(() -> ChunkPlanner.validate("i", ChunkPlanner.plan(3 * MB, MB), 3 * MB))
                .doesNotThrowAnyException();

        List<UploadChunk> gap = List.of(new UploadChunk(0, 0, MB), new UploadChunk(1, 2 * MB, 3 * MB));
        assertThatThrownBy(() -> ChunkPlanner.validate("i", gap, 3 * MB))
                .isInstanceOf(UploadValidationException.class)
                .hasMessageContaining("starts at");

        assertThatThrownBy(() -> ChunkPlanner.validate("i", ChunkPlanner.plan(2 * MB, MB), 3 * MB))
                .isInstanceOf(UploadValidationException.class);
    }

    @Test
    @DisplayName("Should reject a chunk too large to read in one range")
    void testValidateOversizedChunk() {
        long size = Integer.MAX_VALUE + 2L;
        List<UploadChunk> oversized = List.of(new UploadChunk(0, 0, size));

        assertThatThrownBy(() -> ChunkPlanner.validate("i", oversized, size))
                .isInstanceOf(UploadValidationException.class)
                .hasMessageContaining("exceeds");
    }
}
