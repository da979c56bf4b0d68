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

import dev.mars.conveyor.core.UploadChunk;
import dev.mars.conveyor.core.exceptions.UploadValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a file into contiguous {@link UploadChunk} ranges and checks existing plans.
 */
public final class ChunkPlanner {

    private ChunkPlanner() {
    }

    /**
     * Plan {@code ceil(size / chunkSize)} PENDING chunks covering {@code [0, size)}. Only the last
     * chunk may be shorter than {@code chunkSize}; an empty file has no chunks.
     *
     * @throws IllegalArgumentException if {@code size < 0} or {@code chunkSize <= 0}
     */
    public static List<UploadChunk> plan(long size, long chunkSize) {
        if (size < 0) {
            throw new IllegalArgumentException("File size must be >= 0, got: " + size);
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be > 0, got: " + chunkSize);
        }
        long count = chunkCount(size, chunkSize);
        if (count > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too many chunks (" + count + ") for chunk size " + chunkSize);
        }
        List<UploadChunk> chunks = new ArrayList<>((int) count);
        for (int index = 0; index < count; index++) {
            long start = index * chunkSize;
            chunks.add(new UploadChunk(index, start, Math.min(start + chunkSize, size)));
        }
        return chunks;
    }

    public static long chunkCount(long size, long chunkSize) {
        return (size + chunkSize - 1) / chunkSize;
    }

    /**
     * Check that {@code chunks} are indexed in order, contiguous, non-empty, no larger than
     * {@link Integer#MAX_VALUE} bytes each and cover exactly {@code [0, size)}.
     *
     * @throws UploadValidationException describing the first gap, overlap or bad index
     */
    public static void validate(String itemId, List<UploadChunk> chunks, long size) throws UploadValidationException {
        long expectedStart = 0;
        for (int i = 0; i < chunks.size(); i++) {
            UploadChunk chunk = chunks.get(i);
            if (chunk.getIndex() != i) {
                throw new UploadValidationException(itemId, "Chunk at position " + i + " has index " + chunk.getIndex());
            }
            if (chunk.getStart() != expectedStart) {
                throw new UploadValidationException(itemId, "Chunk " + i + " starts at " + chunk.getStart()
                        + ", expected " + expectedStart);
            }
            if (chunk.getSize() <= 0) {
                throw new UploadValidationException(itemId, "Chunk " + i + " is empty");
            }
            if (chunk.getSize() > Integer.MAX_VALUE) {
                throw new UploadValidationException(itemId, "Chunk " + i + " of " + chunk.getSize()
                        + " bytes exceeds the largest readable range");
            }
            expectedStart = chunk.getEnd();
        }
        if (expectedStart != size) {
            throw new UploadValidationException(itemId, "Chunks cover " + expectedStart + " of " + size + " bytes");
        }
    }
}
