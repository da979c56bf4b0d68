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

package dev.mars.conveyor.strategy;

/**
 * Upload in fixed-size ranges, each retried on its own, followed by a finalize call.
 *
 * @param chunkSize          bytes per chunk, at most {@link Integer#MAX_VALUE}; the last chunk may be shorter
 * @param parallelChunks     requested concurrent chunks; chunks are currently sent one at a time
 * @param checksumValidation attach a SHA-256 of each chunk to its payload
 * @param resumable          keep acknowledged chunks across pause, resume and automatic retry
 * @param maxRetries         attempts per chunk before the item fails
 * @param retryDelayMs       base backoff between chunk attempts, doubled on each attempt
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public record ChunkedStrategy(long chunkSize,
                              int parallelChunks,
                              boolean checksumValidation,
                              boolean resumable,
                              int maxRetries,
                              long retryDelayMs) implements UploadStrategy {

    public ChunkedStrategy {
        if (chunkSize <= 0 || chunkSize > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("chunkSize must be between 1 and " + Integer.MAX_VALUE
                    + ", got: " + chunkSize);
        }
        if (parallelChunks < 1) {
            throw new IllegalArgumentException("parallelChunks must be >= 1, got: " + parallelChunks);
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1, got: " + maxRetries);
        }
        if (retryDelayMs < 0) {
            throw new IllegalArgumentException("retryDelayMs must be >= 0, got: " + retryDelayMs);
        }
    }

    @Override
    public StrategyType type() {
        return StrategyType.CHUNKED;
    }
}
