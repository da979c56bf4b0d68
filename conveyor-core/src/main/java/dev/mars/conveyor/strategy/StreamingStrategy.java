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
 * Send the file as consecutive segments of {@code bufferSize} bytes.
 *
 * @param bufferSize bytes per segment
 * @param resumable  restart from the last acknowledged offset instead of byte zero
 */
public record StreamingStrategy(int bufferSize, boolean resumable) implements UploadStrategy {

    public static final int DEFAULT_BUFFER_SIZE = 64 * 1024;

    public StreamingStrategy {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be > 0, got: " + bufferSize);
        }
    }

    public StreamingStrategy() {
        this(DEFAULT_BUFFER_SIZE, true);
    }

    @Override
    public StrategyType type() {
        return StrategyType.STREAMING;
    }
}
