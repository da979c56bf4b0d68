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

import dev.mars.conveyor.config.UploadQueueConfig;
import dev.mars.conveyor.core.FileSource;

import java.util.Objects;

/**
 * Picks the strategy for files enqueued without one.
 *
 * <p>Files strictly larger than the configured chunked threshold are chunked with checksum
 * validation and resume enabled; everything else goes up in a single call.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class StrategySelector {

    static final int DEFAULT_PARALLEL_CHUNKS = 3;

    private final UploadQueueConfig config;

    public StrategySelector(UploadQueueConfig config) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
    }

    public UploadStrategy select(FileSource file) {
        if (file.getSize() > config.getChunkedThreshold()) {
            return chunked();
        }
        return new SingleStrategy();
    }

    /**
     * The default chunked strategy for this configuration.
     */
    public ChunkedStrategy chunked() {
        return new ChunkedStrategy(config.getChunkSize(), DEFAULT_PARALLEL_CHUNKS, true, true,
                Math.max(1, config.getMaxRetries()), config.getRetryDelayMs());
    }
}
