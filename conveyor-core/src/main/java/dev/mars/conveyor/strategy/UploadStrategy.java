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
 * How a queue item's bytes are moved to the receiver.
 *
 * <p>The set of strategies is closed; each variant carries only the parameters its executor
 * reads:</p>
 * <ul>
 *   <li>{@link SingleStrategy} - one transport call for the whole file</li>
 *   <li>{@link ChunkedStrategy} - fixed-size checksummed ranges, then a finalize call</li>
 *   <li>{@link StreamingStrategy} - sequential buffer-sized segments</li>
 *   <li>{@link BatchStrategy} - one call tagged so the receiver can group files</li>
 * </ul>
 *
 * <pre>{@code
 * String describe(UploadStrategy strategy) {
 *     if (strategy instanceof ChunkedStrategy chunked) {
 *         return "chunks of " + chunked.chunkSize();
 *     }
 *     return strategy.type().name();
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public sealed interface UploadStrategy
        permits SingleStrategy, ChunkedStrategy, StreamingStrategy, BatchStrategy {

    StrategyType type();
}
