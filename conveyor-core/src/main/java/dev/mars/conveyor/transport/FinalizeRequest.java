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

package dev.mars.conveyor.transport;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Asks the receiver to assemble a chunked upload once every chunk is acknowledged.
 *
 * @param itemId         the queue item
 * @param sessionId      the owning session
 * @param fileName       original file name
 * @param totalBytes     size of the assembled file
 * @param totalChunks    number of chunks sent
 * @param chunkChecksums SHA-256 per chunk in index order, entries are null without checksum validation
 * @param metadata       item metadata
 */
public record FinalizeRequest(@JsonProperty("itemId") String itemId,
                              @JsonProperty("sessionId") String sessionId,
                              @JsonProperty("fileName") String fileName,
                              @JsonProperty("totalBytes") long totalBytes,
                              @JsonProperty("totalChunks") int totalChunks,
                              @JsonProperty("chunkChecksums") List<String> chunkChecksums,
                              @JsonProperty("metadata") Map<String, Object> metadata) {
}
