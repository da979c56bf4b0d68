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

package dev.mars.conveyor.core.exceptions;

/**
 * The receiver acknowledged a chunk under a different SHA-256 than the one computed locally.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ChecksumMismatchException extends UploadValidationException {

    private final int chunkIndex;
    private final String expectedChecksum;
    private final String actualChecksum;

    public ChecksumMismatchException(String itemId, int chunkIndex, String expectedChecksum, String actualChecksum) {
        super(itemId, String.format("Checksum mismatch on chunk %d - expected: %s, actual: %s",
                chunkIndex, expectedChecksum, actualChecksum));
        this.chunkIndex = chunkIndex;
        this.expectedChecksum = expectedChecksum;
        this.actualChecksum = actualChecksum;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }

    public String getExpectedChecksum() {
        return expectedChecksum;
    }

    public String getActualChecksum() {
        return actualChecksum;
    }
}
