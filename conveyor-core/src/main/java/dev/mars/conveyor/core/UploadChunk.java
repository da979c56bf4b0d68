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

import java.time.Instant;

/**
 * One contiguous byte range {@code [start, end)} of a chunked upload.
 *
 * <p>Chunks are mutable but owned by the scheduler; callers only ever see copies.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class UploadChunk {

    private final int index;
    private final long start;
    private final long end;
    private ChunkStatus status;
    private int retryCount;
    private String checksum;
    private Instant uploadedAt;

    public UploadChunk(int index, long start, long end) {
        if (index < 0) {
            throw new IllegalArgumentException("Chunk index must be >= 0, got: " + index);
        }
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid chunk range [" + start + ", " + end + ")");
        }
        this.index = index;
        this.start = start;
        this.end = end;
        this.status = ChunkStatus.PENDING;
    }

    public int getIndex() {
        return index;
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    public long getSize() {
        return end - start;
    }

    public ChunkStatus getStatus() {
        return status;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public String getChecksum() {
        return checksum;
    }

    public Instant getUploadedAt() {
        return uploadedAt;
    }

    public boolean isCompleted() {
        return status == ChunkStatus.COMPLETED;
    }

    public void markUploading() {
        this.status = ChunkStatus.UPLOADING;
    }

    public void markCompleted(String checksum, Instant uploadedAt) {
        this.status = ChunkStatus.COMPLETED;
        if (checksum != null) {
            this.checksum = checksum;
        }
        this.uploadedAt = uploadedAt;
    }

    public void markFailed(int retryCount) {
        this.status = ChunkStatus.FAILED;
        this.retryCount = retryCount;
    }

    /**
     * Back to PENDING, forgetting any earlier acknowledgement.
     */
    public void reset() {
        this.status = ChunkStatus.PENDING;
        this.retryCount = 0;
        this.checksum = null;
        this.uploadedAt = null;
    }

    public UploadChunk copy() {
        UploadChunk copy = new UploadChunk(index, start, end);
        copy.status = status;
        copy.retryCount = retryCount;
        copy.checksum = checksum;
        copy.uploadedAt = uploadedAt;
        return copy;
    }

    @Override
    public String toString() {
        return "UploadChunk{" + index + " [" + start + ", " + end + ") " + status +
                (retryCount > 0 ? ", retries=" + retryCount : "") + '}';
    }
}
