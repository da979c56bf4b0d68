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

import io.vertx.core.buffer.Buffer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One unit of bytes handed to an {@link UploadTransport}: a whole file, a chunk or a stream
 * segment, plus everything the receiver needs to place it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class UploadPayload {

    private final String itemId;
    private final String sessionId;
    private final String fileName;
    private final String mimeType;
    private final PayloadKind kind;
    private final long offset;
    private final long totalBytes;
    private final Buffer data;
    private final Integer chunkIndex;
    private final Integer totalChunks;
    private final String checksum;
    private final String batchKey;
    private final boolean lastSegment;
    private final Map<String, Object> metadata;

    private UploadPayload(Builder builder) {
        this.itemId = Objects.requireNonNull(builder.itemId, "Item id cannot be null");
        this.sessionId = builder.sessionId;
        this.fileName = builder.fileName;
        this.mimeType = builder.mimeType;
        this.kind = Objects.requireNonNull(builder.kind, "Payload kind cannot be null");
        this.offset = builder.offset;
        this.totalBytes = builder.totalBytes;
        this.data = builder.data != null ? builder.data : Buffer.buffer();
        this.chunkIndex = builder.chunkIndex;
        this.totalChunks = builder.totalChunks;
        this.checksum = builder.checksum;
        this.batchKey = builder.batchKey;
        this.lastSegment = builder.lastSegment;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getItemId() { return itemId; }

    public String getSessionId() { return sessionId; }

    public String getFileName() { return fileName; }

    public String getMimeType() { return mimeType; }

    public PayloadKind getKind() { return kind; }

    /**
     * Position of {@link #getData()} within the file.
     */
    public long getOffset() { return offset; }

    /**
     * Size of the whole file, not of this payload.
     */
    public long getTotalBytes() { return totalBytes; }

    public Buffer getData() { return data; }

    public int length() { return data.length(); }

    public Integer getChunkIndex() { return chunkIndex; }

    public Integer getTotalChunks() { return totalChunks; }

    /**
     * SHA-256 hex of {@link #getData()}, or null when checksum validation is off.
     */
    public String getChecksum() { return checksum; }

    public String getBatchKey() { return batchKey; }

    public boolean isLastSegment() { return lastSegment; }

    public Map<String, Object> getMetadata() { return metadata; }

    @Override
    public String toString() {
        return "UploadPayload{" + kind + " item=" + itemId +
                (chunkIndex != null ? " chunk=" + chunkIndex + "/" + totalChunks : "") +
                " offset=" + offset + " length=" + data.length() + '}';
    }

    public static final class Builder {
        private String itemId;
        private String sessionId;
        private String fileName;
        private String mimeType;
        private PayloadKind kind;
        private long offset;
        private long totalBytes;
        private Buffer data;
        private Integer chunkIndex;
        private Integer totalChunks;
        private String checksum;
        private String batchKey;
        private boolean lastSegment = true;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder itemId(String itemId) {
            this.itemId = itemId;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        public Builder mimeType(String mimeType) {
            this.mimeType = mimeType;
            return this;
        }

        public Builder kind(PayloadKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder offset(long offset) {
            this.offset = offset;
            return this;
        }

        public Builder totalBytes(long totalBytes) {
            this.totalBytes = totalBytes;
            return this;
        }

        public Builder data(Buffer data) {
            this.data = data;
            return this;
        }

        public Builder chunk(int index, int totalChunks) {
            this.chunkIndex = index;
            this.totalChunks = totalChunks;
            return this;
        }

        public Builder checksum(String checksum) {
            this.checksum = checksum;
            return this;
        }

        public Builder batchKey(String batchKey) {
            this.batchKey = batchKey;
            return this;
        }

        public Builder lastSegment(boolean lastSegment) {
            this.lastSegment = lastSegment;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public UploadPayload build() {
            return new UploadPayload(this);
        }
    }
}
