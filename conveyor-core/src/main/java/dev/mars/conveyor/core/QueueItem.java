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

import dev.mars.conveyor.strategy.StrategyType;
import dev.mars.conveyor.strategy.UploadStrategy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Mutable runtime state of one file in the upload queue.
 *
 * <p>A queue item tracks where a single file is in its lifecycle: its {@link QueueItemStatus},
 * the bytes acknowledged so far, the derived speed and time remaining, the chunk plan when the
 * {@link StrategyType#CHUNKED chunked} strategy is used, and the append-only log of every
 * {@link QueueError} it has hit.</p>
 *
 * <h3>Ownership:</h3>
 * <p>Instances are owned by the upload queue manager and are only mutated while its lock is
 * held. Every instance handed to callers is a {@link #copy()}, so this class does no locking of
 * its own.</p>
 *
 * <h3>Transitions:</h3>
 * <p>The lifecycle methods ({@link #start(Instant)}, {@link #pause(Instant)}, {@link #fail(QueueError)}
 * and so on) return {@code false} instead of throwing when the move is not legal from the current
 * status, mirroring {@link QueueItemStatus#canTransitionTo(QueueItemStatus)}.</p>
 *
 * <h3>Progress:</h3>
 * <p>{@code progress} stays strictly below 100 until the item is {@link QueueItemStatus#COMPLETED},
 * and {@code uploadedBytes} never exceeds {@code totalBytes}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @see QueueItemStatus
 * @see UploadChunk
 */
public class QueueItem {

    /**
     * Highest progress an item reports before it is completed.
     */
    public static final double MAX_IN_FLIGHT_PROGRESS = 99.9;

    public static final String META_FILENAME = "filename";
    public static final String META_MIME_TYPE = "mimeType";
    public static final String META_ADDED_AT = "addedAt";

    private final String id;
    private final String sessionId;
    private final FileSource source;
    private final UploadStrategy strategy;
    private final long sequence;
    private final long totalBytes;
    private final Instant addedAt;
    private final Map<String, Object> metadata;
    private final List<QueueError> errors;
    private final List<UploadChunk> chunks;

    private UploadPriority priority;
    private QueueItemStatus status;
    private double progress;
    private long uploadedBytes;
    private double speed;
    private long timeRemainingMs;
    private int retryCount;
    private Instant startedAt;
    private Instant pausedAt;
    private Instant completedAt;
    private Instant lastProgressAt;
    private UploadResponse response;

    private QueueItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.sessionId = Objects.requireNonNull(builder.sessionId, "Session id cannot be null");
        this.source = Objects.requireNonNull(builder.source, "File source cannot be null");
        this.strategy = Objects.requireNonNull(builder.strategy, "Strategy cannot be null");
        this.priority = builder.priority != null ? builder.priority : UploadPriority.NORMAL;
        this.sequence = builder.sequence;
        this.totalBytes = source.getSize();
        this.addedAt = builder.addedAt != null ? builder.addedAt : Instant.now();
        this.metadata = new LinkedHashMap<>();
        this.metadata.put(META_FILENAME, source.getName());
        this.metadata.put(META_MIME_TYPE, source.getMimeType());
        this.metadata.put(META_ADDED_AT, addedAt.toString());
        this.metadata.putAll(builder.metadata);
        this.errors = new ArrayList<>();
        this.chunks = new ArrayList<>();
        this.status = QueueItemStatus.QUEUED;
        this.timeRemainingMs = -1;
    }

    private QueueItem(QueueItem other) {
        this.id = other.id;
        this.sessionId = other.sessionId;
        this.source = other.source;
        this.strategy = other.strategy;
        this.sequence = other.sequence;
        this.totalBytes = other.totalBytes;
        this.addedAt = other.addedAt;
        this.metadata = new LinkedHashMap<>(other.metadata);
        this.errors = new ArrayList<>(other.errors);
        this.chunks = new ArrayList<>(other.chunks.size());
        for (UploadChunk chunk : other.chunks) {
            this.chunks.add(chunk.copy());
        }
        this.priority = other.priority;
        this.status = other.status;
        this.progress = other.progress;
        this.uploadedBytes = other.uploadedBytes;
        this.speed = other.speed;
        this.timeRemainingMs = other.timeRemainingMs;
        this.retryCount = other.retryCount;
        this.startedAt = other.startedAt;
        this.pausedAt = other.pausedAt;
        this.completedAt = other.completedAt;
        this.lastProgressAt = other.lastProgressAt;
        this.response = other.response;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Deep copy: chunks are copied, errors are immutable and shared.
     */
    public QueueItem copy() {
        return new QueueItem(this);
    }

    // ========== GETTERS ==========

    public String getId() { return id; }

    public String getSessionId() { return sessionId; }

    public FileSource getSource() { return source; }

    public UploadStrategy getStrategy() { return strategy; }

    public UploadPriority getPriority() { return priority; }

    public QueueItemStatus getStatus() { return status; }

    /**
     * Enqueue order, used to keep items of the same tier first-in first-out.
     */
    public long getSequence() { return sequence; }

    public double getProgress() { return progress; }

    public long getUploadedBytes() { return uploadedBytes; }

    public long getTotalBytes() { return totalBytes; }

    /**
     * @return the last derived transfer rate in bytes per second, 0 when idle
     */
    public double getSpeed() { return speed; }

    /**
     * @return estimated milliseconds to completion, or -1 when unknown
     */
    public long getTimeRemainingMs() { return timeRemainingMs; }

    public int getRetryCount() { return retryCount; }

    public List<QueueError> getErrors() { return Collections.unmodifiableList(errors); }

    /**
     * @return the most recent error, or null if the item never failed
     */
    public QueueError getLastError() {
        return errors.isEmpty() ? null : errors.get(errors.size() - 1);
    }

    /**
     * @return the chunk plan, empty unless the strategy is chunked and the item has been admitted
     */
    public List<UploadChunk> getChunks() { return Collections.unmodifiableList(chunks); }

    public Map<String, Object> getMetadata() { return Collections.unmodifiableMap(metadata); }

    public Instant getAddedAt() { return addedAt; }

    public Instant getStartedAt() { return startedAt; }

    public Instant getPausedAt() { return pausedAt; }

    public Instant getCompletedAt() { return completedAt; }

    public Instant getLastProgressAt() { return lastProgressAt; }

    /**
     * @return what the receiver returned on completion, or null
     */
    public UploadResponse getResponse() { return response; }

    // ========== LIFECYCLE ==========

    /**
     * QUEUED to UPLOADING. Stamps the start time and restarts the progress clock.
     */
    public boolean start(Instant now) {
        if (!status.canTransitionTo(QueueItemStatus.UPLOADING)) {
            return false;
        }
        status = QueueItemStatus.UPLOADING;
        startedAt = now;
        lastProgressAt = now;
        speed = 0;
        timeRemainingMs = -1;
        return true;
    }

    /**
     * UPLOADING to PROCESSING, once every byte has been acknowledged.
     */
    public boolean beginProcessing() {
        if (!status.canTransitionTo(QueueItemStatus.PROCESSING)) {
            return false;
        }
        status = QueueItemStatus.PROCESSING;
        speed = 0;
        timeRemainingMs = 0;
        return true;
    }

    public boolean complete(Instant now, UploadResponse response) {
        if (!status.canTransitionTo(QueueItemStatus.COMPLETED)) {
            return false;
        }
        status = QueueItemStatus.COMPLETED;
        progress = 100;
        uploadedBytes = totalBytes;
        speed = 0;
        timeRemainingMs = 0;
        completedAt = now;
        this.response = response;
        return true;
    }

    /**
     * Record the error and move to FAILED. The error is logged even if the transition is refused.
     */
    public boolean fail(QueueError error) {
        errors.add(Objects.requireNonNull(error, "Error cannot be null"));
        if (!status.canTransitionTo(QueueItemStatus.FAILED)) {
            return false;
        }
        status = QueueItemStatus.FAILED;
        speed = 0;
        timeRemainingMs = -1;
        return true;
    }

    public boolean pause(Instant now) {
        if (!status.canTransitionTo(QueueItemStatus.PAUSED)) {
            return false;
        }
        status = QueueItemStatus.PAUSED;
        pausedAt = now;
        speed = 0;
        timeRemainingMs = -1;
        return true;
    }

    /**
     * PAUSED to QUEUED.
     */
    public boolean resume() {
        if (status != QueueItemStatus.PAUSED) {
            return false;
        }
        status = QueueItemStatus.QUEUED;
        pausedAt = null;
        return true;
    }

    /**
     * FAILED to QUEUED with the given retry count.
     */
    public boolean requeue(int retryCount) {
        if (status != QueueItemStatus.FAILED) {
            return false;
        }
        status = QueueItemStatus.QUEUED;
        this.retryCount = retryCount;
        return true;
    }

    public boolean cancel() {
        if (!status.isCancellable()) {
            return false;
        }
        status = QueueItemStatus.CANCELLED;
        speed = 0;
        timeRemainingMs = -1;
        return true;
    }

    // ========== PROGRESS ==========

    /**
     * Apply a progress report. Reports that would move {@code uploadedBytes} backwards are ignored.
     *
     * @param uploaded        cumulative bytes acknowledged
     * @param speed           derived bytes per second
     * @param timeRemainingMs derived estimate, -1 when unknown
     * @param now             when the report arrived
     * @return true if the report was applied
     */
    public boolean recordProgress(long uploaded, double speed, long timeRemainingMs, Instant now) {
        long bounded = Math.min(Math.max(uploaded, 0), totalBytes);
        if (bounded < uploadedBytes) {
            return false;
        }
        this.uploadedBytes = bounded;
        this.progress = totalBytes == 0 ? 0 : Math.min(bounded * 100.0 / totalBytes, MAX_IN_FLIGHT_PROGRESS);
        this.speed = speed;
        this.timeRemainingMs = timeRemainingMs;
        this.lastProgressAt = now;
        return true;
    }

    /**
     * Note that the transfer is alive without moving {@code uploadedBytes}.
     */
    public void touch(Instant now) {
        this.lastProgressAt = now;
    }

    /**
     * Forget all transfer progress, including acknowledged chunks.
     */
    public void resetProgress() {
        uploadedBytes = 0;
        progress = 0;
        speed = 0;
        timeRemainingMs = -1;
        chunks.forEach(UploadChunk::reset);
    }

    /**
     * Move acknowledged progress back to {@code bytes}, for resuming at a known-good offset.
     */
    public void rewindProgress(long bytes) {
        uploadedBytes = Math.min(Math.max(bytes, 0), totalBytes);
        progress = totalBytes == 0 ? 0 : Math.min(uploadedBytes * 100.0 / totalBytes, MAX_IN_FLIGHT_PROGRESS);
        speed = 0;
        timeRemainingMs = -1;
    }

    public void setPriority(UploadPriority priority) {
        this.priority = Objects.requireNonNull(priority, "Priority cannot be null");
    }

    public void replaceChunks(List<UploadChunk> plan) {
        chunks.clear();
        chunks.addAll(plan);
    }

    /**
     * @return the live chunk at {@code index}, or null if there is none
     */
    public UploadChunk chunk(int index) {
        return index >= 0 && index < chunks.size() ? chunks.get(index) : null;
    }

    /**
     * Sum of the sizes of the chunks acknowledged so far.
     */
    public long completedChunkBytes() {
        long total = 0;
        for (UploadChunk chunk : chunks) {
            if (chunk.isCompleted()) {
                total += chunk.getSize();
            }
        }
        return total;
    }

    @Override
    public String toString() {
        return "QueueItem{" +
                "id='" + id + '\'' +
                ", file='" + source.getName() + '\'' +
                ", status=" + status +
                ", priority=" + priority +
                ", progress=" + String.format("%.1f", progress) +
                ", retries=" + retryCount +
                '}';
    }

    public static final class Builder {
        private String id;
        private String sessionId;
        private FileSource source;
        private UploadPriority priority;
        private UploadStrategy strategy;
        private long sequence;
        private Instant addedAt;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder source(FileSource source) {
            this.source = source;
            return this;
        }

        public Builder priority(UploadPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder strategy(UploadStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder addedAt(Instant addedAt) {
            this.addedAt = addedAt;
            return this;
        }

        public Builder metadata(Map<String, ?> metadata) {
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public QueueItem build() {
            return new QueueItem(this);
        }
    }
}
