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

package dev.mars.conveyor.queue;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.conveyor.core.QueueItem;
import dev.mars.conveyor.core.QueueItemStatus;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate view of the queue, derived from the items each time it is requested.
 *
 * <ul>
 *   <li>{@code overallProgress}: uploaded bytes over total bytes, in percent; 0 for an empty queue</li>
 *   <li>{@code averageSpeed}: mean speed of the items holding a transfer slot</li>
 *   <li>{@code estimatedTimeRemainingMs}: bytes left on unfinished items over the average speed; 0
 *       when nothing is moving</li>
 *   <li>{@code successRate} / {@code errorRate}: completed and failed items over all items</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class QueueStatistics {

    private final Map<QueueItemStatus, Integer> counts;
    private final int totalItems;
    private final long totalSize;
    private final long totalUploaded;
    private final double overallProgress;
    private final double averageSpeed;
    private final long estimatedTimeRemainingMs;
    private final double successRate;
    private final double errorRate;

    private QueueStatistics(Map<QueueItemStatus, Integer> counts, int totalItems, long totalSize, long totalUploaded,
                            double overallProgress, double averageSpeed, long estimatedTimeRemainingMs,
                            double successRate, double errorRate) {
        this.counts = Collections.unmodifiableMap(counts);
        this.totalItems = totalItems;
        this.totalSize = totalSize;
        this.totalUploaded = totalUploaded;
        this.overallProgress = overallProgress;
        this.averageSpeed = averageSpeed;
        this.estimatedTimeRemainingMs = estimatedTimeRemainingMs;
        this.successRate = successRate;
        this.errorRate = errorRate;
    }

    public static QueueStatistics from(Collection<QueueItem> items) {
        Map<QueueItemStatus, Integer> counts = new EnumMap<>(QueueItemStatus.class);
        for (QueueItemStatus status : QueueItemStatus.values()) {
            counts.put(status, 0);
        }

        long totalSize = 0;
        long totalUploaded = 0;
        long remaining = 0;
        double activeSpeed = 0;
        int activeCount = 0;

        for (QueueItem item : items) {
            counts.merge(item.getStatus(), 1, Integer::sum);
            totalSize += item.getTotalBytes();
            totalUploaded += item.getUploadedBytes();
            if (item.getStatus().isActive()) {
                activeSpeed += item.getSpeed();
                activeCount++;
            }
            if (item.getStatus() != QueueItemStatus.COMPLETED && item.getStatus() != QueueItemStatus.CANCELLED) {
                remaining += item.getTotalBytes() - item.getUploadedBytes();
            }
        }

        int total = items.size();
        double overallProgress = totalSize == 0 ? 0 : totalUploaded * 100.0 / totalSize;
        double averageSpeed = activeCount == 0 ? 0 : activeSpeed / activeCount;
        long eta = averageSpeed > 0 ? (long) (remaining / averageSpeed * 1000) : 0;
        double successRate = total == 0 ? 0 : (double) counts.get(QueueItemStatus.COMPLETED) / total;
        double errorRate = total == 0 ? 0 : (double) counts.get(QueueItemStatus.FAILED) / total;

        return new QueueStatistics(counts, total, totalSize, totalUploaded, overallProgress, averageSpeed, eta,
                successRate, errorRate);
    }

    @JsonIgnore
    public int count(QueueItemStatus status) {
        return counts.getOrDefault(status, 0);
    }

    @JsonProperty("counts")
    public Map<QueueItemStatus, Integer> getCounts() {
        return counts;
    }

    @JsonProperty("totalItems")
    public int getTotalItems() {
        return totalItems;
    }

    @JsonProperty("queued")
    public int getQueued() {
        return count(QueueItemStatus.QUEUED);
    }

    @JsonProperty("uploading")
    public int getUploading() {
        return count(QueueItemStatus.UPLOADING);
    }

    @JsonProperty("processing")
    public int getProcessing() {
        return count(QueueItemStatus.PROCESSING);
    }

    @JsonProperty("paused")
    public int getPaused() {
        return count(QueueItemStatus.PAUSED);
    }

    @JsonProperty("completed")
    public int getCompleted() {
        return count(QueueItemStatus.COMPLETED);
    }

    @JsonProperty("failed")
    public int getFailed() {
        return count(QueueItemStatus.FAILED);
    }

    @JsonProperty("cancelled")
    public int getCancelled() {
        return count(QueueItemStatus.CANCELLED);
    }

    @JsonProperty("totalSize")
    public long getTotalSize() {
        return totalSize;
    }

    @JsonProperty("totalUploaded")
    public long getTotalUploaded() {
        return totalUploaded;
    }

    @JsonProperty("overallProgress")
    public double getOverallProgress() {
        return overallProgress;
    }

    @JsonProperty("averageSpeed")
    public double getAverageSpeed() {
        return averageSpeed;
    }

    @JsonProperty("estimatedTimeRemainingMs")
    public long getEstimatedTimeRemainingMs() {
        return estimatedTimeRemainingMs;
    }

    @JsonProperty("successRate")
    public double getSuccessRate() {
        return successRate;
    }

    @JsonProperty("errorRate")
    public double getErrorRate() {
        return errorRate;
    }

    @Override
    public String toString() {
        return String.format("QueueStatistics{total=%d, queued=%d, active=%d, completed=%d, failed=%d, progress=%.1f%%}",
                totalItems, getQueued(), getUploading() + getProcessing(), getCompleted(), getFailed(), overallProgress);
    }
}
