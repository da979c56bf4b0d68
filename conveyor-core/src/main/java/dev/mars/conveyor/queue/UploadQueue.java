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

import dev.mars.conveyor.core.FileSource;
import dev.mars.conveyor.core.QueueItem;
import dev.mars.conveyor.core.UploadPriority;
import dev.mars.conveyor.monitoring.BandwidthMonitor;
import dev.mars.conveyor.monitoring.ResourceUsage;
import dev.mars.conveyor.strategy.UploadStrategy;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Accepts files for upload, schedules them under concurrency limits and exposes their state.
 *
 * <p>Control operations return {@code false} instead of throwing when the item is unknown or its
 * current status does not allow the operation.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface UploadQueue extends AutoCloseable {

    /**
     * Enqueue files.
     *
     * @param files     the files to upload
     * @param sessionId the session the files belong to
     * @param priority  the tier to schedule them in, null for NORMAL
     * @param strategy  how to upload them, null to choose by size
     * @param metadata  extra entries merged into each item's metadata, may be null
     * @return the new item ids in the order of {@code files}
     * @throws IllegalArgumentException if no executor handles the strategy
     * @throws IllegalStateException    if the queue has been shut down
     */
    List<String> addToQueue(List<? extends FileSource> files, String sessionId, UploadPriority priority,
                            UploadStrategy strategy, Map<String, ?> metadata);

    default List<String> addToQueue(List<? extends FileSource> files, String sessionId, UploadPriority priority,
                                    UploadStrategy strategy) {
        return addToQueue(files, sessionId, priority, strategy, null);
    }

    default List<String> addToQueue(List<? extends FileSource> files, String sessionId, UploadPriority priority) {
        return addToQueue(files, sessionId, priority, null, null);
    }

    default List<String> addToQueue(List<? extends FileSource> files, String sessionId) {
        return addToQueue(files, sessionId, UploadPriority.NORMAL, null, null);
    }

    boolean pause(String itemId);

    boolean resume(String itemId);

    boolean cancel(String itemId);

    /**
     * Requeue a failed item with a fresh retry budget.
     */
    boolean retry(String itemId);

    /**
     * Move a queued or paused item to another tier.
     */
    boolean changePriority(String itemId, UploadPriority priority);

    /**
     * Stop admitting work and pause every uploading item.
     *
     * @return the number of items paused
     */
    int pauseAll();

    /**
     * Allow admission again and resume every paused item.
     *
     * @return the number of items resumed
     */
    int resumeAll();

    boolean removeFromQueue(String itemId);

    /**
     * @return the number of items removed
     */
    int clearQueue();

    int clearQueue(String sessionId);

    List<QueueItem> getQueue();

    List<QueueItem> getQueue(String sessionId);

    Optional<QueueItem> getQueueItem(String itemId);

    QueueStatistics getStatistics();

    BandwidthMonitor getBandwidthMonitor();

    ResourceUsage getResourceUsage();

    boolean isGloballyPaused();

    int getActiveCount();

    ListenerRegistration addEventListener(UploadEventListener listener);

    void start();

    void shutdown();

    @Override
    default void close() {
        shutdown();
    }
}
