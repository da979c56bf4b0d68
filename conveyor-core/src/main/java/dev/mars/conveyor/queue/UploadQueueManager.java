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

import dev.mars.conveyor.config.UploadQueueConfig;
import dev.mars.conveyor.core.ChunkStatus;
import dev.mars.conveyor.core.FileSource;
import dev.mars.conveyor.core.PriorityLevel;
import dev.mars.conveyor.core.QueueError;
import dev.mars.conveyor.core.QueueItem;
import dev.mars.conveyor.core.QueueItemStatus;
import dev.mars.conveyor.core.UploadChunk;
import dev.mars.conveyor.core.UploadPriority;
import dev.mars.conveyor.core.UploadResponse;
import dev.mars.conveyor.core.exceptions.UploadCancelledException;
import dev.mars.conveyor.core.exceptions.UploadTimeoutException;
import dev.mars.conveyor.monitoring.BandwidthMonitor;
import dev.mars.conveyor.monitoring.ResourceMonitor;
import dev.mars.conveyor.monitoring.ResourceUsage;
import dev.mars.conveyor.queue.observability.UploadQueueMetrics;
import dev.mars.conveyor.strategy.ChunkedStrategy;
import dev.mars.conveyor.strategy.StrategySelector;
import dev.mars.conveyor.strategy.StreamingStrategy;
import dev.mars.conveyor.strategy.UploadStrategy;
import dev.mars.conveyor.transfer.CancellationToken;
import dev.mars.conveyor.transfer.ChunkPlanner;
import dev.mars.conveyor.transfer.ErrorClassifier;
import dev.mars.conveyor.transfer.TransferContext;
import dev.mars.conveyor.transfer.TransferExecutor;
import dev.mars.conveyor.transfer.TransferExecutorRegistry;
import dev.mars.conveyor.transfer.TransferListener;
import dev.mars.conveyor.transport.UploadTransport;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Schedules queued uploads onto a bounded number of transfer slots.
 *
 * <h3>Admission:</h3>
 * <p>Every mutation requests an admission pass. Requests are coalesced: the first one arms a
 * single Vert.x timer for the debounce interval and later requests are absorbed until it fires.
 * A pass fills the free slots with QUEUED items ordered by descending tier weight and then by
 * enqueue order, skipping items whose tier is already at its own cap. Nothing is admitted while
 * the queue is globally paused.</p>
 *
 * <h3>Attempts:</h3>
 * <p>Each admission starts a new attempt with its own {@link CancellationToken}. Pausing,
 * cancelling, removing or timing out an item changes its status immediately and fires the token;
 * whatever the superseded attempt reports afterwards is discarded.</p>
 *
 * <h3>Retry:</h3>
 * <p>A failure is classified, appended to the item's error log and, if retryable and the item has
 * used fewer than {@code maxRetries} attempts, retried after {@code retryDelay * 2^retryCount} ms.
 * Otherwise the item stays FAILED until retried manually or removed.</p>
 *
 * <h3>Threading:</h3>
 * <p>All item state is guarded by one lock. Events are collected while the lock is held and
 * delivered after it is released; executors are started outside the lock as well.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class UploadQueueManager implements UploadQueue {
    private static final Logger logger = LoggerFactory.getLogger(UploadQueueManager.class);

    private final Vertx vertx;
    private volatile UploadQueueConfig config;
    private final TransferExecutorRegistry executors;
    private volatile StrategySelector strategySelector;
    private final UploadQueueMetrics metrics;
    private final BandwidthMonitor bandwidthMonitor;
    private final ResourceMonitor resourceMonitor;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, QueueItem> items = new LinkedHashMap<>();
    private final Map<String, ActiveTransfer> active = new HashMap<>();
    private final Map<String, Long> retryTimers = new HashMap<>();
    private final List<UploadEventListener> listeners = new CopyOnWriteArrayList<>();

    private final AtomicBoolean admissionRequested = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong attempts = new AtomicLong();
    private final AtomicLong acknowledgedBytes = new AtomicLong();
    private volatile boolean globallyPaused;
    private long watchdogTimerId = -1;

    public UploadQueueManager(Vertx vertx, UploadTransport transport) {
        this(vertx, transport, UploadQueueConfig.load());
    }

    public UploadQueueManager(Vertx vertx, UploadTransport transport, UploadQueueConfig config) {
        this(vertx, config, TransferExecutorRegistry.withDefaults(vertx, transport));
    }

    public UploadQueueManager(Vertx vertx, UploadQueueConfig config, TransferExecutorRegistry executors) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null").validate();
        this.executors = Objects.requireNonNull(executors, "Executor registry cannot be null");
        this.strategySelector = new StrategySelector(config);
        this.metrics = config.isTelemetryEnabled() ? UploadQueueMetrics.getInstance() : UploadQueueMetrics.noop();
        this.bandwidthMonitor = new BandwidthMonitor(vertx, config, this::sampleAggregateSpeed, acknowledgedBytes::get);
        this.resourceMonitor = new ResourceMonitor(vertx, config.getResourceSampleIntervalMs(),
                bandwidthMonitor::getCurrentSpeed);

        logger.info("UploadQueueManager initialized: {}", config);
    }

    // ========== LIFECYCLE ==========

    @Override
    public void start() {
        if (shutdown.get()) {
            throw new IllegalStateException("Upload queue has been shut down");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        bandwidthMonitor.start();
        resourceMonitor.start();
        armWatchdog();
        logger.info("Upload queue started (max {} concurrent, timeout {} ms)", config.getMaxConcurrentUploads(),
                config.getTimeoutMs());
        requestAdmission();
    }

    @Override
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        disarmWatchdog();
        bandwidthMonitor.stop();
        resourceMonitor.stop();

        List<CancellationToken> tokens = new ArrayList<>();
        lock.lock();
        try {
            retryTimers.values().forEach(vertx::cancelTimer);
            retryTimers.clear();
            Instant now = Instant.now();
            for (ActiveTransfer transfer : active.values()) {
                tokens.add(transfer.token);
                QueueItem item = items.get(transfer.itemId);
                if (item != null) {
                    item.pause(now);
                }
            }
            active.clear();
            metrics.setActiveUploads(0);
        } finally {
            lock.unlock();
        }
        tokens.forEach(token -> token.cancel(CancellationToken.Reason.SHUTDOWN));
        logger.info("Upload queue shut down, {} in-flight transfer(s) aborted", tokens.size());
    }

    // ========== ENQUEUE ==========

    @Override
    public List<String> addToQueue(List<? extends FileSource> files, String sessionId, UploadPriority priority,
                                   UploadStrategy strategy, Map<String, ?> metadata) {
        Objects.requireNonNull(files, "Files cannot be null");
        Objects.requireNonNull(sessionId, "Session id cannot be null");
        if (shutdown.get()) {
            throw new IllegalStateException("Upload queue has been shut down");
        }
        UploadPriority tier = priority != null ? priority : UploadPriority.NORMAL;

        List<UploadStrategy> strategies = new ArrayList<>(files.size());
        for (FileSource file : files) {
            Objects.requireNonNull(file, "File cannot be null");
            UploadStrategy chosen = strategy != null ? strategy : strategySelector.select(file);
            if (!executors.supports(chosen.type())) {
                throw new IllegalArgumentException("No executor registered for strategy " + chosen.type());
            }
            strategies.add(chosen);
        }

        List<String> ids = new ArrayList<>(files.size());
        List<UploadEvent> events = new ArrayList<>();
        lock.lock();
        try {
            for (int i = 0; i < files.size(); i++) {
                QueueItem item = QueueItem.builder()
                        .sessionId(sessionId)
                        .source(files.get(i))
                        .priority(tier)
                        .strategy(strategies.get(i))
                        .sequence(sequence.incrementAndGet())
                        .metadata(metadata)
                        .build();
                items.put(item.getId(), item);
                ids.add(item.getId());
                metrics.recordItemAdded(tier, item.getStrategy().type());
                events.add(event(UploadEventType.FILE_ADDED, item, null));
            }
        } finally {
            lock.unlock();
        }

        logger.info("Added {} file(s) to session {} at priority {}", ids.size(), sessionId, tier);
        publish(events);
        requestAdmission();
        return ids;
    }

    // ========== CONTROL ==========

    @Override
    public boolean pause(String itemId) {
        CancellationToken token;
        List<UploadEvent> events = new ArrayList<>();
        lock.lock();
        try {
            QueueItem item = items.get(itemId);
            if (item == null || item.getStatus() != QueueItemStatus.UPLOADING) {
                logRejected("pause", itemId, item);
                return false;
            }
            ActiveTransfer transfer = active.remove(itemId);
            token = transfer != null ? transfer.token : null;
            item.pause(Instant.now());
            metrics.setActiveUploads(active.size());
            events.add(event(UploadEventType.PAUSED, item, null));
        } finally {
            lock.unlock();
        }
        fire(token, CancellationToken.Reason.PAUSED);
        logger.info("Paused upload {}", itemId);
        publish(events);
        requestAdmission();
        return true;
    }

    @Override
    public boolean resume(String itemId) {
        List<UploadEvent> events = new ArrayList<>();
        lock.lock();
        try {
            QueueItem item = items.get(itemId);
            if (item == null || !item.resume()) {
                logRejected("resume", itemId, item);
                return false;
            }
            events.add(event(UploadEventType.RESUMED, item, null));
        } finally {
            lock.unlock();
        }
        logger.info("Resumed upload {}", itemId);
        publish(events);
        requestAdmission();
        return true;
    }

    @Override
    public boolean cancel(String itemId) {
        CancellationToken token;
        List<UploadEvent> events = new ArrayList<>();
        lock.lock();
        try {
            QueueItem item = items.get(itemId);
            if (item == null || !item.getStatus().isCancellable()) {
                logRejected("cancel", itemId, item);
                return false;
            }
            ActiveTransfer transfer = active.remove(itemId);
            token = transfer != null ? transfer.token : null;
            cancelRetryTimer(itemId);
            item.cancel();
            metrics.setActiveUploads(active.size());
            metrics.recordCancelled(item.getPriority(), item.getStrategy().type());
            events.add(event(UploadEventType.CANCELLED, item,
                    Map.of(UploadEvent.KEY_REASON, UploadEvent.REASON_CANCELLED)));
        } finally {
            lock.unlock();
        }
        fire(token, CancellationToken.Reason.CANCELLED);
        logger.info("Cancelled upload {}", itemId);
        publish(events);
        requestAdmission();
        return true;
    }

    @Override
    public boolean retry(String itemId) {
        List<UploadEvent> events = new ArrayList<>();
        lock.lock();
        try {
            QueueItem item = items.get(itemId);
            if (item == null || item.getStatus() != QueueItemStatus.FAILED) {
                logRejected("retry", itemId, item);
                return false;
            }
            cancelRetryTimer(itemId);
            item.resetProgress();
            item.requeue(0);
            metrics.recordRetry(item.getPriority(), false);
            events.add(event(UploadEventType.RETRYING, item, Map.of(UploadEvent.KEY_AUTOMATIC, false)));
        } finally {
            lock.unlock();
        }
        logger.info("Manual retry requested for upload {}", itemId);
        publish(events);
        requestAdmission();
        return true;
    }

    @Override
    public boolean changePriority(String itemId, UploadPriority priority) {
        Objects.requireNonNull(priority, "Priority cannot be null");
        lock.lock();
        try {
            QueueItem item = items.get(itemId);
            if (item == null || (item.getStatus() != QueueItemStatus.QUEUED
                    && item.getStatus() != QueueItemStatus.PAUSED)) {
                logRejected("changePriority", itemId, item);
                return false;
            }
            logger.debug("Upload {} moved from {} to {}", itemId, item.getPriority(), priority);
            item.setPriority(priority);
        } finally {
            lock.unlock();
        }
        requestAdmission();
        return true;
    }

    @Override
    public int pauseAll() {
        globallyPaused = true;
        List<String> uploading = idsWithStatus(QueueItemStatus.UPLOADING);
        int paused = 0;
        for (String id : uploading) {
            if (pause(id)) {
                paused++;
            }
        }
        logger.info("Queue paused, {} upload(s) interrupted", paused);
        return paused;
    }

    @Override
    public int resumeAll() {
        globallyPaused = false;
        List<String> pausedIds = idsWithStatus(QueueItemStatus.PAUSED);
        int resumed = 0;
        for (String id : pausedIds) {
            if (resume(id)) {
                resumed++;
            }
        }
        logger.info("Queue resumed, {} upload(s) requeued", resumed);
        requestAdmission();
        return resumed;
    }

    @Override
    public boolean removeFromQueue(String itemId) {
        CancellationToken token;
        List<UploadEvent> events = new ArrayList<>();
        lock.lock();
        try {
            QueueItem item = items.remove(itemId);
            if (item == null) {
                return false;
            }
            ActiveTransfer transfer = active.remove(itemId);
            token = transfer != null ? transfer.token : null;
            cancelRetryTimer(itemId);
            if (item.cancel()) {
                metrics.recordCancelled(item.getPriority(), item.getStrategy().type());
                events.add(event(UploadEventType.CANCELLED, item,
                        Map.of(UploadEvent.KEY_REASON, UploadEvent.REASON_REMOVED)));
            }
            metrics.setActiveUploads(active.size());
        } finally {
            lock.unlock();
        }
        fire(token, CancellationToken.Reason.REMOVED);
        logger.info("Removed upload {} from the queue", itemId);
        publish(events);
        requestAdmission();
        return true;
    }

    @Override
    public int clearQueue() {
        List<CancellationToken> tokens = new ArrayList<>();
        int removed;
        lock.lock();
        try {
            removed = items.size();
            active.values().forEach(transfer -> tokens.add(transfer.token));
            active.clear();
            retryTimers.values().forEach(vertx::cancelTimer);
            retryTimers.clear();
            items.clear();
            metrics.setActiveUploads(0);
        } finally {
            lock.unlock();
        }
        tokens.forEach(token -> token.cancel(CancellationToken.Reason.REMOVED));
        logger.info("Cleared {} item(s) from the queue", removed);
        return removed;
    }

    @Override
    public int clearQueue(String sessionId) {
        List<CancellationToken> tokens = new ArrayList<>();
        int removed = 0;
        lock.lock();
        try {
            Iterator<QueueItem> iterator = items.values().iterator();
            while (iterator.hasNext()) {
                QueueItem item = iterator.next();
                if (!item.getSessionId().equals(sessionId)) {
                    continue;
                }
                ActiveTransfer transfer = active.remove(item.getId());
                if (transfer != null) {
                    tokens.add(transfer.token);
                }
                cancelRetryTimer(item.getId());
                iterator.remove();
                removed++;
            }
            metrics.setActiveUploads(active.size());
        } finally {
            lock.unlock();
        }
        tokens.forEach(token -> token.cancel(CancellationToken.Reason.REMOVED));
        logger.info("Cleared {} item(s) of session {}", removed, sessionId);
        if (!tokens.isEmpty()) {
            requestAdmission();
        }
        return removed;
    }

    // ========== QUERIES ==========

    @Override
    public List<QueueItem> getQueue() {
        lock.lock();
        try {
            return items.values().stream().map(QueueItem::copy).toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<QueueItem> getQueue(String sessionId) {
        lock.lock();
        try {
            return items.values().stream()
                    .filter(item -> item.getSessionId().equals(sessionId))
                    .map(QueueItem::copy)
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<QueueItem> getQueueItem(String itemId) {
        lock.lock();
        try {
            return Optional.ofNullable(items.get(itemId)).map(QueueItem::copy);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public QueueStatistics getStatistics() {
        lock.lock();
        try {
            return QueueStatistics.from(items.values());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public BandwidthMonitor getBandwidthMonitor() {
        return bandwidthMonitor;
    }

    @Override
    public ResourceUsage getResourceUsage() {
        return resourceMonitor.getLatest();
    }

    @Override
    public boolean isGloballyPaused() {
        return globallyPaused;
    }

    @Override
    public int getActiveCount() {
        lock.lock();
        try {
            return active.size();
        } finally {
            lock.unlock();
        }
    }

    public UploadQueueConfig getConfig() {
        return config;
    }

    /**
     * Apply {@code changes} on top of the current configuration.
     *
     * @see #updateConfig(UploadQueueConfig)
     */
    public UploadQueueConfig updateConfig(Consumer<UploadQueueConfig.Builder> changes) {
        Objects.requireNonNull(changes, "Changes cannot be null");
        UploadQueueConfig.Builder builder = config.toBuilder();
        changes.accept(builder);
        return updateConfig(builder.build());
    }

    /**
     * Replace the configuration of a running queue. Concurrency limits, tier caps, retry policy,
     * the no-progress timeout and automatic strategy selection take effect at once; uploads
     * already running keep their slots even if the new limits are lower. Monitor sampling,
     * bandwidth throttling and telemetry stay as they were at construction.
     *
     * @throws IllegalStateException if {@code newConfig} does not validate
     */
    public UploadQueueConfig updateConfig(UploadQueueConfig newConfig) {
        Objects.requireNonNull(newConfig, "Config cannot be null").validate();
        long previousTimeout;
        lock.lock();
        try {
            previousTimeout = config.getTimeoutMs();
            config = newConfig;
            strategySelector = new StrategySelector(newConfig);
        } finally {
            lock.unlock();
        }
        if (previousTimeout != newConfig.getTimeoutMs() && started.get() && !shutdown.get()) {
            armWatchdog();
        }
        logger.info("Upload queue configuration updated: {}", newConfig);
        requestAdmission();
        return newConfig;
    }

    @Override
    public ListenerRegistration addEventListener(UploadEventListener listener) {
        Objects.requireNonNull(listener, "Listener cannot be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private synchronized void armWatchdog() {
        disarmWatchdog();
        if (shutdown.get()) {
            return;
        }
        long period = Math.max(1, Math.min(1000, config.getTimeoutMs() / 2));
        watchdogTimerId = vertx.setPeriodic(period, id -> checkTimeouts());
    }

    private synchronized void disarmWatchdog() {
        if (watchdogTimerId >= 0) {
            vertx.cancelTimer(watchdogTimerId);
            watchdogTimerId = -1;
        }
    }

    // ========== ADMISSION ==========

    private void requestAdmission() {
        if (shutdown.get() || !started.get()) {
            return;
        }
        if (admissionRequested.compareAndSet(false, true)) {
            vertx.setTimer(config.getAdmissionDebounceMs(), id -> {
                admissionRequested.set(false);
                runAdmission();
            });
        }
    }

    void runAdmission() {
        List<Dispatch> dispatches = new ArrayList<>();
        List<UploadEvent> events = new ArrayList<>();
        boolean failedDuringAdmission = false;
        lock.lock();
        try {
            if (globallyPaused || shutdown.get()) {
                return;
            }
            int available = config.getMaxConcurrentUploads() - active.size();
            if (available <= 0) {
                logger.debug("No free upload slots ({} active)", active.size());
                return;
            }

            Map<UploadPriority, Integer> activeByTier = new EnumMap<>(UploadPriority.class);
            for (ActiveTransfer transfer : active.values()) {
                QueueItem item = items.get(transfer.itemId);
                if (item != null) {
                    activeByTier.merge(item.getPriority(), 1, Integer::sum);
                }
            }

            List<QueueItem> candidates = items.values().stream()
                    .filter(item -> item.getStatus() == QueueItemStatus.QUEUED)
                    .sorted(admissionOrder())
                    .toList();

            for (QueueItem item : candidates) {
                if (available <= 0) {
                    break;
                }
                PriorityLevel level = config.getPriorityLevel(item.getPriority());
                int tierActive = activeByTier.getOrDefault(item.getPriority(), 0);
                if (tierActive >= level.getMaxConcurrent()) {
                    logger.debug("Skipping {}: tier {} at its cap of {}", item.getId(), item.getPriority(),
                            level.getMaxConcurrent());
                    continue;
                }

                item.start(Instant.now());
                try {
                    prepareAttempt(item);
                } catch (IllegalArgumentException e) {
                    handleFailure(item, ErrorClassifier.classify(e), events);
                    failedDuringAdmission = true;
                    continue;
                }
                activeByTier.merge(item.getPriority(), 1, Integer::sum);
                available--;

                long attempt = attempts.incrementAndGet();
                ActiveTransfer transfer = new ActiveTransfer(item.getId(), attempt, item.getUploadedBytes());
                active.put(item.getId(), transfer);

                logger.debug("Admitted {} ({}, {}, attempt {})", item.getId(), item.getPriority(),
                        item.getStrategy().type(), item.getRetryCount() + 1);
                events.add(event(UploadEventType.UPLOAD_STARTED, item,
                        Map.of(UploadEvent.KEY_ATTEMPT, item.getRetryCount() + 1)));
                dispatches.add(new Dispatch(executors.get(item.getStrategy().type()),
                        new TransferContext(item.copy(), attempt, transfer.token,
                                new AttemptListener(item.getId(), attempt))));
            }
            metrics.setActiveUploads(active.size());
        } finally {
            lock.unlock();
        }

        publish(events);
        dispatches.forEach(this::dispatch);
        if (failedDuringAdmission) {
            requestAdmission();
        }
    }

    private Comparator<QueueItem> admissionOrder() {
        return Comparator.<QueueItem>comparingInt(item -> -config.getPriorityLevel(item.getPriority()).getWeight())
                .thenComparingLong(QueueItem::getSequence);
    }

    /**
     * Bring chunk plan and progress in line with the strategy before a new attempt.
     */
    private void prepareAttempt(QueueItem item) {
        UploadStrategy strategy = item.getStrategy();
        if (strategy instanceof ChunkedStrategy chunked) {
            if (item.getChunks().isEmpty()) {
                item.replaceChunks(ChunkPlanner.plan(item.getTotalBytes(), chunked.chunkSize()));
                item.rewindProgress(0);
            } else if (chunked.resumable()) {
                item.rewindProgress(item.completedChunkBytes());
            } else {
                item.resetProgress();
            }
        } else if (strategy instanceof StreamingStrategy streaming) {
            if (!streaming.resumable()) {
                item.resetProgress();
            }
        } else {
            item.resetProgress();
        }
    }

    private void dispatch(Dispatch dispatch) {
        TransferContext context = dispatch.context;
        Future<UploadResponse> future;
        try {
            future = dispatch.executor.execute(context);
        } catch (RuntimeException e) {
            future = Future.failedFuture(e);
        }
        future.onComplete(ar -> {
            if (ar.succeeded()) {
                onTransferSucceeded(context.getItemId(), context.getAttempt(), ar.result());
            } else {
                onTransferFailed(context.getItemId(), context.getAttempt(), ar.cause());
            }
        });
    }

    // ========== TRANSFER OUTCOMES ==========

    private void onTransferSucceeded(String itemId, long attempt, UploadResponse response) {
        List<UploadEvent> events = new ArrayList<>();
        lock.lock();
        try {
            if (current(itemId, attempt) == null) {
                logger.debug("Discarding completion of superseded attempt {} for {}", attempt, itemId);
                return;
            }
            active.remove(itemId);
            metrics.setActiveUploads(active.size());
            QueueItem item = items.get(itemId);
            long unreported = item.getTotalBytes() - item.getUploadedBytes();
            if (item.complete(Instant.now(), response)) {
                acknowledgedBytes.addAndGet(unreported);
                Duration duration = Duration.between(item.getStartedAt(), item.getCompletedAt());
                metrics.recordCompleted(item.getPriority(), item.getStrategy().type(), item.getTotalBytes(),
                        duration.toMillis() / 1000.0);
                Map<String, Object> data = new HashMap<>();
                data.put(UploadEvent.KEY_DURATION_MS, duration.toMillis());
                if (response != null) {
                    data.put(UploadEvent.KEY_RESPONSE, response);
                }
                events.add(event(UploadEventType.COMPLETED, item, data));
                logger.info("Upload {} ({}) completed in {} ms", itemId, item.getSource().getName(),
                        duration.toMillis());
            }
        } finally {
            lock.unlock();
        }
        publish(events);
        requestAdmission();
    }

    private void onTransferFailed(String itemId, long attempt, Throwable cause) {
        List<UploadEvent> events = new ArrayList<>();
        lock.lock();
        try {
            if (current(itemId, attempt) == null || cause instanceof UploadCancelledException) {
                logger.debug("Discarding failure of superseded attempt {} for {}: {}", attempt, itemId,
                        cause.getMessage());
                return;
            }
            active.remove(itemId);
            metrics.setActiveUploads(active.size());
            handleFailure(items.get(itemId), ErrorClassifier.classify(cause), events);
        } finally {
            lock.unlock();
        }
        publish(events);
        requestAdmission();
    }

    /**
     * Record a classified failure and either schedule the automatic retry or fail for good.
     * Caller holds the lock and has already released the item's slot.
     */
    private void handleFailure(QueueItem item, QueueError error, List<UploadEvent> events) {
        int attemptNumber = item.getRetryCount() + 1;
        boolean willRetry = error.isRetryable() && attemptNumber < config.getMaxRetries();

        for (UploadChunk chunk : item.getChunks()) {
            if (chunk.getStatus() == ChunkStatus.UPLOADING) {
                chunk.markFailed(chunk.getRetryCount());
            }
        }

        QueueError recorded = error.withDetail(UploadEvent.KEY_ATTEMPT, attemptNumber);
        if (!item.fail(recorded)) {
            return;
        }

        Map<String, Object> data = new HashMap<>();
        data.put(UploadEvent.KEY_ERROR, recorded);
        data.put(UploadEvent.KEY_ATTEMPT, attemptNumber);
        data.put(UploadEvent.KEY_WILL_RETRY, willRetry);

        if (!willRetry) {
            logger.error("Upload {} ({}) failed after {} attempt(s) [{}]: {}", item.getId(),
                    item.getSource().getName(), attemptNumber, error.getType(), error.getMessage());
            metrics.recordFailed(item.getPriority(), item.getStrategy().type(), error.getType());
            events.add(event(UploadEventType.FAILED, item, data));
            return;
        }

        long delay = backoffDelay(item.getRetryCount());
        data.put(UploadEvent.KEY_RETRY_DELAY_MS, delay);
        logger.warn("Upload {} failed (attempt {}/{}), retrying in {} ms: {}", item.getId(), attemptNumber,
                config.getMaxRetries(), delay, error.getMessage());
        // event first so its timestamp precedes the timer
        events.add(event(UploadEventType.FAILED, item, data));
        scheduleRetry(item.getId(), item.getRetryCount() + 1, delay);
    }

    long backoffDelay(int retryCount) {
        return config.getRetryDelayMs() * (1L << Math.min(retryCount, 30));
    }

    private void scheduleRetry(String itemId, int nextRetryCount, long delayMs) {
        long timerId = vertx.setTimer(Math.max(1, delayMs), id -> onRetryTimer(itemId, nextRetryCount, id));
        retryTimers.put(itemId, timerId);
    }

    private void onRetryTimer(String itemId, int retryCount, long timerId) {
        List<UploadEvent> events = new ArrayList<>();
        lock.lock();
        try {
            Long registered = retryTimers.get(itemId);
            if (registered == null || registered != timerId) {
                return;
            }
            retryTimers.remove(itemId);
            QueueItem item = items.get(itemId);
            if (item == null || !item.requeue(retryCount)) {
                return;
            }
            metrics.recordRetry(item.getPriority(), true);
            events.add(event(UploadEventType.RETRYING, item, Map.of(UploadEvent.KEY_AUTOMATIC, true)));
            logger.info("Retrying upload {} (retry {})", itemId, retryCount);
        } finally {
            lock.unlock();
        }
        publish(events);
        requestAdmission();
    }

    private void cancelRetryTimer(String itemId) {
        Long timerId = retryTimers.remove(itemId);
        if (timerId != null) {
            vertx.cancelTimer(timerId);
        }
    }

    // ========== PROGRESS ==========

    private void onProgress(String itemId, long attempt, long uploadedBytes, long elapsedMs) {
        List<UploadEvent> events = new ArrayList<>();
        lock.lock();
        try {
            ActiveTransfer transfer = current(itemId, attempt);
            QueueItem item = items.get(itemId);
            if (transfer == null || item == null || item.getStatus() != QueueItemStatus.UPLOADING) {
                return;
            }
            long bytes = Math.min(Math.max(uploadedBytes, 0), item.getTotalBytes());
            if (bytes == item.getUploadedBytes()) {
                // transport still working on the same bytes
                item.touch(Instant.now());
                return;
            }
            if (bytes < item.getUploadedBytes()) {
                return;
            }
            long deltaBytes = bytes - transfer.lastBytes;
            long deltaMs = elapsedMs - transfer.lastElapsedMs;
            double speed = deltaMs > 0 ? deltaBytes * 1000.0 / deltaMs : item.getSpeed();
            long remainingMs = speed > 0 ? (long) ((item.getTotalBytes() - bytes) / speed * 1000) : -1;

            item.recordProgress(bytes, speed, remainingMs, Instant.now());
            acknowledgedBytes.addAndGet(deltaBytes);
            transfer.lastBytes = bytes;
            if (deltaMs > 0) {
                transfer.lastElapsedMs = elapsedMs;
            }
            events.add(event(UploadEventType.PROGRESS_UPDATED, item, null));
        } finally {
            lock.unlock();
        }
        publish(events);
    }

    private void checkTimeouts() {
        List<CancellationToken> tokens = new ArrayList<>();
        List<UploadEvent> events = new ArrayList<>();
        lock.lock();
        try {
            Instant now = Instant.now();
            Iterator<ActiveTransfer> iterator = active.values().iterator();
            while (iterator.hasNext()) {
                ActiveTransfer transfer = iterator.next();
                QueueItem item = items.get(transfer.itemId);
                if (item == null || item.getStatus() != QueueItemStatus.UPLOADING || item.getLastProgressAt() == null) {
                    continue;
                }
                Duration idle = Duration.between(item.getLastProgressAt(), now);
                if (idle.toMillis() < config.getTimeoutMs()) {
                    continue;
                }
                iterator.remove();
                tokens.add(transfer.token);
                logger.warn("Upload {} made no progress for {} ms", item.getId(), idle.toMillis());
                handleFailure(item, ErrorClassifier.classify(new UploadTimeoutException(item.getId(), idle)), events);
            }
            metrics.setActiveUploads(active.size());
        } finally {
            lock.unlock();
        }
        if (tokens.isEmpty()) {
            return;
        }
        tokens.forEach(token -> token.cancel(CancellationToken.Reason.TIMEOUT));
        publish(events);
        requestAdmission();
    }

    private double sampleAggregateSpeed() {
        double speed = 0;
        lock.lock();
        try {
            for (ActiveTransfer transfer : active.values()) {
                QueueItem item = items.get(transfer.itemId);
                if (item != null) {
                    speed += item.getSpeed();
                }
            }
        } finally {
            lock.unlock();
        }
        metrics.setCurrentBandwidth(speed);
        return speed;
    }

    // ========== HELPERS ==========

    private ActiveTransfer current(String itemId, long attempt) {
        ActiveTransfer transfer = active.get(itemId);
        return transfer != null && transfer.attempt == attempt ? transfer : null;
    }

    private List<String> idsWithStatus(QueueItemStatus status) {
        lock.lock();
        try {
            return items.values().stream()
                    .filter(item -> item.getStatus() == status)
                    .map(QueueItem::getId)
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    private UploadEvent event(UploadEventType type, QueueItem item, Map<String, Object> data) {
        return new UploadEvent(type, item.copy(), data);
    }

    private void publish(List<UploadEvent> events) {
        for (UploadEvent event : events) {
            for (UploadEventListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    logger.warn("Upload event listener failed on {} for {}: {}", event.getType(), event.getItemId(),
                            e.getMessage(), e);
                }
            }
        }
    }

    private static void fire(CancellationToken token, CancellationToken.Reason reason) {
        if (token != null) {
            token.cancel(reason);
        }
    }

    private static void logRejected(String operation, String itemId, QueueItem item) {
        if (item == null) {
            logger.debug("Ignoring {} for unknown upload {}", operation, itemId);
        } else {
            logger.debug("Ignoring {} for upload {} in status {}", operation, itemId, item.getStatus());
        }
    }

    /**
     * Slot held by one admitted attempt.
     */
    private static final class ActiveTransfer {
        private final String itemId;
        private final long attempt;
        private final CancellationToken token = new CancellationToken();
        private long lastBytes;
        private long lastElapsedMs;

        private ActiveTransfer(String itemId, long attempt, long startBytes) {
            this.itemId = itemId;
            this.attempt = attempt;
            this.lastBytes = startBytes;
        }
    }

    private record Dispatch(TransferExecutor executor, TransferContext context) {
    }

    /**
     * Routes executor callbacks for one attempt back into the queue.
     */
    private final class AttemptListener implements TransferListener {
        private final String itemId;
        private final long attempt;

        private AttemptListener(String itemId, long attempt) {
            this.itemId = itemId;
            this.attempt = attempt;
        }

        @Override
        public void onProgress(long uploadedBytes, long elapsedMs) {
            UploadQueueManager.this.onProgress(itemId, attempt, uploadedBytes, elapsedMs);
        }

        @Override
        public void onChunkStarted(int index) {
            withChunk(index, UploadChunk::markUploading);
        }

        @Override
        public void onChunkCompleted(int index, String checksum) {
            Instant now = Instant.now();
            withChunk(index, chunk -> chunk.markCompleted(checksum, now));
        }

        @Override
        public void onChunkRetry(int index, int failedAttempts, QueueError error) {
            withChunk(index, chunk -> chunk.markFailed(failedAttempts));
            metrics.recordChunkRetry(error.getType());
        }

        @Override
        public void onProcessing() {
            List<UploadEvent> events = new ArrayList<>();
            lock.lock();
            try {
                QueueItem item = items.get(itemId);
                if (current(itemId, attempt) != null && item != null && item.beginProcessing()) {
                    logger.debug("Upload {} finalizing", itemId);
                    events.add(event(UploadEventType.PROCESSING_STARTED, item, null));
                }
            } finally {
                lock.unlock();
            }
            publish(events);
        }

        private void withChunk(int index, Consumer<UploadChunk> update) {
            lock.lock();
            try {
                QueueItem item = items.get(itemId);
                if (current(itemId, attempt) == null || item == null) {
                    return;
                }
                UploadChunk chunk = item.chunk(index);
                if (chunk != null) {
                    update.accept(chunk);
                }
            } finally {
                lock.unlock();
            }
        }
    }
}
