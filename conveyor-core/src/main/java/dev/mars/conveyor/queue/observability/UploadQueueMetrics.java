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

package dev.mars.conveyor.queue.observability;

import dev.mars.conveyor.core.ErrorType;
import dev.mars.conveyor.core.UploadPriority;
import dev.mars.conveyor.strategy.StrategyType;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the upload queue.
 *
 * Instruments:
 * - conveyor.queue.items.added (counter) - Files enqueued
 * - conveyor.queue.uploads.completed (counter) - Uploads completed
 * - conveyor.queue.uploads.failed (counter) - Uploads failed for good
 * - conveyor.queue.uploads.cancelled (counter) - Uploads cancelled or removed
 * - conveyor.queue.retries (counter) - Automatic and manual item retries
 * - conveyor.queue.chunks.retries (counter) - Chunk-level retries
 * - conveyor.queue.bytes.uploaded (counter) - Bytes of completed uploads
 * - conveyor.queue.upload.duration.seconds (histogram) - Admission to completion
 * - conveyor.queue.active (gauge) - Uploads holding a transfer slot
 * - conveyor.bandwidth.current (gauge) - Last sampled aggregate speed
 *
 * Instruments are registered against {@link GlobalOpenTelemetry}, so they are no-ops until an
 * SDK is installed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0 (OpenTelemetry)
 */
public class UploadQueueMetrics {

    private static final Logger logger = LoggerFactory.getLogger(UploadQueueMetrics.class);
    private static final String METER_NAME = "conveyor-core";

    private static UploadQueueMetrics instance;
    private static UploadQueueMetrics disabled;

    private final LongCounter itemsAdded;
    private final LongCounter uploadsCompleted;
    private final LongCounter uploadsFailed;
    private final LongCounter uploadsCancelled;
    private final LongCounter retries;
    private final LongCounter chunkRetries;
    private final LongCounter bytesUploaded;
    private final DoubleHistogram uploadDuration;

    private final AtomicLong activeUploads = new AtomicLong(0);
    private volatile double currentBandwidth;

    private static final AttributeKey<String> PRIORITY_KEY = AttributeKey.stringKey("priority");
    private static final AttributeKey<String> STRATEGY_KEY = AttributeKey.stringKey("strategy");
    private static final AttributeKey<String> ERROR_TYPE_KEY = AttributeKey.stringKey("error.type");
    private static final AttributeKey<String> RETRY_KIND_KEY = AttributeKey.stringKey("retry.kind");

    private UploadQueueMetrics(Meter meter) {
        itemsAdded = meter.counterBuilder("conveyor.queue.items.added")
                .setDescription("Number of files added to the upload queue")
                .setUnit("1")
                .build();

        uploadsCompleted = meter.counterBuilder("conveyor.queue.uploads.completed")
                .setDescription("Number of uploads completed")
                .setUnit("1")
                .build();

        uploadsFailed = meter.counterBuilder("conveyor.queue.uploads.failed")
                .setDescription("Number of uploads failed with no retry pending")
                .setUnit("1")
                .build();

        uploadsCancelled = meter.counterBuilder("conveyor.queue.uploads.cancelled")
                .setDescription("Number of uploads cancelled or removed")
                .setUnit("1")
                .build();

        retries = meter.counterBuilder("conveyor.queue.retries")
                .setDescription("Number of item retries scheduled")
                .setUnit("1")
                .build();

        chunkRetries = meter.counterBuilder("conveyor.queue.chunks.retries")
                .setDescription("Number of chunk retries")
                .setUnit("1")
                .build();

        bytesUploaded = meter.counterBuilder("conveyor.queue.bytes.uploaded")
                .setDescription("Bytes of completed uploads")
                .setUnit("By")
                .build();

        uploadDuration = meter.histogramBuilder("conveyor.queue.upload.duration.seconds")
                .setDescription("Upload duration from admission to completion")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("conveyor.queue.active")
                .setDescription("Number of uploads holding a transfer slot")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeUploads.get()));

        meter.gaugeBuilder("conveyor.bandwidth.current")
                .setDescription("Last sampled aggregate upload speed")
                .setUnit("By/s")
                .buildWithCallback(measurement -> measurement.record(currentBandwidth));
    }

    /**
     * The shared instance bound to {@link GlobalOpenTelemetry}.
     */
    public static synchronized UploadQueueMetrics getInstance() {
        if (instance == null) {
            instance = new UploadQueueMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
            logger.info("UploadQueueMetrics initialized");
        }
        return instance;
    }

    /**
     * An instance that records nothing, for when telemetry is switched off.
     */
    public static synchronized UploadQueueMetrics noop() {
        if (disabled == null) {
            disabled = new UploadQueueMetrics(OpenTelemetry.noop().getMeter(METER_NAME));
        }
        return disabled;
    }

    public void recordItemAdded(UploadPriority priority, StrategyType strategy) {
        itemsAdded.add(1, attributes(priority, strategy));
    }

    public void recordCompleted(UploadPriority priority, StrategyType strategy, long bytes, double durationSeconds) {
        Attributes attrs = attributes(priority, strategy);
        uploadsCompleted.add(1, attrs);
        bytesUploaded.add(bytes, attrs);
        if (durationSeconds >= 0) {
            uploadDuration.record(durationSeconds, attrs);
        }
    }

    public void recordFailed(UploadPriority priority, StrategyType strategy, ErrorType errorType) {
        Attributes attrs = Attributes.builder()
                .put(PRIORITY_KEY, key(priority))
                .put(STRATEGY_KEY, key(strategy))
                .put(ERROR_TYPE_KEY, errorType != null ? errorType.key() : "unknown")
                .build();
        uploadsFailed.add(1, attrs);
    }

    public void recordCancelled(UploadPriority priority, StrategyType strategy) {
        uploadsCancelled.add(1, attributes(priority, strategy));
    }

    /**
     * @param automatic true for a backoff retry, false for a caller-requested one
     */
    public void recordRetry(UploadPriority priority, boolean automatic) {
        retries.add(1, Attributes.builder()
                .put(PRIORITY_KEY, key(priority))
                .put(RETRY_KIND_KEY, automatic ? "automatic" : "manual")
                .build());
    }

    public void recordChunkRetry(ErrorType errorType) {
        chunkRetries.add(1, Attributes.of(ERROR_TYPE_KEY, errorType != null ? errorType.key() : "unknown"));
    }

    public void setActiveUploads(long active) {
        activeUploads.set(active);
    }

    public long getActiveUploads() {
        return activeUploads.get();
    }

    public void setCurrentBandwidth(double bytesPerSecond) {
        this.currentBandwidth = bytesPerSecond;
    }

    private static Attributes attributes(UploadPriority priority, StrategyType strategy) {
        return Attributes.builder()
                .put(PRIORITY_KEY, key(priority))
                .put(STRATEGY_KEY, key(strategy))
                .build();
    }

    private static String key(Enum<?> value) {
        return value != null ? value.name().toLowerCase(Locale.ROOT) : "unknown";
    }
}
