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

package dev.mars.conveyor.config;

import dev.mars.conveyor.core.PriorityLevel;
import dev.mars.conveyor.core.UploadPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Configuration for the upload queue and its monitors.
 *
 * <p>Instances are immutable. Build one programmatically with {@link #builder()}, or load one with
 * {@link #load()}, which layers (lowest precedence first):</p>
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>{@code conveyor.properties} on the classpath</li>
 *   <li>system properties starting with {@code conveyor.}</li>
 * </ol>
 *
 * <p>Unparseable numbers are logged and replaced by the default; out-of-range values are
 * rejected by {@link #validate()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
public final class UploadQueueConfig {

    private static final Logger logger = LoggerFactory.getLogger(UploadQueueConfig.class);

    public static final String PREFIX = "conveyor.";
    public static final String CONFIG_RESOURCE = "conveyor.properties";

    public static final String KEY_MAX_CONCURRENT = "conveyor.queue.max-concurrent";
    public static final String KEY_MAX_RETRIES = "conveyor.queue.max-retries";
    public static final String KEY_RETRY_DELAY_MS = "conveyor.queue.retry-delay-ms";
    public static final String KEY_CHUNK_SIZE = "conveyor.queue.chunk-size";
    public static final String KEY_CHUNKED_THRESHOLD = "conveyor.queue.chunked-threshold";
    public static final String KEY_TIMEOUT_MS = "conveyor.queue.timeout-ms";
    public static final String KEY_ADMISSION_DEBOUNCE_MS = "conveyor.queue.admission-debounce-ms";
    public static final String KEY_THROTTLING_ENABLED = "conveyor.bandwidth.throttling.enabled";
    public static final String KEY_MAX_BANDWIDTH = "conveyor.bandwidth.max-bytes-per-second";
    public static final String KEY_BANDWIDTH_SAMPLE_INTERVAL_MS = "conveyor.bandwidth.sample-interval-ms";
    public static final String KEY_BANDWIDTH_SAMPLE_WINDOW = "conveyor.bandwidth.sample-window";
    public static final String KEY_RESOURCE_SAMPLE_INTERVAL_MS = "conveyor.resource.sample-interval-ms";
    public static final String KEY_TELEMETRY_ENABLED = "conveyor.telemetry.enabled";

    static final int DEFAULT_MAX_CONCURRENT = 3;
    static final int DEFAULT_MAX_RETRIES = 3;
    static final long DEFAULT_RETRY_DELAY_MS = 1000;
    static final long DEFAULT_CHUNK_SIZE = 1024 * 1024;
    static final long DEFAULT_CHUNKED_THRESHOLD = 10L * 1024 * 1024;
    static final long DEFAULT_TIMEOUT_MS = 30_000;
    static final long DEFAULT_ADMISSION_DEBOUNCE_MS = 100;
    static final long DEFAULT_BANDWIDTH_SAMPLE_INTERVAL_MS = 1000;
    static final int DEFAULT_BANDWIDTH_SAMPLE_WINDOW = 60;
    static final long DEFAULT_RESOURCE_SAMPLE_INTERVAL_MS = 5000;

    private final int maxConcurrentUploads;
    private final int maxRetries;
    private final long retryDelayMs;
    private final long chunkSize;
    private final long chunkedThreshold;
    private final long timeoutMs;
    private final long admissionDebounceMs;
    private final boolean bandwidthThrottlingEnabled;
    private final Long maxBandwidth;
    private final long bandwidthSampleIntervalMs;
    private final int bandwidthSampleWindow;
    private final long resourceSampleIntervalMs;
    private final boolean telemetryEnabled;
    private final Map<UploadPriority, PriorityLevel> priorityLevels;

    private UploadQueueConfig(Builder builder) {
        this.maxConcurrentUploads = builder.maxConcurrentUploads;
        this.maxRetries = builder.maxRetries;
        this.retryDelayMs = builder.retryDelayMs;
        this.chunkSize = builder.chunkSize;
        this.chunkedThreshold = builder.chunkedThreshold;
        this.timeoutMs = builder.timeoutMs;
        this.admissionDebounceMs = builder.admissionDebounceMs;
        this.bandwidthThrottlingEnabled = builder.bandwidthThrottlingEnabled;
        this.maxBandwidth = builder.maxBandwidth;
        this.bandwidthSampleIntervalMs = builder.bandwidthSampleIntervalMs;
        this.bandwidthSampleWindow = builder.bandwidthSampleWindow;
        this.resourceSampleIntervalMs = builder.resourceSampleIntervalMs;
        this.telemetryEnabled = builder.telemetryEnabled;
        this.priorityLevels = Collections.unmodifiableMap(new EnumMap<>(builder.priorityLevels));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A builder preset with this configuration's values.
     */
    public Builder toBuilder() {
        Builder builder = new Builder()
                .maxConcurrentUploads(maxConcurrentUploads)
                .maxRetries(maxRetries)
                .retryDelayMs(retryDelayMs)
                .chunkSize(chunkSize)
                .chunkedThreshold(chunkedThreshold)
                .timeoutMs(timeoutMs)
                .admissionDebounceMs(admissionDebounceMs)
                .bandwidthThrottlingEnabled(bandwidthThrottlingEnabled)
                .maxBandwidth(maxBandwidth)
                .bandwidthSampleIntervalMs(bandwidthSampleIntervalMs)
                .bandwidthSampleWindow(bandwidthSampleWindow)
                .resourceSampleIntervalMs(resourceSampleIntervalMs)
                .telemetryEnabled(telemetryEnabled);
        priorityLevels.values().forEach(builder::priorityLevel);
        return builder;
    }

    public static UploadQueueConfig defaults() {
        return builder().build();
    }

    /**
     * Load from the classpath resource and system properties on top of the defaults.
     */
    public static UploadQueueConfig load() {
        Properties properties = new Properties();
        loadFromClasspath(properties);
        loadFromSystemProperties(properties);
        return fromProperties(properties);
    }

    /**
     * Build a configuration from {@code conveyor.*} keys, defaulting every key that is absent.
     */
    public static UploadQueueConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "Properties cannot be null");
        Builder builder = builder()
                .maxConcurrentUploads(getInt(properties, KEY_MAX_CONCURRENT, DEFAULT_MAX_CONCURRENT))
                .maxRetries(getInt(properties, KEY_MAX_RETRIES, DEFAULT_MAX_RETRIES))
                .retryDelayMs(getLong(properties, KEY_RETRY_DELAY_MS, DEFAULT_RETRY_DELAY_MS))
                .chunkSize(getLong(properties, KEY_CHUNK_SIZE, DEFAULT_CHUNK_SIZE))
                .chunkedThreshold(getLong(properties, KEY_CHUNKED_THRESHOLD, DEFAULT_CHUNKED_THRESHOLD))
                .timeoutMs(getLong(properties, KEY_TIMEOUT_MS, DEFAULT_TIMEOUT_MS))
                .admissionDebounceMs(getLong(properties, KEY_ADMISSION_DEBOUNCE_MS, DEFAULT_ADMISSION_DEBOUNCE_MS))
                .bandwidthThrottlingEnabled(getBoolean(properties, KEY_THROTTLING_ENABLED, false))
                .bandwidthSampleIntervalMs(getLong(properties, KEY_BANDWIDTH_SAMPLE_INTERVAL_MS,
                        DEFAULT_BANDWIDTH_SAMPLE_INTERVAL_MS))
                .bandwidthSampleWindow(getInt(properties, KEY_BANDWIDTH_SAMPLE_WINDOW, DEFAULT_BANDWIDTH_SAMPLE_WINDOW))
                .resourceSampleIntervalMs(getLong(properties, KEY_RESOURCE_SAMPLE_INTERVAL_MS,
                        DEFAULT_RESOURCE_SAMPLE_INTERVAL_MS))
                .telemetryEnabled(getBoolean(properties, KEY_TELEMETRY_ENABLED, true));

        long maxBandwidth = getLong(properties, KEY_MAX_BANDWIDTH, -1);
        if (maxBandwidth > 0) {
            builder.maxBandwidth(maxBandwidth);
        }

        for (UploadPriority priority : UploadPriority.values()) {
            String base = PREFIX + "priority." + priority.key();
            builder.priorityLevel(new PriorityLevel(priority,
                    getInt(properties, base + ".weight", priority.getDefaultWeight()),
                    getInt(properties, base + ".max-concurrent", priority.getDefaultMaxConcurrent())));
        }
        return builder.build();
    }

    /**
     * Reject values the scheduler cannot run with.
     *
     * @return this configuration
     * @throws IllegalStateException naming the first offending setting
     */
    public UploadQueueConfig validate() {
        if (maxConcurrentUploads <= 0) {
            throw new IllegalStateException(KEY_MAX_CONCURRENT + " must be > 0, got: " + maxConcurrentUploads);
        }
        if (maxRetries < 0) {
            throw new IllegalStateException(KEY_MAX_RETRIES + " must be >= 0, got: " + maxRetries);
        }
        if (retryDelayMs < 0) {
            throw new IllegalStateException(KEY_RETRY_DELAY_MS + " must be >= 0, got: " + retryDelayMs);
        }
        if (chunkSize <= 0 || chunkSize > Integer.MAX_VALUE) {
            throw new IllegalStateException(KEY_CHUNK_SIZE + " must be between 1 and " + Integer.MAX_VALUE
                    + ", got: " + chunkSize);
        }
        if (chunkedThreshold < 0) {
            throw new IllegalStateException(KEY_CHUNKED_THRESHOLD + " must be >= 0, got: " + chunkedThreshold);
        }
        if (timeoutMs <= 0) {
            throw new IllegalStateException(KEY_TIMEOUT_MS + " must be > 0, got: " + timeoutMs);
        }
        if (admissionDebounceMs <= 0) {
            throw new IllegalStateException(KEY_ADMISSION_DEBOUNCE_MS + " must be > 0, got: " + admissionDebounceMs);
        }
        if (bandwidthSampleIntervalMs <= 0 || resourceSampleIntervalMs <= 0) {
            throw new IllegalStateException("Monitor sample intervals must be > 0");
        }
        if (bandwidthSampleWindow <= 0) {
            throw new IllegalStateException(KEY_BANDWIDTH_SAMPLE_WINDOW + " must be > 0, got: " + bandwidthSampleWindow);
        }
        return this;
    }

    public int getMaxConcurrentUploads() {
        return maxConcurrentUploads;
    }

    /**
     * Total attempts an item gets before it is failed for good.
     */
    public int getMaxRetries() {
        return maxRetries;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    public long getChunkSize() {
        return chunkSize;
    }

    public long getChunkedThreshold() {
        return chunkedThreshold;
    }

    /**
     * How long an uploading item may go without progress.
     */
    public long getTimeoutMs() {
        return timeoutMs;
    }

    public long getAdmissionDebounceMs() {
        return admissionDebounceMs;
    }

    public boolean isBandwidthThrottlingEnabled() {
        return bandwidthThrottlingEnabled;
    }

    /**
     * @return the bandwidth cap in bytes per second, or null when uncapped
     */
    public Long getMaxBandwidth() {
        return maxBandwidth;
    }

    public long getBandwidthSampleIntervalMs() {
        return bandwidthSampleIntervalMs;
    }

    public int getBandwidthSampleWindow() {
        return bandwidthSampleWindow;
    }

    public long getResourceSampleIntervalMs() {
        return resourceSampleIntervalMs;
    }

    public boolean isTelemetryEnabled() {
        return telemetryEnabled;
    }

    public PriorityLevel getPriorityLevel(UploadPriority priority) {
        return priorityLevels.get(priority);
    }

    public Map<UploadPriority, PriorityLevel> getPriorityLevels() {
        return priorityLevels;
    }

    private static void loadFromClasspath(Properties properties) {
        try (InputStream input = UploadQueueConfig.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath: {}", CONFIG_RESOURCE);
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private static void loadFromSystemProperties(Properties properties) {
        System.getProperties().stringPropertyNames().stream()
                .filter(key -> key.startsWith(PREFIX))
                .forEach(key -> {
                    properties.setProperty(key, System.getProperty(key));
                    logger.debug("Override from system property: {}={}", key, System.getProperty(key));
                });
    }

    private static int getInt(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null && !value.isBlank()) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private static long getLong(Properties properties, String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null && !value.isBlank()) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private static boolean getBoolean(Properties properties, String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null && !value.isBlank()) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    @Override
    public String toString() {
        return "UploadQueueConfig{" +
                "maxConcurrentUploads=" + maxConcurrentUploads +
                ", maxRetries=" + maxRetries +
                ", retryDelayMs=" + retryDelayMs +
                ", chunkSize=" + chunkSize +
                ", timeoutMs=" + timeoutMs +
                ", throttling=" + bandwidthThrottlingEnabled +
                (maxBandwidth != null ? ", maxBandwidth=" + maxBandwidth : "") +
                ", priorityLevels=" + priorityLevels.values() +
                '}';
    }

    public static final class Builder {
        private int maxConcurrentUploads = DEFAULT_MAX_CONCURRENT;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private long retryDelayMs = DEFAULT_RETRY_DELAY_MS;
        private long chunkSize = DEFAULT_CHUNK_SIZE;
        private long chunkedThreshold = DEFAULT_CHUNKED_THRESHOLD;
        private long timeoutMs = DEFAULT_TIMEOUT_MS;
        private long admissionDebounceMs = DEFAULT_ADMISSION_DEBOUNCE_MS;
        private boolean bandwidthThrottlingEnabled;
        private Long maxBandwidth;
        private long bandwidthSampleIntervalMs = DEFAULT_BANDWIDTH_SAMPLE_INTERVAL_MS;
        private int bandwidthSampleWindow = DEFAULT_BANDWIDTH_SAMPLE_WINDOW;
        private long resourceSampleIntervalMs = DEFAULT_RESOURCE_SAMPLE_INTERVAL_MS;
        private boolean telemetryEnabled = true;
        private final Map<UploadPriority, PriorityLevel> priorityLevels = new EnumMap<>(UploadPriority.class);

        private Builder() {
            for (UploadPriority priority : UploadPriority.values()) {
                priorityLevels.put(priority, PriorityLevel.defaultFor(priority));
            }
        }

        public Builder maxConcurrentUploads(int maxConcurrentUploads) {
            this.maxConcurrentUploads = maxConcurrentUploads;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelayMs(long retryDelayMs) {
            this.retryDelayMs = retryDelayMs;
            return this;
        }

        public Builder chunkSize(long chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder chunkedThreshold(long chunkedThreshold) {
            this.chunkedThreshold = chunkedThreshold;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder admissionDebounceMs(long admissionDebounceMs) {
            this.admissionDebounceMs = admissionDebounceMs;
            return this;
        }

        public Builder bandwidthThrottlingEnabled(boolean enabled) {
            this.bandwidthThrottlingEnabled = enabled;
            return this;
        }

        public Builder maxBandwidth(Long bytesPerSecond) {
            this.maxBandwidth = bytesPerSecond;
            return this;
        }

        public Builder bandwidthSampleIntervalMs(long intervalMs) {
            this.bandwidthSampleIntervalMs = intervalMs;
            return this;
        }

        public Builder bandwidthSampleWindow(int window) {
            this.bandwidthSampleWindow = window;
            return this;
        }

        public Builder resourceSampleIntervalMs(long intervalMs) {
            this.resourceSampleIntervalMs = intervalMs;
            return this;
        }

        public Builder telemetryEnabled(boolean enabled) {
            this.telemetryEnabled = enabled;
            return this;
        }

        public Builder priorityLevel(PriorityLevel level) {
            this.priorityLevels.put(level.getPriority(), level);
            return this;
        }

        public Builder priorityLevel(UploadPriority priority, int weight, int maxConcurrent) {
            return priorityLevel(new PriorityLevel(priority, weight, maxConcurrent));
        }

        public UploadQueueConfig build() {
            return new UploadQueueConfig(this);
        }
    }
}
