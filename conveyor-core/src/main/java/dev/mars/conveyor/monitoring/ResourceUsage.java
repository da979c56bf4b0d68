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

package dev.mars.conveyor.monitoring;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Process resource reading taken by the {@link ResourceMonitor}.
 *
 * <p>Values the JVM cannot report are -1.</p>
 */
public final class ResourceUsage {

    private final Instant timestamp;
    private final long heapUsedBytes;
    private final long heapCommittedBytes;
    private final long heapMaxBytes;
    private final double cpuLoadPercent;
    private final double networkBytesPerSecond;
    private final long storageUsedBytes;

    private ResourceUsage(Builder builder) {
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
        this.heapUsedBytes = builder.heapUsedBytes;
        this.heapCommittedBytes = builder.heapCommittedBytes;
        this.heapMaxBytes = builder.heapMaxBytes;
        this.cpuLoadPercent = builder.cpuLoadPercent;
        this.networkBytesPerSecond = builder.networkBytesPerSecond;
        this.storageUsedBytes = builder.storageUsedBytes;
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() { return timestamp; }

    @JsonProperty("heapUsedBytes")
    public long getHeapUsedBytes() { return heapUsedBytes; }

    @JsonProperty("heapCommittedBytes")
    public long getHeapCommittedBytes() { return heapCommittedBytes; }

    @JsonProperty("heapMaxBytes")
    public long getHeapMaxBytes() { return heapMaxBytes; }

    @JsonProperty("cpuLoadPercent")
    public double getCpuLoadPercent() { return cpuLoadPercent; }

    @JsonProperty("networkBytesPerSecond")
    public double getNetworkBytesPerSecond() { return networkBytesPerSecond; }

    @JsonProperty("storageUsedBytes")
    public long getStorageUsedBytes() { return storageUsedBytes; }

    /**
     * Heap used as a percentage of the maximum, or -1 when the maximum is undefined.
     */
    public double getHeapUsagePercent() {
        if (heapMaxBytes <= 0) {
            return -1;
        }
        return heapUsedBytes * 100.0 / heapMaxBytes;
    }

    @Override
    public String toString() {
        return String.format("ResourceUsage{heap=%d/%d, cpu=%.1f%%, network=%.0f B/s, storage=%d}",
                heapUsedBytes, heapMaxBytes, cpuLoadPercent, networkBytesPerSecond, storageUsedBytes);
    }

    public static class Builder {
        private Instant timestamp;
        private long heapUsedBytes = -1;
        private long heapCommittedBytes = -1;
        private long heapMaxBytes = -1;
        private double cpuLoadPercent = -1;
        private double networkBytesPerSecond;
        private long storageUsedBytes = -1;

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder heapUsedBytes(long heapUsedBytes) {
            this.heapUsedBytes = heapUsedBytes;
            return this;
        }

        public Builder heapCommittedBytes(long heapCommittedBytes) {
            this.heapCommittedBytes = heapCommittedBytes;
            return this;
        }

        public Builder heapMaxBytes(long heapMaxBytes) {
            this.heapMaxBytes = heapMaxBytes;
            return this;
        }

        public Builder cpuLoadPercent(double cpuLoadPercent) {
            this.cpuLoadPercent = cpuLoadPercent;
            return this;
        }

        public Builder networkBytesPerSecond(double networkBytesPerSecond) {
            this.networkBytesPerSecond = networkBytesPerSecond;
            return this;
        }

        public Builder storageUsedBytes(long storageUsedBytes) {
            this.storageUsedBytes = storageUsedBytes;
            return this;
        }

        public ResourceUsage build() {
            return new ResourceUsage(this);
        }
    }
}
