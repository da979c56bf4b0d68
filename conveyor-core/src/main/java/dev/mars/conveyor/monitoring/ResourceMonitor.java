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

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.DoubleSupplier;

/**
 * Periodically reads heap, process CPU, upload bandwidth and temp-store usage.
 *
 * <p>Periodic readings run on a Vert.x worker thread. Reads go through the platform MXBeans. Process CPU load is only available on JVMs that
 * expose {@code com.sun.management.OperatingSystemMXBean}; elsewhere it is reported as -1.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ResourceMonitor {

    private static final Logger logger = LoggerFactory.getLogger(ResourceMonitor.class);

    private final Vertx vertx;
    private final long intervalMs;
    private final DoubleSupplier networkSpeedSource;
    private final Path storagePath;
    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
    private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();
    private final AtomicReference<ResourceUsage> latest = new AtomicReference<>();
    private long timerId = -1;

    public ResourceMonitor(Vertx vertx, long intervalMs, DoubleSupplier networkSpeedSource) {
        this(vertx, intervalMs, networkSpeedSource, Paths.get(System.getProperty("java.io.tmpdir")));
    }

    public ResourceMonitor(Vertx vertx, long intervalMs, DoubleSupplier networkSpeedSource, Path storagePath) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.intervalMs = intervalMs;
        this.networkSpeedSource = Objects.requireNonNull(networkSpeedSource, "Network source cannot be null");
        this.storagePath = storagePath;
    }

    public synchronized void start() {
        if (timerId >= 0) {
            return;
        }
        sampleInBackground();
        timerId = vertx.setPeriodic(intervalMs, id -> sampleInBackground());
        logger.debug("Resource monitor sampling every {} ms", intervalMs);
    }

    public synchronized void stop() {
        if (timerId >= 0) {
            vertx.cancelTimer(timerId);
            timerId = -1;
        }
    }

    /**
     * Take a reading now and keep it as the latest.
     */
    public ResourceUsage sample() {
        MemoryUsage heap = memoryBean.getHeapMemoryUsage();
        ResourceUsage usage = ResourceUsage.builder()
                .heapUsedBytes(heap.getUsed())
                .heapCommittedBytes(heap.getCommitted())
                .heapMaxBytes(heap.getMax())
                .cpuLoadPercent(readCpuLoad())
                .networkBytesPerSecond(networkSpeedSource.getAsDouble())
                .storageUsedBytes(readStorageUsed())
                .build();
        latest.set(usage);
        return usage;
    }

    /**
     * Take a reading on a worker thread; file store queries may block.
     */
    Future<ResourceUsage> sampleInBackground() {
        return vertx.executeBlocking(this::sample, false)
                .onFailure(e -> logger.warn("Resource sample failed: {}", e.getMessage(), e));
    }

    /**
     * The most recent reading, taken now if none exists yet.
     */
    public ResourceUsage getLatest() {
        ResourceUsage usage = latest.get();
        return usage != null ? usage : sample();
    }

    private double readCpuLoad() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
            double load = sunBean.getProcessCpuLoad();
            return load < 0 ? -1 : Math.min(100.0, load * 100.0);
        }
        return -1;
    }

    private long readStorageUsed() {
        if (storagePath == null) {
            return -1;
        }
        try {
            FileStore store = Files.getFileStore(storagePath);
            return store.getTotalSpace() - store.getUsableSpace();
        } catch (IOException e) {
            logger.debug("Cannot read file store for {}: {}", storagePath, e.getMessage());
            return -1;
        }
    }
}
