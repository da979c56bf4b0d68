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

import dev.mars.conveyor.config.UploadQueueConfig;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Objects;
import java.util.function.DoubleSupplier;
import java.util.function.LongSupplier;

/**
 * Samples the aggregate upload speed on a fixed period and keeps a bounded window of samples.
 *
 * <p>The monitor only reads from the scheduler through the two suppliers it is given: the summed
 * speed of active uploads and a running total of acknowledged bytes. It never touches queue
 * state. Throttling is reported, not enforced: {@link BandwidthSnapshot#isThrottled()} is true
 * when throttling is enabled, a cap is configured and the current speed is above it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class BandwidthMonitor {

    private static final Logger logger = LoggerFactory.getLogger(BandwidthMonitor.class);

    private final Vertx vertx;
    private final DoubleSupplier speedSource;
    private final LongSupplier uploadedBytesSource;
    private final long intervalMs;
    private final int window;
    private final boolean throttlingEnabled;
    private final Long maxBandwidth;

    private final Deque<SpeedSample> samples = new ArrayDeque<>();
    private double currentSpeed;
    private double peakSpeed;
    private long lastUploadedBytes;
    private long timerId = -1;

    public BandwidthMonitor(Vertx vertx, UploadQueueConfig config, DoubleSupplier speedSource,
                            LongSupplier uploadedBytesSource) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.speedSource = Objects.requireNonNull(speedSource, "Speed source cannot be null");
        this.uploadedBytesSource = Objects.requireNonNull(uploadedBytesSource, "Byte source cannot be null");
        this.intervalMs = config.getBandwidthSampleIntervalMs();
        this.window = config.getBandwidthSampleWindow();
        this.throttlingEnabled = config.isBandwidthThrottlingEnabled();
        this.maxBandwidth = config.getMaxBandwidth();
    }

    public synchronized void start() {
        if (timerId >= 0) {
            return;
        }
        lastUploadedBytes = uploadedBytesSource.getAsLong();
        timerId = vertx.setPeriodic(intervalMs, id -> sample());
        logger.debug("Bandwidth monitor sampling every {} ms, window {}", intervalMs, window);
    }

    public synchronized void stop() {
        if (timerId >= 0) {
            vertx.cancelTimer(timerId);
            timerId = -1;
        }
    }

    /**
     * Take one sample now. Called by the periodic timer.
     */
    public synchronized SpeedSample sample() {
        double speed = Math.max(0, speedSource.getAsDouble());
        long uploaded = uploadedBytesSource.getAsLong();
        long delta = Math.max(0, uploaded - lastUploadedBytes);
        lastUploadedBytes = uploaded;

        SpeedSample sample = new SpeedSample(Instant.now(), delta, speed);
        samples.addLast(sample);
        while (samples.size() > window) {
            samples.removeFirst();
        }
        currentSpeed = speed;
        peakSpeed = Math.max(peakSpeed, speed);

        if (isThrottled()) {
            logger.debug("Current upload speed {} B/s exceeds cap {} B/s", (long) speed, maxBandwidth);
        }
        return sample;
    }

    public synchronized double getCurrentSpeed() {
        return currentSpeed;
    }

    public synchronized double getAverageSpeed() {
        if (samples.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (SpeedSample sample : samples) {
            sum += sample.speed();
        }
        return sum / samples.size();
    }

    public synchronized double getPeakSpeed() {
        return peakSpeed;
    }

    public synchronized boolean isThrottled() {
        return throttlingEnabled && maxBandwidth != null && currentSpeed > maxBandwidth;
    }

    public synchronized BandwidthSnapshot snapshot() {
        return new BandwidthSnapshot(currentSpeed, getAverageSpeed(), peakSpeed, new ArrayList<>(samples),
                isThrottled());
    }

    /**
     * Drop all samples and the running peak.
     */
    public synchronized void reset() {
        samples.clear();
        currentSpeed = 0;
        peakSpeed = 0;
        lastUploadedBytes = uploadedBytesSource.getAsLong();
    }
}
