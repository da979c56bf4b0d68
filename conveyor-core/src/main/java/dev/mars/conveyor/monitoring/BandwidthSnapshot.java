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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Point-in-time view of the bandwidth monitor.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class BandwidthSnapshot {

    private final double currentSpeed;
    private final double averageSpeed;
    private final double peakSpeed;
    private final List<SpeedSample> samples;
    private final boolean throttled;

    @JsonCreator
    public BandwidthSnapshot(@JsonProperty("currentSpeed") double currentSpeed,
                             @JsonProperty("averageSpeed") double averageSpeed,
                             @JsonProperty("peakSpeed") double peakSpeed,
                             @JsonProperty("samples") List<SpeedSample> samples,
                             @JsonProperty("throttled") boolean throttled) {
        this.currentSpeed = currentSpeed;
        this.averageSpeed = averageSpeed;
        this.peakSpeed = peakSpeed;
        this.samples = samples == null ? List.of() : List.copyOf(samples);
        this.throttled = throttled;
    }

    @JsonProperty("currentSpeed")
    public double getCurrentSpeed() {
        return currentSpeed;
    }

    /**
     * Mean speed over the samples still in the window.
     */
    @JsonProperty("averageSpeed")
    public double getAverageSpeed() {
        return averageSpeed;
    }

    /**
     * Highest speed seen since the monitor started, including samples that left the window.
     */
    @JsonProperty("peakSpeed")
    public double getPeakSpeed() {
        return peakSpeed;
    }

    /**
     * Samples in the window, oldest first.
     */
    @JsonProperty("samples")
    public List<SpeedSample> getSamples() {
        return samples;
    }

    @JsonProperty("throttled")
    public boolean isThrottled() {
        return throttled;
    }

    @Override
    public String toString() {
        return String.format("BandwidthSnapshot{current=%.0f B/s, average=%.0f B/s, peak=%.0f B/s, samples=%d, throttled=%s}",
                currentSpeed, averageSpeed, peakSpeed, samples.size(), throttled);
    }
}
