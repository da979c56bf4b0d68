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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Scheduling weight and concurrency cap bound to one {@link UploadPriority} tier.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class PriorityLevel {

    private final UploadPriority priority;
    private final int weight;
    private final int maxConcurrent;

    @JsonCreator
    public PriorityLevel(@JsonProperty("priority") UploadPriority priority,
                         @JsonProperty("weight") int weight,
                         @JsonProperty("maxConcurrent") int maxConcurrent) {
        this.priority = Objects.requireNonNull(priority, "Priority cannot be null");
        if (maxConcurrent < 0) {
            throw new IllegalArgumentException("maxConcurrent must be >= 0, got: " + maxConcurrent);
        }
        this.weight = weight;
        this.maxConcurrent = maxConcurrent;
    }

    /**
     * The built-in level for a tier.
     */
    public static PriorityLevel defaultFor(UploadPriority priority) {
        return new PriorityLevel(priority, priority.getDefaultWeight(), priority.getDefaultMaxConcurrent());
    }

    @JsonProperty("priority")
    public UploadPriority getPriority() {
        return priority;
    }

    @JsonProperty("weight")
    public int getWeight() {
        return weight;
    }

    @JsonProperty("maxConcurrent")
    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PriorityLevel that = (PriorityLevel) o;
        return weight == that.weight && maxConcurrent == that.maxConcurrent && priority == that.priority;
    }

    @Override
    public int hashCode() {
        return Objects.hash(priority, weight, maxConcurrent);
    }

    @Override
    public String toString() {
        return "PriorityLevel{" + priority.key() + ", weight=" + weight + ", maxConcurrent=" + maxConcurrent + '}';
    }
}
