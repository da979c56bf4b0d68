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

import java.util.Locale;

/**
 * Priority tier of a queued upload.
 *
 * <p>Each tier carries a default scheduling weight and a default cap on how many of its
 * items may transfer at once. The effective values come from
 * {@link dev.mars.conveyor.config.UploadQueueConfig#getPriorityLevel(UploadPriority)}, which
 * starts from these defaults. Higher weight is admitted first; within a tier items are
 * admitted in enqueue order.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum UploadPriority {

    /**
     * Uploads the caller is actively waiting on.
     */
    URGENT(100, 2),

    /**
     * Uploads that should overtake routine work.
     */
    HIGH(75, 2),

    /**
     * Default tier.
     */
    NORMAL(50, 3),

    /**
     * Background uploads, admitted when nothing heavier is waiting.
     */
    LOW(25, 1);

    private final int defaultWeight;
    private final int defaultMaxConcurrent;

    UploadPriority(int defaultWeight, int defaultMaxConcurrent) {
        this.defaultWeight = defaultWeight;
        this.defaultMaxConcurrent = defaultMaxConcurrent;
    }

    public int getDefaultWeight() {
        return defaultWeight;
    }

    public int getDefaultMaxConcurrent() {
        return defaultMaxConcurrent;
    }

    /**
     * The configuration key segment for this tier, e.g. {@code urgent}.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a priority from its name, case-insensitive.
     *
     * @param value the name to parse, null or blank yields {@link #NORMAL}
     * @return the matching priority
     * @throws IllegalArgumentException if the value is not a known tier
     */
    public static UploadPriority fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            return NORMAL;
        }
        try {
            return UploadPriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid upload priority: " + value, e);
        }
    }
}
