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

import dev.mars.conveyor.core.QueueError;
import dev.mars.conveyor.core.QueueItem;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A lifecycle notification for one queue item.
 *
 * <p>{@link #getItem()} is a copy of the item taken when the event was raised. The data map holds
 * event-specific entries under the {@code KEY_*} names.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class UploadEvent {

    public static final String KEY_ERROR = "error";
    public static final String KEY_WILL_RETRY = "willRetry";
    public static final String KEY_RETRY_DELAY_MS = "retryDelayMs";
    public static final String KEY_ATTEMPT = "attempt";
    public static final String KEY_REASON = "reason";
    public static final String KEY_RESPONSE = "response";
    public static final String KEY_AUTOMATIC = "automatic";
    public static final String KEY_DURATION_MS = "durationMs";

    public static final String REASON_CANCELLED = "cancelled";
    public static final String REASON_REMOVED = "removed";

    private final UploadEventType type;
    private final String sessionId;
    private final String itemId;
    private final QueueItem item;
    private final Map<String, Object> data;
    private final Instant timestamp;

    public UploadEvent(UploadEventType type, QueueItem item, Map<String, Object> data) {
        this.type = Objects.requireNonNull(type, "Event type cannot be null");
        this.item = Objects.requireNonNull(item, "Item cannot be null");
        this.sessionId = item.getSessionId();
        this.itemId = item.getId();
        this.data = data == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.timestamp = Instant.now();
    }

    public UploadEventType getType() {
        return type;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getItemId() {
        return itemId;
    }

    public QueueItem getItem() {
        return item;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return the error carried by a FAILED event, or null
     */
    public QueueError getError() {
        return data.get(KEY_ERROR) instanceof QueueError error ? error : null;
    }

    /**
     * Whether a FAILED event leaves an automatic retry pending.
     */
    public boolean willRetry() {
        return Boolean.TRUE.equals(data.get(KEY_WILL_RETRY));
    }

    @Override
    public String toString() {
        return "UploadEvent{" + type + " item=" + itemId + " session=" + sessionId +
                (data.isEmpty() ? "" : " " + data) + '}';
    }
}
