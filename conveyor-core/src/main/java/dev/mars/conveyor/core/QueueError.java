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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of one classified failure of a queue item.
 *
 * <p>Errors are appended to {@link QueueItem#getErrors()} and never removed, so the list is the
 * full failure history of an item across automatic and manual retries.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class QueueError {

    private final Instant timestamp;
    private final ErrorType type;
    private final String message;
    private final String code;
    private final Integer statusCode;
    private final boolean retryable;
    private final Map<String, Object> details;

    private QueueError(Builder builder) {
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
        this.type = Objects.requireNonNull(builder.type, "Error type cannot be null");
        this.message = builder.message != null ? builder.message : type.key() + " error";
        this.code = builder.code;
        this.statusCode = builder.statusCode;
        this.retryable = builder.retryable;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(builder.details));
    }

    @JsonCreator
    static QueueError fromJson(@JsonProperty("timestamp") Instant timestamp,
                               @JsonProperty("type") ErrorType type,
                               @JsonProperty("message") String message,
                               @JsonProperty("code") String code,
                               @JsonProperty("statusCode") Integer statusCode,
                               @JsonProperty("retryable") boolean retryable,
                               @JsonProperty("details") Map<String, Object> details) {
        Builder builder = builder(type)
                .timestamp(timestamp)
                .message(message)
                .code(code)
                .statusCode(statusCode)
                .retryable(retryable);
        if (details != null) {
            details.forEach(builder::detail);
        }
        return builder.build();
    }

    public static Builder builder(ErrorType type) {
        return new Builder(type);
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonProperty("type")
    public ErrorType getType() {
        return type;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @JsonProperty("code")
    public String getCode() {
        return code;
    }

    @JsonProperty("statusCode")
    public Integer getStatusCode() {
        return statusCode;
    }

    @JsonProperty("retryable")
    public boolean isRetryable() {
        return retryable;
    }

    @JsonProperty("details")
    public Map<String, Object> getDetails() {
        return details;
    }

    /**
     * Copy of this error with one more detail entry.
     */
    public QueueError withDetail(String key, Object value) {
        Builder builder = builder(type)
                .timestamp(timestamp)
                .message(message)
                .code(code)
                .statusCode(statusCode)
                .retryable(retryable);
        details.forEach(builder::detail);
        return builder.detail(key, value).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueueError that = (QueueError) o;
        return retryable == that.retryable
                && timestamp.equals(that.timestamp)
                && type == that.type
                && message.equals(that.message)
                && Objects.equals(code, that.code)
                && Objects.equals(statusCode, that.statusCode)
                && details.equals(that.details);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, type, message, code, statusCode, retryable, details);
    }

    @Override
    public String toString() {
        return "QueueError{" +
                "type=" + type +
                ", message='" + message + '\'' +
                (code != null ? ", code=" + code : "") +
                (statusCode != null ? ", status=" + statusCode : "") +
                ", retryable=" + retryable +
                '}';
    }

    public static final class Builder {
        private final ErrorType type;
        private Instant timestamp;
        private String message;
        private String code;
        private Integer statusCode;
        private boolean retryable;
        private final Map<String, Object> details = new LinkedHashMap<>();

        private Builder(ErrorType type) {
            this.type = type;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder code(String code) {
            this.code = code;
            return this;
        }

        public Builder statusCode(Integer statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        public Builder retryable(boolean retryable) {
            this.retryable = retryable;
            return this;
        }

        public Builder detail(String key, Object value) {
            if (key != null && value != null) {
                this.details.put(key, value);
            }
            return this;
        }

        public QueueError build() {
            return new QueueError(this);
        }
    }
}
