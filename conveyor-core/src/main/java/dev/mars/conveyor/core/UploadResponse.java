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
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the receiver returned for one upload, chunk, segment or finalize call.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class UploadResponse {

    private final String uploadId;
    private final String location;
    private final long bytesReceived;
    private final String checksum;
    private final Map<String, Object> attributes;

    @JsonCreator
    public UploadResponse(@JsonProperty("uploadId") String uploadId,
                          @JsonProperty("location") String location,
                          @JsonProperty("bytesReceived") long bytesReceived,
                          @JsonProperty("checksum") String checksum,
                          @JsonProperty("attributes") Map<String, Object> attributes) {
        this.uploadId = uploadId;
        this.location = location;
        this.bytesReceived = bytesReceived;
        this.checksum = checksum;
        this.attributes = attributes == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static UploadResponse of(String uploadId, long bytesReceived) {
        return new UploadResponse(uploadId, null, bytesReceived, null, null);
    }

    @JsonProperty("uploadId")
    public String getUploadId() {
        return uploadId;
    }

    @JsonProperty("location")
    public String getLocation() {
        return location;
    }

    /**
     * Bytes the receiver acknowledged for this call.
     */
    @JsonProperty("bytesReceived")
    public long getBytesReceived() {
        return bytesReceived;
    }

    /**
     * SHA-256 hex the receiver computed, or null if it does not report one.
     */
    @JsonProperty("checksum")
    public String getChecksum() {
        return checksum;
    }

    @JsonProperty("attributes")
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return "UploadResponse{uploadId=" + uploadId + ", bytesReceived=" + bytesReceived + '}';
    }
}
