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
 * One bandwidth reading.
 *
 * @param timestamp        when the sample was taken
 * @param bytesTransferred bytes acknowledged since the previous sample
 * @param speed            aggregate speed of all active uploads, bytes per second
 */
public record SpeedSample(@JsonProperty("timestamp") Instant timestamp,
                          @JsonProperty("bytesTransferred") long bytesTransferred,
                          @JsonProperty("speed") double speed) {
}
