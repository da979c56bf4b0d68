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

package dev.mars.conveyor.config;

import dev.mars.conveyor.core.UploadPriority;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("UploadQueueConfig Tests")
class UploadQueueConfigTest {

    @AfterEach
    void clearOverrides() {
        System.clearProperty(UploadQueueConfig.KEY_MAX_CONCURRENT);
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("Defaults match the documented values")
        void testDefaults() {
            UploadQueueConfig config = UploadQueueConfig.defaults();

            assertThat(config.getMaxConcurrentUploads()).isEqualTo(3);
            assertThat(config.getMaxRetries()).isEqualTo(3);
            assertThat(config.getRetryDelayMs()).isEqualTo(1000);
            assertThat(config.getChunkSize()).isEqualTo(1024 * 1024);
            assertThat(config.getChunkedThreshold()).isEqualTo(10L * 1024 * 1024);
            assertThat(config.getTimeoutMs()).isEqualTo(30_000);
            assertThat(config.getMaxBandwidth()).isNull();
            assertThat(config.getPriorityLevel(UploadPriority.URGENT).getWeight()).isEqualTo(100);
            assertThat(config.getPriorityLevel(UploadPriority.LOW).getMaxConcurrent()).isEqualTo(1);
        }

        @Test
        @DisplayName("A copied builder keeps every value it is not told to change")
        void testToBuilder() {
            UploadQueueConfig original = UploadQueueConfig.builder()
                    .maxConcurrentUploads(5)
                    .timeoutMs(9000)
                    .maxBandwidth(4096L)
                    .telemetryEnabled(false)
                    .priorityLevel(UploadPriority.LOW, 10, 2)
                    .build();

            UploadQueueConfig changed = original.toBuilder().maxRetries(7).build();

            assertThat(changed.getMaxRetries()).isEqualTo(7);
            assertThat(changed.getMaxConcurrentUploads()).isEqualTo(5);
            assertThat(changed.getTimeoutMs()).isEqualTo(9000);
            assertThat(changed.getMaxBandwidth()).isEqualTo(4096L);
            assertThat(changed.isTelemetryEnabled()).isFalse();
            assertThat(changed.getPriorityLevel(UploadPriority.LOW).getMaxConcurrent()).isEqualTo(2);
            assertThat(original.getMaxRetries()).isEqualTo(3);
        }

        @Test
        @DisplayName("Properties override defaults key by key")
        void testFromProperties() {
            Properties properties = new Properties();
            properties.setProperty(UploadQueueConfig.KEY_MAX_CONCURRENT, "5");
            properties.setProperty(UploadQueueConfig.KEY_RETRY_DELAY_MS, " 250 ");
            properties.setProperty(UploadQueueConfig.KEY_THROTTLING_ENABLED, "true");
            properties.setProperty(UploadQueueConfig.KEY_MAX_BANDWIDTH, "1048576");
            properties.setProperty("conveyor.priority.low.weight", "10");
            properties.setProperty("conveyor.priority.low.max-concurrent", "4");

            UploadQueueConfig config = UploadQueueConfig.fromProperties(properties);

            assertThat(config.getMaxConcurrentUploads()).isEqualTo(5);
            assertThat(config.getRetryDelayMs()).isEqualTo(250);
            assertThat(config.isBandwidthThrottlingEnabled()).isTrue();
            assertThat(config.getMaxBandwidth()).isEqualTo(1048576L);
            assertThat(config.getPriorityLevel(UploadPriority.LOW).getWeight()).isEqualTo(10);
            assertThat(config.getPriorityLevel(UploadPriority.LOW).getMaxConcurrent()).isEqualTo(4);
            assertThat(config.getMaxRetries()).isEqualTo(3);
        }

        @Test
        @DisplayName("Unparseable values fall back to the default")
        void testInvalidValues() {
            Properties properties = new Properties();
            properties.setProperty(UploadQueueConfig.KEY_MAX_CONCURRENT, "many");
            properties.setProperty(UploadQueueConfig.KEY_TIMEOUT_MS, "");

            UploadQueueConfig config = UploadQueueConfig.fromProperties(properties);

            assertThat(config.getMaxConcurrentUploads()).isEqualTo(3);
            assertThat(config.getTimeoutMs()).isEqualTo(30_000);
        }

        @Test
        @DisplayName("System properties win over the classpath file")
        void testSystemPropertyOverride() {
            System.setProperty(UploadQueueConfig.KEY_MAX_CONCURRENT, "9");

            UploadQueueConfig config = UploadQueueConfig.load();

            assertThat(config.getMaxConcurrentUploads()).isEqualTo(9);
            assertThat(config.getChunkSize()).isEqualTo(1048576);
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Zero concurrency is rejected")
        void testZeroConcurrency() {
            UploadQueueConfig config = UploadQueueConfig.builder().maxConcurrentUploads(0).build();

            assertThatThrownBy(config::validate)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining(UploadQueueConfig.KEY_MAX_CONCURRENT);
        }

        @Test
        @DisplayName("Negative timings are rejected")
        void testNegativeTimings() {
            assertThatThrownBy(() -> UploadQueueConfig.builder().retryDelayMs(-1).build().validate())
                    .hasMessageContaining(UploadQueueConfig.KEY_RETRY_DELAY_MS);
            assertThatThrownBy(() -> UploadQueueConfig.builder().timeoutMs(0).build().validate())
                    .hasMessageContaining(UploadQueueConfig.KEY_TIMEOUT_MS);
            assertThatThrownBy(() -> UploadQueueConfig.builder().chunkSize(0).build().validate())
                    .hasMessageContaining(UploadQueueConfig.KEY_CHUNK_SIZE);
        }

        @Test
        @DisplayName("Chunk sizes beyond a single readable range are rejected")
        void testOversizedChunk() {
            assertThatThrownBy(() -> UploadQueueConfig.builder().chunkSize(Integer.MAX_VALUE + 1L).build().validate())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining(UploadQueueConfig.KEY_CHUNK_SIZE);

            UploadQueueConfig largest = UploadQueueConfig.builder().chunkSize(Integer.MAX_VALUE).build();
            assertThat(largest.validate().getChunkSize()).isEqualTo(Integer.MAX_VALUE);
        }

        @Test
        @DisplayName("Zero retries is a valid single-attempt policy")
        void testZeroRetries() {
            UploadQueueConfig config = UploadQueueConfig.builder().maxRetries(0).build();

            assertThat(config.validate()).isSameAs(config);
        }
    }
}
