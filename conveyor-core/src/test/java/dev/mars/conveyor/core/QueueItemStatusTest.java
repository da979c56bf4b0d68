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

import dev.mars.conveyor.core.exceptions.InvalidTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("QueueItemStatus Tests")
class QueueItemStatusTest {

    @Test
    @DisplayName("Should allow the documented lifecycle")
    void testValidTransitions() {
        assertThat(QueueItemStatus.QUEUED.getValidTransitions())
                .containsExactlyInAnyOrder(QueueItemStatus.UPLOADING, QueueItemStatus.CANCELLED);
        assertThat(QueueItemStatus.UPLOADING.getValidTransitions())
                .containsExactlyInAnyOrder(QueueItemStatus.PROCESSING, QueueItemStatus.COMPLETED,
                        QueueItemStatus.FAILED, QueueItemStatus.PAUSED, QueueItemStatus.CANCELLED);
        assertThat(QueueItemStatus.PAUSED.getValidTransitions())
                .containsExactlyInAnyOrder(QueueItemStatus.QUEUED, QueueItemStatus.CANCELLED);
        assertThat(QueueItemStatus.FAILED.getValidTransitions())
                .containsExactlyInAnyOrder(QueueItemStatus.QUEUED, QueueItemStatus.CANCELLED);
    }

    @ParameterizedTest
    @EnumSource(value = QueueItemStatus.class, names = {"COMPLETED", "CANCELLED"})
    @DisplayName("Terminal states go nowhere")
    void testTerminal(QueueItemStatus status) {
        assertThat(status.isTerminal()).isTrue();
        assertThat(status.isCancellable()).isFalse();
        assertThat(status.getValidTransitions()).isEmpty();
    }

    @Test
    @DisplayName("Only uploading and processing hold a slot")
    void testActive() {
        assertThat(QueueItemStatus.UPLOADING.isActive()).isTrue();
        assertThat(QueueItemStatus.PROCESSING.isActive()).isTrue();
        assertThat(QueueItemStatus.PAUSED.isActive()).isFalse();
        assertThat(QueueItemStatus.FAILED.isTerminal()).isFalse();
    }

    @Test
    @DisplayName("validateTransition should explain a refused move")
    void testValidateTransition() {
        assertThatCode(() -> QueueItemStatus.QUEUED.validateTransition("item-1", QueueItemStatus.UPLOADING))
                .doesNotThrowAnyException();

        assertThatThrownBy(() -> QueueItemStatus.QUEUED.validateTransition("item-1", QueueItemStatus.PAUSED))
                .isInstanceOf(InvalidTransitionException.class)
                .satisfies(e -> {
                    InvalidTransitionException ite = (InvalidTransitionException) e;
                    assertThat(ite.getItemId()).isEqualTo("item-1");
                    assertThat(ite.getCurrentState()).isEqualTo(QueueItemStatus.QUEUED);
                    assertThat(ite.getRequestedState()).isEqualTo(QueueItemStatus.PAUSED);
                    assertThat(ite.getValidTransitions()).contains(QueueItemStatus.UPLOADING);
                });
    }
}
