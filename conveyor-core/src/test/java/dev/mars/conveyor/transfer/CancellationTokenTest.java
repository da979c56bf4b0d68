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

package dev.mars.conveyor.transfer;

import dev.mars.conveyor.core.exceptions.UploadCancelledException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CancellationToken Tests")
class CancellationTokenTest {

    @Test
    @DisplayName("The first reason wins and handlers run once")
    void testFiresOnce() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        assertThat(token.cancel(CancellationToken.Reason.PAUSED)).isTrue();
        assertThat(token.cancel(CancellationToken.Reason.CANCELLED)).isFalse();

        assertThat(token.getReason()).isEqualTo(CancellationToken.Reason.PAUSED);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("A handler added after firing runs immediately")
    void testLateHandler() {
        CancellationToken token = new CancellationToken();
        token.cancel(CancellationToken.Reason.TIMEOUT);
        AtomicInteger calls = new AtomicInteger();

        token.onCancel(calls::incrementAndGet);

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("A failing handler does not stop the others")
    void testFailingHandler() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(calls::incrementAndGet);

        token.cancel(CancellationToken.Reason.REMOVED);

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("throwIfCancelled reports the reason")
    void testThrowIfCancelled() {
        CancellationToken token = new CancellationToken();
        assertThatCode(() -> token.throwIfCancelled("item")).doesNotThrowAnyException();

        token.cancel(CancellationToken.Reason.SHUTDOWN);

        assertThatThrownBy(() -> token.throwIfCancelled("item"))
                .isInstanceOf(UploadCancelledException.class)
                .satisfies(e -> assertThat(((UploadCancelledException) e).getReason())
                        .isEqualTo(CancellationToken.Reason.SHUTDOWN));
    }
}
