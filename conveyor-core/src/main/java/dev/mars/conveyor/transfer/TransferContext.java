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

import dev.mars.conveyor.core.QueueItem;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Everything an executor needs for one transfer attempt: a snapshot of the item taken at
 * admission, the attempt's cancellation token and the listener that reports back.
 *
 * <p>The snapshot is private to the attempt. Chunk and progress changes flow back through the
 * {@link TransferListener}; the snapshot itself is never written back.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class TransferContext {

    private final QueueItem item;
    private final long attempt;
    private final CancellationToken token;
    private final TransferListener listener;
    private final long startNanos;

    public TransferContext(QueueItem item, long attempt, CancellationToken token, TransferListener listener) {
        this.item = Objects.requireNonNull(item, "Item cannot be null");
        this.attempt = attempt;
        this.token = Objects.requireNonNull(token, "Cancellation token cannot be null");
        this.listener = Objects.requireNonNull(listener, "Listener cannot be null");
        this.startNanos = System.nanoTime();
    }

    public QueueItem getItem() {
        return item;
    }

    public String getItemId() {
        return item.getId();
    }

    /**
     * Scheduler-wide sequence number of this attempt.
     */
    public long getAttempt() {
        return attempt;
    }

    public CancellationToken getToken() {
        return token;
    }

    public TransferListener getListener() {
        return listener;
    }

    public long elapsedMs() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    public void reportProgress(long uploadedBytes) {
        listener.onProgress(uploadedBytes, elapsedMs());
    }
}
