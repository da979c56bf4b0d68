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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative abort signal shared by the scheduler and one transfer attempt.
 *
 * <p>The scheduler fires the token when it pauses, cancels, removes or times out an item, and
 * moves the item on immediately. Executors check the token between units of work and
 * transports register {@link #onCancel(Runnable)} hooks to abort in-flight calls. A token fires
 * at most once; the first reason wins.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class CancellationToken {

    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    /**
     * Why a transfer was aborted.
     */
    public enum Reason {
        PAUSED,
        CANCELLED,
        REMOVED,
        TIMEOUT,
        SHUTDOWN
    }

    private final AtomicReference<Reason> reason = new AtomicReference<>();
    private final List<Runnable> handlers = new CopyOnWriteArrayList<>();

    /**
     * Fire the token.
     *
     * @return true if this call fired it, false if it had already fired
     */
    public boolean cancel(Reason why) {
        if (!reason.compareAndSet(null, why)) {
            return false;
        }
        for (Runnable handler : handlers) {
            if (handlers.remove(handler)) {
                runHandler(handler);
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    /**
     * @return the reason the token fired, or null while it has not
     */
    public Reason getReason() {
        return reason.get();
    }

    /**
     * Run {@code handler} once when the token fires, or right away if it already has.
     */
    public void onCancel(Runnable handler) {
        handlers.add(handler);
        if (isCancelled() && handlers.remove(handler)) {
            runHandler(handler);
        }
    }

    /**
     * @throws UploadCancelledException if the token has fired
     */
    public void throwIfCancelled(String itemId) throws UploadCancelledException {
        Reason current = reason.get();
        if (current != null) {
            throw new UploadCancelledException(itemId, current);
        }
    }

    private void runHandler(Runnable handler) {
        try {
            handler.run();
        } catch (RuntimeException e) {
            logger.warn("Cancellation handler failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        Reason current = reason.get();
        return current == null ? "CancellationToken{active}" : "CancellationToken{" + current + "}";
    }
}
