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

import dev.mars.conveyor.core.FileSource;
import dev.mars.conveyor.core.QueueItem;
import dev.mars.conveyor.core.exceptions.UploadCancelledException;
import dev.mars.conveyor.transport.PayloadKind;
import dev.mars.conveyor.transport.UploadPayload;
import dev.mars.conveyor.transport.UploadTransport;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;

import java.util.Objects;

/**
 * Shared plumbing for executors: blocking reads off the event loop, cancellable delays and
 * payload construction.
 */
public abstract class AbstractTransferExecutor implements TransferExecutor {

    protected final Vertx vertx;
    protected final UploadTransport transport;

    protected AbstractTransferExecutor(Vertx vertx, UploadTransport transport) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.transport = Objects.requireNonNull(transport, "Transport cannot be null");
    }

    protected Future<Buffer> read(FileSource source, long offset, int length) {
        return vertx.executeBlocking(() -> Buffer.buffer(source.read(offset, length)));
    }

    /**
     * Complete after {@code delayMs}, or fail early once the token fires.
     */
    protected Future<Void> delay(TransferContext context, long delayMs) {
        if (delayMs <= 0) {
            return checkCancelled(context);
        }
        Promise<Void> promise = Promise.promise();
        long timerId = vertx.setTimer(delayMs, id -> promise.tryComplete());
        context.getToken().onCancel(() -> {
            vertx.cancelTimer(timerId);
            promise.tryFail(new UploadCancelledException(context.getItemId(), context.getToken().getReason()));
        });
        return promise.future();
    }

    protected Future<Void> checkCancelled(TransferContext context) {
        try {
            context.getToken().throwIfCancelled(context.getItemId());
            return Future.succeededFuture();
        } catch (UploadCancelledException e) {
            return Future.failedFuture(e);
        }
    }

    protected UploadPayload.Builder payload(TransferContext context, PayloadKind kind) {
        QueueItem item = context.getItem();
        return UploadPayload.builder()
                .itemId(item.getId())
                .sessionId(item.getSessionId())
                .fileName(item.getSource().getName())
                .mimeType(item.getSource().getMimeType())
                .totalBytes(item.getTotalBytes())
                .kind(kind)
                .metadata(item.getMetadata());
    }
}
