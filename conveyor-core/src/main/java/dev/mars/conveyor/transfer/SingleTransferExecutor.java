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
import dev.mars.conveyor.core.UploadResponse;
import dev.mars.conveyor.core.exceptions.UploadValidationException;
import dev.mars.conveyor.strategy.StrategyType;
import dev.mars.conveyor.transport.PayloadKind;
import dev.mars.conveyor.transport.UploadPayload;
import dev.mars.conveyor.transport.UploadTransport;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends the whole file in one transport call.
 */
public class SingleTransferExecutor extends AbstractTransferExecutor {

    private static final Logger logger = LoggerFactory.getLogger(SingleTransferExecutor.class);

    public SingleTransferExecutor(Vertx vertx, UploadTransport transport) {
        super(vertx, transport);
    }

    @Override
    public StrategyType getStrategyType() {
        return StrategyType.SINGLE;
    }

    @Override
    public Future<UploadResponse> execute(TransferContext context) {
        QueueItem item = context.getItem();
        long size = item.getTotalBytes();
        if (size > Integer.MAX_VALUE) {
            return Future.failedFuture(new UploadValidationException(item.getId(),
                    "File of " + size + " bytes is too large for a single upload"));
        }
        logger.debug("Uploading {} ({} bytes) as {}", item.getSource().getName(), size, payloadKind());

        return checkCancelled(context)
                .compose(v -> read(item.getSource(), 0, (int) size))
                .compose(data -> {
                    UploadPayload payload = decorate(payload(context, payloadKind()).offset(0).data(data), context)
                            .build();
                    return transport.upload(payload, context::reportProgress, context.getToken());
                })
                .map(response -> {
                    context.reportProgress(size);
                    return response;
                });
    }

    protected PayloadKind payloadKind() {
        return PayloadKind.WHOLE_FILE;
    }

    /**
     * Hook for subclasses to add strategy-specific payload fields.
     */
    protected UploadPayload.Builder decorate(UploadPayload.Builder payload, TransferContext context) {
        return payload;
    }
}
