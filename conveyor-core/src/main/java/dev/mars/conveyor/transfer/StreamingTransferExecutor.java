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
import dev.mars.conveyor.strategy.StrategyType;
import dev.mars.conveyor.strategy.StreamingStrategy;
import dev.mars.conveyor.transport.PayloadKind;
import dev.mars.conveyor.transport.UploadTransport;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends the file as consecutive segments of the strategy's buffer size, one at a time.
 *
 * <p>Progress is reported as each segment is acknowledged, so the item's uploaded bytes always
 * equal the acknowledged offset. Transport progress within a segment only repeats that offset,
 * which keeps a slow segment alive without moving the resume point. A resumable stream picks up
 * from that offset; the token is checked before every segment.</p>
 */
public class StreamingTransferExecutor extends AbstractTransferExecutor {

    private static final Logger logger = LoggerFactory.getLogger(StreamingTransferExecutor.class);

    public StreamingTransferExecutor(Vertx vertx, UploadTransport transport) {
        super(vertx, transport);
    }

    @Override
    public StrategyType getStrategyType() {
        return StrategyType.STREAMING;
    }

    @Override
    public Future<UploadResponse> execute(TransferContext context) {
        QueueItem item = context.getItem();
        StreamingStrategy strategy = item.getStrategy() instanceof StreamingStrategy streaming
                ? streaming
                : new StreamingStrategy();
        long startOffset = strategy.resumable() ? item.getUploadedBytes() : 0;
        if (startOffset > 0) {
            logger.info("Resuming stream of {} at offset {} of {}", item.getSource().getName(),
                    startOffset, item.getTotalBytes());
        }
        return sendFrom(context, strategy, startOffset, null);
    }

    private Future<UploadResponse> sendFrom(TransferContext context, StreamingStrategy strategy,
                                            long offset, UploadResponse lastResponse) {
        QueueItem item = context.getItem();
        long total = item.getTotalBytes();
        if (offset >= total && lastResponse != null) {
            return Future.succeededFuture(lastResponse);
        }
        int length = (int) Math.min(strategy.bufferSize(), total - offset);
        boolean last = offset + length >= total;

        return checkCancelled(context)
                .compose(v -> read(item.getSource(), offset, length))
                .compose(data -> transport.upload(payload(context, PayloadKind.STREAM_SEGMENT)
                                .offset(offset)
                                .data(data)
                                .lastSegment(last)
                                .build(),
                        bytesSent -> context.reportProgress(offset),
                        context.getToken()))
                .compose(response -> {
                    long acknowledged = offset + length;
                    context.reportProgress(acknowledged);
                    if (last) {
                        return Future.succeededFuture(response);
                    }
                    return sendFrom(context, strategy, acknowledged, response);
                });
    }
}
