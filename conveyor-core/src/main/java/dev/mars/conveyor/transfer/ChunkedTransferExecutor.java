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

import dev.mars.conveyor.core.QueueError;
import dev.mars.conveyor.core.QueueItem;
import dev.mars.conveyor.core.UploadChunk;
import dev.mars.conveyor.core.UploadResponse;
import dev.mars.conveyor.core.exceptions.ChecksumMismatchException;
import dev.mars.conveyor.core.exceptions.UploadCancelledException;
import dev.mars.conveyor.core.exceptions.UploadValidationException;
import dev.mars.conveyor.storage.ChecksumCalculator;
import dev.mars.conveyor.strategy.ChunkedStrategy;
import dev.mars.conveyor.strategy.StrategyType;
import dev.mars.conveyor.transport.FinalizeRequest;
import dev.mars.conveyor.transport.PayloadKind;
import dev.mars.conveyor.transport.UploadPayload;
import dev.mars.conveyor.transport.UploadTransport;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Uploads a file as its planned chunks, then asks the receiver to assemble it.
 *
 * <h3>Behaviour:</h3>
 * <ul>
 *   <li>Chunks go out strictly one after another in index order. Chunks the snapshot already
 *       marks COMPLETED are skipped, which is how a resumable upload continues.</li>
 *   <li>Each chunk gets {@link ChunkedStrategy#maxRetries()} attempts. Between attempts the
 *       executor waits {@code retryDelayMs * 2^(k-1)} after the k-th failure. Non-retryable
 *       failures end the attempt at once.</li>
 *   <li>With checksum validation on, the SHA-256 of each chunk travels with its payload and is
 *       compared with the checksum the receiver reports, if it reports one.</li>
 *   <li>Progress is the total size of acknowledged chunks plus bytes sent of the chunk in flight.</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ChunkedTransferExecutor extends AbstractTransferExecutor {

    private static final Logger logger = LoggerFactory.getLogger(ChunkedTransferExecutor.class);

    public ChunkedTransferExecutor(Vertx vertx, UploadTransport transport) {
        super(vertx, transport);
    }

    @Override
    public StrategyType getStrategyType() {
        return StrategyType.CHUNKED;
    }

    @Override
    public Future<UploadResponse> execute(TransferContext context) {
        QueueItem item = context.getItem();
        if (!(item.getStrategy() instanceof ChunkedStrategy strategy)) {
            return Future.failedFuture(new UploadValidationException(item.getId(),
                    "Chunked executor given a " + item.getStrategy().type() + " strategy"));
        }

        List<UploadChunk> chunks = item.getChunks();
        try {
            ChunkPlanner.validate(item.getId(), chunks, item.getTotalBytes());
        } catch (UploadValidationException e) {
            return Future.failedFuture(e);
        }

        if (strategy.parallelChunks() > 1) {
            logger.debug("Item {} requested {} parallel chunks, sending sequentially", item.getId(),
                    strategy.parallelChunks());
        }

        long alreadyAcknowledged = item.completedChunkBytes();
        long skipped = chunks.stream().filter(UploadChunk::isCompleted).count();
        if (skipped > 0) {
            logger.info("Resuming {} with {} of {} chunks already acknowledged", item.getSource().getName(),
                    skipped, chunks.size());
        }

        String[] checksums = new String[chunks.size()];
        for (UploadChunk chunk : chunks) {
            checksums[chunk.getIndex()] = chunk.getChecksum();
        }

        return uploadFrom(context, strategy, chunks, 0, alreadyAcknowledged, checksums)
                .compose(v -> finalizeUpload(context, chunks.size(), checksums));
    }

    private Future<Void> uploadFrom(TransferContext context, ChunkedStrategy strategy, List<UploadChunk> chunks,
                                    int index, long acknowledged, String[] checksums) {
        if (index >= chunks.size()) {
            return Future.succeededFuture();
        }
        UploadChunk chunk = chunks.get(index);
        if (chunk.isCompleted()) {
            return uploadFrom(context, strategy, chunks, index + 1, acknowledged, checksums);
        }

        return uploadChunk(context, strategy, chunk, chunks.size(), acknowledged, 1)
                .compose(checksum -> {
                    checksums[chunk.getIndex()] = checksum;
                    long total = acknowledged + chunk.getSize();
                    context.getListener().onChunkCompleted(chunk.getIndex(), checksum);
                    context.reportProgress(total);
                    return uploadFrom(context, strategy, chunks, index + 1, total, checksums);
                });
    }

    /**
     * One chunk, retried on its own budget.
     *
     * @return the checksum sent with the chunk, null when validation is off
     */
    private Future<String> uploadChunk(TransferContext context, ChunkedStrategy strategy, UploadChunk chunk,
                                       int totalChunks, long acknowledged, int attempt) {
        QueueItem item = context.getItem();
        return checkCancelled(context)
                .compose(v -> {
                    context.getListener().onChunkStarted(chunk.getIndex());
                    return read(item.getSource(), chunk.getStart(), Math.toIntExact(chunk.getSize()));
                })
                .compose(data -> send(context, strategy, chunk, totalChunks, acknowledged, data))
                .recover(failure -> {
                    if (context.getToken().isCancelled() || failure instanceof UploadCancelledException) {
                        return Future.failedFuture(failure);
                    }
                    QueueError error = ErrorClassifier.classify(failure);
                    if (!error.isRetryable() || attempt >= strategy.maxRetries()) {
                        logger.warn("Chunk {} of {} failed after {} attempt(s): {}", chunk.getIndex(),
                                item.getId(), attempt, error.getMessage());
                        return Future.failedFuture(failure);
                    }
                    long backoff = strategy.retryDelayMs() * (1L << Math.min(attempt - 1, 30));
                    logger.warn("Chunk {} of {} failed (attempt {}/{}), retrying in {} ms: {}", chunk.getIndex(),
                            item.getId(), attempt, strategy.maxRetries(), backoff, error.getMessage());
                    context.getListener().onChunkRetry(chunk.getIndex(), attempt, error);
                    return delay(context, backoff)
                            .compose(v -> uploadChunk(context, strategy, chunk, totalChunks, acknowledged, attempt + 1));
                });
    }

    private Future<String> send(TransferContext context, ChunkedStrategy strategy, UploadChunk chunk,
                                int totalChunks, long acknowledged, Buffer data) {
        String checksum = strategy.checksumValidation() ? ChecksumCalculator.sha256Hex(data.getBytes()) : null;
        UploadPayload payload = payload(context, PayloadKind.CHUNK)
                .offset(chunk.getStart())
                .data(data)
                .chunk(chunk.getIndex(), totalChunks)
                .checksum(checksum)
                .lastSegment(chunk.getIndex() == totalChunks - 1)
                .build();

        return transport.upload(payload, bytes -> context.reportProgress(acknowledged + bytes), context.getToken())
                .compose(response -> {
                    if (checksum != null && response != null && response.getChecksum() != null
                            && !ChecksumCalculator.matches(checksum, response.getChecksum())) {
                        return Future.failedFuture(new ChecksumMismatchException(context.getItemId(),
                                chunk.getIndex(), checksum, response.getChecksum()));
                    }
                    return Future.succeededFuture(checksum);
                });
    }

    private Future<UploadResponse> finalizeUpload(TransferContext context, int totalChunks, String[] checksums) {
        QueueItem item = context.getItem();
        return checkCancelled(context).compose(v -> {
            context.getListener().onProcessing();
            List<String> checksumList = new ArrayList<>(totalChunks);
            for (String checksum : checksums) {
                checksumList.add(checksum);
            }
            FinalizeRequest request = new FinalizeRequest(item.getId(), item.getSessionId(),
                    item.getSource().getName(), item.getTotalBytes(), totalChunks, checksumList,
                    item.getMetadata());
            logger.debug("Finalizing {} after {} chunks", item.getId(), totalChunks);
            return transport.finalizeUpload(request, context.getToken());
        });
    }
}
