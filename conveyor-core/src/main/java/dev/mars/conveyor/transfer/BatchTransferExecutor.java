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

import dev.mars.conveyor.strategy.BatchStrategy;
import dev.mars.conveyor.strategy.StrategyType;
import dev.mars.conveyor.transport.PayloadKind;
import dev.mars.conveyor.transport.UploadPayload;
import dev.mars.conveyor.transport.UploadTransport;
import io.vertx.core.Vertx;

/**
 * Single-call upload tagged with the batch key so the receiver can group the files of a batch.
 */
public class BatchTransferExecutor extends SingleTransferExecutor {

    public BatchTransferExecutor(Vertx vertx, UploadTransport transport) {
        super(vertx, transport);
    }

    @Override
    public StrategyType getStrategyType() {
        return StrategyType.BATCH;
    }

    @Override
    protected PayloadKind payloadKind() {
        return PayloadKind.BATCH_FILE;
    }

    @Override
    protected UploadPayload.Builder decorate(UploadPayload.Builder payload, TransferContext context) {
        String sessionId = context.getItem().getSessionId();
        String key = context.getItem().getStrategy() instanceof BatchStrategy batch
                ? batch.resolveKey(sessionId)
                : sessionId;
        return payload.batchKey(key);
    }
}
