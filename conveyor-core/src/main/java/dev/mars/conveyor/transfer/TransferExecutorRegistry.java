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

import dev.mars.conveyor.strategy.StrategyType;
import dev.mars.conveyor.transport.UploadTransport;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps each {@link StrategyType} to the executor that runs it.
 */
public class TransferExecutorRegistry {
    private static final Logger logger = LoggerFactory.getLogger(TransferExecutorRegistry.class);

    private final Map<StrategyType, TransferExecutor> executors = new EnumMap<>(StrategyType.class);

    /**
     * A registry holding the built-in executor for every strategy type.
     */
    public static TransferExecutorRegistry withDefaults(Vertx vertx, UploadTransport transport) {
        TransferExecutorRegistry registry = new TransferExecutorRegistry();
        registry.register(new SingleTransferExecutor(vertx, transport));
        registry.register(new ChunkedTransferExecutor(vertx, transport));
        registry.register(new StreamingTransferExecutor(vertx, transport));
        registry.register(new BatchTransferExecutor(vertx, transport));
        logger.debug("Registered default transfer executors: {}", registry.getSupportedTypes());
        return registry;
    }

    /**
     * Register or replace the executor for its strategy type.
     */
    public void register(TransferExecutor executor) {
        TransferExecutor previous = executors.put(executor.getStrategyType(), executor);
        if (previous != null) {
            logger.info("Replaced {} executor {} with {}", executor.getStrategyType(),
                    previous.getClass().getSimpleName(), executor.getClass().getSimpleName());
        }
    }

    /**
     * @return the executor, or null if none is registered for the type
     */
    public TransferExecutor get(StrategyType type) {
        return type == null ? null : executors.get(type);
    }

    public boolean supports(StrategyType type) {
        return type != null && executors.containsKey(type);
    }

    public Set<StrategyType> getSupportedTypes() {
        return Collections.unmodifiableSet(executors.keySet());
    }
}
