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

import dev.mars.conveyor.core.UploadResponse;
import dev.mars.conveyor.strategy.StrategyType;
import io.vertx.core.Future;

/**
 * Drives one transfer attempt for items of a single {@link StrategyType}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface TransferExecutor {

    StrategyType getStrategyType();

    /**
     * Run the attempt. The future fails with the raw transport failure, which the scheduler
     * classifies, or with an {@link dev.mars.conveyor.core.exceptions.UploadCancelledException}
     * once the context's token fires.
     */
    Future<UploadResponse> execute(TransferContext context);
}
