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

package dev.mars.conveyor.core.exceptions;

/**
 * A local precondition for an upload does not hold, such as an inconsistent chunk plan or an
 * unreadable source. Never retried.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class UploadValidationException extends UploadException {

    public UploadValidationException(String itemId, String message) {
        super(itemId, message);
    }

    public UploadValidationException(String itemId, String message, Throwable cause) {
        super(itemId, message, cause);
    }
}
