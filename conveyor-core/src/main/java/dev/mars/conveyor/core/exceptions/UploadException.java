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
 * A transport call for one queue item failed.
 *
 * <p>Carries the HTTP-like status reported by the receiver and a symbolic error code
 * when the transport knows one. Both feed
 * {@link dev.mars.conveyor.transfer.ErrorClassifier}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class UploadException extends ConveyorException {

    /** Code for connectivity failures the transport detected itself. */
    public static final String NETWORK_ERROR = "NETWORK_ERROR";

    /** Code for transport-level deadlines. */
    public static final String TIMEOUT = "TIMEOUT";

    /** Code for a 5xx the transport could not map to a status. */
    public static final String SERVER_ERROR = "SERVER_ERROR";

    private final String itemId;
    private final Integer statusCode;
    private final String code;

    public UploadException(String itemId, String message) {
        this(itemId, message, null, null, null);
    }

    public UploadException(String itemId, String message, Throwable cause) {
        this(itemId, message, null, null, cause);
    }

    public UploadException(String itemId, String message, Integer statusCode, String code) {
        this(itemId, message, statusCode, code, null);
    }

    public UploadException(String itemId, String message, Integer statusCode, String code, Throwable cause) {
        super(message, cause);
        this.itemId = itemId;
        this.statusCode = statusCode;
        this.code = code;
    }

    public String getItemId() {
        return itemId;
    }

    /**
     * @return the receiver status, or null when the failure never reached the receiver
     */
    public Integer getStatusCode() {
        return statusCode;
    }

    /**
     * @return the symbolic error code, or null
     */
    public String getCode() {
        return code;
    }

    @Override
    public String getMessage() {
        return String.format("Upload %s failed: %s", itemId, super.getMessage());
    }
}
