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

import dev.mars.conveyor.core.ErrorType;
import dev.mars.conveyor.core.QueueError;
import dev.mars.conveyor.core.exceptions.UploadException;
import dev.mars.conveyor.core.exceptions.UploadTimeoutException;
import dev.mars.conveyor.core.exceptions.UploadValidationException;
import io.netty.channel.ConnectTimeoutException;
import io.vertx.core.http.HttpClosedException;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.channels.ClosedChannelException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Maps a transport failure to an {@link ErrorType} and decides whether it is worth retrying.
 *
 * <p>The cause chain is walked from the outermost throwable inwards and the first recognisable
 * failure decides the type:</p>
 * <ol>
 *   <li>timeouts: {@link UploadTimeoutException}, code {@code TIMEOUT}, {@link TimeoutException},
 *       {@link SocketTimeoutException}, {@link ConnectTimeoutException}</li>
 *   <li>validation: {@link UploadValidationException}, {@link IllegalArgumentException}</li>
 *   <li>network: code {@code NETWORK_ERROR}, {@link ConnectException}, {@link UnknownHostException},
 *       {@link NoRouteToHostException}, {@link SocketException}, {@link ClosedChannelException},
 *       {@link HttpClosedException}</li>
 *   <li>status: 5xx or code {@code SERVER_ERROR} is SERVER, 4xx is CLIENT</li>
 * </ol>
 * <p>Anything else is CLIENT. A failure is retryable when its type is NETWORK, SERVER or TIMEOUT,
 * or its status is one of 408, 429, 500, 502, 503, 504. VALIDATION is never retryable.</p>
 *
 * <p>Classification never throws and gives the same answer for the same input.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class ErrorClassifier {

    private static final Set<Integer> RETRYABLE_STATUSES = Set.of(408, 429, 500, 502, 503, 504);
    private static final int MAX_CAUSE_DEPTH = 32;

    private ErrorClassifier() {
    }

    public static QueueError classify(Throwable failure) {
        if (failure == null) {
            return QueueError.builder(ErrorType.CLIENT)
                    .message("Unknown upload failure")
                    .retryable(false)
                    .build();
        }

        Integer status = findStatus(failure);
        String code = findCode(failure);
        ErrorType type = ErrorType.CLIENT;
        Throwable decisive = failure;

        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = failure;
        int depth = 0;
        while (current != null && seen.add(current) && depth++ < MAX_CAUSE_DEPTH) {
            ErrorType recognised = recognise(current);
            if (recognised != null) {
                type = recognised;
                decisive = current;
                break;
            }
            current = current.getCause();
        }

        return QueueError.builder(type)
                .message(messageOf(decisive))
                .code(code)
                .statusCode(status)
                .retryable(isRetryable(type, status))
                .detail("exception", decisive.getClass().getName())
                .build();
    }

    static boolean isRetryable(ErrorType type, Integer status) {
        if (type == ErrorType.VALIDATION) {
            return false;
        }
        return type.isTransient() || (status != null && RETRYABLE_STATUSES.contains(status));
    }

    private static ErrorType recognise(Throwable t) {
        String code = t instanceof UploadException ue ? ue.getCode() : null;

        if (t instanceof UploadTimeoutException
                || UploadException.TIMEOUT.equals(code)
                || t instanceof TimeoutException
                || t instanceof SocketTimeoutException
                || t instanceof ConnectTimeoutException) {
            return ErrorType.TIMEOUT;
        }
        if (t instanceof UploadValidationException || t instanceof IllegalArgumentException) {
            return ErrorType.VALIDATION;
        }
        if (UploadException.NETWORK_ERROR.equals(code)
                || t instanceof ConnectException
                || t instanceof UnknownHostException
                || t instanceof SocketException
                || t instanceof ClosedChannelException
                || t instanceof HttpClosedException) {
            return ErrorType.NETWORK;
        }
        if (UploadException.SERVER_ERROR.equals(code)) {
            return ErrorType.SERVER;
        }
        if (t instanceof UploadException ue && ue.getStatusCode() != null) {
            return typeForStatus(ue.getStatusCode());
        }
        return null;
    }

    private static ErrorType typeForStatus(int status) {
        if (status >= 500) {
            return ErrorType.SERVER;
        }
        return ErrorType.CLIENT;
    }

    private static Integer findStatus(Throwable failure) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable t = failure; t != null && seen.add(t); t = t.getCause()) {
            if (t instanceof UploadException ue && ue.getStatusCode() != null) {
                return ue.getStatusCode();
            }
        }
        return null;
    }

    private static String findCode(Throwable failure) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable t = failure; t != null && seen.add(t); t = t.getCause()) {
            if (t instanceof UploadException ue && ue.getCode() != null) {
                return ue.getCode();
            }
        }
        return null;
    }

    private static String messageOf(Throwable t) {
        String message = t.getMessage();
        return message != null && !message.isBlank() ? message : t.getClass().getSimpleName();
    }
}
