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

package dev.mars.conveyor.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.mars.conveyor.core.UploadResponse;
import dev.mars.conveyor.core.exceptions.UploadCancelledException;
import dev.mars.conveyor.core.exceptions.UploadException;
import dev.mars.conveyor.core.exceptions.UploadTimeoutException;
import dev.mars.conveyor.transfer.CancellationToken;
import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link UploadTransport} over HTTP using the Vert.x {@link HttpClient} for payloads and a
 * {@link WebClient} wrapping the same client for finalize calls.
 *
 * <p>Every payload is a {@code POST <baseUrl>/upload} whose body is the raw bytes, written in
 * slices of {@value #WRITE_SLICE_BYTES} bytes. Placement travels in {@code X-Conveyor-*}
 * headers; the file name and the JSON item metadata are URL-encoded so that any character
 * survives. Chunked uploads are assembled with a JSON {@code POST <baseUrl>/upload/finalize}.</p>
 *
 * <p>Progress is reported as each slice reaches the connection. While the body is in flight or
 * the receiver is still answering, the bytes sent so far are re-reported every
 * {@code progressIntervalMs} so that the scheduler sees the request as alive. A receiver that
 * stays silent for {@code responseTimeoutMs} after the body was sent fails the call with an
 * {@link UploadTimeoutException}.</p>
 *
 * <p>A 2xx response body, if present, is read as an {@link UploadResponse}. Any other status
 * fails the call with an {@link UploadException} carrying that status. When the cancellation
 * token fires the payload stream is reset, so no further bytes are sent, and the returned
 * future fails at once with {@link UploadCancelledException}. Finalize calls carry no payload
 * and are abandoned rather than reset.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class HttpUploadTransport implements UploadTransport {

    private static final Logger logger = LoggerFactory.getLogger(HttpUploadTransport.class);

    public static final String UPLOAD_PATH = "/upload";
    public static final String FINALIZE_PATH = "/upload/finalize";

    public static final String HEADER_ITEM_ID = "X-Conveyor-Item-Id";
    public static final String HEADER_SESSION_ID = "X-Conveyor-Session-Id";
    public static final String HEADER_KIND = "X-Conveyor-Kind";
    public static final String HEADER_FILE_NAME = "X-Conveyor-File-Name";
    public static final String HEADER_OFFSET = "X-Conveyor-Offset";
    public static final String HEADER_TOTAL_BYTES = "X-Conveyor-Total-Bytes";
    public static final String HEADER_CHUNK_INDEX = "X-Conveyor-Chunk-Index";
    public static final String HEADER_TOTAL_CHUNKS = "X-Conveyor-Total-Chunks";
    public static final String HEADER_CHECKSUM = "X-Conveyor-Checksum";
    public static final String HEADER_BATCH_KEY = "X-Conveyor-Batch-Key";
    public static final String HEADER_LAST_SEGMENT = "X-Conveyor-Last-Segment";
    public static final String HEADER_METADATA = "X-Conveyor-Metadata";

    public static final int WRITE_SLICE_BYTES = 64 * 1024;
    public static final long DEFAULT_PROGRESS_INTERVAL_MS = 1_000;
    public static final long DEFAULT_RESPONSE_TIMEOUT_MS = 60_000;

    private final Vertx vertx;
    private final HttpClient httpClient;
    private final WebClient webClient;
    private final String baseUrl;
    private final String userAgent;
    private final long progressIntervalMs;
    private final long responseTimeoutMs;

    public HttpUploadTransport(Vertx vertx, String baseUrl) {
        this(vertx, baseUrl, defaultOptions());
    }

    public HttpUploadTransport(Vertx vertx, String baseUrl, WebClientOptions options) {
        this(vertx, baseUrl, options, DEFAULT_PROGRESS_INTERVAL_MS, DEFAULT_RESPONSE_TIMEOUT_MS);
    }

    public HttpUploadTransport(Vertx vertx, String baseUrl, WebClientOptions options, long progressIntervalMs,
                               long responseTimeoutMs) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "Base URL cannot be null"));
        Objects.requireNonNull(options, "Client options cannot be null");
        if (progressIntervalMs <= 0 || responseTimeoutMs <= 0) {
            throw new IllegalArgumentException("Progress interval and response timeout must be > 0");
        }
        this.httpClient = vertx.createHttpClient(options);
        this.webClient = WebClient.wrap(httpClient, options);
        this.userAgent = options.isUserAgentEnabled() ? options.getUserAgent() : null;
        this.progressIntervalMs = progressIntervalMs;
        this.responseTimeoutMs = responseTimeoutMs;
        logger.debug("HttpUploadTransport initialized for {} (connectTimeout={}ms, idleTimeout={}s, "
                        + "progressInterval={}ms, responseTimeout={}ms)", this.baseUrl, options.getConnectTimeout(),
                options.getIdleTimeout(), progressIntervalMs, responseTimeoutMs);
    }

    public static WebClientOptions defaultOptions() {
        return new WebClientOptions()
                .setConnectTimeout(10_000)
                .setIdleTimeout(60)
                .setUserAgent("Conveyor/1.0");
    }

    @Override
    public Future<UploadResponse> upload(UploadPayload payload, ProgressListener progress, CancellationToken token) {
        String itemId = payload.getItemId();
        MultiMap headers;
        try {
            headers = uploadHeaders(payload);
        } catch (JsonProcessingException e) {
            return Future.failedFuture(new UploadException(itemId,
                    "metadata is not serialisable: " + e.getOriginalMessage(), e));
        }
        Buffer data = payload.getData();
        RequestOptions options = new RequestOptions()
                .setMethod(HttpMethod.POST)
                .setAbsoluteURI(baseUrl + UPLOAD_PATH)
                .setHeaders(headers);

        Promise<UploadResponse> promise = Promise.promise();
        AtomicReference<HttpClientRequest> inFlight = new AtomicReference<>();
        AtomicLong sent = new AtomicLong();

        token.onCancel(() -> {
            HttpClientRequest request = inFlight.get();
            if (request != null && request.reset()) {
                logger.debug("Reset upload stream for {} after {} of {} bytes", itemId, sent.get(), data.length());
            }
            promise.tryFail(new UploadCancelledException(itemId, token.getReason()));
        });
        long keepAlive = vertx.setPeriodic(progressIntervalMs, id -> progress.onProgress(sent.get()));
        promise.future().onComplete(ar -> vertx.cancelTimer(keepAlive));

        logger.debug("POST {} {} bytes for {} ({})", UPLOAD_PATH, data.length(), itemId, payload.getKind());
        httpClient.request(options)
                .compose(request -> {
                    inFlight.set(request);
                    if (token.isCancelled()) {
                        request.reset();
                        return Future.failedFuture(new UploadCancelledException(itemId, token.getReason()));
                    }
                    request.putHeader(HttpHeaders.CONTENT_LENGTH, Integer.toString(data.length()));
                    return writeBody(itemId, request, data, 0, sent, progress, token)
                            .compose(v -> request.end())
                            .compose(v -> {
                                armResponseTimeout(itemId, request, promise);
                                return request.response();
                            });
                })
                .compose(response -> response.body()
                        .compose(body -> toUploadResponse(itemId, response.statusCode(), response.statusMessage(),
                                body, data.length())))
                .onComplete(ar -> {
                    if (ar.succeeded()) {
                        if (sent.get() < data.length()) {
                            progress.onProgress(data.length());
                        }
                        promise.tryComplete(ar.result());
                    } else {
                        promise.tryFail(wrapFailure(itemId, ar.cause()));
                    }
                });
        return promise.future();
    }

    /**
     * Fail the call and reset the stream if the receiver has not answered within
     * {@code responseTimeoutMs} of the body being sent.
     */
    private void armResponseTimeout(String itemId, HttpClientRequest request, Promise<UploadResponse> promise) {
        long timer = vertx.setTimer(responseTimeoutMs, id -> {
            if (promise.tryFail(new UploadTimeoutException(itemId, Duration.ofMillis(responseTimeoutMs)))) {
                logger.warn("No response for {} within {} ms, resetting the stream", itemId, responseTimeoutMs);
                request.reset();
            }
        });
        promise.future().onComplete(ar -> vertx.cancelTimer(timer));
    }

    /**
     * Write {@code data} from {@code offset} one slice at a time, each after the previous one
     * has been handed to the connection.
     */
    private static Future<Void> writeBody(String itemId, HttpClientRequest request, Buffer data, int offset,
                                          AtomicLong sent, ProgressListener progress, CancellationToken token) {
        if (offset >= data.length()) {
            return Future.succeededFuture();
        }
        if (token.isCancelled()) {
            return Future.failedFuture(new UploadCancelledException(itemId, token.getReason()));
        }
        int end = Math.min(data.length(), offset + WRITE_SLICE_BYTES);
        return request.write(data.getBuffer(offset, end))
                .compose(v -> {
                    sent.set(end);
                    progress.onProgress(end);
                    return writeBody(itemId, request, data, end, sent, progress, token);
                });
    }

    @Override
    public Future<UploadResponse> finalizeUpload(FinalizeRequest finalizeRequest, CancellationToken token) {
        Buffer body;
        try {
            body = ConveyorJson.encode(finalizeRequest);
        } catch (JsonProcessingException e) {
            return Future.failedFuture(new UploadException(finalizeRequest.itemId(),
                    "finalize request is not serialisable: " + e.getOriginalMessage(), e));
        }
        logger.debug("POST {} for {} ({} chunks)", FINALIZE_PATH, finalizeRequest.itemId(),
                finalizeRequest.totalChunks());
        Future<HttpResponse<Buffer>> sent = webClient.postAbs(baseUrl + FINALIZE_PATH)
                .putHeader("Content-Type", "application/json")
                .putHeader(HEADER_ITEM_ID, finalizeRequest.itemId())
                .sendBuffer(body);
        return cancellable(finalizeRequest.itemId(), token, sent)
                .compose(response -> toUploadResponse(finalizeRequest.itemId(), response.statusCode(),
                        response.statusMessage(), response.body(), finalizeRequest.totalBytes()));
    }

    @Override
    public void close() {
        logger.debug("Closing HttpUploadTransport clients");
        webClient.close();
        httpClient.close();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    private static <T> Future<T> cancellable(String itemId, CancellationToken token, Future<T> call) {
        Promise<T> promise = Promise.promise();
        token.onCancel(() -> promise.tryFail(new UploadCancelledException(itemId, token.getReason())));
        call.onComplete(ar -> {
            if (ar.succeeded()) {
                promise.tryComplete(ar.result());
            } else {
                promise.tryFail(wrapFailure(itemId, ar.cause()));
            }
        });
        return promise.future();
    }

    private static Throwable wrapFailure(String itemId, Throwable cause) {
        if (cause instanceof UploadException || cause instanceof UploadCancelledException) {
            return cause;
        }
        return new UploadException(itemId, describe(cause), cause);
    }

    private static Future<UploadResponse> toUploadResponse(String itemId, int status, String statusMessage,
                                                           Buffer body, long expectedBytes) {
        if (status < 200 || status >= 300) {
            String message = "HTTP " + status + (statusMessage != null ? " " + statusMessage : "");
            return Future.failedFuture(new UploadException(itemId, message, status,
                    status >= 500 ? UploadException.SERVER_ERROR : null));
        }
        if (body == null || body.length() == 0) {
            return Future.succeededFuture(UploadResponse.of(null, expectedBytes));
        }
        try {
            return Future.succeededFuture(ConveyorJson.decode(body, UploadResponse.class));
        } catch (IOException e) {
            return Future.failedFuture(new UploadException(itemId, "unreadable response body: " + e.getMessage(),
                    status, null, e));
        }
    }

    private MultiMap uploadHeaders(UploadPayload payload) throws JsonProcessingException {
        MultiMap headers = MultiMap.caseInsensitiveMultiMap()
                .add(HttpHeaders.CONTENT_TYPE, contentType(payload))
                .add(HEADER_ITEM_ID, payload.getItemId())
                .add(HEADER_KIND, payload.getKind().name())
                .add(HEADER_OFFSET, Long.toString(payload.getOffset()))
                .add(HEADER_TOTAL_BYTES, Long.toString(payload.getTotalBytes()))
                .add(HEADER_LAST_SEGMENT, Boolean.toString(payload.isLastSegment()));
        putIfPresent(headers, HttpHeaders.USER_AGENT.toString(), userAgent);
        putIfPresent(headers, HEADER_SESSION_ID, payload.getSessionId());
        putIfPresent(headers, HEADER_FILE_NAME, encode(payload.getFileName()));
        putIfPresent(headers, HEADER_CHUNK_INDEX, payload.getChunkIndex());
        putIfPresent(headers, HEADER_TOTAL_CHUNKS, payload.getTotalChunks());
        putIfPresent(headers, HEADER_CHECKSUM, payload.getChecksum());
        putIfPresent(headers, HEADER_BATCH_KEY, payload.getBatchKey());
        if (!payload.getMetadata().isEmpty()) {
            headers.add(HEADER_METADATA, encode(ConveyorJson.mapper().writeValueAsString(payload.getMetadata())));
        }
        return headers;
    }

    private static String contentType(UploadPayload payload) {
        String mime = payload.getMimeType();
        return mime != null && !mime.isBlank() ? mime : "application/octet-stream";
    }

    private static void putIfPresent(MultiMap headers, String header, Object value) {
        if (value != null) {
            headers.add(header, value.toString());
        }
    }

    private static String encode(String value) {
        return value != null ? URLEncoder.encode(value, StandardCharsets.UTF_8) : null;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public String toString() {
        return "HttpUploadTransport{" + baseUrl + "}";
    }
}
