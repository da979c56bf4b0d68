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

import dev.mars.conveyor.config.UploadQueueConfig;
import dev.mars.conveyor.core.BufferFileSource;
import dev.mars.conveyor.core.ErrorType;
import dev.mars.conveyor.core.QueueError;
import dev.mars.conveyor.core.QueueItem;
import dev.mars.conveyor.core.QueueItemStatus;
import dev.mars.conveyor.core.UploadPriority;
import dev.mars.conveyor.core.UploadResponse;
import dev.mars.conveyor.core.exceptions.UploadCancelledException;
import dev.mars.conveyor.core.exceptions.UploadException;
import dev.mars.conveyor.queue.UploadQueueManager;
import dev.mars.conveyor.strategy.SingleStrategy;
import dev.mars.conveyor.transfer.CancellationToken;
import dev.mars.conveyor.transfer.ErrorClassifier;
import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.extension.ExtendWith;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Tests for {@link HttpUploadTransport} against a real local HTTP server.
 */
@ExtendWith(VertxExtension.class)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@DisplayName("HttpUploadTransport Tests")
class HttpUploadTransportTest {

    private static final int HANG = -1;
    private static final int SLOW = -2;
    private static final long SLOW_RESPONSE_MS = 1500;

    private Vertx vertx;
    private HttpServer testServer;
    private HttpUploadTransport transport;

    private final AtomicInteger uploadStatus = new AtomicInteger(200);
    private final AtomicInteger uploadCount = new AtomicInteger();
    private final AtomicReference<MultiMap> lastHeaders = new AtomicReference<>();
    private final AtomicReference<Buffer> lastBody = new AtomicReference<>();
    private final AtomicReference<JsonObject> lastFinalize = new AtomicReference<>();
    private final AtomicBoolean hungConnectionClosed = new AtomicBoolean();

    @BeforeAll
    void setUp(Vertx vertx, VertxTestContext testContext) {
        this.vertx = vertx;
        Router router = Router.router(vertx);
        router.route().handler(BodyHandler.create());

        router.post(HttpUploadTransport.FINALIZE_PATH).handler(ctx -> {
            lastFinalize.set(ctx.body().asJsonObject());
            ctx.response()
                    .setStatusCode(200)
                    .putHeader("content-type", "application/json")
                    .end(new JsonObject()
                            .put("uploadId", "assembled-1")
                            .put("location", "/files/assembled-1")
                            .put("bytesReceived", lastFinalize.get().getLong("totalBytes"))
                            .encode());
        });

        router.post(HttpUploadTransport.UPLOAD_PATH).handler(ctx -> {
            uploadCount.incrementAndGet();
            lastHeaders.set(MultiMap.caseInsensitiveMultiMap().addAll(ctx.request().headers()));
            lastBody.set(ctx.body().buffer());

            int status = uploadStatus.get();
            if (status == HANG) {
                ctx.request().connection().closeHandler(v -> hungConnectionClosed.set(true));
                return;
            }
            if (status == SLOW) {
                int length = lastBody.get().length();
                vertx.setTimer(SLOW_RESPONSE_MS, id -> ctx.response()
                        .setStatusCode(200)
                        .putHeader("content-type", "application/json")
                        .end(new JsonObject().put("uploadId", "slow").put("bytesReceived", length).encode()));
                return;
            }
            if (status == 200) {
                ctx.response()
                        .setStatusCode(200)
                        .putHeader("content-type", "application/json")
                        .end(new JsonObject()
                                .put("uploadId", "stored-" + uploadCount.get())
                                .put("bytesReceived", lastBody.get().length())
                                .put("checksum", ctx.request().getHeader(HttpUploadTransport.HEADER_CHECKSUM))
                                .put("serverVersion", "2")
                                .encode());
            } else {
                ctx.response().setStatusCode(status).end();
            }
        });

        vertx.createHttpServer()
                .requestHandler(router)
                .listen(0)
                .onSuccess(server -> {
                    testServer = server;
                    transport = new HttpUploadTransport(vertx, "http://localhost:" + server.actualPort() + "/");
                    testContext.completeNow();
                })
                .onFailure(testContext::failNow);
    }

    @BeforeEach
    void reset() {
        uploadStatus.set(200);
        uploadCount.set(0);
        lastHeaders.set(null);
        lastBody.set(null);
        lastFinalize.set(null);
        hungConnectionClosed.set(false);
    }

    @AfterAll
    void tearDown(VertxTestContext testContext) {
        transport.close();
        if (testServer != null) {
            testServer.close().onComplete(ar -> testContext.completeNow());
        } else {
            testContext.completeNow();
        }
    }

    private static <T> T result(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }

    private static UploadPayload chunkPayload() {
        return UploadPayload.builder()
                .itemId("item-1")
                .sessionId("session-1")
                .fileName("quarterly report.pdf")
                .mimeType("application/pdf")
                .kind(PayloadKind.CHUNK)
                .offset(1024)
                .totalBytes(4096)
                .data(Buffer.buffer("chunk-bytes"))
                .chunk(1, 4)
                .checksum("abc123")
                .lastSegment(false)
                .metadata(Map.of("owner", "finance"))
                .build();
    }

    // ==================== Upload ====================

    @Nested
    @DisplayName("Upload")
    class Upload {

        @Test
        @DisplayName("Should send the raw bytes with placement headers")
        void testHeadersAndBody() throws Exception {
            List<Long> progress = new CopyOnWriteArrayList<>();

            UploadResponse response = result(transport.upload(chunkPayload(), progress::add, new CancellationToken()));

            MultiMap headers = lastHeaders.get();
            assertThat(lastBody.get().toString()).isEqualTo("chunk-bytes");
            assertThat(headers.get("Content-Type")).isEqualTo("application/pdf");
            assertThat(headers.get(HttpUploadTransport.HEADER_ITEM_ID)).isEqualTo("item-1");
            assertThat(headers.get(HttpUploadTransport.HEADER_SESSION_ID)).isEqualTo("session-1");
            assertThat(headers.get(HttpUploadTransport.HEADER_KIND)).isEqualTo("CHUNK");
            assertThat(headers.get(HttpUploadTransport.HEADER_FILE_NAME)).isEqualTo("quarterly+report.pdf");
            assertThat(headers.get(HttpUploadTransport.HEADER_OFFSET)).isEqualTo("1024");
            assertThat(headers.get(HttpUploadTransport.HEADER_TOTAL_BYTES)).isEqualTo("4096");
            assertThat(headers.get(HttpUploadTransport.HEADER_CHUNK_INDEX)).isEqualTo("1");
            assertThat(headers.get(HttpUploadTransport.HEADER_TOTAL_CHUNKS)).isEqualTo("4");
            assertThat(headers.get(HttpUploadTransport.HEADER_CHECKSUM)).isEqualTo("abc123");
            assertThat(headers.get(HttpUploadTransport.HEADER_LAST_SEGMENT)).isEqualTo("false");
            assertThat(headers.contains(HttpUploadTransport.HEADER_BATCH_KEY)).isFalse();
            assertThat(headers.get("User-Agent")).isEqualTo("Conveyor/1.0");
            assertThat(metadata(headers).getString("owner")).isEqualTo("finance");

            assertThat(response.getUploadId()).isEqualTo("stored-1");
            assertThat(response.getBytesReceived()).isEqualTo(11);
            assertThat(response.getChecksum()).isEqualTo("abc123");
            assertThat(progress).isNotEmpty().allMatch(bytes -> bytes <= 11L);
            assertThat(progress.get(progress.size() - 1)).isEqualTo(11L);
        }

        @Test
        @DisplayName("Should keep names and metadata outside Latin-1 intact")
        void testNonLatinNames() throws Exception {
            String name = "résumé-简历.pdf";
            UploadPayload payload = UploadPayload.builder()
                    .itemId("item-cjk")
                    .fileName(name)
                    .kind(PayloadKind.WHOLE_FILE)
                    .totalBytes(4)
                    .data(Buffer.buffer(new byte[]{1, 2, 3, 4}))
                    .metadata(Map.of("filename", name, "album", "夏の旅"))
                    .build();

            result(transport.upload(payload, ProgressListener.NONE, new CancellationToken()));

            MultiMap headers = lastHeaders.get();
            assertThat(URLDecoder.decode(headers.get(HttpUploadTransport.HEADER_FILE_NAME), StandardCharsets.UTF_8))
                    .isEqualTo(name);
            JsonObject metadata = metadata(headers);
            assertThat(metadata.getString("filename")).isEqualTo(name);
            assertThat(metadata.getString("album")).isEqualTo("夏の旅");
        }

        @Test
        @DisplayName("Should report progress slice by slice as the body is written")
        void testSlicedProgress() throws Exception {
            int size = 3 * HttpUploadTransport.WRITE_SLICE_BYTES + 100;
            List<Long> progress = new CopyOnWriteArrayList<>();
            UploadPayload payload = UploadPayload.builder()
                    .itemId("item-big")
                    .fileName("big.bin")
                    .kind(PayloadKind.WHOLE_FILE)
                    .totalBytes(size)
                    .data(Buffer.buffer(new byte[size]))
                    .build();

            UploadResponse response = result(transport.upload(payload, progress::add, new CancellationToken()));

            long slice = HttpUploadTransport.WRITE_SLICE_BYTES;
            assertThat(response.getBytesReceived()).isEqualTo(size);
            assertThat(lastBody.get().length()).isEqualTo(size);
            assertThat(progress).containsSubsequence(slice, 2 * slice, 3 * slice, (long) size);
            assertThat(progress).isSorted();
        }

        @Test
        @DisplayName("Should default the content type and accept an empty acknowledgement")
        void testEmptyAcknowledgement() throws Exception {
            uploadStatus.set(204);
            UploadPayload payload = UploadPayload.builder()
                    .itemId("item-2")
                    .fileName("raw.bin")
                    .kind(PayloadKind.WHOLE_FILE)
                    .totalBytes(3)
                    .data(Buffer.buffer(new byte[]{1, 2, 3}))
                    .build();

            UploadResponse response = result(transport.upload(payload, ProgressListener.NONE, new CancellationToken()));

            assertThat(response.getUploadId()).isNull();
            assertThat(response.getBytesReceived()).isEqualTo(3);
            assertThat(lastHeaders.get().get("Content-Type")).isEqualTo("application/octet-stream");
            assertThat(lastHeaders.get().contains(HttpUploadTransport.HEADER_SESSION_ID)).isFalse();
            assertThat(lastHeaders.get().contains(HttpUploadTransport.HEADER_METADATA)).isFalse();
        }
    }

    // ==================== Failures ====================

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Should report a 503 as a retryable server failure")
        void testServerError() {
            uploadStatus.set(503);

            assertThatThrownBy(() -> result(transport.upload(chunkPayload(), ProgressListener.NONE,
                    new CancellationToken())))
                    .isInstanceOf(ExecutionException.class)
                    .cause()
                    .isInstanceOfSatisfying(UploadException.class, e -> {
                        assertThat(e.getStatusCode()).isEqualTo(503);
                        QueueError error = ErrorClassifier.classify(e);
                        assertThat(error.getType()).isEqualTo(ErrorType.SERVER);
                        assertThat(error.isRetryable()).isTrue();
                    });
        }

        @Test
        @DisplayName("Should report a 400 as a client failure")
        void testClientError() {
            uploadStatus.set(400);

            assertThatThrownBy(() -> result(transport.upload(chunkPayload(), ProgressListener.NONE,
                    new CancellationToken())))
                    .cause()
                    .isInstanceOfSatisfying(UploadException.class, e -> {
                        QueueError error = ErrorClassifier.classify(e);
                        assertThat(error.getType()).isEqualTo(ErrorType.CLIENT);
                        assertThat(error.isRetryable()).isFalse();
                    });
        }

        @Test
        @DisplayName("Should fail at once when the token fires mid-request")
        void testCancelInFlight() {
            uploadStatus.set(HANG);
            CancellationToken token = new CancellationToken();

            Future<UploadResponse> call = transport.upload(chunkPayload(), ProgressListener.NONE, token);
            await().atMost(Duration.ofSeconds(5)).until(() -> uploadCount.get() == 1);
            token.cancel(CancellationToken.Reason.PAUSED);

            assertThatThrownBy(() -> result(call))
                    .cause()
                    .isInstanceOfSatisfying(UploadCancelledException.class,
                            e -> assertThat(e.getReason()).isEqualTo(CancellationToken.Reason.PAUSED));
            await().atMost(Duration.ofSeconds(5)).untilTrue(hungConnectionClosed);
        }

        @Test
        @DisplayName("Should keep reporting while the receiver is silent, then time out")
        void testSilentReceiver() {
            uploadStatus.set(HANG);
            HttpUploadTransport impatient = new HttpUploadTransport(vertx, transport.getBaseUrl(),
                    HttpUploadTransport.defaultOptions(), 100, 500);
            List<Long> progress = new CopyOnWriteArrayList<>();
            try {
                assertThatThrownBy(() -> result(impatient.upload(chunkPayload(), progress::add,
                        new CancellationToken())))
                        .cause()
                        .isInstanceOfSatisfying(UploadException.class, e -> {
                            QueueError error = ErrorClassifier.classify(e);
                            assertThat(error.getType()).isEqualTo(ErrorType.TIMEOUT);
                            assertThat(error.isRetryable()).isTrue();
                        });
                assertThat(progress).filteredOn(bytes -> bytes == 11L).hasSizeGreaterThanOrEqualTo(2);
                await().atMost(Duration.ofSeconds(5)).untilTrue(hungConnectionClosed);
            } finally {
                impatient.close();
            }
        }

        @Test
        @DisplayName("Should classify an unreachable receiver as a network failure")
        void testConnectionRefused() {
            HttpUploadTransport unreachable = new HttpUploadTransport(vertx, "http://localhost:1");
            try {
                assertThatThrownBy(() -> result(unreachable.upload(chunkPayload(), ProgressListener.NONE,
                        new CancellationToken())))
                        .cause()
                        .isInstanceOfSatisfying(UploadException.class,
                                e -> assertThat(ErrorClassifier.classify(e).getType()).isEqualTo(ErrorType.NETWORK));
            } finally {
                unreachable.close();
            }
        }
    }

    // ==================== Scheduling ====================

    @Nested
    @DisplayName("Scheduling")
    class Scheduling {

        @Test
        @DisplayName("Should complete an upload whose receiver answers after the no-progress timeout")
        void testSlowReceiverCompletes() {
            uploadStatus.set(SLOW);
            HttpUploadTransport lively = new HttpUploadTransport(vertx, transport.getBaseUrl(),
                    HttpUploadTransport.defaultOptions(), 200, 10_000);
            UploadQueueManager queue = new UploadQueueManager(vertx, lively, UploadQueueConfig.builder()
                    .timeoutMs(1000)
                    .maxRetries(2)
                    .retryDelayMs(50)
                    .admissionDebounceMs(20)
                    .telemetryEnabled(false)
                    .build());
            try {
                queue.start();
                String id = queue.addToQueue(List.of(new BufferFileSource("slow.bin", new byte[4096])), "session-1",
                        UploadPriority.NORMAL, new SingleStrategy()).get(0);

                await().atMost(Duration.ofSeconds(10))
                        .until(() -> queue.getQueueItem(id).orElseThrow().getStatus().isTerminal());

                QueueItem item = queue.getQueueItem(id).orElseThrow();
                assertThat(item.getStatus()).isEqualTo(QueueItemStatus.COMPLETED);
                assertThat(item.getErrors()).isEmpty();
                assertThat(uploadCount.get()).isEqualTo(1);
            } finally {
                queue.shutdown();
                lively.close();
            }
        }
    }

    // ==================== Finalize ====================

    @Test
    @DisplayName("Should post the assembly request as JSON")
    void testFinalize() throws Exception {
        FinalizeRequest request = new FinalizeRequest("item-3", "session-1", "video.mp4", 3000, 3,
                List.of("a", "b", "c"), Map.of("owner", "media"));

        UploadResponse response = result(transport.finalizeUpload(request, new CancellationToken()));

        JsonObject body = lastFinalize.get();
        assertThat(body.getString("itemId")).isEqualTo("item-3");
        assertThat(body.getInteger("totalChunks")).isEqualTo(3);
        assertThat(body.getJsonArray("chunkChecksums").getList()).containsExactly("a", "b", "c");
        assertThat(response.getUploadId()).isEqualTo("assembled-1");
        assertThat(response.getLocation()).isEqualTo("/files/assembled-1");
        assertThat(response.getBytesReceived()).isEqualTo(3000);
    }

    private static JsonObject metadata(MultiMap headers) {
        return new JsonObject(URLDecoder.decode(headers.get(HttpUploadTransport.HEADER_METADATA),
                StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should strip a trailing slash from the base URL")
    void testBaseUrl() {
        assertThat(transport.getBaseUrl()).doesNotEndWith("/");
    }
}
