package fr.lapetina.ocr.pipeline.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.ocr.pipeline.domain.model.ErrorType;
import fr.lapetina.ocr.pipeline.domain.model.InferenceRequest;
import fr.lapetina.ocr.pipeline.domain.model.InferenceResponse;
import fr.lapetina.ocr.pipeline.domain.retry.RetryPolicy;
import fr.lapetina.ocr.pipeline.infrastructure.metrics.PipelineMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class InferenceClientTest {

    private static final String COMPLETION = "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"page json\"},"
            + "\"finish_reason\":\"stop\"}],\"usage\":{\"prompt_tokens\":1500,\"completion_tokens\":250}}";

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<String> bodies = new CopyOnWriteArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();

    private HttpServer server;
    private ExecutorService serverExecutor;
    private InferenceClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.createContext("/v1/models", exchange ->
                respond(exchange, 200, "{\"data\":[{\"id\":\"test-model\"},{\"id\":\"other\"}]}"));
        server.start();
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    private void onCompletion(int[] statuses, String okBody) {
        server.createContext("/v1/chat/completions", exchange -> {
            bodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            int call = calls.getAndIncrement();
            int status = call < statuses.length ? statuses[call] : 200;
            respond(exchange, status, status == 200 ? okBody : "{\"error\":{\"message\":\"busy\"}}");
        });
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private InferenceClient client(URI baseUrl) {
        return client(baseUrl, Duration.ofMillis(200));
    }

    private InferenceClient client(URI baseUrl, Duration probeCeiling) {
        RetryPolicy fast = new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(40), 2.0);
        return new InferenceClient(
                baseUrl,
                Duration.ofSeconds(2),
                4,
                fast,
                fast,
                new CircuitBreaker("test", 10, Duration.ofSeconds(30), 1),
                Duration.ofMillis(20),
                probeCeiling,
                Duration.ofSeconds(1),
                PipelineMetrics.NOOP
        );
    }

    private URI serverUrl() {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort());
    }

    private static InferenceRequest request() {
        return InferenceRequest.builder()
                .model("test-model")
                .prompt("Read this page")
                .imageBase64("iVBORw0KGgo=")
                .temperature(0.3)
                .maxTokens(4500)
                .build();
    }

    private static InferenceResponse await(CompletableFuture<InferenceResponse> future) throws Exception {
        return future.get(10, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("should send an OpenAI-style vision request and parse the completion")
    void shouldCompleteRequest() throws Exception {
        onCompletion(new int[0], COMPLETION);
        client = client(serverUrl());

        InferenceResponse response = await(client.complete(request(), Duration.ofSeconds(5)));

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.text()).isEqualTo("page json");
        assertThat(response.finishReason()).isEqualTo("stop");
        assertThat(response.inputTokens()).isEqualTo(1500);
        assertThat(response.outputTokens()).isEqualTo(250);
        assertThat(response.transportAttempts()).isEqualTo(1);

        JsonNode body = mapper.readTree(bodies.get(0));
        assertThat(body.path("model").asText()).isEqualTo("test-model");
        assertThat(body.path("temperature").asDouble()).isEqualTo(0.3);
        JsonNode content = body.path("messages").get(0).path("content");
        assertThat(content.get(0).path("text").asText()).isEqualTo("Read this page");
        assertThat(content.get(1).path("image_url").path("url").asText())
                .isEqualTo("data:image/png;base64,iVBORw0KGgo=");
    }

    @Test
    @DisplayName("should back off and retry while the backend reports overload")
    void shouldRetryOverload() throws Exception {
        onCompletion(new int[]{503, 429}, COMPLETION);
        client = client(serverUrl());

        InferenceResponse response = await(client.complete(request(), Duration.ofSeconds(5)));

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.transportAttempts()).isEqualTo(3);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("should give up with RESOURCE_EXHAUSTED after the overload budget")
    void shouldExhaustOverloadRetries() throws Exception {
        onCompletion(new int[]{503, 503, 503, 503, 503}, COMPLETION);
        client = client(serverUrl());

        InferenceResponse response = await(client.complete(request(), Duration.ofSeconds(5)));

        assertThat(response.errorType()).isEqualTo(ErrorType.RESOURCE_EXHAUSTED);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("should not retry client errors")
    void shouldNotRetryClientErrors() throws Exception {
        onCompletion(new int[]{400}, COMPLETION);
        client = client(serverUrl());

        InferenceResponse response = await(client.complete(request(), Duration.ofSeconds(5)));

        assertThat(response.errorType()).isEqualTo(ErrorType.CLIENT_ERROR);
        assertThat(response.errorMessage()).contains("busy");
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("should report a completion envelope without content as malformed")
    void shouldReportMalformedEnvelope() throws Exception {
        onCompletion(new int[0], "{\"choices\":[]}");
        client = client(serverUrl());

        InferenceResponse response = await(client.complete(request(), Duration.ofSeconds(5)));

        assertThat(response.errorType()).isEqualTo(ErrorType.MALFORMED_RESPONSE);
    }

    @Test
    @DisplayName("should retry connection failures and then report a network error")
    void shouldReportUnreachableBackend() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        client = client(URI.create("http://127.0.0.1:" + port));

        InferenceResponse response = await(client.complete(request(), Duration.ofSeconds(2)));

        assertThat(response.errorType()).isEqualTo(ErrorType.NETWORK_ERROR);
        assertThat(response.errorType().isConnectivity()).isTrue();
        assertThat(response.transportAttempts()).isEqualTo(3);
        assertThat(client.getCircuitBreaker().getFailureCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("should complete in-flight calls as cancelled on shutdown")
    void shouldCancelInFlight() throws Exception {
        CountDownLatch received = new CountDownLatch(1);
        server.createContext("/v1/chat/completions", exchange -> {
            received.countDown();
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, COMPLETION);
        });
        client = client(serverUrl());

        CompletableFuture<InferenceResponse> pending = client.complete(request(), Duration.ofSeconds(30));
        assertThat(received.await(5, TimeUnit.SECONDS)).isTrue();
        client.cancelInFlight();

        assertThat(await(pending).errorType()).isEqualTo(ErrorType.CANCELLED);
        assertThat(await(client.complete(request(), Duration.ofSeconds(5))).errorType())
                .isEqualTo(ErrorType.CANCELLED);
        assertThat(client.getOutstandingCount()).isZero();
    }

    @Test
    @DisplayName("should list served models and probe readiness")
    void shouldListModels() throws Exception {
        client = client(serverUrl());

        assertThat(client.listModels(Duration.ofSeconds(2)).get(5, TimeUnit.SECONDS))
                .containsExactly("test-model", "other");
        assertThat(client.isReady().get(5, TimeUnit.SECONDS)).isTrue();
    }

    private void modelsAvailable(AtomicBoolean up, AtomicInteger probes) {
        server.removeContext("/v1/models");
        server.createContext("/v1/models", exchange -> {
            probes.incrementAndGet();
            if (up.get()) {
                respond(exchange, 200, "{\"data\":[{\"id\":\"test-model\"}]}");
            } else {
                respond(exchange, 503, "{\"error\":\"loading\"}");
            }
        });
    }

    @Test
    @DisplayName("should never have more exchanges in flight than maxInFlight")
    void shouldBoundInFlightExchanges() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        server.createContext("/v1/chat/completions", exchange -> {
            exchange.getRequestBody().readAllBytes();
            peak.accumulateAndGet(active.incrementAndGet(), Math::max);
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            active.decrementAndGet();
            respond(exchange, 200, COMPLETION);
        });
        client = client(serverUrl());

        List<CompletableFuture<InferenceResponse>> futures = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            futures.add(client.complete(request(), Duration.ofSeconds(10)));
        }

        for (CompletableFuture<InferenceResponse> future : futures) {
            assertThat(await(future).isSuccess()).isTrue();
        }
        assertThat(peak.get()).isLessThanOrEqualTo(4);
        assertThat(client.getOutstandingCount()).isZero();
    }

    @Test
    @DisplayName("should report BACKEND_UNAVAILABLE when the backend stays down past the probe ceiling")
    void shouldGiveUpAtProbeCeiling() throws Exception {
        AtomicInteger probes = new AtomicInteger();
        modelsAvailable(new AtomicBoolean(false), probes);
        onCompletion(new int[0], COMPLETION);
        client = client(serverUrl());
        client.getCircuitBreaker().forceState(CircuitBreaker.State.OPEN);

        InferenceResponse response = await(client.complete(request(), Duration.ofSeconds(5)));

        assertThat(response.errorType()).isEqualTo(ErrorType.BACKEND_UNAVAILABLE);
        assertThat(probes.get()).isGreaterThan(1);
        assertThat(calls.get()).isZero();
    }

    @Test
    @DisplayName("should resume sending once the readiness check succeeds")
    void shouldResumeAfterBackendRecovers() throws Exception {
        AtomicBoolean up = new AtomicBoolean(false);
        AtomicInteger probes = new AtomicInteger();
        modelsAvailable(up, probes);
        onCompletion(new int[0], COMPLETION);
        client = client(serverUrl(), Duration.ofSeconds(5));
        client.getCircuitBreaker().forceState(CircuitBreaker.State.OPEN);

        CompletableFuture<InferenceResponse> pending = client.complete(request(), Duration.ofSeconds(5));
        Thread.sleep(60);
        assertThat(pending).isNotDone();
        up.set(true);

        InferenceResponse response = await(pending);

        assertThat(response.isSuccess()).isTrue();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(client.getCircuitBreaker().getState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }
}
