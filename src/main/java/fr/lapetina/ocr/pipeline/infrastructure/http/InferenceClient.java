package fr.lapetina.ocr.pipeline.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.ocr.pipeline.domain.model.ErrorType;
import fr.lapetina.ocr.pipeline.domain.model.InferenceRequest;
import fr.lapetina.ocr.pipeline.domain.model.InferenceResponse;
import fr.lapetina.ocr.pipeline.domain.retry.RetryPolicy;
import fr.lapetina.ocr.pipeline.infrastructure.config.PipelineConfig;
import fr.lapetina.ocr.pipeline.infrastructure.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * HTTP client for an OpenAI-compatible vision model endpoint.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. Every call completes
 * normally with an {@link InferenceResponse}; failures are reported through
 * its {@link ErrorType}, never by completing the future exceptionally.
 *
 * <ul>
 *   <li>At most {@code maxInFlight} exchanges run at once; further calls wait in FIFO order.</li>
 *   <li>Transport failures are retried with {@code transportRetry} backoff.</li>
 *   <li>429, 503 and 507 answers are retried with the longer {@code overloadRetry} backoff.</li>
 *   <li>Once the circuit breaker opens, callers wait for the readiness probe
 *       ({@code GET /v1/models}) to succeed, up to {@code probeCeiling}.</li>
 * </ul>
 */
public class InferenceClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InferenceClient.class);

    private static final Set<Integer> OVERLOAD_STATUSES = Set.of(429, 503, 507);

    private final URI baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RetryPolicy transportRetry;
    private final RetryPolicy overloadRetry;
    private final CircuitBreaker breaker;
    private final Duration probeInterval;
    private final Duration probeCeiling;
    private final Duration probeTimeout;
    private final PipelineMetrics metrics;

    private final int maxInFlight;
    private final Semaphore permits;
    private final Queue<Runnable> pending = new ConcurrentLinkedQueue<>();
    private final Set<Call> calls = ConcurrentHashMap.newKeySet();
    private final AtomicReference<CompletableFuture<Boolean>> recovery = new AtomicReference<>();
    private volatile boolean cancelled;

    public InferenceClient(
            URI baseUrl,
            Duration connectTimeout,
            int maxInFlight,
            RetryPolicy transportRetry,
            RetryPolicy overloadRetry,
            CircuitBreaker breaker,
            Duration probeInterval,
            Duration probeCeiling,
            Duration probeTimeout,
            PipelineMetrics metrics
    ) {
        this.baseUrl = baseUrl;
        this.maxInFlight = maxInFlight;
        this.permits = new Semaphore(maxInFlight, true);
        this.transportRetry = transportRetry;
        this.overloadRetry = overloadRetry;
        this.breaker = breaker;
        this.probeInterval = probeInterval;
        this.probeCeiling = probeCeiling;
        this.probeTimeout = probeTimeout;
        this.metrics = metrics;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public InferenceClient(URI baseUrl) {
        this(
                baseUrl,
                Duration.ofSeconds(10),
                64,
                new RetryPolicy(5, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0),
                new RetryPolicy(10, Duration.ofSeconds(10), Duration.ofMinutes(5), 2.0),
                new CircuitBreaker(baseUrl.toString()),
                Duration.ofSeconds(1),
                Duration.ofMinutes(10),
                Duration.ofSeconds(5),
                PipelineMetrics.NOOP
        );
    }

    /**
     * Creates a client from the {@code inference} configuration section.
     */
    public static InferenceClient fromConfig(PipelineConfig.InferenceConfig config, PipelineMetrics metrics) {
        PipelineConfig.CircuitBreakerConfig cb = config.getCircuitBreaker();
        PipelineConfig.HealthProbeConfig probe = config.getHealthProbe();
        return new InferenceClient(
                URI.create(config.getUrl()),
                Duration.ofMillis(config.getConnectTimeoutMs()),
                config.getMaxInFlight(),
                toPolicy(config.getRetry()),
                toPolicy(config.getOverloadRetry()),
                new CircuitBreaker(config.getUrl(), cb.getFailureThreshold(),
                        Duration.ofMillis(cb.getRecoveryMs()), cb.getHalfOpenMaxCalls()),
                Duration.ofMillis(probe.getIntervalMs()),
                Duration.ofMillis(probe.getCeilingMs()),
                Duration.ofMillis(probe.getTimeoutMs()),
                metrics
        );
    }

    private static RetryPolicy toPolicy(PipelineConfig.RetryConfig retry) {
        return new RetryPolicy(
                retry.getMaxAttempts(),
                Duration.ofMillis(retry.getInitialBackoffMs()),
                Duration.ofMillis(retry.getMaxBackoffMs()),
                retry.getBackoffMultiplier(),
                retry.getJitterFactor(),
                () -> ThreadLocalRandom.current().nextDouble()
        );
    }

    /**
     * Sends a completion request.
     *
     * @param request inference request
     * @param timeout per-exchange response timeout
     * @return future that always completes normally
     */
    public CompletableFuture<InferenceResponse> complete(InferenceRequest request, Duration timeout) {
        if (cancelled) {
            return CompletableFuture.completedFuture(cancelledResponse(request));
        }
        Call call = new Call(request, timeout);
        calls.add(call);
        call.result.whenComplete((response, ex) -> calls.remove(call));
        dispatch(call);
        return call.result;
    }

    private void dispatch(Call call) {
        if (call.result.isDone()) {
            return;
        }
        if (!breaker.allowRequest()) {
            awaitBackend(call);
            return;
        }
        admit(() -> exchange(call));
    }

    private void admit(Runnable exchange) {
        pending.add(exchange);
        drain();
    }

    private void drain() {
        while (!pending.isEmpty() && permits.tryAcquire()) {
            Runnable next = pending.poll();
            if (next == null) {
                permits.release();
                continue;
            }
            next.run();
        }
    }

    private void releasePermit() {
        permits.release();
        drain();
    }

    private void exchange(Call call) {
        if (call.result.isDone()) {
            releasePermit();
            return;
        }
        InferenceRequest request = call.request;
        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(request, call.timeout);
        } catch (JsonProcessingException e) {
            releasePermit();
            log.error("Failed to build request: requestId={}", request.requestId(), e);
            finish(call, error(request, ErrorType.CLIENT_ERROR, "Failed to build request: " + e.getMessage()));
            return;
        }

        call.exchanges++;
        Instant startTime = Instant.now();
        log.debug("Sending request: requestId={}, correlationId={}, model={}, exchange={}",
                request.requestId(), request.correlationId(), request.model(), call.exchanges);

        CompletableFuture<HttpResponse<String>> future =
                httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString());
        call.inFlight = future;
        future.whenComplete((response, ex) -> {
            releasePermit();
            Duration latency = Duration.between(startTime, Instant.now());
            try {
                if (ex != null) {
                    onTransportFailure(call, unwrap(ex), latency);
                } else {
                    onResponse(call, response, latency);
                }
            } catch (RuntimeException e) {
                log.error("Unexpected error handling response: requestId={}", request.requestId(), e);
                finish(call, error(request, ErrorType.INTERNAL_ERROR, e.getMessage()));
            }
        });
    }

    private HttpRequest buildHttpRequest(InferenceRequest request, Duration timeout) throws JsonProcessingException {
        return HttpRequest.newBuilder()
                .uri(endpoint("v1/chat/completions"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("X-Request-ID", request.requestId())
                .header("X-Correlation-ID", request.correlationId())
                .POST(HttpRequest.BodyPublishers.ofString(buildRequestBody(request)))
                .build();
    }

    private String buildRequestBody(InferenceRequest request) throws JsonProcessingException {
        List<Map<String, Object>> content = new ArrayList<>();
        content.add(Map.of("type", "text", "text", request.prompt()));
        if (request.imageBase64() != null) {
            content.add(Map.of(
                    "type", "image_url",
                    "image_url", Map.of("url", "data:image/png;base64," + request.imageBase64())
            ));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", request.model());
        body.put("messages", List.of(Map.of("role", "user", "content", content)));
        body.put("max_tokens", request.maxTokens());
        body.put("temperature", request.temperature());
        return objectMapper.writeValueAsString(body);
    }

    private void onResponse(Call call, HttpResponse<String> response, Duration latency) {
        InferenceRequest request = call.request;
        int statusCode = response.statusCode();
        // Any HTTP answer proves the backend is up
        breaker.recordSuccess();

        if (statusCode >= 200 && statusCode < 300) {
            InferenceResponse parsed = parseCompletion(request, response.body(), latency);
            metrics.recordInferenceCall(latency, parsed.errorType());
            log.debug("Request successful: requestId={}, status={}, latencyMs={}, inputTokens={}, outputTokens={}",
                    request.requestId(), statusCode, latency.toMillis(), parsed.inputTokens(), parsed.outputTokens());
            finish(call, parsed);
            return;
        }

        if (OVERLOAD_STATUSES.contains(statusCode)) {
            metrics.recordInferenceCall(latency, ErrorType.RESOURCE_EXHAUSTED);
            call.overloadRetries++;
            if (!overloadRetry.canRetry(call.overloadRetries)) {
                log.error("Backend overloaded, retries exhausted: requestId={}, status={}, attempts={}",
                        request.requestId(), statusCode, call.overloadRetries);
                finish(call, error(request, ErrorType.RESOURCE_EXHAUSTED, "HTTP " + statusCode));
                return;
            }
            Duration delay = overloadRetry.delayBefore(call.overloadRetries - 1);
            log.warn("Backend overloaded, backing off: requestId={}, status={}, attempt={}, delayMs={}",
                    request.requestId(), statusCode, call.overloadRetries, delay.toMillis());
            metrics.recordTransportRetry();
            schedule(call, delay);
            return;
        }

        ErrorType errorType = statusCode >= 500 ? ErrorType.SERVER_ERROR : ErrorType.CLIENT_ERROR;
        metrics.recordInferenceCall(latency, errorType);
        log.warn("Request failed with HTTP error: requestId={}, status={}, latencyMs={}",
                request.requestId(), statusCode, latency.toMillis());
        finish(call, error(request, errorType, "HTTP " + statusCode + ": " + errorMessage(response.body())));
    }

    private void onTransportFailure(Call call, Throwable cause, Duration latency) {
        if (cause instanceof CancellationException || call.result.isDone()) {
            return;
        }
        InferenceRequest request = call.request;
        ErrorType errorType = classifyException(cause);
        metrics.recordInferenceCall(latency, errorType);

        if (errorType == ErrorType.INTERNAL_ERROR) {
            log.error("Request failed unexpectedly: requestId={}, errorType={}, error={}",
                    request.requestId(), cause.getClass().getSimpleName(), cause.getMessage(), cause);
            finish(call, error(request, errorType, cause.getMessage()));
            return;
        }

        breaker.recordFailure();
        call.transportFailures++;
        if (!transportRetry.canRetry(call.transportFailures)) {
            log.error("Request failed, retries exhausted: requestId={}, errorType={}, attempts={}, error={}",
                    request.requestId(), errorType, call.transportFailures, cause.getMessage());
            finish(call, error(request, errorType, cause.getClass().getSimpleName() + ": " + cause.getMessage()));
            return;
        }
        Duration delay = transportRetry.delayBefore(call.transportFailures - 1);
        log.warn("Transport failure, retrying: requestId={}, errorType={}, attempt={}, delayMs={}, error={}",
                request.requestId(), errorType, call.transportFailures, delay.toMillis(), cause.getMessage());
        metrics.recordTransportRetry();
        schedule(call, delay);
    }

    private ErrorType classifyException(Throwable cause) {
        if (cause instanceof HttpConnectTimeoutException) {
            return ErrorType.NETWORK_ERROR;
        }
        if (cause instanceof HttpTimeoutException || cause instanceof TimeoutException) {
            return ErrorType.TIMEOUT;
        }
        if (cause instanceof IOException) {
            return ErrorType.NETWORK_ERROR;
        }
        return ErrorType.INTERNAL_ERROR;
    }

    private void schedule(Call call, Duration delay) {
        CompletableFuture.runAsync(
                () -> dispatch(call),
                CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS)
        );
    }

    private InferenceResponse parseCompletion(InferenceRequest request, String body, Duration latency) {
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode choice = root.path("choices").path(0);
            JsonNode content = choice.path("message").path("content");
            if (!content.isTextual()) {
                return error(request, ErrorType.MALFORMED_RESPONSE, "Missing choices[0].message.content");
            }
            JsonNode usage = root.path("usage");
            return InferenceResponse.builder()
                    .requestId(request.requestId())
                    .model(request.model())
                    .text(content.asText())
                    .finishReason(choice.path("finish_reason").asText(null))
                    .inputTokens(usage.path("prompt_tokens").asInt(0))
                    .outputTokens(usage.path("completion_tokens").asInt(0))
                    .createdAt(request.createdAt())
                    .completedAt(Instant.now())
                    .totalDuration(latency)
                    .build();
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse completion envelope: requestId={}, error={}",
                    request.requestId(), e.getOriginalMessage());
            return error(request, ErrorType.MALFORMED_RESPONSE, "Failed to parse response: " + e.getOriginalMessage());
        }
    }

    private String errorMessage(String body) {
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.isTextual()) {
                return error.asText();
            }
            if (error.path("message").isTextual()) {
                return error.path("message").asText();
            }
        } catch (JsonProcessingException ignored) {
            // Non-JSON error body, fall through to the raw text
        }
        return body == null || body.length() <= 200 ? body : body.substring(0, 200);
    }

    private void awaitBackend(Call call) {
        CompletableFuture<Boolean> current = recovery.get();
        if (current == null || current.isDone()) {
            CompletableFuture<Boolean> fresh = new CompletableFuture<>();
            if (recovery.compareAndSet(current, fresh)) {
                log.warn("Backend suspected down, probing readiness: url={}, intervalMs={}, ceilingMs={}",
                        baseUrl, probeInterval.toMillis(), probeCeiling.toMillis());
                probeUntil(fresh, Instant.now().plus(probeCeiling));
            }
            current = recovery.get();
        }
        current.thenAccept(healthy -> {
            if (healthy) {
                dispatch(call);
            } else {
                finish(call, error(call.request, ErrorType.BACKEND_UNAVAILABLE,
                        "Backend not ready after " + probeCeiling.toMillis() + "ms"));
            }
        });
    }

    private void probeUntil(CompletableFuture<Boolean> outcome, Instant deadline) {
        if (cancelled) {
            outcome.complete(false);
            return;
        }
        isReady().thenAccept(ready -> {
            if (ready) {
                breaker.recordProbeSuccess();
                log.info("Backend ready again: url={}", baseUrl);
                outcome.complete(true);
            } else if (Instant.now().isBefore(deadline)) {
                CompletableFuture.runAsync(
                        () -> probeUntil(outcome, deadline),
                        CompletableFuture.delayedExecutor(probeInterval.toMillis(), TimeUnit.MILLISECONDS)
                );
            } else {
                log.error("Backend still unavailable at probe ceiling: url={}, ceilingMs={}",
                        baseUrl, probeCeiling.toMillis());
                outcome.complete(false);
            }
        });
    }

    /**
     * Readiness probe: true when {@code /v1/models} answers 200.
     */
    public CompletableFuture<Boolean> isReady() {
        return listModels(probeTimeout).handle((models, ex) -> {
            if (ex != null) {
                log.debug("Readiness probe failed: url={}, error={}", baseUrl, unwrap(ex).getMessage());
                return false;
            }
            return true;
        });
    }

    /**
     * Lists the model ids served by the backend.
     * Unlike {@link #complete}, this future fails on transport or HTTP errors.
     */
    public CompletableFuture<List<String>> listModels(Duration timeout) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint("v1/models"))
                .timeout(timeout)
                .GET()
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    if (response.statusCode() != 200) {
                        throw new UncheckedIOException(new IOException(
                                "Model listing returned HTTP " + response.statusCode()));
                    }
                    try {
                        List<String> ids = new ArrayList<>();
                        for (JsonNode model : objectMapper.readTree(response.body()).path("data")) {
                            if (model.path("id").isTextual()) {
                                ids.add(model.path("id").asText());
                            }
                        }
                        return ids;
                    } catch (JsonProcessingException e) {
                        throw new UncheckedIOException(e);
                    }
                });
    }

    /**
     * Completes every outstanding call with {@link ErrorType#CANCELLED}; later calls are cancelled immediately.
     */
    public void cancelInFlight() {
        cancelled = true;
        int count = 0;
        for (Call call : calls) {
            if (call.result.complete(cancelledResponse(call.request).withTransportAttempts(call.exchanges))) {
                count++;
            }
            CompletableFuture<?> exchange = call.inFlight;
            if (exchange != null) {
                exchange.cancel(true);
            }
        }
        CompletableFuture<Boolean> probing = recovery.get();
        if (probing != null) {
            probing.complete(false);
        }
        log.warn("Cancelled in-flight inference calls: count={}", count);
    }

    private InferenceResponse cancelledResponse(InferenceRequest request) {
        return error(request, ErrorType.CANCELLED, "Cancelled by shutdown");
    }

    private static InferenceResponse error(InferenceRequest request, ErrorType errorType, String message) {
        return InferenceResponse.error(request.requestId(), request.model(), errorType, message, request.createdAt());
    }

    private void finish(Call call, InferenceResponse response) {
        call.result.complete(response.withTransportAttempts(Math.max(1, call.exchanges)));
    }

    private URI endpoint(String path) {
        String base = baseUrl.toString();
        if (!base.endsWith("/")) {
            base += "/";
        }
        return URI.create(base + path);
    }

    private static Throwable unwrap(Throwable ex) {
        return ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    }

    public CircuitBreaker getCircuitBreaker() {
        return breaker;
    }

    /**
     * Calls accepted but not yet completed, including those waiting for a permit or backoff.
     */
    public int getOutstandingCount() {
        return calls.size();
    }

    public int getActiveExchanges() {
        return maxInFlight - permits.availablePermits();
    }

    public URI getBaseUrl() {
        return baseUrl;
    }

    @Override
    public void close() {
        if (!calls.isEmpty()) {
            cancelInFlight();
        }
    }

    private static final class Call {
        final InferenceRequest request;
        final Duration timeout;
        final CompletableFuture<InferenceResponse> result = new CompletableFuture<>();
        volatile CompletableFuture<?> inFlight;
        volatile int exchanges;
        volatile int transportFailures;
        volatile int overloadRetries;

        Call(InferenceRequest request, Duration timeout) {
            this.request = request;
            this.timeout = timeout;
        }
    }
}
