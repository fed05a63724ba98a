package fr.lapetina.ocr.pipeline.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.ocr.pipeline.disruptor.ResultWriterPipeline;
import fr.lapetina.ocr.pipeline.infrastructure.http.CircuitBreaker;
import fr.lapetina.ocr.pipeline.infrastructure.http.InferenceClient;
import fr.lapetina.ocr.pipeline.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ocr.pipeline.infrastructure.metrics.MetricsSnapshot;
import fr.lapetina.ocr.pipeline.queue.QueueStats;
import fr.lapetina.ocr.pipeline.queue.WorkQueue;
import fr.lapetina.ocr.pipeline.worker.WorkerManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Read-only status endpoints using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET /health - Backend, queue and writer state
 * - GET /metrics - Prometheus metrics endpoint
 */
public final class StatusServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StatusServer.class);

    private final HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final InferenceClient inferenceClient;
    private final WorkQueue queue;
    private final WorkerManager workerManager;
    private final ResultWriterPipeline writer;
    private final MetricsRegistry metricsRegistry;

    public StatusServer(
            String host,
            int port,
            InferenceClient inferenceClient,
            WorkQueue queue,
            WorkerManager workerManager,
            ResultWriterPipeline writer,
            MetricsRegistry metricsRegistry
    ) throws IOException {
        this.inferenceClient = inferenceClient;
        this.queue = queue;
        this.workerManager = workerManager;
        this.writer = writer;
        this.metricsRegistry = metricsRegistry;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule());

        this.server = HttpServer.create(new InetSocketAddress(host, port), 0);
        this.executor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "status-server");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());

        log.info("Status server configured: host={}, port={}", host, port);
    }

    public void start() {
        server.start();
        log.info("Status server started");
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdownNow();
        log.info("Status server stopped");
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            CircuitBreaker.State breaker = inferenceClient.getCircuitBreaker().getState();
            String status = determineOverallHealth(breaker);

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", status);
            health.put("timestamp", System.currentTimeMillis());

            Map<String, Object> backend = new LinkedHashMap<>();
            backend.put("url", inferenceClient.getBaseUrl().toString());
            backend.put("circuit", breaker.name());
            backend.put("outstanding", inferenceClient.getOutstandingCount());
            backend.put("activeExchanges", inferenceClient.getActiveExchanges());
            health.put("backend", backend);

            Map<String, Object> queueInfo = new LinkedHashMap<>();
            try {
                QueueStats stats = queue.stats();
                queueInfo.put("total", stats.total());
                queueInfo.put("done", stats.done());
                queueInfo.put("failed", stats.failed());
                queueInfo.put("leased", stats.leased());
                queueInfo.put("available", stats.available());
            } catch (RuntimeException e) {
                queueInfo.put("error", e.getMessage());
            }
            health.put("queue", queueInfo);

            MetricsSnapshot snapshot = metricsRegistry.snapshot();
            Map<String, Object> progress = new LinkedHashMap<>();
            progress.put("activeLeases", workerManager.getActiveLeaseCount());
            progress.put("ringBufferRemaining", writer.getRemainingCapacity());
            progress.put("pages", snapshot.pagesProcessed());
            progress.put("fallbackRate", snapshot.fallbackRate());
            progress.put("documents", snapshot.documentsWritten());
            health.put("pipeline", progress);

            int statusCode = "DOWN".equals(status) ? 503 : 200;
            sendJson(exchange, statusCode, health);
        }

        private String determineOverallHealth(CircuitBreaker.State breaker) {
            return switch (breaker) {
                case CLOSED -> "UP";
                case HALF_OPEN -> "DEGRADED";
                case OPEN -> "DOWN";
            };
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== UTILITIES ====================

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message);
        sendJson(exchange, statusCode, error);
    }
}
