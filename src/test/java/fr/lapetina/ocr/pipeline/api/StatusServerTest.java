package fr.lapetina.ocr.pipeline.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.ocr.pipeline.infrastructure.http.CircuitBreaker;
import fr.lapetina.ocr.pipeline.integration.TestPipelineFactory;
import fr.lapetina.ocr.pipeline.support.FakePageSource;
import fr.lapetina.ocr.pipeline.support.StubInferenceClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StatusServerTest {

    @TempDir
    Path workspace;

    private final HttpClient http = HttpClient.newHttpClient();
    private final ObjectMapper mapper = new ObjectMapper();

    private TestPipelineFactory factory;
    private StatusServer server;

    @BeforeEach
    void setUp() throws IOException {
        factory = TestPipelineFactory.create(workspace, List.of(),
                StubInferenceClient.answering("ok"), new FakePageSource());
        factory.getQueue().populate(List.of(List.of("/in/a.pdf"), List.of("/in/b.pdf")));
        server = new StatusServer("127.0.0.1", 0, factory.getInferenceClient(), factory.getQueue(),
                factory.getWorkerManager(), factory.getWriter(), factory.getMetricsRegistry());
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
        factory.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.getPort() + path))
                .GET()
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("should report UP with queue counts while the backend circuit is closed")
    void shouldReportHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode health = mapper.readTree(response.body());
        assertThat(health.path("status").asText()).isEqualTo("UP");
        assertThat(health.path("queue").path("total").asInt()).isEqualTo(2);
        assertThat(health.path("queue").path("available").asInt()).isEqualTo(2);
    }

    @Test
    @DisplayName("should report DOWN with 503 while the backend circuit is open")
    void shouldReportDown() throws Exception {
        factory.getInferenceClient().getCircuitBreaker().forceState(CircuitBreaker.State.OPEN);

        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(503);
        assertThat(mapper.readTree(response.body()).path("status").asText()).isEqualTo("DOWN");
    }

    @Test
    @DisplayName("should expose Prometheus metrics including pipeline gauges")
    void shouldExposeMetrics() throws Exception {
        HttpResponse<String> response = get("/metrics");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("_active_leases");
    }
}
