package fr.lapetina.ocr.pipeline.integration;

import fr.lapetina.ocr.pipeline.PipelineOrchestrator;
import fr.lapetina.ocr.pipeline.disruptor.OutputKeys;
import fr.lapetina.ocr.pipeline.domain.model.RunSummary;
import fr.lapetina.ocr.pipeline.domain.model.WorkItem;
import fr.lapetina.ocr.pipeline.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.ocr.pipeline.support.FakePageSource;
import fr.lapetina.ocr.pipeline.support.StubInferenceClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static fr.lapetina.ocr.pipeline.support.StubInferenceClient.completion;
import static fr.lapetina.ocr.pipeline.support.StubInferenceClient.pageJson;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end runs over a temporary workspace.
 * Configuration is externalized to test-config.yaml.
 */
@Timeout(60)
class PipelineOrchestratorIntegrationTest {

    @TempDir
    Path root;

    private Path input;
    private String docA;
    private String docB;
    private TestPipelineFactory factory;

    @BeforeEach
    void setUp() throws IOException {
        input = Files.createDirectories(root.resolve("input"));
        docA = Files.write(input.resolve("a.pdf"), new byte[]{1}).toString();
        docB = Files.write(input.resolve("b.pdf"), new byte[]{1}).toString();
    }

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    private TestPipelineFactory factory(StubInferenceClient client) {
        FakePageSource pages = new FakePageSource().withDocument(docA, 3).withDocument(docB, 1);
        factory = TestPipelineFactory.create(root.resolve("workspace"), List.of(input.toString()), client, pages);
        return factory;
    }

    private String results() {
        String id = WorkItem.of(List.of(docA, docB)).id();
        return factory.getObjectStore().get(OutputKeys.results(id)).orElseThrow().asString();
    }

    @Test
    @DisplayName("should process all sources and exit cleanly when a page recovers after retries")
    void shouldCompleteRun() throws Exception {
        StubInferenceClient client = new StubInferenceClient((request, call) ->
                request.correlationId().equals(docA + "-2") && call <= 2
                        ? completion(request, "{\"natural_text\": ")
                        : completion(request, pageJson("content")));

        RunSummary summary = new PipelineOrchestrator(factory(client)).run();

        assertThat(summary.exitCode()).isEqualTo(PipelineOrchestrator.EXIT_OK);
        assertThat(summary.documentsWritten()).isEqualTo(2);
        assertThat(summary.pagesProcessed()).isEqualTo(4);
        assertThat(summary.fallbackPages()).isZero();
        assertThat(summary.batchesCompleted()).isEqualTo(1);
        assertThat(client.callsFor(docA, 2)).isEqualTo(3);
        assertThat(results().lines()).hasSize(2);
        assertThat(factory.getObjectStore().exists("markdown" + input.resolve("a.md"))).isTrue();
    }

    @Test
    @DisplayName("should write fallback output and report an incomplete run when the backend goes away")
    void shouldReportUnreachableBackend() throws Exception {
        RunSummary summary = new PipelineOrchestrator(factory(StubInferenceClient.unreachable())).run();

        assertThat(summary.exitCode()).isEqualTo(PipelineOrchestrator.EXIT_INCOMPLETE);
        assertThat(summary.batchesFailed()).isEqualTo(1);
        assertThat(summary.fallbackRate()).isEqualTo(1.0);
        assertThat(results().lines()).hasSize(2);
    }

    @Test
    @DisplayName("should resume from the existing queue without reprocessing finished work")
    void shouldResumeIdempotently() throws Exception {
        new PipelineOrchestrator(factory(StubInferenceClient.answering("first run"))).run();
        factory.close();

        StubInferenceClient second = StubInferenceClient.answering("second run");
        RunSummary summary = new PipelineOrchestrator(factory(second)).run();

        assertThat(summary.exitCode()).isEqualTo(PipelineOrchestrator.EXIT_OK);
        assertThat(second.getRequests()).isEmpty();
        assertThat(results()).contains("first run");
    }

    @Test
    @DisplayName("should refuse to start when the backend serves another model")
    void shouldFailStartupOnModelMismatch() {
        StubInferenceClient client = new StubInferenceClient((request, call) -> completion(request, "x")) {
            @Override
            public CompletableFuture<List<String>> listModels(Duration timeout) {
                return CompletableFuture.completedFuture(List.of("another-model"));
            }
        };

        assertThatThrownBy(() -> new PipelineOrchestrator(factory(client)).run())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("another-model");
    }
}
