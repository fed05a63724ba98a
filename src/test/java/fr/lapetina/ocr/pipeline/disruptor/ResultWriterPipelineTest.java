package fr.lapetina.ocr.pipeline.disruptor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.ocr.pipeline.domain.event.BatchWriteResult;
import fr.lapetina.ocr.pipeline.domain.model.Document;
import fr.lapetina.ocr.pipeline.domain.model.PageResponse;
import fr.lapetina.ocr.pipeline.domain.model.PageResult;
import fr.lapetina.ocr.pipeline.domain.model.WorkItem;
import fr.lapetina.ocr.pipeline.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ocr.pipeline.infrastructure.storage.LocalObjectStore;
import fr.lapetina.ocr.pipeline.infrastructure.storage.ObjectStore;
import fr.lapetina.ocr.pipeline.infrastructure.storage.ObjectStoreException;
import fr.lapetina.ocr.pipeline.infrastructure.storage.StoredObject;
import fr.lapetina.ocr.pipeline.processing.DocumentBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultWriterPipelineTest {

    @TempDir
    Path workspace;

    private LocalObjectStore store;
    private MetricsRegistry metrics;
    private ResultWriterPipeline pipeline;
    private final ObjectMapper mapper = new ObjectMapper();
    private final DocumentBuilder documentBuilder = new DocumentBuilder("1.0.0",
            Clock.fixed(Instant.parse("2024-05-02T08:30:00Z"), ZoneOffset.UTC));

    @BeforeEach
    void setUp() {
        store = new LocalObjectStore(workspace);
        metrics = new MetricsRegistry("test");
    }

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.close();
        }
        metrics.close();
    }

    private ResultWriterPipeline start(ObjectStore objectStore, boolean markdown) {
        pipeline = ResultWriterPipeline.builder()
                .ringBufferSize(8)
                .markdownEnabled(markdown)
                .objectStore(objectStore)
                .metrics(metrics)
                .build();
        pipeline.start();
        return pipeline;
    }

    private Document document(String sourceRef, String... pages) {
        List<PageResult> results = new java.util.ArrayList<>();
        for (int i = 0; i < pages.length; i++) {
            results.add(PageResult.accepted(i + 1, new PageResponse("en", true, 0, false, false, pages[i]), 10, 5, 1));
        }
        return documentBuilder.build(sourceRef, results);
    }

    @Test
    @DisplayName("should write one JSON line per document and a markdown file per source")
    void shouldWriteBatch() throws Exception {
        WorkItem item = WorkItem.of(List.of("/in/a.pdf", "/in/b.pdf"));
        List<Document> documents = List.of(document("/in/a.pdf", "one", "two"), document("/in/b.pdf", "three"));

        BatchWriteResult result = start(store, true).submit(item, documents).get(10, TimeUnit.SECONDS);

        assertThat(result.outputKey()).isEqualTo(OutputKeys.results(item.id()));
        assertThat(result.markdownKeys()).containsExactly("markdown/in/a.md", "markdown/in/b.md");
        assertThat(result.documents()).isEqualTo(2);

        String jsonl = store.get(result.outputKey()).orElseThrow().asString();
        String[] lines = jsonl.split("\n");
        assertThat(lines).hasSize(2);
        assertThat(result.bytesWritten()).isGreaterThanOrEqualTo(jsonl.length());

        JsonNode first = mapper.readTree(lines[0]);
        assertThat(first.path("text").asText()).isEqualTo("one\ntwo");
        assertThat(first.path("source").asText()).isEqualTo("page-ocr-pipeline");
        assertThat(first.path("created").asText()).isEqualTo("2024-05-02");
        assertThat(first.path("metadata").path("Source-File").asText()).isEqualTo("/in/a.pdf");
        assertThat(first.path("metadata").path("pdf-total-pages").asInt()).isEqualTo(2);
        assertThat(first.path("attributes").path("pdf_page_numbers").get(1).toString()).isEqualTo("[4,7,2]");

        assertThat(store.get("markdown/in/b.md").orElseThrow().asString()).isEqualTo("three");
        assertThat(metrics.snapshot().documentsWritten()).isEqualTo(2);
    }

    @Test
    @DisplayName("should overwrite the previous output when a batch is written again")
    void shouldOverwriteOnRewrite() throws Exception {
        WorkItem item = WorkItem.of(List.of("/in/a.pdf"));
        start(store, false);

        pipeline.submit(item, List.of(document("/in/a.pdf", "draft"))).get(10, TimeUnit.SECONDS);
        BatchWriteResult second = pipeline.submit(item, List.of(document("/in/a.pdf", "final")))
                .get(10, TimeUnit.SECONDS);

        assertThat(second.markdownKeys()).isEmpty();
        assertThat(store.list("results/")).containsExactly(OutputKeys.results(item.id()));
        assertThat(store.get(second.outputKey()).orElseThrow().asString()).contains("\"final\"");
    }

    @Test
    @DisplayName("should write an empty output for a batch whose documents were all skipped")
    void shouldWriteEmptyBatch() throws Exception {
        WorkItem item = WorkItem.of(List.of("/in/missing.pdf"));

        BatchWriteResult result = start(store, true).submit(item, List.of()).get(10, TimeUnit.SECONDS);

        assertThat(result.documents()).isZero();
        assertThat(store.exists(result.outputKey())).isTrue();
    }

    @Test
    @DisplayName("should fail the future when storage fails")
    void shouldPropagateStorageFailure() {
        ObjectStore failing = new ObjectStore() {
            @Override public Optional<StoredObject> get(String key) { return store.get(key); }
            @Override public void put(String key, byte[] data) { throw new ObjectStoreException("disk full"); }
            @Override public boolean putIfAbsent(String key, byte[] data) { return false; }
            @Override public boolean compareAndSet(String key, String v, byte[] data) { return false; }
            @Override public List<String> list(String prefix) { return store.list(prefix); }
            @Override public void delete(String key) { }
        };
        WorkItem item = WorkItem.of(List.of("/in/a.pdf"));

        CompletableFuture<BatchWriteResult> future = start(failing, false)
                .submit(item, List.of(document("/in/a.pdf", "text")));

        assertThatThrownBy(() -> future.get(10, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(ObjectStoreException.class);
    }

    @Test
    @DisplayName("should refuse batches before start")
    void shouldRejectWhenNotRunning() {
        ResultWriterPipeline stopped = ResultWriterPipeline.builder().objectStore(store).build();

        assertThat(stopped.submit(WorkItem.of(List.of("/a.pdf")), List.of())).isCompletedExceptionally();
    }
}
