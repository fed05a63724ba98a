package fr.lapetina.ocr.pipeline.worker;

import fr.lapetina.ocr.pipeline.disruptor.OutputKeys;
import fr.lapetina.ocr.pipeline.disruptor.ResultWriterPipeline;
import fr.lapetina.ocr.pipeline.domain.model.FallbackTextMode;
import fr.lapetina.ocr.pipeline.domain.model.WorkItem;
import fr.lapetina.ocr.pipeline.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ocr.pipeline.infrastructure.metrics.MetricsSnapshot;
import fr.lapetina.ocr.pipeline.infrastructure.storage.LocalObjectStore;
import fr.lapetina.ocr.pipeline.processing.DocumentBuilder;
import fr.lapetina.ocr.pipeline.processing.DocumentProcessor;
import fr.lapetina.ocr.pipeline.processing.PageProcessor;
import fr.lapetina.ocr.pipeline.processing.PageResponseParser;
import fr.lapetina.ocr.pipeline.processing.PromptBuilder;
import fr.lapetina.ocr.pipeline.processing.RepetitionDetector;
import fr.lapetina.ocr.pipeline.processing.SamplingSchedule;
import fr.lapetina.ocr.pipeline.queue.LeasedWork;
import fr.lapetina.ocr.pipeline.queue.ObjectStoreWorkQueue;
import fr.lapetina.ocr.pipeline.queue.QueueStats;
import fr.lapetina.ocr.pipeline.support.FakePageSource;
import fr.lapetina.ocr.pipeline.support.StubInferenceClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Timeout(60)
class WorkerManagerTest {

    @TempDir
    Path workspace;

    private LocalObjectStore store;
    private ObjectStoreWorkQueue queue;
    private MetricsRegistry metrics;
    private ResultWriterPipeline writer;
    private ShutdownSignal shutdownSignal;
    private FakePageSource pageSource;

    @BeforeEach
    void setUp() {
        store = new LocalObjectStore(workspace);
        queue = new ObjectStoreWorkQueue(store);
        metrics = new MetricsRegistry("test");
        shutdownSignal = new ShutdownSignal();
        pageSource = new FakePageSource()
                .withDocument("/in/a.pdf", 2)
                .withDocument("/in/b.pdf", 1)
                .withDocument("/in/c.pdf", 3);
        writer = ResultWriterPipeline.builder()
                .ringBufferSize(8)
                .objectStore(store)
                .metrics(metrics)
                .markdownEnabled(true)
                .build();
        writer.start();
    }

    @AfterEach
    void tearDown() {
        writer.close();
        metrics.close();
    }

    private WorkerManager manager(StubInferenceClient client, int workers) {
        PageProcessor pageProcessor = new PageProcessor(
                client, pageSource, Runnable::run, new PromptBuilder(),
                new PageResponseParser(0, new RepetitionDetector()),
                new SamplingSchedule(4500, 3000), "test-model", 3, 1288, Duration.ofSeconds(5),
                FallbackTextMode.EMPTY, metrics, shutdownSignal::isForced);
        DocumentProcessor documentProcessor = new DocumentProcessor(
                pageSource, pageProcessor, new DocumentBuilder("1.0.0", Clock.systemUTC()), 4);
        return WorkerManager.builder()
                .queue(queue)
                .documentProcessor(documentProcessor)
                .writer(writer)
                .metrics(metrics)
                .shutdownSignal(shutdownSignal)
                .workerCount(workers)
                .leaseVisibility(Duration.ofSeconds(30))
                .renewInterval(Duration.ofSeconds(5))
                .maxBatchAttempts(2)
                .pollInterval(Duration.ofMillis(50))
                .ownerPrefix("test")
                .build();
    }

    private long lines(String key) {
        return store.get(key).orElseThrow().asString().lines().count();
    }

    @Test
    @DisplayName("should process every batch once and exit when the queue is drained")
    void shouldDrainQueue() throws Exception {
        List<String> first = List.of("/in/a.pdf", "/in/b.pdf");
        List<String> second = List.of("/in/c.pdf");
        queue.populate(List.of(first, second));

        manager(StubInferenceClient.answering("ok"), 2).run();

        assertThat(queue.stats()).isEqualTo(new QueueStats(2, 2, 0, 0));
        assertThat(lines(OutputKeys.results(WorkItem.of(first).id()))).isEqualTo(2);
        assertThat(lines(OutputKeys.results(WorkItem.of(second).id()))).isEqualTo(1);
        assertThat(store.exists("markdown/in/c.md")).isTrue();

        MetricsSnapshot snapshot = metrics.snapshot();
        assertThat(snapshot.pagesProcessed()).isEqualTo(6);
        assertThat(snapshot.batchesCompleted()).isEqualTo(2);
        assertThat(snapshot.documentsWritten()).isEqualTo(3);
    }

    @Test
    @DisplayName("should write fallback records but not complete a batch when the backend is unreachable")
    void shouldNotCompleteUnreachableBatch() throws Exception {
        List<String> batch = List.of("/in/a.pdf", "/in/b.pdf");
        queue.populate(List.of(batch));

        manager(StubInferenceClient.unreachable(), 1).run();

        // Released on the first attempt, dead-lettered on the second
        QueueStats stats = queue.stats();
        assertThat(stats.done()).isZero();
        assertThat(stats.failed()).isEqualTo(1);
        assertThat(lines(OutputKeys.results(WorkItem.of(batch).id()))).isEqualTo(2);

        MetricsSnapshot snapshot = metrics.snapshot();
        assertThat(snapshot.batchesReleased()).isEqualTo(1);
        assertThat(snapshot.batchesFailed()).isEqualTo(1);
        assertThat(snapshot.fallbackRate()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should skip an unreadable document and still complete its batch")
    void shouldSkipUnreadableDocument() throws Exception {
        List<String> batch = List.of("/in/a.pdf", "/in/corrupt.pdf");
        queue.populate(List.of(batch));

        manager(StubInferenceClient.answering("ok"), 1).run();

        assertThat(queue.stats().done()).isEqualTo(1);
        assertThat(lines(OutputKeys.results(WorkItem.of(batch).id()))).isEqualTo(1);
        assertThat(metrics.snapshot().documentsSkipped()).isEqualTo(1);
    }

    @Test
    @DisplayName("should write and release a batch interrupted by a forced shutdown")
    void shouldReleaseOnForcedShutdown() throws Exception {
        List<String> batch = List.of("/in/c.pdf");
        queue.populate(List.of(batch));
        WorkerManager manager = manager(StubInferenceClient.answering("never sent"), 1);
        LeasedWork work = queue.lease("test-w0", Duration.ofSeconds(30)).orElseThrow();

        shutdownSignal.force();
        manager.processBatch("test-w0", work);

        assertThat(queue.stats()).isEqualTo(new QueueStats(1, 0, 0, 0));
        assertThat(store.exists(OutputKeys.results(work.id()))).isTrue();
        assertThat(metrics.snapshot().batchesReleased()).isEqualTo(1);
        assertThat(manager.getActiveLeaseCount()).isZero();
    }

    @Test
    @DisplayName("should stop leasing once a stop is requested")
    void shouldHonourStopRequest() throws Exception {
        queue.populate(List.of(List.of("/in/a.pdf")));
        shutdownSignal.requestStop();

        manager(StubInferenceClient.answering("ok"), 2).run();

        assertThat(queue.stats().done()).isZero();
    }

    @Test
    @DisplayName("should reject a renew interval not shorter than the lease")
    void shouldValidateLeaseTiming() {
        assertThatThrownBy(() -> WorkerManager.builder()
                .queue(queue)
                .documentProcessor(new DocumentProcessor(pageSource, null, null, 1))
                .writer(writer)
                .leaseVisibility(Duration.ofSeconds(10))
                .renewInterval(Duration.ofSeconds(10))
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
