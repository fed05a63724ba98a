package fr.lapetina.ocr.pipeline;

import fr.lapetina.ocr.pipeline.disruptor.ResultWriterPipeline;
import fr.lapetina.ocr.pipeline.infrastructure.config.ConfigLoader;
import fr.lapetina.ocr.pipeline.infrastructure.config.PipelineConfig;
import fr.lapetina.ocr.pipeline.infrastructure.health.BackendHealthChecker;
import fr.lapetina.ocr.pipeline.infrastructure.http.InferenceClient;
import fr.lapetina.ocr.pipeline.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ocr.pipeline.infrastructure.render.PageSource;
import fr.lapetina.ocr.pipeline.infrastructure.render.PdfBoxPageSource;
import fr.lapetina.ocr.pipeline.infrastructure.storage.LocalObjectStore;
import fr.lapetina.ocr.pipeline.infrastructure.storage.ObjectStore;
import fr.lapetina.ocr.pipeline.processing.DocumentBuilder;
import fr.lapetina.ocr.pipeline.processing.DocumentProcessor;
import fr.lapetina.ocr.pipeline.processing.PageProcessor;
import fr.lapetina.ocr.pipeline.processing.PageResponseParser;
import fr.lapetina.ocr.pipeline.processing.PromptBuilder;
import fr.lapetina.ocr.pipeline.processing.RepetitionDetector;
import fr.lapetina.ocr.pipeline.processing.SamplingSchedule;
import fr.lapetina.ocr.pipeline.queue.ObjectStoreWorkQueue;
import fr.lapetina.ocr.pipeline.worker.ShutdownSignal;
import fr.lapetina.ocr.pipeline.worker.WorkerManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for creating fully-wired pipeline components from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (PipelineFactory factory = PipelineFactory.create("config.yaml")) {
 *     RunSummary summary = new PipelineOrchestrator(factory).run();
 * }
 * }</pre>
 */
public class PipelineFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PipelineFactory.class);

    private final PipelineConfig config;
    private final MetricsRegistry metricsRegistry;
    private final ObjectStore objectStore;
    private final ObjectStoreWorkQueue queue;
    private final InferenceClient inferenceClient;
    private final BackendHealthChecker healthChecker;
    private final PageSource pageSource;
    private final ExecutorService renderExecutor;
    private final ShutdownSignal shutdownSignal;
    private final DocumentProcessor documentProcessor;
    private final ResultWriterPipeline writer;
    private final WorkerManager workerManager;

    protected PipelineFactory(
            PipelineConfig config,
            InferenceClient inferenceClientOverride,
            PageSource pageSourceOverride
    ) {
        ConfigLoader.validate(config);
        this.config = config;

        log.info("Initializing PipelineFactory: workspace={}, model={}, url={}, startServer={}",
                config.getWorkspace(), config.getInference().getModel(),
                config.getInference().getUrl(), config.getInference().isStartServer());

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Workspace and queue
        this.objectStore = new LocalObjectStore(Path.of(config.getWorkspace()));
        this.queue = new ObjectStoreWorkQueue(
                objectStore, config.getQueue().getPrefix(), Clock.systemUTC(), new Random());

        // Initialize inference client (allow override for testing)
        this.inferenceClient = inferenceClientOverride != null
                ? inferenceClientOverride
                : InferenceClient.fromConfig(config.getInference(), metricsRegistry);

        PipelineConfig.HealthProbeConfig probe = config.getInference().getHealthProbe();
        this.healthChecker = new BackendHealthChecker(
                inferenceClient,
                Duration.ofMillis(probe.getIntervalMs()),
                probe.getFailuresBeforeRestart()
        );

        this.pageSource = pageSourceOverride != null ? pageSourceOverride : new PdfBoxPageSource();
        AtomicInteger renderThreads = new AtomicInteger(0);
        this.renderExecutor = Executors.newFixedThreadPool(config.getRender().getThreads(), r -> {
            Thread t = new Thread(r, "render-" + renderThreads.getAndIncrement());
            t.setDaemon(true);
            return t;
        });

        this.shutdownSignal = new ShutdownSignal();

        PipelineConfig.PageConfig page = config.getPage();
        PageProcessor pageProcessor = new PageProcessor(
                inferenceClient,
                pageSource,
                renderExecutor,
                new PromptBuilder(),
                new PageResponseParser(page.getModelMaxContext(), new RepetitionDetector()),
                new SamplingSchedule(page.getMaxTokens(), page.getAnchorTextLength()),
                config.getInference().getModel(),
                page.getMaxAttempts(),
                page.getTargetLongestImageDim(),
                Duration.ofMillis(config.getInference().getRequestTimeoutMs()),
                page.getFallbackText(),
                metricsRegistry,
                shutdownSignal::isForced
        );

        this.documentProcessor = new DocumentProcessor(
                pageSource,
                pageProcessor,
                new DocumentBuilder(config.getOutput().getPipelineVersion(), Clock.systemUTC()),
                config.getDocument().getMaxConcurrentPages()
        );

        // Build result writer
        this.writer = ResultWriterPipeline.builder()
                .fromConfig(config.getOutput())
                .objectStore(objectStore)
                .metrics(metricsRegistry)
                .build();

        this.workerManager = WorkerManager.builder()
                .fromConfig(config.getWorker())
                .queue(queue)
                .documentProcessor(documentProcessor)
                .writer(writer)
                .metrics(metricsRegistry)
                .shutdownSignal(shutdownSignal)
                .build();

        registerGauges();

        log.info("PipelineFactory initialized: workers={}, renderThreads={}, maxInFlight={}",
                config.getWorker().getCount(), config.getRender().getThreads(),
                config.getInference().getMaxInFlight());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static PipelineFactory create(String configPath) {
        return new PipelineFactory(new ConfigLoader(configPath).load(), null, null);
    }

    /**
     * Creates a factory from an already loaded configuration.
     */
    public static PipelineFactory create(PipelineConfig config) {
        return new PipelineFactory(config, null, null);
    }

    /**
     * Starts the result writer. Backend checks are the orchestrator's job.
     */
    public PipelineFactory start() {
        writer.start();
        log.info("Pipeline started");
        return this;
    }

    public PipelineConfig getConfig() {
        return config;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ObjectStore getObjectStore() {
        return objectStore;
    }

    public ObjectStoreWorkQueue getQueue() {
        return queue;
    }

    public InferenceClient getInferenceClient() {
        return inferenceClient;
    }

    public BackendHealthChecker getHealthChecker() {
        return healthChecker;
    }

    public PageSource getPageSource() {
        return pageSource;
    }

    public ShutdownSignal getShutdownSignal() {
        return shutdownSignal;
    }

    public DocumentProcessor getDocumentProcessor() {
        return documentProcessor;
    }

    public ResultWriterPipeline getWriter() {
        return writer;
    }

    public WorkerManager getWorkerManager() {
        return workerManager;
    }

    private void registerGauges() {
        metricsRegistry.registerGauge("active_leases", "Batches leased by this process",
                workerManager::getActiveLeaseCount);
        metricsRegistry.registerGauge("inference_outstanding", "Inference calls admitted or waiting",
                inferenceClient::getOutstandingCount);
        metricsRegistry.registerGauge("ring_buffer_remaining", "Free result writer slots",
                writer::getRemainingCapacity);
        metricsRegistry.registerGauge("circuit_state", "Backend circuit breaker state (0=closed, 1=half-open, 2=open)",
                () -> switch (inferenceClient.getCircuitBreaker().getState()) {
                    case CLOSED -> 0;
                    case HALF_OPEN -> 1;
                    case OPEN -> 2;
                });
    }

    @Override
    public void close() {
        log.info("Shutting down PipelineFactory...");

        try {
            healthChecker.close();
        } catch (Exception e) {
            log.warn("Error closing health checker", e);
        }

        try {
            writer.close();
        } catch (Exception e) {
            log.warn("Error closing result writer", e);
        }

        try {
            inferenceClient.close();
        } catch (Exception e) {
            log.warn("Error closing inference client", e);
        }

        try {
            renderExecutor.shutdown();
            if (!renderExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                renderExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            renderExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("PipelineFactory shut down");
    }
}
