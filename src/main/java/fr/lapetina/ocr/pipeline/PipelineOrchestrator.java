package fr.lapetina.ocr.pipeline;

import fr.lapetina.ocr.pipeline.api.StatusServer;
import fr.lapetina.ocr.pipeline.domain.model.RunSummary;
import fr.lapetina.ocr.pipeline.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.ocr.pipeline.infrastructure.config.PipelineConfig;
import fr.lapetina.ocr.pipeline.infrastructure.health.InferenceServerManager;
import fr.lapetina.ocr.pipeline.infrastructure.metrics.MetricsSnapshot;
import fr.lapetina.ocr.pipeline.queue.QueueStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Top-level run: backend startup, queue population, workers, shutdown and summary.
 *
 * <p>Shutdown is two-phase. {@link #shutdown()} stops leasing at once and lets
 * in-flight batches finish for {@code worker.shutdownGraceMs}; after that,
 * in-flight inference is cancelled (the affected pages become fallbacks), the
 * degraded batches are written and their leases released.
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_INCOMPLETE = 1;
    public static final int EXIT_STARTUP_FAILURE = 2;

    private final PipelineFactory factory;
    private final PipelineConfig config;
    private final CountDownLatch finished = new CountDownLatch(1);
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);

    private volatile InferenceServerManager serverManager;
    private volatile StatusServer statusServer;
    private volatile boolean backendLost;

    public PipelineOrchestrator(PipelineFactory factory) {
        this.factory = factory;
        this.config = factory.getConfig();
    }

    /**
     * Runs the pipeline to completion.
     *
     * @throws ConfigurationException if the backend is unreachable or serves another model
     * @throws InferenceServerManager.InferenceServerException if a self-managed server cannot be started
     */
    public RunSummary run() throws InterruptedException {
        try {
            startBackend();
            factory.start();
            startStatusServer();
            populateQueue();

            factory.getWorkerManager().run();

            RunSummary summary = summarize();
            if (summary.exitCode() == EXIT_OK) {
                log.info("Run finished: {}", summary);
            } else {
                log.warn("Run finished incomplete: {}", summary);
            }
            return summary;
        } finally {
            stopServers();
            finished.countDown();
        }
    }

    private void startBackend() throws InterruptedException {
        PipelineConfig.InferenceConfig inference = config.getInference();
        Duration probeTimeout = Duration.ofMillis(inference.getHealthProbe().getTimeoutMs());

        if (!inference.isStartServer()) {
            factory.getHealthChecker().verifyModel(inference.getModel(), probeTimeout);
            return;
        }

        serverManager = new InferenceServerManager(
                inference.getServerCommand(),
                factory.getHealthChecker(),
                config.getServer().getMaxRestarts(),
                Duration.ofMillis(inference.getHealthProbe().getCeilingMs()),
                this::onBackendLost
        );
        serverManager.start();
        factory.getHealthChecker().verifyModel(inference.getModel(), probeTimeout);
    }

    private void onBackendLost() {
        backendLost = true;
        log.error("Inference server could not be kept alive, stopping pipeline");
        Thread stopper = new Thread(this::shutdown, "pipeline-shutdown");
        stopper.setDaemon(true);
        stopper.start();
    }

    private void startStatusServer() {
        if (!config.getServer().isEnabled()) {
            return;
        }
        try {
            statusServer = new StatusServer(
                    config.getServer().getHost(),
                    config.getServer().getPort(),
                    factory.getInferenceClient(),
                    factory.getQueue(),
                    factory.getWorkerManager(),
                    factory.getWriter(),
                    factory.getMetricsRegistry()
            );
            statusServer.start();
        } catch (IOException e) {
            throw new ConfigurationException("Cannot start status server on port " + config.getServer().getPort(), e);
        }
    }

    private void populateQueue() {
        if (config.getSources().isEmpty()) {
            log.info("No sources configured, working on the existing queue");
            return;
        }
        List<String> refs = SourceResolver.resolve(config.getSources());
        List<List<String>> batches = SourceResolver.batches(refs, config.getQueue().getBatchSize());
        int created = factory.getQueue().populate(batches);
        log.info("Sources queued: documents={}, batches={}, newItems={}", refs.size(), batches.size(), created);
    }

    /**
     * Requests a graceful shutdown and waits for it to take effect.
     * Safe to call from a JVM shutdown hook.
     */
    public void shutdown() {
        if (!shutdownRequested.compareAndSet(false, true)) {
            return;
        }
        long graceMs = config.getWorker().getShutdownGraceMs();
        log.info("Shutdown requested: graceMs={}, activeLeases={}",
                graceMs, factory.getWorkerManager().getActiveLeaseCount());
        factory.getShutdownSignal().requestStop();

        try {
            if (finished.await(graceMs, TimeUnit.MILLISECONDS)) {
                return;
            }
            log.warn("Grace period elapsed, cancelling in-flight inference: activeLeases={}",
                    factory.getWorkerManager().getActiveLeaseCount());
            factory.getShutdownSignal().force();
            factory.getInferenceClient().cancelInFlight();

            if (!finished.await(graceMs, TimeUnit.MILLISECONDS)) {
                int released = factory.getWorkerManager().releaseOutstanding();
                log.warn("Workers still busy after cancellation: releasedLeases={}", released);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            factory.getWorkerManager().releaseOutstanding();
        }
    }

    RunSummary summarize() {
        MetricsSnapshot metrics = factory.getMetricsRegistry().snapshot();
        QueueStats stats = factory.getQueue().stats();
        return new RunSummary(
                metrics.documentsWritten(),
                metrics.documentsSkipped(),
                metrics.pagesProcessed(),
                metrics.pagesFallback(),
                metrics.batchesCompleted(),
                metrics.batchesReleased(),
                stats.failed(),
                stats.outstanding()
        );
    }

    public boolean isBackendLost() {
        return backendLost;
    }

    private void stopServers() {
        if (statusServer != null) {
            try {
                statusServer.close();
            } catch (Exception e) {
                log.warn("Error closing status server", e);
            }
        }
        if (serverManager != null) {
            try {
                serverManager.close();
            } catch (Exception e) {
                log.warn("Error closing inference server", e);
            }
        }
    }
}
