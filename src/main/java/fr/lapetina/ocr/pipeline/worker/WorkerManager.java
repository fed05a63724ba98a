package fr.lapetina.ocr.pipeline.worker;

import fr.lapetina.ocr.pipeline.disruptor.ResultWriterPipeline;
import fr.lapetina.ocr.pipeline.domain.event.BatchWriteResult;
import fr.lapetina.ocr.pipeline.domain.model.Document;
import fr.lapetina.ocr.pipeline.infrastructure.config.PipelineConfig;
import fr.lapetina.ocr.pipeline.infrastructure.metrics.MetricsSnapshot;
import fr.lapetina.ocr.pipeline.infrastructure.metrics.PipelineMetrics;
import fr.lapetina.ocr.pipeline.infrastructure.metrics.PipelineMetrics.BatchOutcome;
import fr.lapetina.ocr.pipeline.infrastructure.render.SourceDocumentException;
import fr.lapetina.ocr.pipeline.infrastructure.storage.ObjectStoreException;
import fr.lapetina.ocr.pipeline.processing.DocumentProcessor;
import fr.lapetina.ocr.pipeline.queue.LeaseLostException;
import fr.lapetina.ocr.pipeline.queue.LeasedWork;
import fr.lapetina.ocr.pipeline.queue.QueueStats;
import fr.lapetina.ocr.pipeline.queue.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a fixed number of worker loops that lease batches, process their
 * documents, write the output and settle the lease.
 *
 * <p>Each loop: lease, renew periodically, process every document of the batch
 * concurrently, submit the documents to the {@link ResultWriterPipeline}, wait
 * for the write, then complete. A batch that could not be finished is released
 * for another attempt, or dead-lettered once its lease attempt reaches
 * {@code maxBatchAttempts}.
 */
public class WorkerManager {

    private static final Logger log = LoggerFactory.getLogger(WorkerManager.class);

    private final WorkQueue queue;
    private final DocumentProcessor documentProcessor;
    private final ResultWriterPipeline writer;
    private final PipelineMetrics metrics;
    private final ShutdownSignal shutdownSignal;
    private final int workerCount;
    private final Duration leaseVisibility;
    private final Duration renewInterval;
    private final int maxBatchAttempts;
    private final Duration pollInterval;
    private final boolean runForever;
    private final Duration reportInterval;
    private final String ownerPrefix;

    private final ScheduledExecutorService scheduler;
    private final Map<String, ActiveLease> activeLeases = new ConcurrentHashMap<>();

    private WorkerManager(Builder builder) {
        this.queue = builder.queue;
        this.documentProcessor = builder.documentProcessor;
        this.writer = builder.writer;
        this.metrics = builder.metrics;
        this.shutdownSignal = builder.shutdownSignal;
        this.workerCount = builder.workerCount;
        this.leaseVisibility = builder.leaseVisibility;
        this.renewInterval = builder.renewInterval;
        this.maxBatchAttempts = builder.maxBatchAttempts;
        this.pollInterval = builder.pollInterval;
        this.runForever = builder.runForever;
        this.reportInterval = builder.reportInterval;
        this.ownerPrefix = builder.ownerPrefix;

        this.scheduler = Executors.newScheduledThreadPool(1, r -> {
            Thread t = new Thread(r, "worker-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Runs the workers until no work is left (or a stop is requested) and blocks until all of them exit.
     */
    public void run() throws InterruptedException {
        AtomicInteger threadIds = new AtomicInteger(0);
        ExecutorService pool = Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r, "worker-" + threadIds.getAndIncrement());
            t.setDaemon(false);
            return t;
        });

        Reporter reporter = new Reporter();
        ScheduledFuture<?> reporting = scheduler.scheduleAtFixedRate(
                reporter, reportInterval.toMillis(), reportInterval.toMillis(), TimeUnit.MILLISECONDS);

        log.info("Workers starting: count={}, leaseVisibilityMs={}, renewIntervalMs={}, maxBatchAttempts={}, runForever={}",
                workerCount, leaseVisibility.toMillis(), renewInterval.toMillis(), maxBatchAttempts, runForever);

        try {
            for (int i = 0; i < workerCount; i++) {
                String workerId = ownerPrefix + "-w" + i;
                pool.execute(() -> workerLoop(workerId));
            }
            pool.shutdown();
            while (!pool.awaitTermination(1, TimeUnit.SECONDS)) {
                log.trace("Waiting for workers: activeLeases={}", activeLeases.size());
            }
        } finally {
            reporting.cancel(false);
            pool.shutdownNow();
            reporter.run();
            scheduler.shutdownNow();
        }
        log.info("All workers stopped");
    }

    private void workerLoop(String workerId) {
        MDC.put("workerId", workerId);
        log.info("Worker started: workerId={}", workerId);
        try {
            while (!shutdownSignal.isStopRequested()) {
                Optional<LeasedWork> leased;
                try {
                    leased = queue.lease(workerId, leaseVisibility);
                } catch (ObjectStoreException e) {
                    log.warn("Lease attempt failed: workerId={}, error={}", workerId, e.getMessage());
                    shutdownSignal.awaitStop(pollInterval);
                    continue;
                }

                if (leased.isPresent()) {
                    try {
                        processBatch(workerId, leased.get());
                    } catch (RuntimeException e) {
                        // Lease settlement failed; the lease expires on its own
                        log.error("Batch settlement failed: workerId={}, workItemId={}",
                                workerId, leased.get().id(), e);
                    }
                    continue;
                }

                if (!runForever && queue.stats().outstanding() == 0) {
                    log.info("No work left, worker exiting: workerId={}", workerId);
                    return;
                }
                // Items may still be leased by others; expired leases come back here
                shutdownSignal.awaitStop(pollInterval);
            }
            log.info("Stop requested, worker exiting: workerId={}", workerId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker interrupted: workerId={}", workerId);
        } catch (RuntimeException e) {
            log.error("Worker loop crashed: workerId={}", workerId, e);
        } finally {
            MDC.remove("workerId");
        }
    }

    void processBatch(String workerId, LeasedWork work) throws InterruptedException {
        String workItemId = work.id();
        MDC.put("workItemId", workItemId);
        Instant started = Instant.now();
        log.info("Batch leased: workerId={}, workItemId={}, documents={}, attempt={}",
                workerId, workItemId, work.item().size(), work.attempt());

        LeaseRenewal renewal = new LeaseRenewal(workItemId, workerId);
        renewal.future = scheduler.scheduleAtFixedRate(
                renewal, renewInterval.toMillis(), renewInterval.toMillis(), TimeUnit.MILLISECONDS);
        activeLeases.put(workItemId, new ActiveLease(workerId, work));

        BatchOutcome outcome;
        try {
            List<Document> documents = processDocuments(work);
            BatchWriteResult written = write(work, documents);

            if (shutdownSignal.isForced()) {
                log.warn("Batch interrupted by shutdown, releasing: workItemId={}, documents={}",
                        workItemId, written.documents());
                queue.release(workItemId, workerId);
                outcome = BatchOutcome.RELEASED;
            } else if (!documents.isEmpty() && documents.stream().allMatch(Document::lostToConnectivity)) {
                throw new BatchFailedException(workItemId, "All pages lost to backend connectivity");
            } else {
                queue.complete(workItemId, workerId);
                outcome = BatchOutcome.COMPLETED;
                log.info("Batch completed: workItemId={}, documents={}, bytes={}, durationMs={}, leaseLost={}",
                        workItemId, written.documents(), written.bytesWritten(),
                        Duration.between(started, Instant.now()).toMillis(), renewal.lost);
            }
        } catch (BatchFailedException e) {
            outcome = releaseOrFail(workerId, work, e.getMessage());
        } catch (InterruptedException e) {
            queue.release(workItemId, workerId);
            metrics.recordBatch(BatchOutcome.RELEASED);
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected batch error: workItemId={}", workItemId, e);
            outcome = releaseOrFail(workerId, work, e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            renewal.future.cancel(false);
            activeLeases.remove(workItemId);
            MDC.remove("workItemId");
        }
        metrics.recordBatch(outcome);
    }

    private List<Document> processDocuments(LeasedWork work) throws InterruptedException {
        List<String> refs = work.item().documentRefs();
        List<CompletableFuture<Document>> futures = new ArrayList<>(refs.size());
        for (String ref : refs) {
            futures.add(startDocument(ref).exceptionally(ex -> skipIfUnreadable(ref, ex)));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
        } catch (ExecutionException e) {
            throw new BatchFailedException(work.id(), "Document processing failed: " + e.getCause().getMessage(),
                    e.getCause());
        }

        List<Document> documents = new ArrayList<>(refs.size());
        for (CompletableFuture<Document> future : futures) {
            Document document = future.join();
            if (document != null) {
                documents.add(document);
            }
        }
        return documents;
    }

    private CompletableFuture<Document> startDocument(String ref) {
        MDC.put("documentRef", ref);
        try {
            return documentProcessor.process(ref);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        } finally {
            MDC.remove("documentRef");
        }
    }

    private Document skipIfUnreadable(String ref, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof SourceDocumentException) {
            log.warn("Document skipped: documentRef={}, error={}", ref, cause.getMessage());
            metrics.recordDocumentSkipped();
            return null;
        }
        throw new CompletionException(cause);
    }

    private BatchWriteResult write(LeasedWork work, List<Document> documents) throws InterruptedException {
        try {
            return writer.submit(work.item(), documents).get();
        } catch (ExecutionException e) {
            throw new BatchFailedException(work.id(), "Write failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    private BatchOutcome releaseOrFail(String workerId, LeasedWork work, String reason) {
        String workItemId = work.id();
        if (work.attempt() >= maxBatchAttempts) {
            log.error("Batch failed permanently: workItemId={}, attempt={}, reason={}",
                    workItemId, work.attempt(), reason);
            queue.fail(workItemId, workerId, reason);
            return BatchOutcome.FAILED;
        }
        log.warn("Batch released for retry: workItemId={}, attempt={}/{}, reason={}",
                workItemId, work.attempt(), maxBatchAttempts, reason);
        queue.release(workItemId, workerId);
        return BatchOutcome.RELEASED;
    }

    /**
     * Releases every lease still held by a worker of this process.
     * Called after a forced shutdown so other workers pick the batches up at once.
     */
    public int releaseOutstanding() {
        int released = 0;
        for (Map.Entry<String, ActiveLease> entry : activeLeases.entrySet()) {
            try {
                queue.release(entry.getKey(), entry.getValue().ownerId());
                released++;
            } catch (RuntimeException e) {
                log.warn("Could not release lease: workItemId={}, error={}", entry.getKey(), e.getMessage());
            }
        }
        if (released > 0) {
            log.info("Outstanding leases released: count={}", released);
        }
        return released;
    }

    public int getActiveLeaseCount() {
        return activeLeases.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    private record ActiveLease(String ownerId, LeasedWork work) {
    }

    /**
     * Periodic lease extension for one batch. Stops for good once the lease is lost.
     */
    private final class LeaseRenewal implements Runnable {
        private final String workItemId;
        private final String ownerId;
        private volatile ScheduledFuture<?> future;
        private volatile boolean lost;

        LeaseRenewal(String workItemId, String ownerId) {
            this.workItemId = workItemId;
            this.ownerId = ownerId;
        }

        @Override
        public void run() {
            try {
                queue.renew(workItemId, ownerId, leaseVisibility);
                log.debug("Lease renewed: workItemId={}, ownerId={}", workItemId, ownerId);
            } catch (LeaseLostException e) {
                lost = true;
                log.warn("Lease lost, renewal stopped: workItemId={}, ownerId={}", workItemId, ownerId);
                future.cancel(false);
            } catch (RuntimeException e) {
                log.warn("Lease renewal failed: workItemId={}, error={}", workItemId, e.getMessage());
            }
        }
    }

    /**
     * Logs throughput, fallback and retry rates along with queue state.
     */
    private final class Reporter implements Runnable {
        private MetricsSnapshot previous = MetricsSnapshot.EMPTY;
        private Instant previousAt = Instant.now();

        @Override
        public synchronized void run() {
            try {
                MetricsSnapshot current = metrics.snapshot();
                Instant now = Instant.now();
                double seconds = Math.max(1, Duration.between(previousAt, now).toMillis()) / 1000.0;
                double pagesPerSecond = (current.pagesProcessed() - previous.pagesProcessed()) / seconds;
                QueueStats stats = queue.stats();

                log.info("Progress: pagesPerSec={}, pages={}, fallbackRate={}, retryRate={}, documents={}, " +
                                "skipped={}, queueTotal={}, queueDone={}, queueFailed={}, queueLeased={}, activeLeases={}",
                        String.format("%.2f", pagesPerSecond), current.pagesProcessed(),
                        String.format("%.4f", current.fallbackRate()), String.format("%.4f", current.retryRate()),
                        current.documentsWritten(), current.documentsSkipped(),
                        stats.total(), stats.done(), stats.failed(), stats.leased(), activeLeases.size());

                previous = current;
                previousAt = now;
            } catch (RuntimeException e) {
                log.warn("Progress report failed: error={}", e.getMessage());
            }
        }
    }

    /**
     * Builder for WorkerManager.
     */
    public static final class Builder {
        private WorkQueue queue;
        private DocumentProcessor documentProcessor;
        private ResultWriterPipeline writer;
        private PipelineMetrics metrics = PipelineMetrics.NOOP;
        private ShutdownSignal shutdownSignal = new ShutdownSignal();
        private int workerCount = 8;
        private Duration leaseVisibility = Duration.ofMinutes(30);
        private Duration renewInterval = Duration.ofMinutes(5);
        private int maxBatchAttempts = 3;
        private Duration pollInterval = Duration.ofSeconds(5);
        private boolean runForever = false;
        private Duration reportInterval = Duration.ofMinutes(1);
        private String ownerPrefix = defaultOwnerPrefix();

        public Builder queue(WorkQueue queue) {
            this.queue = queue;
            return this;
        }

        public Builder documentProcessor(DocumentProcessor processor) {
            this.documentProcessor = processor;
            return this;
        }

        public Builder writer(ResultWriterPipeline writer) {
            this.writer = writer;
            return this;
        }

        public Builder metrics(PipelineMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder shutdownSignal(ShutdownSignal signal) {
            this.shutdownSignal = signal;
            return this;
        }

        public Builder workerCount(int count) {
            this.workerCount = count;
            return this;
        }

        public Builder leaseVisibility(Duration visibility) {
            this.leaseVisibility = visibility;
            return this;
        }

        public Builder renewInterval(Duration interval) {
            this.renewInterval = interval;
            return this;
        }

        public Builder maxBatchAttempts(int attempts) {
            this.maxBatchAttempts = attempts;
            return this;
        }

        public Builder pollInterval(Duration interval) {
            this.pollInterval = interval;
            return this;
        }

        public Builder runForever(boolean runForever) {
            this.runForever = runForever;
            return this;
        }

        public Builder reportInterval(Duration interval) {
            this.reportInterval = interval;
            return this;
        }

        public Builder ownerPrefix(String prefix) {
            this.ownerPrefix = prefix;
            return this;
        }

        public Builder fromConfig(PipelineConfig.WorkerConfig config) {
            this.workerCount = config.getCount();
            this.leaseVisibility = Duration.ofMillis(config.getLeaseVisibilityMs());
            this.renewInterval = Duration.ofMillis(config.getRenewIntervalMs());
            this.maxBatchAttempts = config.getMaxBatchAttempts();
            this.pollInterval = Duration.ofMillis(config.getPollIntervalMs());
            this.runForever = config.isRunForever();
            this.reportInterval = Duration.ofMillis(config.getReportIntervalMs());
            return this;
        }

        public WorkerManager build() {
            if (queue == null) {
                throw new IllegalStateException("WorkQueue is required");
            }
            if (documentProcessor == null) {
                throw new IllegalStateException("DocumentProcessor is required");
            }
            if (writer == null) {
                throw new IllegalStateException("ResultWriterPipeline is required");
            }
            if (workerCount < 1) {
                throw new IllegalArgumentException("workerCount must be >= 1");
            }
            if (!renewInterval.minus(leaseVisibility).isNegative()) {
                throw new IllegalArgumentException("renewInterval must be shorter than leaseVisibility");
            }
            return new WorkerManager(this);
        }

        private static String defaultOwnerPrefix() {
            String host = System.getenv().getOrDefault("HOSTNAME", "local");
            return host + "-" + ProcessHandle.current().pid();
        }
    }
}
