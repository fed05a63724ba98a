package fr.lapetina.ocr.pipeline.infrastructure.metrics;

import fr.lapetina.ocr.pipeline.domain.model.ErrorType;
import fr.lapetina.ocr.pipeline.domain.model.PageResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Page, document and batch counters
 * - Token and byte counters
 * - Inference latency and per-stage timers
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements PipelineMetrics, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final Counter pagesProcessed;
    private final Counter pagesFallback;
    private final Counter transportRetries;
    private final Counter inputTokens;
    private final Counter outputTokens;
    private final Counter bytesWritten;
    private final Counter documentsWritten;
    private final Counter documentsSkipped;
    private final Timer inferenceLatency;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> pageRetryCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ErrorType, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<BatchOutcome, Counter> batchCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.pagesProcessed = counter("_pages_total", "Pages resolved, accepted or fallback");
        this.pagesFallback = counter("_pages_fallback_total", "Pages resolved as fallback");
        this.transportRetries = counter("_transport_retries_total", "HTTP retries issued by the inference client");
        this.inputTokens = counter("_input_tokens_total", "Prompt tokens of accepted pages");
        this.outputTokens = counter("_output_tokens_total", "Completion tokens of accepted pages");
        this.bytesWritten = counter("_bytes_written_total", "Bytes written to the workspace");
        this.documentsWritten = counter("_documents_written_total", "Documents written");
        this.documentsSkipped = counter("_documents_skipped_total", "Documents skipped as unreadable");

        this.inferenceLatency = Timer.builder(prefix + "_inference_latency")
                .description("Inference HTTP exchange latency")
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("page_ocr");
    }

    private Counter counter(String suffix, String description) {
        return Counter.builder(prefix + suffix)
                .description(description)
                .register(registry);
    }

    @Override
    public void recordInferenceCall(Duration latency, ErrorType errorType) {
        inferenceLatency.record(latency);
        if (errorType != null) {
            errorCounters.computeIfAbsent(errorType, type ->
                    Counter.builder(prefix + "_inference_errors_total")
                            .description("Inference calls ending in error")
                            .tag("type", type.name())
                            .register(registry)
            ).increment();
        }
    }

    @Override
    public void recordTransportRetry() {
        transportRetries.increment();
    }

    @Override
    public void recordPageRetry(String reason) {
        pageRetryCounters.computeIfAbsent(reason, r ->
                Counter.builder(prefix + "_page_retries_total")
                        .description("Page attempts that were retried")
                        .tag("reason", r)
                        .register(registry)
        ).increment();
    }

    @Override
    public void recordPage(PageResult result) {
        pagesProcessed.increment();
        if (result.fallback()) {
            pagesFallback.increment();
        }
        inputTokens.increment(result.inputTokens());
        outputTokens.increment(result.outputTokens());
    }

    @Override
    public void recordDocumentWritten(int pages) {
        documentsWritten.increment();
    }

    @Override
    public void recordDocumentSkipped() {
        documentsSkipped.increment();
    }

    @Override
    public void recordBytesWritten(long bytes) {
        bytesWritten.increment(bytes);
    }

    @Override
    public void recordBatch(BatchOutcome outcome) {
        batchCounter(outcome).increment();
    }

    private Counter batchCounter(BatchOutcome outcome) {
        return batchCounters.computeIfAbsent(outcome, o ->
                Counter.builder(prefix + "_batches_total")
                        .description("Leased batches by outcome")
                        .tag("outcome", o.name())
                        .register(registry)
        );
    }

    @Override
    public void recordStage(String stage, Duration duration) {
        stageTimers.computeIfAbsent(stage, k ->
                Timer.builder(prefix + "_stage_latency")
                        .description("Pipeline stage latency")
                        .tag("stage", stage)
                        .register(registry)
        ).record(duration);
    }

    /**
     * Registers a gauge backed by a live value, such as queue depth.
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_" + name, valueSupplier, s -> s.get().doubleValue())
                .description(description)
                .register(registry);
    }

    @Override
    public MetricsSnapshot snapshot() {
        Map<String, Duration> stages = new LinkedHashMap<>();
        stageTimers.forEach((stage, timer) ->
                stages.put(stage, Duration.ofNanos((long) timer.totalTime(TimeUnit.NANOSECONDS))));

        return new MetricsSnapshot(
                (long) pagesProcessed.count(),
                (long) pagesFallback.count(),
                (long) sum(pageRetryCounters),
                (long) transportRetries.count(),
                inferenceLatency.count(),
                (long) sum(errorCounters),
                (long) inputTokens.count(),
                (long) outputTokens.count(),
                (long) bytesWritten.count(),
                (long) documentsWritten.count(),
                (long) documentsSkipped.count(),
                (long) batchCounter(BatchOutcome.COMPLETED).count(),
                (long) batchCounter(BatchOutcome.RELEASED).count(),
                (long) batchCounter(BatchOutcome.FAILED).count(),
                stages
        );
    }

    private static double sum(Map<?, Counter> counters) {
        return counters.values().stream().mapToDouble(Counter::count).sum();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
