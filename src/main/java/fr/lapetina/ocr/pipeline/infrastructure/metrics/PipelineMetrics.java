package fr.lapetina.ocr.pipeline.infrastructure.metrics;

import fr.lapetina.ocr.pipeline.domain.model.ErrorType;
import fr.lapetina.ocr.pipeline.domain.model.PageResult;

import java.time.Duration;

/**
 * Metrics sink injected into every stage of the pipeline.
 * Implementations must be thread-safe.
 */
public interface PipelineMetrics {

    /** Outcome of one leased batch. */
    enum BatchOutcome {
        COMPLETED,
        RELEASED,
        FAILED
    }

    /**
     * Records one HTTP exchange with the inference backend.
     *
     * @param errorType null on success
     */
    void recordInferenceCall(Duration latency, ErrorType errorType);

    /** A transport-level retry was scheduled by the inference client. */
    void recordTransportRetry();

    /** A page attempt failed and another one was issued. */
    void recordPageRetry(String reason);

    void recordPage(PageResult result);

    void recordDocumentWritten(int pages);

    void recordDocumentSkipped();

    void recordBytesWritten(long bytes);

    void recordBatch(BatchOutcome outcome);

    /** Wall-clock time spent in a named stage (render, inference, write...). */
    void recordStage(String stage, Duration duration);

    /**
     * Totals since process start.
     */
    MetricsSnapshot snapshot();

    /**
     * Sink that drops everything, for tests and tools.
     */
    PipelineMetrics NOOP = new PipelineMetrics() {
        @Override public void recordInferenceCall(Duration latency, ErrorType errorType) { }
        @Override public void recordTransportRetry() { }
        @Override public void recordPageRetry(String reason) { }
        @Override public void recordPage(PageResult result) { }
        @Override public void recordDocumentWritten(int pages) { }
        @Override public void recordDocumentSkipped() { }
        @Override public void recordBytesWritten(long bytes) { }
        @Override public void recordBatch(BatchOutcome outcome) { }
        @Override public void recordStage(String stage, Duration duration) { }
        @Override public MetricsSnapshot snapshot() { return MetricsSnapshot.EMPTY; }
    };
}
