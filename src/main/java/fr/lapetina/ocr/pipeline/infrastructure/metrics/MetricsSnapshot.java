package fr.lapetina.ocr.pipeline.infrastructure.metrics;

import java.time.Duration;
import java.util.Map;

/**
 * Point-in-time copy of the pipeline counters. Counters only grow during a run.
 */
public record MetricsSnapshot(
        long pagesProcessed,
        long pagesFallback,
        long pageRetries,
        long transportRetries,
        long inferenceCalls,
        long inferenceErrors,
        long inputTokens,
        long outputTokens,
        long bytesWritten,
        long documentsWritten,
        long documentsSkipped,
        long batchesCompleted,
        long batchesReleased,
        long batchesFailed,
        Map<String, Duration> stageTotals
) {
    public static final MetricsSnapshot EMPTY =
            new MetricsSnapshot(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, Map.of());

    public MetricsSnapshot {
        stageTotals = Map.copyOf(stageTotals);
    }

    public double fallbackRate() {
        return pagesProcessed == 0 ? 0.0 : (double) pagesFallback / pagesProcessed;
    }

    /**
     * Page retries per processed page.
     */
    public double retryRate() {
        return pagesProcessed == 0 ? 0.0 : (double) pageRetries / pagesProcessed;
    }
}
