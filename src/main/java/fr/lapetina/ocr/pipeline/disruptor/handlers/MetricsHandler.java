package fr.lapetina.ocr.pipeline.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.ocr.pipeline.domain.event.BatchResultEvent;
import fr.lapetina.ocr.pipeline.domain.model.Document;
import fr.lapetina.ocr.pipeline.infrastructure.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;

/**
 * Third stage handler: records output metrics.
 *
 * Records:
 * - Documents written and their page counts
 * - Bytes written
 * - Serialize and write stage timings
 */
public final class MetricsHandler implements EventHandler<BatchResultEvent> {

    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    private final PipelineMetrics metrics;

    public MetricsHandler(PipelineMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onEvent(BatchResultEvent event, long sequence, boolean endOfBatch) {
        setupMDC(event);

        try {
            recordMetrics(event);
        } finally {
            clearMDC();
        }
    }

    private void setupMDC(BatchResultEvent event) {
        if (event.getWorkItem() != null) {
            MDC.put("workItemId", event.getWorkItem().id());
        }
        MDC.put("eventState", event.getState() != null ? event.getState().name() : "UNKNOWN");
    }

    private void clearMDC() {
        MDC.remove("workItemId");
        MDC.remove("eventState");
    }

    private void recordMetrics(BatchResultEvent event) {
        if (event.isFailed()) {
            log.warn("Batch output not recorded: workItemId={}, error={}",
                    event.getWorkItem() != null ? event.getWorkItem().id() : "unknown",
                    event.getError() != null ? event.getError().getMessage() : "unknown");
            return;
        }

        for (Document document : event.getDocuments()) {
            metrics.recordDocumentWritten(document.metadata().totalPages());
        }
        metrics.recordBytesWritten(event.getBytesWritten());

        if (event.getSerializedAt() != null && event.getAcceptedAt() != null) {
            metrics.recordStage("serialize", Duration.between(event.getAcceptedAt(), event.getSerializedAt()));
        }
        if (event.getWrittenAt() != null && event.getSerializedAt() != null) {
            metrics.recordStage("write", Duration.between(event.getSerializedAt(), event.getWrittenAt()));
        }
        if (event.getAcceptedAt() != null) {
            metrics.recordStage("output", Duration.between(event.getAcceptedAt(), Instant.now()));
        }
    }
}
