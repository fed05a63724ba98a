package fr.lapetina.ocr.pipeline.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.ocr.pipeline.domain.event.BatchResultEvent;
import fr.lapetina.ocr.pipeline.domain.event.BatchWriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.concurrent.CompletableFuture;

/**
 * Final stage handler: notifies the submitting worker and recycles the slot.
 *
 * Responsibilities:
 * - Completes the caller's CompletableFuture with a receipt or the stage error
 * - Logs the batch summary
 * - Clears the event for reuse
 */
public final class CompletionHandler implements EventHandler<BatchResultEvent> {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    @Override
    public void onEvent(BatchResultEvent event, long sequence, boolean endOfBatch) {
        try {
            CompletableFuture<BatchWriteResult> future = event.getResultFuture();
            if (future == null || event.getWorkItem() == null) {
                return;
            }

            String workItemId = event.getWorkItem().id();
            long latencyMs = event.getAcceptedAt() != null
                    ? Duration.between(event.getAcceptedAt(), Instant.now()).toMillis()
                    : 0;

            if (event.isFailed()) {
                log.warn("Batch output failed: workItemId={}, latencyMs={}, error={}",
                        workItemId, latencyMs, event.getError() != null ? event.getError().getMessage() : "unknown");
                future.completeExceptionally(event.getError() != null
                        ? event.getError()
                        : new IllegalStateException("Batch output failed: " + workItemId));
                return;
            }

            event.markCompleted();
            BatchWriteResult result = new BatchWriteResult(
                    workItemId,
                    event.getOutputKey(),
                    new ArrayList<>(event.getMarkdown().keySet()),
                    event.getDocuments().size(),
                    event.getBytesWritten()
            );
            log.debug("Batch output completed: workItemId={}, latencyMs={}", workItemId, latencyMs);
            future.complete(result);
        } finally {
            // Clear event for reuse
            event.clear();
        }
    }
}
