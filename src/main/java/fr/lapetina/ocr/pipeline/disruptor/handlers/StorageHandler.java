package fr.lapetina.ocr.pipeline.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.ocr.pipeline.domain.event.BatchResultEvent;
import fr.lapetina.ocr.pipeline.infrastructure.storage.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Second stage handler: writes the serialized batch to the workspace.
 *
 * Writes are plain puts, so a batch written twice (after a lost lease or a
 * retry) ends with the same keys and the latest content.
 */
public final class StorageHandler implements EventHandler<BatchResultEvent> {

    private static final Logger log = LoggerFactory.getLogger(StorageHandler.class);

    private final ObjectStore objectStore;

    public StorageHandler(ObjectStore objectStore) {
        this.objectStore = objectStore;
    }

    @Override
    public void onEvent(BatchResultEvent event, long sequence, boolean endOfBatch) {
        if (event.isFailed()) {
            log.debug("Skipping failed event: sequence={}", sequence);
            return;
        }

        try {
            long bytes = 0;
            for (Map.Entry<String, byte[]> entry : event.getMarkdown().entrySet()) {
                objectStore.put(entry.getKey(), entry.getValue());
                bytes += entry.getValue().length;
            }
            // Results last: their presence means the markdown is there too
            objectStore.put(event.getOutputKey(), event.getJsonl());
            bytes += event.getJsonl().length;
            event.markWritten(bytes);

            log.info("Batch written: workItemId={}, outputKey={}, documents={}, bytes={}",
                    event.getWorkItem().id(), event.getOutputKey(), event.getDocuments().size(), bytes);
        } catch (RuntimeException e) {
            log.error("Batch write failed: workItemId={}, outputKey={}",
                    event.getWorkItem().id(), event.getOutputKey(), e);
            event.markFailed(e);
        }
    }
}
