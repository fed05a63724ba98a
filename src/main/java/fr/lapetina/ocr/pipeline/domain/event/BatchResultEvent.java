package fr.lapetina.ocr.pipeline.domain.event;

import fr.lapetina.ocr.pipeline.domain.model.Document;
import fr.lapetina.ocr.pipeline.domain.model.WorkItem;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Event object for the result writer ring buffer.
 *
 * This is a mutable holder that gets reused across the ring buffer.
 * Each handler stage updates the event as it progresses through the pipeline.
 * It should never be accessed outside the Disruptor pipeline handlers.
 */
public final class BatchResultEvent {

    // Immutable batch data
    private WorkItem workItem;
    private List<Document> documents;

    // Stage outputs
    private EventState state;
    private String outputKey;
    private byte[] jsonl;
    private final Map<String, byte[]> markdown = new LinkedHashMap<>();
    private long bytesWritten;
    private Throwable error;

    // Timing
    private Instant acceptedAt;
    private Instant serializedAt;
    private Instant writtenAt;

    // Callback for async completion
    private CompletableFuture<BatchWriteResult> resultFuture;

    /**
     * Clears the event for reuse.
     * Called by the completion stage once the caller has been notified.
     */
    public void clear() {
        this.workItem = null;
        this.documents = null;
        this.state = null;
        this.outputKey = null;
        this.jsonl = null;
        this.markdown.clear();
        this.bytesWritten = 0;
        this.error = null;
        this.acceptedAt = null;
        this.serializedAt = null;
        this.writtenAt = null;
        this.resultFuture = null;
    }

    /**
     * Initializes the event with a finished batch.
     */
    public void initialize(
            WorkItem workItem,
            List<Document> documents,
            CompletableFuture<BatchWriteResult> resultFuture
    ) {
        clear();
        this.workItem = workItem;
        this.documents = List.copyOf(documents);
        this.resultFuture = resultFuture;
        this.state = EventState.CREATED;
        this.acceptedAt = Instant.now();
    }

    // Getters
    public WorkItem getWorkItem() {
        return workItem;
    }

    public List<Document> getDocuments() {
        return documents;
    }

    public EventState getState() {
        return state;
    }

    public String getOutputKey() {
        return outputKey;
    }

    public byte[] getJsonl() {
        return jsonl;
    }

    public Map<String, byte[]> getMarkdown() {
        return markdown;
    }

    public long getBytesWritten() {
        return bytesWritten;
    }

    public Throwable getError() {
        return error;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    public Instant getSerializedAt() {
        return serializedAt;
    }

    public Instant getWrittenAt() {
        return writtenAt;
    }

    public CompletableFuture<BatchWriteResult> getResultFuture() {
        return resultFuture;
    }

    // Stage updates
    public void markSerialized(String outputKey, byte[] jsonl, Map<String, byte[]> markdown) {
        this.outputKey = outputKey;
        this.jsonl = jsonl;
        this.markdown.putAll(markdown);
        this.state = EventState.SERIALIZED;
        this.serializedAt = Instant.now();
    }

    public void markWritten(long bytesWritten) {
        this.bytesWritten = bytesWritten;
        this.state = EventState.WRITTEN;
        this.writtenAt = Instant.now();
    }

    public void markCompleted() {
        this.state = EventState.COMPLETED;
    }

    public void markFailed(Throwable error) {
        this.state = EventState.FAILED;
        this.error = error;
    }

    public boolean isFailed() {
        return state == EventState.FAILED;
    }

    @Override
    public String toString() {
        return "BatchResultEvent{" +
                "workItemId=" + (workItem != null ? workItem.id() : "null") +
                ", documents=" + (documents != null ? documents.size() : 0) +
                ", state=" + state +
                '}';
    }
}
