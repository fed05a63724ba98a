package fr.lapetina.ocr.pipeline.worker;

/**
 * A leased batch could not be finished; its lease is released or the item dead-lettered.
 */
public class BatchFailedException extends RuntimeException {

    private final String workItemId;

    public BatchFailedException(String workItemId, String message) {
        super(message);
        this.workItemId = workItemId;
    }

    public BatchFailedException(String workItemId, String message, Throwable cause) {
        super(message, cause);
        this.workItemId = workItemId;
    }

    public String getWorkItemId() {
        return workItemId;
    }
}
