package fr.lapetina.ocr.pipeline.queue;

/**
 * Thrown when a worker tries to act on a lease it no longer holds.
 */
public final class LeaseLostException extends RuntimeException {

    private final String workItemId;
    private final String ownerId;

    public LeaseLostException(String workItemId, String ownerId, String details) {
        super("Lease lost: workItemId=" + workItemId + ", ownerId=" + ownerId + " - " + details);
        this.workItemId = workItemId;
        this.ownerId = ownerId;
    }

    public String getWorkItemId() {
        return workItemId;
    }

    public String getOwnerId() {
        return ownerId;
    }
}
