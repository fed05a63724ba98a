package fr.lapetina.ocr.pipeline.queue;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable, lease-based queue of document batches shared by independent workers.
 *
 * <p>An item is {@code available}, {@code leased}, {@code done} or {@code failed}.
 * At most one non-expired lease exists per item. A worker that crashes simply
 * lets its lease expire; the item then becomes available to any other worker.
 */
public interface WorkQueue {

    /**
     * Adds one work item per batch. Batches already present are left untouched.
     *
     * @return number of newly created items
     */
    int populate(List<List<String>> batches);

    /**
     * Atomically claims one available item for {@code ownerId}.
     *
     * @return the leased item, or empty if nothing is currently available
     */
    Optional<LeasedWork> lease(String ownerId, Duration visibilityTimeout);

    /**
     * Extends a lease still held by {@code ownerId}.
     *
     * @throws LeaseLostException if the lease expired or belongs to someone else
     */
    void renew(String workItemId, String ownerId, Duration visibilityTimeout);

    /**
     * Marks an item done. Completing an already completed item is a no-op.
     */
    void complete(String workItemId, String ownerId);

    /**
     * Returns a leased item to the available state before its lease expires.
     */
    void release(String workItemId, String ownerId);

    /**
     * Permanently removes an item from circulation after its delivery attempts ran out.
     */
    void fail(String workItemId, String ownerId, String reason);

    /**
     * Returns a point-in-time view of the queue.
     */
    QueueStats stats();
}
