package fr.lapetina.ocr.pipeline.queue;

import fr.lapetina.ocr.pipeline.domain.model.Lease;
import fr.lapetina.ocr.pipeline.domain.model.WorkItem;

/**
 * A work item together with the lease that grants the caller exclusive access to it.
 */
public record LeasedWork(WorkItem item, Lease lease) {

    public String id() {
        return item.id();
    }

    public int attempt() {
        return lease.attempt();
    }
}
