package fr.lapetina.ocr.pipeline.queue;

/**
 * Counts of work items by state.
 */
public record QueueStats(int total, int done, int failed, int leased) {

    public int available() {
        return Math.max(0, total - done - failed - leased);
    }

    /**
     * Items that still need a worker, leased or not.
     */
    public int outstanding() {
        return Math.max(0, total - done - failed);
    }
}
