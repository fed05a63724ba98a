package fr.lapetina.ocr.pipeline.domain.model;

/**
 * Final report of a pipeline run.
 */
public record RunSummary(
        long documentsWritten,
        long documentsSkipped,
        long pagesProcessed,
        long fallbackPages,
        long batchesCompleted,
        long batchesReleased,
        long batchesFailed,
        long batchesOutstanding
) {

    public double fallbackRate() {
        return pagesProcessed == 0 ? 0.0 : (double) fallbackPages / pagesProcessed;
    }

    /**
     * Zero on full completion, non-zero when any batch stayed unrecoverable.
     */
    public int exitCode() {
        return batchesFailed == 0 && batchesOutstanding == 0 ? 0 : 1;
    }

    @Override
    public String toString() {
        return String.format(
                "RunSummary{documents=%d, skipped=%d, pages=%d, fallbackPages=%d (%.2f%%), " +
                        "batches completed=%d, released=%d, failed=%d, outstanding=%d}",
                documentsWritten, documentsSkipped, pagesProcessed, fallbackPages, fallbackRate() * 100,
                batchesCompleted, batchesReleased, batchesFailed, batchesOutstanding);
    }
}
