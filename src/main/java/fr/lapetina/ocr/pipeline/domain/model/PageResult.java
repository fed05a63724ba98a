package fr.lapetina.ocr.pipeline.domain.model;

/**
 * Final outcome for one page: either an accepted model answer or a fallback stub.
 * Immutable once produced.
 */
public record PageResult(
        int pageNumber,
        String text,
        boolean valid,
        boolean rotationValid,
        int rotationCorrection,
        String primaryLanguage,
        boolean table,
        boolean diagram,
        int inputTokens,
        int outputTokens,
        boolean fallback,
        String errorReason,
        ErrorType errorType,
        int attempts
) {
    public PageResult {
        if (pageNumber < 1) {
            throw new IllegalArgumentException("Page numbers are 1-based: " + pageNumber);
        }
        if (text == null) {
            text = "";
        }
    }

    /**
     * Creates a result from a validated model answer.
     */
    public static PageResult accepted(
            int pageNumber,
            PageResponse response,
            int inputTokens,
            int outputTokens,
            int attempts
    ) {
        return new PageResult(
                pageNumber,
                response.naturalText(),
                true,
                Boolean.TRUE.equals(response.rotationValid()),
                response.rotationCorrection() != null ? response.rotationCorrection() : 0,
                response.primaryLanguage(),
                Boolean.TRUE.equals(response.table()),
                Boolean.TRUE.equals(response.diagram()),
                inputTokens,
                outputTokens,
                false,
                null,
                null,
                attempts
        );
    }

    /**
     * Creates a degraded placeholder for a page that could not be processed.
     *
     * @param errorType last inference error, or null when the last attempt failed validation
     */
    public static PageResult fallback(
            int pageNumber,
            String text,
            String errorReason,
            ErrorType errorType,
            int attempts
    ) {
        return new PageResult(
                pageNumber, text, false, true, 0, null, false, false,
                0, 0, true, errorReason, errorType, attempts
        );
    }

    /**
     * Whether this page fell back because the backend could not be reached.
     */
    public boolean lostToConnectivity() {
        return fallback && errorType != null && errorType.isConnectivity();
    }
}
