package fr.lapetina.ocr.pipeline.domain.model;

/**
 * Error taxonomy for inference calls.
 * Provides clear categorization for retry decisions and metrics.
 */
public enum ErrorType {
    /** Connection refused/reset or other transport failure, retries exhausted */
    NETWORK_ERROR(true),

    /** Request timed out waiting for response, retries exhausted */
    TIMEOUT(true),

    /** Backend overloaded or out of memory (429, 503, 507), retries exhausted */
    RESOURCE_EXHAUSTED(true),

    /** Backend stayed unhealthy past the health probe ceiling */
    BACKEND_UNAVAILABLE(true),

    /** Backend rejected the request (4xx) */
    CLIENT_ERROR(false),

    /** Backend failed while serving the request (5xx) */
    SERVER_ERROR(false),

    /** Response envelope could not be parsed */
    MALFORMED_RESPONSE(false),

    /** Call cancelled by a forced shutdown */
    CANCELLED(false),

    /** Internal system error */
    INTERNAL_ERROR(false);

    private final boolean connectivity;

    ErrorType(boolean connectivity) {
        this.connectivity = connectivity;
    }

    /**
     * Whether this error means the backend could not be reached at all,
     * as opposed to a backend that answered badly.
     */
    public boolean isConnectivity() {
        return connectivity;
    }
}
