package fr.lapetina.llmrouter.domain.model;

/**
 * Error taxonomy for routed requests.
 * Provides clear categorization for error handling and metrics.
 */
public enum ErrorKind {
    /** Backend rejected or failed the invocation */
    BACKEND_ERROR,

    /** Backend did not answer in time */
    TIMEOUT,

    /** Caller cancelled the request */
    CANCELLED,

    /** The backend handle could not be constructed */
    HANDLE_CREATION_FAILED,

    /** A cache tier failed; the request fell through to a backend */
    CACHE_FAILURE,

    /** No configured model can serve the request */
    NO_AVAILABLE_MODEL,

    /** Validation error in request */
    VALIDATION_ERROR,

    /** Internal system error */
    INTERNAL_ERROR
}
