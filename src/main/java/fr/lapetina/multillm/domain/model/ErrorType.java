package fr.lapetina.multillm.domain.model;

/**
 * Error taxonomy for completion and session operations.
 * Provides clear categorization for error handling and metrics.
 */
public enum ErrorType {
    /** Request rejected before any network call (blank credential, bad input) */
    VALIDATION_ERROR,

    /** Handshake reported failure, the enclosing completion was aborted */
    HANDSHAKE_ERROR,

    /** Provider answered with a non-success status or could not be reached */
    TRANSPORT_ERROR,

    /** Success response with an unrecognized shape, recovered as raw text */
    PROTOCOL_ERROR,

    /** No adapter registered for the requested provider */
    UNSUPPORTED_PROVIDER,

    /** Operation was cancelled by the caller */
    CANCELLED,

    /** Internal system error */
    INTERNAL_ERROR
}
