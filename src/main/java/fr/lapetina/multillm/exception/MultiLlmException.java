package fr.lapetina.multillm.exception;

import fr.lapetina.multillm.domain.model.ErrorType;

/**
 * Base class of every failure raised by the completion layer.
 */
public class MultiLlmException extends RuntimeException {

    private final ErrorType errorType;

    public MultiLlmException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public MultiLlmException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
