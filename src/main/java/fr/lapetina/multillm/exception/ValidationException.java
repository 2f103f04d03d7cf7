package fr.lapetina.multillm.exception;

import fr.lapetina.multillm.domain.model.ErrorType;

/**
 * Thrown when a call is rejected before any network request, e.g. a blank credential.
 */
public final class ValidationException extends MultiLlmException {

    public ValidationException(String message) {
        super(ErrorType.VALIDATION_ERROR, message);
    }
}
