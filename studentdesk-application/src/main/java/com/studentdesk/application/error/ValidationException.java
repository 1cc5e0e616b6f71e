package com.studentdesk.application.error;

import com.studentdesk.domain.DomainException;

/**
 * Operator input has the wrong shape. Raised before the store is contacted.
 */
public final class ValidationException extends DomainException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
