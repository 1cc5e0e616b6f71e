package com.studentdesk.application.error;

import com.studentdesk.domain.DomainException;

/**
 * Any store failure other than a uniqueness violation.
 * The message is the store's own diagnostic text.
 */
public class StoreException extends DomainException {

    public StoreException(String diagnostic, Throwable cause) {
        super(diagnostic, cause);
    }

    public String diagnostic() {
        String m = getMessage();
        if (m != null && !m.isBlank()) return m;
        Throwable c = getCause();
        return c == null ? "unknown store error" : c.toString();
    }
}
