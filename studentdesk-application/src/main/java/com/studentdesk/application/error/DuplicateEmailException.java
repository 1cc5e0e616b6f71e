package com.studentdesk.application.error;

import com.studentdesk.domain.DomainException;

public final class DuplicateEmailException extends DomainException {

    private final String email;

    public DuplicateEmailException(String email) {
        this(email, null);
    }

    public DuplicateEmailException(String email, Throwable cause) {
        super("That email is already in use. Please use a different email.", cause);
        this.email = email;
    }

    public String email() {
        return email;
    }
}
