package com.studentdesk.application.error;

public final class StoreConnectionException extends StoreException {

    public StoreConnectionException(String diagnostic, Throwable cause) {
        super(diagnostic, cause);
    }
}
