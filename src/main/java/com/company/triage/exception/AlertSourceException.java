package com.company.triage.exception;

public class AlertSourceException extends RuntimeException {
    public AlertSourceException(String message) {
        super(message);
    }

    public AlertSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
