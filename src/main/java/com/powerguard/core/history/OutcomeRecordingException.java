package com.powerguard.core.history;

public class OutcomeRecordingException extends RuntimeException {

    public OutcomeRecordingException(String message, Throwable cause) {
        super(message, cause);
    }
}
