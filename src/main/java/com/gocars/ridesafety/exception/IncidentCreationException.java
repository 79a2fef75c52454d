package com.gocars.ridesafety.exception;

/**
 * The emergency could not be recorded. Always surfaced to the caller: a rider pressing SOS has to
 * know right away that nothing was raised.
 */
public class IncidentCreationException extends RuntimeException {

    public IncidentCreationException(String message) {
        super(message);
    }

    public IncidentCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
