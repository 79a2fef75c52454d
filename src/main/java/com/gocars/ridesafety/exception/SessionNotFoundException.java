package com.gocars.ridesafety.exception;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("Monitoring session not found: " + sessionId);
    }
}
