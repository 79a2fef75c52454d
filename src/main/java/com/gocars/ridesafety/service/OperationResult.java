package com.gocars.ridesafety.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of an operation the caller may legitimately get wrong: unknown ids, transitions out of a
 * terminal state, stopping a session twice. Failures carry a message and never an exception.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OperationResult {

    boolean success;
    String message;

    public static OperationResult success(String message) {
        return new OperationResult(true, message);
    }

    public static OperationResult failure(String message) {
        return new OperationResult(false, message);
    }
}
