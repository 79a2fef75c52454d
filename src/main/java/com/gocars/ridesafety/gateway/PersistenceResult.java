package com.gocars.ridesafety.gateway;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PersistenceResult {

    public enum Outcome {
        WRITTEN,
        /** A newer version was already stored; nothing written */
        STALE,
        FAILED
    }

    Outcome outcome;
    String error;

    public static PersistenceResult written() {
        return new PersistenceResult(Outcome.WRITTEN, null);
    }

    public static PersistenceResult stale() {
        return new PersistenceResult(Outcome.STALE, null);
    }

    public static PersistenceResult failed(String error) {
        return new PersistenceResult(Outcome.FAILED, error);
    }

    /** A stale write is not an error: the store already holds newer data. */
    public boolean isSuccess() {
        return outcome != Outcome.FAILED;
    }
}
