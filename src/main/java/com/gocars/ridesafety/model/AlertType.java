package com.gocars.ridesafety.model;

/**
 * Every signal that can raise a {@link SafetyAlert}.
 */
public enum AlertType {

    /** Vehicle opened a major off-route episode */
    ROUTE_DEVIATION,

    /** Speed above the posted limit plus tolerance */
    SPEED_VIOLATION,

    /** Harsh acceleration or harsh braking */
    HARSH_DRIVING,

    /** Check-in not answered in time, or answered "not ok" */
    CHECK_IN_MISSED,

    /** Rider pressed the panic button during the ride */
    PANIC_BUTTON,

    /** No location fix for several polling cycles in a row */
    COMMUNICATION_LOSS,

    /** Vehicle stationary for longer than allowed */
    EXTENDED_STOP
}
