package com.gocars.ridesafety.model;

/**
 * Status of a safety check-in.
 *
 * OVERDUE marks a check-in whose response arrived after it had already been marked MISSED.
 */
public enum CheckInStatus {
    PENDING,
    COMPLETED,
    MISSED,
    OVERDUE
}
