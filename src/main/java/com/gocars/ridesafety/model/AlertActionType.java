package com.gocars.ridesafety.model;

public enum AlertActionType {

    /** In-app notification pushed to the rider */
    NOTIFICATION_SENT,

    /** One emergency contact messaged */
    CONTACT_NOTIFIED,

    /** Escalated to an emergency incident with emergency services requested */
    EMERGENCY_DISPATCHED
}
