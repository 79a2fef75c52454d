package com.gocars.ridesafety.model;

public enum ResponderStatus {
    NOTIFIED,
    RESPONDING,
    ON_SCENE,
    COMPLETED
}
