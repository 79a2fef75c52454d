package com.gocars.ridesafety.model;

public enum CheckInType {
    AUTOMATIC,
    MANUAL,
    PROMPTED
}
