package com.gocars.ridesafety.model;

public enum DeviationSeverity {
    MINOR,
    MAJOR
}
