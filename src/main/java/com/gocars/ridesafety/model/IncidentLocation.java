package com.gocars.ridesafety.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class IncidentLocation {

    double latitude;
    double longitude;
    Double accuracy;

    /** Human-readable address; coordinates formatted as text when no geocoder is available */
    String address;
}
