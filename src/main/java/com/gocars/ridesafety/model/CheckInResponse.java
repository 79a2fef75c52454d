package com.gocars.ridesafety.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CheckInResponse {

    boolean ok;
    String message;
    RoutePoint location;
}
