package com.gocars.ridesafety.gateway;

import com.gocars.ridesafety.model.RoutePoint;

import java.time.Duration;
import java.util.Optional;

/**
 * Source of position fixes. Best effort: a provider may return empty, block up to the timeout,
 * or fail.
 */
public interface LocationProvider {

    /**
     * @param subjectId user whose device position is wanted
     * @param timeout   how long the caller is prepared to wait
     */
    Optional<RoutePoint> sample(String subjectId, Duration timeout);
}
