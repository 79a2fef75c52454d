package com.gocars.ridesafety.gateway;

import com.gocars.ridesafety.config.RideSafetyProperties;
import com.gocars.ridesafety.model.RoutePoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default {@link LocationProvider}: keeps the freshest position each rider device has reported
 * and serves it to the samplers while it is younger than {@code ride-safety.location.max-age}.
 *
 * Reports are not consumed by a sample, so monitoring and incident tracking can read the same
 * position. An out-of-order report older than the buffered one is dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeviceLocationBuffer implements LocationProvider {

    private final RideSafetyProperties properties;
    private final Clock clock;

    private final Map<String, RoutePoint> latestByUser = new ConcurrentHashMap<>();

    /**
     * @return false if the report was older than the one already buffered
     */
    public boolean report(String userId, RoutePoint fix) {
        RoutePoint stored = latestByUser.merge(userId, fix,
                (current, incoming) -> incoming.getTimestamp().isAfter(current.getTimestamp()) ? incoming : current);
        boolean accepted = stored == fix;
        if (!accepted) {
            log.debug("Out-of-order location report for {} at {} ignored", userId, fix.getTimestamp());
        }
        return accepted;
    }

    @Override
    public Optional<RoutePoint> sample(String subjectId, Duration timeout) {
        RoutePoint fix = latestByUser.get(subjectId);
        if (fix == null) {
            return Optional.empty();
        }
        Duration age = Duration.between(fix.getTimestamp(), LocalDateTime.now(clock));
        if (age.compareTo(properties.getLocation().getMaxAge()) > 0) {
            log.debug("Latest location for {} is {}s old — treated as absent", subjectId, age.getSeconds());
            return Optional.empty();
        }
        return Optional.of(fix);
    }

    public void clear(String userId) {
        latestByUser.remove(userId);
    }
}
