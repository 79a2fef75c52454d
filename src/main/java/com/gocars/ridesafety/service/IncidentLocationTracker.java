package com.gocars.ridesafety.service;

import com.gocars.ridesafety.config.RideSafetyProperties;
import com.gocars.ridesafety.model.RoutePoint;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * Continuous location tracking for open incidents, one periodic task per incident.
 */
@Service
@Slf4j
public class IncidentLocationTracker {

    private final TaskScheduler taskScheduler;
    private final LocationSampler locationSampler;
    private final RideSafetyProperties properties;

    private final Map<String, ScheduledFuture<?>> trackers = new ConcurrentHashMap<>();

    public IncidentLocationTracker(@Qualifier("safetyTaskScheduler") TaskScheduler taskScheduler,
                                   LocationSampler locationSampler,
                                   RideSafetyProperties properties) {
        this.taskScheduler = taskScheduler;
        this.locationSampler = locationSampler;
        this.properties = properties;
    }

    /**
     * Samples the user's position every tracking interval and hands each fix to {@code onFix}.
     * Restarting tracking for the same incident replaces the previous task.
     */
    public void start(String incidentId, String userId, Consumer<RoutePoint> onFix) {
        ScheduledFuture<?> task = taskScheduler.scheduleAtFixedRate(
                () -> track(incidentId, userId, onFix), properties.getIncident().getTrackingInterval());
        ScheduledFuture<?> previous = trackers.put(incidentId, task);
        if (previous != null) {
            previous.cancel(false);
        }
        log.info("Location tracking started for incident {} (user {})", incidentId, userId);
    }

    /** @return whether a tracking task was running */
    public boolean stop(String incidentId) {
        ScheduledFuture<?> task = trackers.remove(incidentId);
        if (task == null) {
            return false;
        }
        task.cancel(false);
        log.info("Location tracking stopped for incident {}", incidentId);
        return true;
    }

    public boolean isTracking(String incidentId) {
        return trackers.containsKey(incidentId);
    }

    @PreDestroy
    public void stopAll() {
        trackers.keySet().forEach(this::stop);
    }

    private void track(String incidentId, String userId, Consumer<RoutePoint> onFix) {
        try {
            locationSampler.sample(userId).ifPresent(onFix);
        } catch (RuntimeException e) {
            log.warn("Tracking cycle for incident {} failed: {}", incidentId, e.getMessage());
        }
    }
}
