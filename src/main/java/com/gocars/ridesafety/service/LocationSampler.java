package com.gocars.ridesafety.service;

import com.gocars.ridesafety.config.RideSafetyProperties;
import com.gocars.ridesafety.gateway.LocationProvider;
import com.gocars.ridesafety.model.RoutePoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Pulls one fix from the {@link LocationProvider}, bounded by the sample timeout.
 *
 * Absence, timeout and provider errors all come back as an empty result: the caller skips the
 * cycle and keeps its previous state.
 */
@Service
@Slf4j
public class LocationSampler {

    private final LocationProvider locationProvider;
    private final Executor samplingExecutor;
    private final RideSafetyProperties properties;

    public LocationSampler(LocationProvider locationProvider,
                           @Qualifier("locationSamplingExecutor") Executor samplingExecutor,
                           RideSafetyProperties properties) {
        this.locationProvider = locationProvider;
        this.samplingExecutor = samplingExecutor;
        this.properties = properties;
    }

    public Optional<RoutePoint> sample(String subjectId) {
        Duration timeout = properties.getMonitoring().getSampleTimeout();
        CompletableFuture<Optional<RoutePoint>> future = CompletableFuture.supplyAsync(
                () -> locationProvider.sample(subjectId, timeout), samplingExecutor);
        try {
            Optional<RoutePoint> fix = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return fix != null ? fix : Optional.empty();
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Location sample for {} timed out after {} ms", subjectId, timeout.toMillis());
            return Optional.empty();
        } catch (ExecutionException e) {
            log.warn("Location sample for {} failed: {}", subjectId, e.getCause().getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }
}
