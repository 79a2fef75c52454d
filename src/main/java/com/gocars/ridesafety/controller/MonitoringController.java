package com.gocars.ridesafety.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.gocars.ridesafety.dto.AlertActionRequest;
import com.gocars.ridesafety.dto.ApiResponse;
import com.gocars.ridesafety.dto.CheckInRequest;
import com.gocars.ridesafety.dto.RoutePointRequest;
import com.gocars.ridesafety.dto.StartMonitoringRequest;
import com.gocars.ridesafety.exception.SessionNotFoundException;
import com.gocars.ridesafety.model.CheckInResponse;
import com.gocars.ridesafety.model.MonitoringSession;
import com.gocars.ridesafety.service.MonitoringSupervisor;
import com.gocars.ridesafety.service.OperationResult;
import com.gocars.ridesafety.service.StartMonitoringCommand;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * REST surface of ride monitoring: session lifecycle, pushed fixes, check-ins, panic button and
 * alert handling.
 *
 * Core operations that are rejected (unknown session, terminal alert, stopped session) come back
 * as 400 with the reason in the message.
 */
@RestController
@RequestMapping("/api/monitoring")
@RequiredArgsConstructor
@Slf4j
public class MonitoringController {

    private final MonitoringSupervisor monitoringSupervisor;
    private final Clock clock;

    /**
     * POST /api/monitoring/start
     *
     * Starts location polling and check-ins for a ride. 409 if the ride is already monitored.
     */
    @PostMapping("/start")
    public ResponseEntity<ApiResponse> start(@Valid @RequestBody StartMonitoringRequest request) {
        log.info("Monitoring requested for ride {} (user {})", request.getRideId(), request.getUserId());
        LocalDateTime now = LocalDateTime.now(clock);

        MonitoringSession session = monitoringSupervisor.startMonitoring(StartMonitoringCommand.builder()
                .rideId(request.getRideId())
                .userId(request.getUserId())
                .driverId(request.getDriverId())
                .plannedRoute(request.getPlannedRoute().stream().map(p -> p.toRoutePoint(now)).toList())
                .build());

        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(
                Map.of("sessionId", session.getId(), "rideId", session.getRideId()),
                "Monitoring started"));
    }

    @PostMapping("/{sessionId}/stop")
    public ResponseEntity<ApiResponse> stop(@PathVariable String sessionId) {
        return respond(monitoringSupervisor.stopMonitoring(sessionId));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<ApiResponse> get(@PathVariable String sessionId) {
        JsonNode session = monitoringSupervisor.view(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        return ResponseEntity.ok(ApiResponse.success(session, "Monitoring session"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse> list() {
        List<JsonNode> sessions = monitoringSupervisor.activeSessions();
        return ResponseEntity.ok(ApiResponse.success(sessions, sessions.size() + " active session(s)"));
    }

    /**
     * POST /api/monitoring/{sessionId}/fix
     *
     * Pushes a fix straight into the session, for clients that stream positions instead of
     * waiting to be polled.
     */
    @PostMapping("/{sessionId}/fix")
    public ResponseEntity<ApiResponse> fix(@PathVariable String sessionId,
                                           @Valid @RequestBody RoutePointRequest request) {
        return respond(monitoringSupervisor.recordFix(sessionId, request.toRoutePoint(LocalDateTime.now(clock))));
    }

    /** Rider-initiated check-in */
    @PostMapping("/{sessionId}/check-ins")
    public ResponseEntity<ApiResponse> manualCheckIn(@PathVariable String sessionId,
                                                     @Valid @RequestBody CheckInRequest request) {
        return respond(monitoringSupervisor.manualCheckIn(sessionId, toResponse(request)));
    }

    /** Operator asks the rider for an extra check-in now */
    @PostMapping("/{sessionId}/check-ins/prompt")
    public ResponseEntity<ApiResponse> promptCheckIn(@PathVariable String sessionId) {
        return respond(monitoringSupervisor.requestCheckIn(sessionId));
    }

    @PostMapping("/{sessionId}/check-ins/{checkInId}/response")
    public ResponseEntity<ApiResponse> respondToCheckIn(@PathVariable String sessionId,
                                                        @PathVariable String checkInId,
                                                        @Valid @RequestBody CheckInRequest request) {
        return respond(monitoringSupervisor.respondToCheckIn(sessionId, checkInId, toResponse(request)));
    }

    @PostMapping("/{sessionId}/panic")
    public ResponseEntity<ApiResponse> panic(@PathVariable String sessionId) {
        log.warn("PANIC button pressed, session {}", sessionId);
        return respond(monitoringSupervisor.triggerPanic(sessionId));
    }

    @PostMapping("/{sessionId}/alerts/{alertId}/acknowledge")
    public ResponseEntity<ApiResponse> acknowledge(@PathVariable String sessionId, @PathVariable String alertId,
                                                   @Valid @RequestBody AlertActionRequest request) {
        return respond(monitoringSupervisor.acknowledgeAlert(sessionId, alertId, request.getActor()));
    }

    @PostMapping("/{sessionId}/alerts/{alertId}/resolve")
    public ResponseEntity<ApiResponse> resolve(@PathVariable String sessionId, @PathVariable String alertId,
                                               @Valid @RequestBody AlertActionRequest request) {
        return respond(monitoringSupervisor.resolveAlert(sessionId, alertId, request.getActor()));
    }

    @PostMapping("/{sessionId}/alerts/{alertId}/false-alarm")
    public ResponseEntity<ApiResponse> falseAlarm(@PathVariable String sessionId, @PathVariable String alertId,
                                                  @Valid @RequestBody AlertActionRequest request) {
        return respond(monitoringSupervisor.markAlertFalseAlarm(sessionId, alertId, request.getActor()));
    }

    private CheckInResponse toResponse(CheckInRequest request) {
        return CheckInResponse.builder()
                .ok(request.getOk())
                .message(request.getMessage())
                .location(request.getLocation() != null
                        ? request.getLocation().toRoutePoint(LocalDateTime.now(clock))
                        : null)
                .build();
    }

    private ResponseEntity<ApiResponse> respond(OperationResult result) {
        if (!result.isSuccess()) {
            log.info("Monitoring operation rejected: {}", result.getMessage());
            return ResponseEntity.badRequest().body(ApiResponse.of(result));
        }
        return ResponseEntity.ok(ApiResponse.of(result));
    }
}
