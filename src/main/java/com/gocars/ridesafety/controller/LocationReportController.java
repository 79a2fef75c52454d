package com.gocars.ridesafety.controller;

import com.gocars.ridesafety.dto.ApiResponse;
import com.gocars.ridesafety.dto.LocationReportRequest;
import com.gocars.ridesafety.gateway.DeviceLocationBuffer;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Device location feed. Reports land in the {@link DeviceLocationBuffer}, where the monitoring
 * and incident-tracking loops pick them up on their next cycle.
 */
@RestController
@RequestMapping("/api/location")
@RequiredArgsConstructor
@Slf4j
public class LocationReportController {

    private final DeviceLocationBuffer locationBuffer;
    private final Clock clock;

    /**
     * POST /api/location/report
     *
     * Returns 202 Accepted: the report is buffered, not processed inline.
     */
    @PostMapping("/report")
    public ResponseEntity<ApiResponse> report(@Valid @RequestBody LocationReportRequest request) {
        log.debug("Location report from {}: ({}, {})", request.getUserId(),
                request.getPosition().getLatitude(), request.getPosition().getLongitude());

        boolean accepted = locationBuffer.report(request.getUserId(),
                request.getPosition().toRoutePoint(LocalDateTime.now(clock)));

        return ResponseEntity.accepted().body(ApiResponse.builder()
                .success(true)
                .message(accepted ? "Location report accepted" : "Older than the buffered report, ignored")
                .build());
    }
}
