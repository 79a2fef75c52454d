package com.gocars.ridesafety.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.gocars.ridesafety.dto.ApiResponse;
import com.gocars.ridesafety.dto.CreateIncidentRequest;
import com.gocars.ridesafety.dto.ResolveIncidentRequest;
import com.gocars.ridesafety.dto.ResponderStatusRequest;
import com.gocars.ridesafety.exception.IncidentNotFoundException;
import com.gocars.ridesafety.model.EmergencyIncident;
import com.gocars.ridesafety.service.CreateIncidentCommand;
import com.gocars.ridesafety.service.EmergencyIncidentManager;
import com.gocars.ridesafety.service.OperationResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST surface of emergency incidents.
 *
 * POST /api/incidents answers 201 only once the incident is recorded; a failed recording is a
 * 503 so the rider app can fall back to calling for help directly.
 */
@RestController
@RequestMapping("/api/incidents")
@RequiredArgsConstructor
@Slf4j
public class IncidentController {

    private final EmergencyIncidentManager incidentManager;

    @PostMapping
    public ResponseEntity<ApiResponse> create(@Valid @RequestBody CreateIncidentRequest request) {
        log.warn("Emergency ({}) raised by user {}", request.getType(), request.getUserId());

        EmergencyIncident incident = incidentManager.createIncident(CreateIncidentCommand.builder()
                .userId(request.getUserId())
                .rideId(request.getRideId())
                .type(request.getType())
                .latitude(request.getLatitude())
                .longitude(request.getLongitude())
                .accuracy(request.getAccuracy())
                .description(request.getDescription())
                .discreteMode(request.getDiscreteMode())
                .requestEmergencyServices(request.isRequestEmergencyServices())
                .triggeredBy(request.getUserId())
                .build());

        JsonNode view = incidentManager.view(incident.getId())
                .orElseThrow(() -> new IncidentNotFoundException(incident.getId()));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(view, "Emergency incident created"));
    }

    @GetMapping("/{incidentId}")
    public ResponseEntity<ApiResponse> get(@PathVariable String incidentId) {
        JsonNode view = incidentManager.view(incidentId)
                .orElseThrow(() -> new IncidentNotFoundException(incidentId));
        return ResponseEntity.ok(ApiResponse.success(view, "Emergency incident"));
    }

    /** Open incidents, newest first; all users unless userId is given */
    @GetMapping
    public ResponseEntity<ApiResponse> listOpen(@RequestParam(required = false) String userId) {
        List<JsonNode> incidents = incidentManager.openIncidents(userId);
        return ResponseEntity.ok(ApiResponse.success(incidents, incidents.size() + " open incident(s)"));
    }

    @PostMapping("/{incidentId}/responders/{responderId}/status")
    public ResponseEntity<ApiResponse> updateResponder(@PathVariable String incidentId,
                                                       @PathVariable String responderId,
                                                       @Valid @RequestBody ResponderStatusRequest request) {
        return respond(incidentId, incidentManager.updateResponderStatus(incidentId, responderId, request.getStatus()));
    }

    @PostMapping("/{incidentId}/resolve")
    public ResponseEntity<ApiResponse> resolve(@PathVariable String incidentId,
                                               @Valid @RequestBody ResolveIncidentRequest request) {
        return respond(incidentId, incidentManager.resolveIncident(incidentId,
                request.getResolvedBy(), request.getResolution(), request.isFollowUpRequired()));
    }

    @PostMapping("/{incidentId}/false-alarm")
    public ResponseEntity<ApiResponse> falseAlarm(@PathVariable String incidentId,
                                                  @Valid @RequestBody ResolveIncidentRequest request) {
        return respond(incidentId, incidentManager.markFalseAlarm(incidentId,
                request.getResolvedBy(), request.getResolution(), request.isFollowUpRequired()));
    }

    private ResponseEntity<ApiResponse> respond(String incidentId, OperationResult result) {
        if (result.isSuccess()) {
            return ResponseEntity.ok(ApiResponse.of(result));
        }
        if (incidentManager.getIncident(incidentId).isEmpty()) {
            throw new IncidentNotFoundException(incidentId);
        }
        return ResponseEntity.badRequest().body(ApiResponse.of(result));
    }
}
