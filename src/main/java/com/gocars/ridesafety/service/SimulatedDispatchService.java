package com.gocars.ridesafety.service;

import com.gocars.ridesafety.config.RideSafetyProperties;
import com.gocars.ridesafety.gateway.DispatchGateway;
import com.gocars.ridesafety.model.EmergencyIncident;
import com.gocars.ridesafety.model.EmergencyResponder;
import com.gocars.ridesafety.model.ResponderStatus;
import com.gocars.ridesafety.model.ResponderType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Default {@link DispatchGateway}. Logs the dispatch request and returns a responder with the
 * configured ETA; a real CAD/PSAP integration replaces this bean.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SimulatedDispatchService implements DispatchGateway {

    private final RideSafetyProperties properties;
    private final Clock clock;

    @Override
    public EmergencyResponder contactEmergencyServices(EmergencyIncident incident) {
        RideSafetyProperties.Incident config = properties.getIncident();
        log.info("================================================================");
        log.info("[DISPATCH] Requesting emergency services for incident {} ({}, {})",
                incident.getId(), incident.getType(), incident.getPriority());
        if (incident.getLocation() != null) {
            log.info("[DISPATCH] Location: {}", incident.getLocation().getAddress());
        }
        log.info("================================================================");

        return EmergencyResponder.builder()
                .id("responder_" + UUID.randomUUID())
                .type(ResponderType.EMERGENCY_SERVICES)
                .name("Emergency Services")
                .phoneNumber(config.getEmergencyServicesNumber())
                .status(ResponderStatus.NOTIFIED)
                .estimatedArrival(LocalDateTime.now(clock).plus(config.getEmergencyServicesEta()))
                .build();
    }
}
