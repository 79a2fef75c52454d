package com.gocars.ridesafety.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.gocars.ridesafety.config.RideSafetyProperties;
import com.gocars.ridesafety.exception.IncidentCreationException;
import com.gocars.ridesafety.gateway.DispatchGateway;
import com.gocars.ridesafety.gateway.EvidenceCaptureGateway;
import com.gocars.ridesafety.gateway.IncidentSnapshot;
import com.gocars.ridesafety.gateway.NotificationChannels;
import com.gocars.ridesafety.gateway.PersistenceResult;
import com.gocars.ridesafety.model.EmergencyContact;
import com.gocars.ridesafety.model.EmergencyIncident;
import com.gocars.ridesafety.model.EmergencyResponder;
import com.gocars.ridesafety.model.EmergencySettings;
import com.gocars.ridesafety.model.IncidentLocation;
import com.gocars.ridesafety.model.IncidentPriority;
import com.gocars.ridesafety.model.IncidentResolution;
import com.gocars.ridesafety.model.IncidentStatus;
import com.gocars.ridesafety.model.IncidentType;
import com.gocars.ridesafety.model.ResponderStatus;
import com.gocars.ridesafety.model.ResponderType;
import com.gocars.ridesafety.model.RoutePoint;
import com.gocars.ridesafety.model.TimelineEvent;
import com.gocars.ridesafety.model.TimelineEventType;
import com.gocars.ridesafety.util.GeoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Owns the lifecycle of emergency incidents.
 *
 * Lifecycle:
 *   ACTIVE → RESPONDING   first responder reports RESPONDING or ON_SCENE
 *   ACTIVE | RESPONDING → RESOLVED | FALSE_ALARM   explicit resolution record; terminal
 *
 * Creation writes the incident synchronously before anything else happens and fails loudly when
 * that write fails. The response workflow that follows is best effort: every step is isolated,
 * and each step, failed or not, leaves a timeline entry.
 *
 * Only open incidents live in the in-memory registry. A closed incident moves to a bounded cache
 * of recently closed ones, so it stays readable and a repeated resolve still fails cleanly; the
 * durable record is the store's. All mutation of an incident happens while holding its monitor.
 */
@Service
@Slf4j
public class EmergencyIncidentManager {

    static final String SYSTEM_ACTOR = "system";

    private final SettingsResolver settingsResolver;
    private final NotificationChannels notificationChannels;
    private final DispatchGateway dispatchGateway;
    private final EvidenceCaptureGateway evidenceCaptureGateway;
    private final IncidentLocationTracker locationTracker;
    private final SnapshotMapper snapshotMapper;
    private final SafetyPersistenceService persistenceService;
    private final SafetyEventPublisher eventPublisher;
    private final RideSafetyProperties properties;
    private final Clock clock;

    private final Map<String, EmergencyIncident> incidents = new ConcurrentHashMap<>();
    private final Cache<String, EmergencyIncident> closedIncidents;

    public EmergencyIncidentManager(SettingsResolver settingsResolver,
                                    NotificationChannels notificationChannels,
                                    DispatchGateway dispatchGateway,
                                    EvidenceCaptureGateway evidenceCaptureGateway,
                                    IncidentLocationTracker locationTracker,
                                    SnapshotMapper snapshotMapper,
                                    SafetyPersistenceService persistenceService,
                                    SafetyEventPublisher eventPublisher,
                                    RideSafetyProperties properties,
                                    Clock clock) {
        this.settingsResolver = settingsResolver;
        this.notificationChannels = notificationChannels;
        this.dispatchGateway = dispatchGateway;
        this.evidenceCaptureGateway = evidenceCaptureGateway;
        this.locationTracker = locationTracker;
        this.snapshotMapper = snapshotMapper;
        this.persistenceService = persistenceService;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
        this.closedIncidents = Caffeine.newBuilder()
                .expireAfterWrite(properties.getIncident().getClosedRetention())
                .maximumSize(properties.getIncident().getClosedMaxSize())
                .build();
    }

    /**
     * Records a new incident and runs the response workflow.
     *
     * @throws IncidentCreationException when the incident could not be recorded
     */
    public EmergencyIncident createIncident(CreateIncidentCommand command) {
        if (command.getUserId() == null || command.getUserId().isBlank()) {
            throw new IncidentCreationException("An incident needs a user id");
        }
        EmergencySettings settings = settingsResolver.emergencySettings(command.getUserId());
        IncidentType type = command.getType() != null ? command.getType() : IncidentType.OTHER;
        String actor = command.getTriggeredBy() != null ? command.getTriggeredBy() : command.getUserId();

        EmergencyIncident incident = EmergencyIncident.builder()
                .id("incident_" + UUID.randomUUID())
                .userId(command.getUserId())
                .rideId(command.getRideId())
                .type(type)
                .priority(type.priority())
                .location(toLocation(command.getLatitude(), command.getLongitude(), command.getAccuracy()))
                .createdAt(now())
                .description(command.getDescription() != null && !command.getDescription().isBlank()
                        ? command.getDescription()
                        : "Emergency (" + type + ") triggered")
                .emergencyContacts(settings.activeContacts().stream()
                        .map(EmergencyContact::getId)
                        .collect(Collectors.toCollection(ArrayList::new)))
                .build();
        addTimeline(incident, TimelineEventType.INCIDENT_CREATED,
                "Emergency incident created: " + incident.getDescription(), actor);
        incident.nextVersion();

        IncidentSnapshot snapshot = snapshotMapper.snapshot(incident)
                .orElseThrow(() -> new IncidentCreationException("Incident " + incident.getId() + " could not be serialized"));
        PersistenceResult result = persistenceService.persistIncidentNow(snapshot);
        if (!result.isSuccess()) {
            log.error("Incident for user {} could not be recorded: {}", command.getUserId(), result.getError());
            throw new IncidentCreationException("Emergency incident could not be recorded: " + result.getError());
        }
        log.warn("==> EMERGENCY INCIDENT {} created — user {}, type {}, priority {}",
                incident.getId(), incident.getUserId(), type, incident.getPriority());

        boolean discrete = command.getDiscreteMode() != null ? command.getDiscreteMode() : settings.isDiscreteMode();
        synchronized (incident) {
            // registered under the monitor, so a close waits for the workflow it would otherwise race
            incidents.put(incident.getId(), incident);
            runResponseWorkflow(incident, settings, discrete, command.isRequestEmergencyServices());
            commit(incident);
        }
        eventPublisher.publishIncident("CREATED", incident);
        return incident;
    }

    /**
     * Records a responder's status. The incident moves to RESPONDING the first time a responder
     * is under way or on scene.
     */
    public OperationResult updateResponderStatus(String incidentId, String responderId, ResponderStatus status) {
        EmergencyIncident incident = find(incidentId);
        if (incident == null) {
            return OperationResult.failure("Incident not found: " + incidentId);
        }
        synchronized (incident) {
            if (incident.getStatus().isTerminal()) {
                return OperationResult.failure("Incident " + incidentId + " is already " + incident.getStatus());
            }
            Optional<EmergencyResponder> found = incident.findResponder(responderId);
            if (found.isEmpty()) {
                return OperationResult.failure("Responder " + responderId + " is not assigned to incident " + incidentId);
            }
            EmergencyResponder responder = found.get();
            responder.setStatus(status);
            addTimeline(incident, TimelineEventType.STATUS_UPDATE,
                    responder.getName() + " is " + status, responder.getId());

            if (incident.getStatus() == IncidentStatus.ACTIVE
                    && (status == ResponderStatus.RESPONDING || status == ResponderStatus.ON_SCENE)) {
                incident.setStatus(IncidentStatus.RESPONDING);
                addTimeline(incident, TimelineEventType.STATUS_UPDATE,
                        "Incident is being responded to by " + responder.getName(), SYSTEM_ACTOR);
                log.info("Incident {} is now RESPONDING", incidentId);
            }
            commit(incident);
        }
        eventPublisher.publishIncident("RESPONDER_UPDATED", incident);
        return OperationResult.success("Responder " + responderId + " is " + status);
    }

    public OperationResult resolveIncident(String incidentId, String resolvedBy, String resolution, boolean followUpRequired) {
        return close(incidentId, IncidentStatus.RESOLVED, resolvedBy, resolution, followUpRequired);
    }

    public OperationResult markFalseAlarm(String incidentId, String resolvedBy, String resolution, boolean followUpRequired) {
        return close(incidentId, IncidentStatus.FALSE_ALARM, resolvedBy, resolution, followUpRequired);
    }

    /** Open incidents, and closed ones still within their retention. */
    public Optional<EmergencyIncident> getIncident(String incidentId) {
        return Optional.ofNullable(find(incidentId));
    }

    public int activeIncidentCount() {
        return incidents.size();
    }

    /** Detached JSON copy of the incident, taken under its monitor. */
    public Optional<JsonNode> view(String incidentId) {
        EmergencyIncident incident = find(incidentId);
        if (incident == null) {
            return Optional.empty();
        }
        synchronized (incident) {
            return Optional.of(snapshotMapper.view(incident));
        }
    }

    /**
     * Non-terminal incidents, newest first, optionally for one user.
     */
    public List<JsonNode> openIncidents(String userId) {
        return incidents.values().stream()
                .filter(i -> userId == null || userId.equals(i.getUserId()))
                .sorted(Comparator.comparing(EmergencyIncident::getCreatedAt).reversed())
                .map(incident -> {
                    synchronized (incident) {
                        return incident.getStatus().isTerminal() ? null : snapshotMapper.view(incident);
                    }
                })
                .filter(Objects::nonNull)
                .toList();
    }

    // ────────────────────────────────────────────────────────────────────────
    // Response workflow
    // ────────────────────────────────────────────────────────────────────────

    private void runResponseWorkflow(EmergencyIncident incident, EmergencySettings settings,
                                     boolean discrete, boolean servicesRequested) {
        step(incident, "Location tracking", () -> {
            locationTracker.start(incident.getId(), incident.getUserId(), fix -> onTrackedFix(incident, fix));
            addTimeline(incident, TimelineEventType.LOCATION_TRACKING_STARTED,
                    "Continuous location tracking started", SYSTEM_ACTOR);
        });

        if (!discrete) {
            for (EmergencyContact contact : settings.activeContacts()) {
                notifyContact(incident, contact, settings);
            }
        }

        if ((settings.isAutoCallEmergencyServices() || servicesRequested)
                && incident.getPriority() == IncidentPriority.CRITICAL) {
            step(incident, "Emergency services dispatch", () -> {
                EmergencyResponder responder = dispatchGateway.contactEmergencyServices(incident);
                incident.getResponders().add(responder);
                addTimeline(incident, TimelineEventType.SERVICES_CONTACTED,
                        "Emergency services contacted" + eta(responder), SYSTEM_ACTOR);
            });
        }

        RideSafetyProperties.Incident config = properties.getIncident();
        if (incident.getPriority().isAtLeast(IncidentPriority.HIGH)) {
            step(incident, "Security team assignment", () -> assignResponder(incident, ResponderType.SECURITY_TEAM,
                    config.getSecurityTeamName(), config.getSecurityTeamPhone(), config.getSecurityTeamEta()));
        }
        step(incident, "Support agent assignment", () -> assignResponder(incident, ResponderType.SUPPORT_AGENT,
                config.getSupportAgentName(), null, null));

        if (!discrete && settings.isAutoRecordAudio()) {
            step(incident, "Audio recording", () -> {
                evidenceCaptureGateway.startAudioRecording(incident, config.getAudioRecordingDuration());
                addTimeline(incident, TimelineEventType.EVIDENCE_CAPTURE_STARTED, "Audio recording started", SYSTEM_ACTOR);
            });
        }
        if (!discrete && settings.isAutoTakePhotos()) {
            step(incident, "Photo capture", () -> {
                evidenceCaptureGateway.capturePhotos(incident);
                addTimeline(incident, TimelineEventType.EVIDENCE_CAPTURE_STARTED, "Photo capture started", SYSTEM_ACTOR);
            });
        }

        if (incident.getRideId() != null) {
            step(incident, "Driver notification", () -> {
                notificationChannels.notifyDriver(incident);
                addTimeline(incident, TimelineEventType.DRIVER_NOTIFIED,
                        "Driver of ride " + incident.getRideId() + " notified", SYSTEM_ACTOR);
            });
        }
    }

    /**
     * SMS and email go to every contact that enabled them; the call only to the primary contact.
     * Channels are attempted independently of each other.
     */
    private void notifyContact(EmergencyIncident incident, EmergencyContact contact, EmergencySettings settings) {
        List<String> reached = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        if (contact.isSmsEnabled()) {
            attempt("SMS", () -> notificationChannels.sendSms(contact.getPhoneNumber(), smsText(incident, settings)),
                    incident, contact, reached, failed);
        }
        if (contact.isPrimary() && contact.isCallEnabled()) {
            attempt("call", () -> notificationChannels.placeCall(contact.getPhoneNumber(), incident),
                    incident, contact, reached, failed);
        }
        if (contact.isEmailEnabled()) {
            attempt("email", () -> notificationChannels.sendEmail(contact, incident),
                    incident, contact, reached, failed);
        }

        if (!reached.isEmpty()) {
            addTimeline(incident, TimelineEventType.CONTACTS_NOTIFIED,
                    "Emergency contact " + contact.getName() + " notified via " + String.join(", ", reached), SYSTEM_ACTOR);
        }
        if (!failed.isEmpty()) {
            addTimeline(incident, TimelineEventType.STEP_FAILED,
                    "Could not reach " + contact.getName() + " via " + String.join(", ", failed), SYSTEM_ACTOR);
        }
    }

    private void attempt(String channel, Runnable send, EmergencyIncident incident, EmergencyContact contact,
                         List<String> reached, List<String> failed) {
        try {
            send.run();
            reached.add(channel);
        } catch (RuntimeException e) {
            log.error("Incident {} — {} to contact {} failed: {}", incident.getId(), channel, contact.getId(), e.getMessage());
            failed.add(channel);
        }
    }

    private void assignResponder(EmergencyIncident incident, ResponderType type, String name, String phone, Duration eta) {
        EmergencyResponder responder = EmergencyResponder.builder()
                .id("responder_" + UUID.randomUUID())
                .type(type)
                .name(name)
                .phoneNumber(phone)
                .status(ResponderStatus.NOTIFIED)
                .estimatedArrival(eta != null ? now().plus(eta) : null)
                .build();
        incident.getResponders().add(responder);
        addTimeline(incident, TimelineEventType.RESPONDER_ASSIGNED, name + " assigned" + eta(responder), SYSTEM_ACTOR);
    }

    private void step(EmergencyIncident incident, String name, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("Incident {} — {} failed", incident.getId(), name, e);
            addTimeline(incident, TimelineEventType.STEP_FAILED, name + " failed: " + e.getMessage(), SYSTEM_ACTOR);
        }
    }

    // ────────────────────────────────────────────────────────────────────────
    // Tracking and closing
    // ────────────────────────────────────────────────────────────────────────

    private void onTrackedFix(EmergencyIncident incident, RoutePoint fix) {
        synchronized (incident) {
            if (incident.getStatus().isTerminal()) {
                return;
            }
            incident.setLocation(toLocation(fix.getLatitude(), fix.getLongitude(), fix.getAccuracy()));
            commit(incident);
        }
        log.debug("Incident {} location updated to {}", incident.getId(),
                GeoUtil.formatCoordinates(fix.getLatitude(), fix.getLongitude()));
    }

    private OperationResult close(String incidentId, IncidentStatus target, String resolvedBy,
                                  String resolution, boolean followUpRequired) {
        if (resolvedBy == null || resolvedBy.isBlank() || resolution == null || resolution.isBlank()) {
            return OperationResult.failure("Resolver id and resolution are required");
        }
        EmergencyIncident incident = find(incidentId);
        if (incident == null) {
            return OperationResult.failure("Incident not found: " + incidentId);
        }
        synchronized (incident) {
            if (incident.getStatus().isTerminal()) {
                return OperationResult.failure("Incident " + incidentId + " is already " + incident.getStatus());
            }
            LocalDateTime now = now();
            incident.setStatus(target);
            incident.setResolution(IncidentResolution.builder()
                    .resolvedAt(now)
                    .resolvedBy(resolvedBy)
                    .resolution(resolution)
                    .followUpRequired(followUpRequired)
                    .build());
            incident.getResponders().stream()
                    .filter(r -> r.getStatus() != ResponderStatus.COMPLETED)
                    .forEach(r -> r.setStatus(ResponderStatus.COMPLETED));
            addTimeline(incident, TimelineEventType.RESOLVED,
                    (target == IncidentStatus.FALSE_ALARM ? "Marked as false alarm: " : "Resolved: ") + resolution,
                    resolvedBy);
            commit(incident);
            incidents.remove(incidentId);
            closedIncidents.put(incidentId, incident);
        }
        locationTracker.stop(incidentId);
        log.info("Incident {} closed as {} by {}, {} still open", incidentId, target, resolvedBy, incidents.size());
        eventPublisher.publishIncident(target.name(), incident);
        return OperationResult.success("Incident " + incidentId + " is " + target);
    }

    private EmergencyIncident find(String incidentId) {
        EmergencyIncident incident = incidents.get(incidentId);
        return incident != null ? incident : closedIncidents.getIfPresent(incidentId);
    }

    private void commit(EmergencyIncident incident) {
        incident.nextVersion();
        snapshotMapper.snapshot(incident).ifPresent(persistenceService::persistIncident);
    }

    private void addTimeline(EmergencyIncident incident, TimelineEventType type, String description, String actor) {
        incident.getTimeline().add(TimelineEvent.builder()
                .id("event_" + UUID.randomUUID())
                .timestamp(now())
                .type(type)
                .description(description)
                .actor(actor)
                .build());
    }

    private String smsText(EmergencyIncident incident, EmergencySettings settings) {
        StringBuilder text = new StringBuilder("EMERGENCY ALERT: your contact triggered a ")
                .append(incident.getType()).append(" emergency alert.");
        if (settings.isShareLocationWithContacts() && incident.getLocation() != null) {
            IncidentLocation location = incident.getLocation();
            text.append(" Location: https://maps.google.com/?q=")
                    .append(location.getLatitude()).append(',').append(location.getLongitude());
        }
        return text.append(" Please check on them immediately.").toString();
    }

    private String eta(EmergencyResponder responder) {
        if (responder.getEstimatedArrival() == null) {
            return "";
        }
        long minutes = Math.max(0, Duration.between(now(), responder.getEstimatedArrival()).toMinutes());
        return ", ETA " + minutes + " min";
    }

    private IncidentLocation toLocation(Double latitude, Double longitude, Double accuracy) {
        if (latitude == null || longitude == null) {
            return null;
        }
        return IncidentLocation.builder()
                .latitude(latitude)
                .longitude(longitude)
                .accuracy(accuracy)
                .address(GeoUtil.formatCoordinates(latitude, longitude))
                .build();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
