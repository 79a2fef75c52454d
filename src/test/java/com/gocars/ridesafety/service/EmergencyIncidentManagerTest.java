package com.gocars.ridesafety.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gocars.ridesafety.config.RideSafetyProperties;
import com.gocars.ridesafety.exception.IncidentCreationException;
import com.gocars.ridesafety.gateway.DispatchGateway;
import com.gocars.ridesafety.gateway.EvidenceCaptureGateway;
import com.gocars.ridesafety.gateway.NotificationChannels;
import com.gocars.ridesafety.gateway.PersistenceResult;
import com.gocars.ridesafety.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for EmergencyIncidentManager.
 *
 *  - priority and dispatch rules
 *  - synchronous first write; a failed write aborts creation
 *  - each workflow step fails on its own
 *  - closing is allowed once
 */
@ExtendWith(MockitoExtension.class)
class EmergencyIncidentManagerTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private SettingsResolver settingsResolver;
    @Mock private NotificationChannels notificationChannels;
    @Mock private DispatchGateway dispatchGateway;
    @Mock private EvidenceCaptureGateway evidenceCaptureGateway;
    @Mock private IncidentLocationTracker locationTracker;
    @Mock private SafetyPersistenceService persistenceService;
    @Mock private SafetyEventPublisher eventPublisher;

    private EmergencyIncidentManager incidentManager;

    // ── Test fixtures ─────────────────────────────────────────────────────────

    private static final String USER_ID = "user-1";

    private static final EmergencyContact PRIMARY = EmergencyContact.builder()
            .id("1").name("Asha").phoneNumber("+91-9000000001").email("asha@example.com")
            .primary(true).active(true).smsEnabled(true).callEnabled(true).emailEnabled(true)
            .build();

    @BeforeEach
    void setUp() {
        incidentManager = managerWith(new RideSafetyProperties());
    }

    private EmergencyIncidentManager managerWith(RideSafetyProperties properties) {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T09:00:00Z"), ZoneOffset.UTC);
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return new EmergencyIncidentManager(settingsResolver, notificationChannels, dispatchGateway,
                evidenceCaptureGateway, locationTracker, new SnapshotMapper(objectMapper, clock),
                persistenceService, eventPublisher, properties, clock);
    }

    private void givenSettings(EmergencySettings settings) {
        when(settingsResolver.emergencySettings(USER_ID)).thenReturn(settings);
    }

    private void givenFirstWrite(PersistenceResult result) {
        when(persistenceService.persistIncidentNow(any())).thenReturn(result);
    }

    private CreateIncidentCommand command(IncidentType type) {
        return CreateIncidentCommand.builder()
                .userId(USER_ID)
                .rideId("ride-1")
                .type(type)
                .latitude(12.9716)
                .longitude(77.5946)
                .build();
    }

    private static List<TimelineEventType> timelineTypes(EmergencyIncident incident) {
        return incident.getTimeline().stream().map(TimelineEvent::getType).toList();
    }

    // ── Creation ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("MEDICAL is CRITICAL; with auto-call emergency services are dispatched")
    void medical_autoCall_dispatchesServices() {
        givenSettings(EmergencySettings.defaults(USER_ID).toBuilder().autoCallEmergencyServices(true).build());
        givenFirstWrite(PersistenceResult.written());
        when(dispatchGateway.contactEmergencyServices(any())).thenReturn(EmergencyResponder.builder()
                .id("responder-911").type(ResponderType.EMERGENCY_SERVICES).name("Emergency Services").build());

        EmergencyIncident incident = incidentManager.createIncident(command(IncidentType.MEDICAL));

        assertThat(incident.getPriority()).isEqualTo(IncidentPriority.CRITICAL);
        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.ACTIVE);
        assertThat(incident.getResponders()).extracting(EmergencyResponder::getType)
                .containsExactly(ResponderType.EMERGENCY_SERVICES, ResponderType.SECURITY_TEAM, ResponderType.SUPPORT_AGENT);
        assertThat(timelineTypes(incident)).startsWith(TimelineEventType.INCIDENT_CREATED,
                        TimelineEventType.LOCATION_TRACKING_STARTED)
                .contains(TimelineEventType.SERVICES_CONTACTED, TimelineEventType.DRIVER_NOTIFIED)
                .doesNotContain(TimelineEventType.STEP_FAILED);
        assertThat(incident.getVersion()).isEqualTo(2);

        verify(persistenceService).persistIncidentNow(argThat(s -> s.getVersion() == 1));
        verify(persistenceService).persistIncident(argThat(s -> s.getVersion() == 2));
        verify(locationTracker).start(eq(incident.getId()), eq(USER_ID), any());
        verify(eventPublisher).publishIncident("CREATED", incident);
        assertThat(incidentManager.getIncident(incident.getId())).contains(incident);
    }

    @Test
    @DisplayName("Without auto-call or an explicit request, no dispatch happens")
    void critical_withoutRequest_noDispatch() {
        givenSettings(EmergencySettings.defaults(USER_ID));
        givenFirstWrite(PersistenceResult.written());

        EmergencyIncident incident = incidentManager.createIncident(command(IncidentType.SOS));

        verifyNoInteractions(dispatchGateway);
        assertThat(incident.hasResponder(ResponderType.EMERGENCY_SERVICES)).isFalse();
    }

    @Test
    @DisplayName("Requested services are not dispatched for a non-critical incident")
    void medium_requestIgnored() {
        givenSettings(EmergencySettings.defaults(USER_ID));
        givenFirstWrite(PersistenceResult.written());

        EmergencyIncident incident = incidentManager.createIncident(command(IncidentType.VEHICLE_ISSUE).toBuilder()
                .requestEmergencyServices(true).build());

        verifyNoInteractions(dispatchGateway);
        assertThat(incident.getResponders()).extracting(EmergencyResponder::getType)
                .containsExactly(ResponderType.SUPPORT_AGENT);
    }

    @Test
    @DisplayName("Failed first write aborts creation and nothing is registered")
    void failedFirstWrite_throws() {
        givenSettings(EmergencySettings.defaults(USER_ID));
        givenFirstWrite(PersistenceResult.failed("disk full"));

        assertThatThrownBy(() -> incidentManager.createIncident(command(IncidentType.SOS)))
                .isInstanceOf(IncidentCreationException.class)
                .hasMessageContaining("disk full");

        verifyNoInteractions(locationTracker, notificationChannels, eventPublisher);
        assertThat(incidentManager.openIncidents(null)).isEmpty();
    }

    @Test
    void blankUser_rejected() {
        assertThatThrownBy(() -> incidentManager.createIncident(CreateIncidentCommand.builder()
                .type(IncidentType.SOS).build()))
                .isInstanceOf(IncidentCreationException.class);
    }

    // ── Workflow steps ────────────────────────────────────────────────────────

    @Test
    @DisplayName("A failing step is recorded and the remaining steps still run")
    void failingStep_isolated() {
        givenSettings(EmergencySettings.defaults(USER_ID).toBuilder().emergencyContact(PRIMARY).build());
        givenFirstWrite(PersistenceResult.written());
        doThrow(new IllegalStateException("scheduler down")).when(locationTracker).start(anyString(), anyString(), any());
        doThrow(new IllegalArgumentException("SMS gateway down")).when(notificationChannels).sendSms(anyString(), anyString());

        EmergencyIncident incident = incidentManager.createIncident(command(IncidentType.HARASSMENT));

        assertThat(timelineTypes(incident))
                .doesNotContain(TimelineEventType.LOCATION_TRACKING_STARTED)
                .contains(TimelineEventType.CONTACTS_NOTIFIED, TimelineEventType.RESPONDER_ASSIGNED,
                        TimelineEventType.DRIVER_NOTIFIED);
        assertThat(timelineTypes(incident)).filteredOn(t -> t == TimelineEventType.STEP_FAILED).hasSize(2);
        verify(notificationChannels).placeCall("+91-9000000001", incident);
        verify(notificationChannels).sendEmail(PRIMARY, incident);
    }

    @Test
    @DisplayName("Discrete mode skips contacts and evidence capture")
    void discreteMode_skipsContactsAndEvidence() {
        givenSettings(EmergencySettings.defaults(USER_ID).toBuilder()
                .emergencyContact(PRIMARY).autoRecordAudio(true).autoTakePhotos(true).build());
        givenFirstWrite(PersistenceResult.written());

        EmergencyIncident incident = incidentManager.createIncident(command(IncidentType.PANIC).toBuilder()
                .discreteMode(true).build());

        verify(notificationChannels, never()).sendSms(anyString(), anyString());
        verifyNoInteractions(evidenceCaptureGateway);
        assertThat(incident.getEmergencyContacts()).containsExactly("1");
        assertThat(timelineTypes(incident)).doesNotContain(TimelineEventType.CONTACTS_NOTIFIED);
    }

    @Test
    @DisplayName("Evidence capture starts when the rider opted in")
    void evidenceCapture() {
        givenSettings(EmergencySettings.defaults(USER_ID).toBuilder().autoRecordAudio(true).autoTakePhotos(true).build());
        givenFirstWrite(PersistenceResult.written());

        EmergencyIncident incident = incidentManager.createIncident(command(IncidentType.OTHER));

        verify(evidenceCaptureGateway).startAudioRecording(eq(incident), any());
        verify(evidenceCaptureGateway).capturePhotos(incident);
        assertThat(timelineTypes(incident)).filteredOn(t -> t == TimelineEventType.EVIDENCE_CAPTURE_STARTED).hasSize(2);
    }

    // ── Responders and closing ────────────────────────────────────────────────

    @Test
    @DisplayName("First responder under way moves the incident to RESPONDING")
    void responderUnderWay_responding() {
        givenSettings(EmergencySettings.defaults(USER_ID));
        givenFirstWrite(PersistenceResult.written());
        EmergencyIncident incident = incidentManager.createIncident(command(IncidentType.OTHER));
        String responderId = incident.getResponders().get(0).getId();

        OperationResult result = incidentManager.updateResponderStatus(incident.getId(), responderId,
                ResponderStatus.RESPONDING);

        assertThat(result.isSuccess()).isTrue();
        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.RESPONDING);
        assertThat(incidentManager.updateResponderStatus(incident.getId(), "nobody", ResponderStatus.ON_SCENE)
                .isSuccess()).isFalse();
    }

    @Test
    @DisplayName("Resolving twice fails the second time and leaves the incident unchanged")
    void resolveTwice() {
        givenSettings(EmergencySettings.defaults(USER_ID));
        givenFirstWrite(PersistenceResult.written());
        EmergencyIncident incident = incidentManager.createIncident(command(IncidentType.SOS));

        OperationResult first = incidentManager.resolveIncident(incident.getId(), "agent-7", "Rider safe", false);
        IncidentResolution resolution = incident.getResolution();
        long version = incident.getVersion();
        int timelineSize = incident.getTimeline().size();

        OperationResult second = incidentManager.markFalseAlarm(incident.getId(), "agent-8", "Pocket dial", true);

        assertThat(first.isSuccess()).isTrue();
        assertThat(second.isSuccess()).isFalse();
        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.RESOLVED);
        assertThat(incident.getResolution()).isSameAs(resolution);
        assertThat(incident.getVersion()).isEqualTo(version);
        assertThat(incident.getTimeline()).hasSize(timelineSize);
        assertThat(incident.getResponders()).allMatch(r -> r.getStatus() == ResponderStatus.COMPLETED);
        verify(locationTracker, times(1)).stop(incident.getId());
    }

    @Test
    @DisplayName("Closing leaves the live registry; the incident stays readable while retained")
    void close_leavesLiveRegistry() {
        givenSettings(EmergencySettings.defaults(USER_ID));
        givenFirstWrite(PersistenceResult.written());
        EmergencyIncident incident = incidentManager.createIncident(command(IncidentType.SOS));
        assertThat(incidentManager.activeIncidentCount()).isEqualTo(1);

        incidentManager.resolveIncident(incident.getId(), "agent-7", "Rider safe", false);

        assertThat(incidentManager.activeIncidentCount()).isZero();
        assertThat(incidentManager.getIncident(incident.getId())).containsSame(incident);
        assertThat(incidentManager.view(incident.getId())).isPresent();
        assertThat(incidentManager.resolveIncident(incident.getId(), "agent-8", "Again", false).getMessage())
                .contains("already RESOLVED");
        assertThat(incidentManager.updateResponderStatus(incident.getId(),
                incident.getResponders().get(0).getId(), ResponderStatus.ON_SCENE).isSuccess()).isFalse();
    }

    @Test
    @DisplayName("Closed incident past its retention is gone from memory and cannot be resolved again")
    void closedIncident_evictedAfterRetention() {
        RideSafetyProperties properties = new RideSafetyProperties();
        properties.getIncident().setClosedRetention(Duration.ZERO);
        incidentManager = managerWith(properties);
        givenSettings(EmergencySettings.defaults(USER_ID));
        givenFirstWrite(PersistenceResult.written());
        EmergencyIncident incident = incidentManager.createIncident(command(IncidentType.SOS));

        OperationResult first = incidentManager.resolveIncident(incident.getId(), "agent-7", "Rider safe", false);
        OperationResult second = incidentManager.markFalseAlarm(incident.getId(), "agent-8", "Pocket dial", true);

        assertThat(first.isSuccess()).isTrue();
        assertThat(incidentManager.activeIncidentCount()).isZero();
        assertThat(incidentManager.getIncident(incident.getId())).isEmpty();
        assertThat(second.isSuccess()).isFalse();
        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.RESOLVED);
    }

    @Test
    @DisplayName("A close arriving during the response workflow waits for it, so tracking is always stopped")
    void closeDuringWorkflow_waitsForIt() throws Exception {
        givenSettings(EmergencySettings.defaults(USER_ID));
        givenFirstWrite(PersistenceResult.written());
        ExecutorService executor = Executors.newSingleThreadExecutor();
        AtomicReference<Future<OperationResult>> closing = new AtomicReference<>();
        doAnswer(invocation -> {
            String incidentId = invocation.getArgument(0);
            closing.set(executor.submit(() ->
                    incidentManager.resolveIncident(incidentId, "agent-7", "Handled", false)));
            assertThatThrownBy(() -> closing.get().get(200, TimeUnit.MILLISECONDS))
                    .isInstanceOf(TimeoutException.class);
            return null;
        }).when(locationTracker).start(anyString(), anyString(), any());

        try {
            EmergencyIncident incident = incidentManager.createIncident(command(IncidentType.SOS));

            assertThat(closing.get().get(5, TimeUnit.SECONDS).isSuccess()).isTrue();
            assertThat(incident.getStatus()).isEqualTo(IncidentStatus.RESOLVED);
            InOrder inOrder = inOrder(locationTracker);
            inOrder.verify(locationTracker).start(eq(incident.getId()), eq(USER_ID), any());
            inOrder.verify(locationTracker).stop(incident.getId());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void close_requiresResolverAndResolution() {
        assertThat(incidentManager.resolveIncident("incident-x", " ", "done", false).isSuccess()).isFalse();
        assertThat(incidentManager.resolveIncident("incident-x", "agent-7", "done", false).isSuccess()).isFalse();
    }

    @Test
    @DisplayName("Open incidents exclude closed ones and render as JSON")
    void openIncidents_excludesClosed() {
        givenSettings(EmergencySettings.defaults(USER_ID));
        givenFirstWrite(PersistenceResult.written());
        EmergencyIncident open = incidentManager.createIncident(command(IncidentType.SOS));
        EmergencyIncident closed = incidentManager.createIncident(command(IncidentType.OTHER));
        incidentManager.resolveIncident(closed.getId(), "agent-7", "Handled", false);

        List<JsonNode> views = incidentManager.openIncidents(USER_ID);

        assertThat(views).hasSize(1);
        assertThat(views.get(0).get("id").asText()).isEqualTo(open.getId());
        assertThat(views.get(0).get("priority").asText()).isEqualTo("CRITICAL");
        assertThat(incidentManager.openIncidents("someone-else")).isEmpty();
    }
}
