package com.gocars.ridesafety.service;

import com.gocars.ridesafety.gateway.NotificationChannels;
import com.gocars.ridesafety.model.EmergencyContact;
import com.gocars.ridesafety.model.EmergencyIncident;
import com.gocars.ridesafety.model.IncidentLocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Default {@link NotificationChannels}.
 *
 * Rider and driver notifications are pushed to the apps over WebSocket. SMS, voice and email are
 * simulated by logging the outgoing message.
 * In production, replace the log statements with:
 *   - Twilio / AWS SNS → SMS and voice
 *   - SES / SendGrid   → email
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService implements NotificationChannels {

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void sendSms(String phoneNumber, String message) {
        requirePhone(phoneNumber);
        log.info("[SMS] To {}: '{}'", phoneNumber, message);
        // TODO (Production): Twilio
        //   Message.creator(new PhoneNumber(phoneNumber), twilioFrom, message).create();
    }

    @Override
    public void placeCall(String phoneNumber, EmergencyIncident incident) {
        requirePhone(phoneNumber);
        log.info("================================================================");
        log.info("[VOICE CALL] Calling {} about {} incident {}", phoneNumber, incident.getType(), incident.getId());
        log.info("[VOICE CALL] Location: {}", describe(incident.getLocation()));
        log.info("================================================================");
    }

    @Override
    public void sendEmail(EmergencyContact contact, EmergencyIncident incident) {
        if (contact.getEmail() == null || contact.getEmail().isBlank()) {
            throw new IllegalArgumentException("Contact " + contact.getId() + " has no email address");
        }
        log.info("[EMAIL] To {} <{}>: Emergency alert ({}) — {}",
                contact.getName(), contact.getEmail(), incident.getType(), describe(incident.getLocation()));
    }

    @Override
    public void notifyUser(String userId, String title, String message) {
        log.info("[PUSH NOTIFICATION] User {}: {} — {}", userId, title, message);
        messagingTemplate.convertAndSend("/topic/users/" + userId + "/notifications",
                Map.of("title", title, "message", message));
    }

    @Override
    public void notifyDriver(EmergencyIncident incident) {
        if (incident.getRideId() == null) {
            throw new IllegalArgumentException("Incident " + incident.getId() + " is not linked to a ride");
        }
        log.info("[PUSH NOTIFICATION] Driver of ride {}: rider raised a {} emergency",
                incident.getRideId(), incident.getType());
        messagingTemplate.convertAndSend("/topic/rides/" + incident.getRideId() + "/driver",
                Map.of("incidentId", incident.getId(), "type", incident.getType().name(),
                        "message", "Your passenger has triggered an emergency alert. Please remain calm and cooperative."));
    }

    private void requirePhone(String phoneNumber) {
        if (phoneNumber == null || phoneNumber.isBlank()) {
            throw new IllegalArgumentException("No phone number");
        }
    }

    private String describe(IncidentLocation location) {
        if (location == null) {
            return "location unavailable";
        }
        return location.getAddress() + " (https://maps.google.com/?q="
                + location.getLatitude() + "," + location.getLongitude() + ")";
    }
}
