package com.gocars.ridesafety.gateway;

import com.gocars.ridesafety.model.EmergencyContact;
import com.gocars.ridesafety.model.EmergencyIncident;

/**
 * Outbound messaging. Every method is independently callable and may throw; callers record the
 * outcome of each call separately.
 */
public interface NotificationChannels {

    void sendSms(String phoneNumber, String message);

    void placeCall(String phoneNumber, EmergencyIncident incident);

    void sendEmail(EmergencyContact contact, EmergencyIncident incident);

    /** In-app notification to the rider */
    void notifyUser(String userId, String title, String message);

    /** Tells the driver of the incident's ride that an emergency was raised */
    void notifyDriver(EmergencyIncident incident);
}
