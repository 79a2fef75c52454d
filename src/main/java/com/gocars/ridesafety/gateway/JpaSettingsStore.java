package com.gocars.ridesafety.gateway;

import com.gocars.ridesafety.config.CacheConfig;
import com.gocars.ridesafety.entity.EmergencyContactRecord;
import com.gocars.ridesafety.entity.EmergencySettingsRecord;
import com.gocars.ridesafety.entity.SafetySettingsRecord;
import com.gocars.ridesafety.model.AlertSensitivity;
import com.gocars.ridesafety.model.EmergencyContact;
import com.gocars.ridesafety.model.EmergencySettings;
import com.gocars.ridesafety.model.SafetySettings;
import com.gocars.ridesafety.repository.EmergencyContactRecordRepository;
import com.gocars.ridesafety.repository.EmergencySettingsRecordRepository;
import com.gocars.ridesafety.repository.SafetySettingsRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Default {@link SettingsStore} over the settings tables, cached per user.
 *
 * Caching strategy:
 *   @Cacheable, keyed by userId, Caffeine with a short TTL (ride-safety.settings.cache-ttl-seconds).
 *   Settings are read at every fix and every alert; the TTL bounds how stale a snapshot may be
 *   after the settings service changes it.
 *
 * Missing rows yield the system defaults (version 0). Data-access exceptions propagate; the
 * SettingsResolver falls back to the last snapshot it saw.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaSettingsStore implements SettingsStore {

    private final SafetySettingsRecordRepository safetySettingsRepository;
    private final EmergencySettingsRecordRepository emergencySettingsRepository;
    private final EmergencyContactRecordRepository contactRepository;

    @Override
    @Cacheable(value = CacheConfig.CACHE_SAFETY_SETTINGS, key = "#userId")
    @Transactional(readOnly = true)
    public SafetySettings getSafetySettings(String userId) {
        log.debug("[CACHE MISS] safety settings for {} — loading from DB", userId);
        return safetySettingsRepository.findById(userId)
                .map(this::toSafetySettings)
                .orElseGet(() -> SafetySettings.defaults(userId));
    }

    @Override
    @Cacheable(value = CacheConfig.CACHE_EMERGENCY_SETTINGS, key = "#userId")
    @Transactional(readOnly = true)
    public EmergencySettings getEmergencySettings(String userId) {
        log.debug("[CACHE MISS] emergency settings for {} — loading from DB", userId);
        List<EmergencyContact> contacts = contactRepository.findByUserIdOrderByIdAsc(userId).stream()
                .map(this::toContact)
                .toList();
        EmergencySettings base = emergencySettingsRepository.findById(userId)
                .map(this::toEmergencySettings)
                .orElseGet(() -> EmergencySettings.defaults(userId));
        return base.toBuilder().emergencyContacts(contacts).build();
    }

    private SafetySettings toSafetySettings(SafetySettingsRecord record) {
        return SafetySettings.builder()
                .userId(record.getUserId())
                .version(record.getVersion() != null ? record.getVersion() : 0)
                .rideMonitoringEnabled(record.isRideMonitoringEnabled())
                .routeDeviationThreshold(record.getRouteDeviationThreshold())
                .speedViolationTolerance(record.getSpeedViolationTolerance())
                .checkInIntervalMinutes(record.getCheckInIntervalMinutes())
                .automaticCheckInsEnabled(record.isAutomaticCheckInsEnabled())
                .emergencyContactsOnAlert(record.isEmergencyContactsOnAlert())
                .shareLocationDuringRide(record.isShareLocationDuringRide())
                .driverBehaviorMonitoring(record.isDriverBehaviorMonitoring())
                .alertSensitivity(record.getAlertSensitivity() != null
                        ? record.getAlertSensitivity()
                        : AlertSensitivity.MEDIUM)
                .build();
    }

    private EmergencySettings toEmergencySettings(EmergencySettingsRecord record) {
        return EmergencySettings.builder()
                .userId(record.getUserId())
                .version(record.getVersion() != null ? record.getVersion() : 0)
                .autoCallEmergencyServices(record.isAutoCallEmergencyServices())
                .shareLocationWithContacts(record.isShareLocationWithContacts())
                .discreteMode(record.isDiscreteMode())
                .autoRecordAudio(record.isAutoRecordAudio())
                .autoTakePhotos(record.isAutoTakePhotos())
                .build();
    }

    private EmergencyContact toContact(EmergencyContactRecord record) {
        return EmergencyContact.builder()
                .id(String.valueOf(record.getId()))
                .name(record.getName())
                .phoneNumber(record.getPhoneNumber())
                .email(record.getEmail())
                .relationship(record.getRelationship())
                .primary(record.isPrimary())
                .active(record.isActive())
                .smsEnabled(record.isSmsEnabled())
                .callEnabled(record.isCallEnabled())
                .emailEnabled(record.isEmailEnabled())
                .build();
    }
}
