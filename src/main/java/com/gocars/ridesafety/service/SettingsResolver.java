package com.gocars.ridesafety.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.gocars.ridesafety.gateway.SettingsStore;
import com.gocars.ridesafety.model.EmergencySettings;
import com.gocars.ridesafety.model.SafetySettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Settings lookup that never fails.
 *
 * Each decision point reads the latest snapshot from the {@link SettingsStore}. When the store is
 * unreachable the last snapshot seen for the rider is used, and the system defaults when there
 * is none. Last-seen snapshots are held in size-bounded Caffeine caches.
 */
@Service
@Slf4j
public class SettingsResolver {

    private final SettingsStore settingsStore;

    private final Cache<String, SafetySettings> lastSafetySettings;
    private final Cache<String, EmergencySettings> lastEmergencySettings;

    public SettingsResolver(SettingsStore settingsStore,
                            @Value("${ride-safety.settings.fallback-max-size:10000}") long fallbackMaxSize) {
        this.settingsStore = settingsStore;
        this.lastSafetySettings = Caffeine.newBuilder().maximumSize(fallbackMaxSize).build();
        this.lastEmergencySettings = Caffeine.newBuilder().maximumSize(fallbackMaxSize).build();
    }

    public SafetySettings safetySettings(String userId) {
        try {
            SafetySettings settings = settingsStore.getSafetySettings(userId);
            lastSafetySettings.put(userId, settings);
            return settings;
        } catch (RuntimeException e) {
            SafetySettings last = lastSafetySettings.getIfPresent(userId);
            SafetySettings fallback = last != null ? last : SafetySettings.defaults(userId);
            log.warn("Safety settings for {} unavailable ({}) — using v{}", userId, e.getMessage(), fallback.getVersion());
            return fallback;
        }
    }

    public EmergencySettings emergencySettings(String userId) {
        try {
            EmergencySettings settings = settingsStore.getEmergencySettings(userId);
            lastEmergencySettings.put(userId, settings);
            return settings;
        } catch (RuntimeException e) {
            EmergencySettings last = lastEmergencySettings.getIfPresent(userId);
            EmergencySettings fallback = last != null ? last : EmergencySettings.defaults(userId);
            log.warn("Emergency settings for {} unavailable ({}) — using v{}", userId, e.getMessage(), fallback.getVersion());
            return fallback;
        }
    }

    /** Riders with a remembered safety snapshot, after pending evictions are applied. */
    long rememberedSafetySnapshots() {
        lastSafetySettings.cleanUp();
        return lastSafetySettings.estimatedSize();
    }
}
