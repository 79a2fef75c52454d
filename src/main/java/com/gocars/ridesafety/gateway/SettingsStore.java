package com.gocars.ridesafety.gateway;

import com.gocars.ridesafety.model.EmergencySettings;
import com.gocars.ridesafety.model.SafetySettings;

/**
 * Read access to per-rider settings owned by the settings service.
 *
 * Implementations return defaults when nothing is stored and may throw on transport or storage
 * failure; callers go through {@code SettingsResolver}, which absorbs those failures.
 */
public interface SettingsStore {

    SafetySettings getSafetySettings(String userId);

    EmergencySettings getEmergencySettings(String userId);
}
