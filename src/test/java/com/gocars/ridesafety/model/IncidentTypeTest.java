package com.gocars.ridesafety.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class IncidentTypeTest {

    @ParameterizedTest
    @EnumSource(IncidentType.class)
    @DisplayName("Every incident type maps to a priority")
    void everyTypeHasPriority(IncidentType type) {
        assertThat(type.priority()).isNotNull();
    }

    @Test
    @DisplayName("Life-threatening types are CRITICAL")
    void criticalTypes() {
        assertThat(IncidentType.SOS.priority()).isEqualTo(IncidentPriority.CRITICAL);
        assertThat(IncidentType.MEDICAL.priority()).isEqualTo(IncidentPriority.CRITICAL);
        assertThat(IncidentType.ACCIDENT.priority()).isEqualTo(IncidentPriority.CRITICAL);
    }

    @Test
    void lowerPriorities() {
        assertThat(IncidentType.PANIC.priority()).isEqualTo(IncidentPriority.HIGH);
        assertThat(IncidentType.HARASSMENT.priority()).isEqualTo(IncidentPriority.HIGH);
        assertThat(IncidentType.VEHICLE_ISSUE.priority()).isEqualTo(IncidentPriority.MEDIUM);
        assertThat(IncidentType.OTHER.priority()).isEqualTo(IncidentPriority.LOW);
    }
}
