package com.gocars.ridesafety.gateway;

import com.gocars.ridesafety.config.RideSafetyProperties;
import com.gocars.ridesafety.model.RoutePoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

class DeviceLocationBufferTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 9, 0);

    private DeviceLocationBuffer buffer;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T09:00:00Z"), ZoneOffset.UTC);
        buffer = new DeviceLocationBuffer(new RideSafetyProperties(), clock);
    }

    @Test
    @DisplayName("Fresh report is served to every sampler")
    void freshReport_servedRepeatedly() {
        RoutePoint fix = RoutePoint.of(12.97, 77.59, NOW.minusSeconds(5));
        assertThat(buffer.report("user-1", fix)).isTrue();

        assertThat(buffer.sample("user-1", Duration.ofSeconds(1))).contains(fix);
        assertThat(buffer.sample("user-1", Duration.ofSeconds(1))).contains(fix);
    }

    @Test
    @DisplayName("Report older than max age is treated as absent")
    void staleReport_absent() {
        buffer.report("user-1", RoutePoint.of(12.97, 77.59, NOW.minusSeconds(60)));

        assertThat(buffer.sample("user-1", Duration.ofSeconds(1))).isEmpty();
    }

    @Test
    @DisplayName("Out-of-order report does not replace a newer one")
    void outOfOrderReport_dropped() {
        RoutePoint newer = RoutePoint.of(12.97, 77.59, NOW.minusSeconds(2));
        RoutePoint older = RoutePoint.of(12.96, 77.58, NOW.minusSeconds(8));
        buffer.report("user-1", newer);

        assertThat(buffer.report("user-1", older)).isFalse();
        assertThat(buffer.sample("user-1", Duration.ofSeconds(1))).contains(newer);
    }

    @Test
    void unknownUser_andClear() {
        assertThat(buffer.sample("nobody", Duration.ofSeconds(1))).isEmpty();

        buffer.report("user-1", RoutePoint.of(12.97, 77.59, NOW));
        buffer.clear("user-1");
        assertThat(buffer.sample("user-1", Duration.ofSeconds(1))).isEmpty();
    }
}
