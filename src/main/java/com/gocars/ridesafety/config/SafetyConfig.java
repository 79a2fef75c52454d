package com.gocars.ridesafety.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(RideSafetyProperties.class)
public class SafetyConfig {

    /** All safety timestamps go through this clock so tests can pin time. */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
