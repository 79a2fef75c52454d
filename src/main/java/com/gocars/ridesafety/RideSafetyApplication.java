package com.gocars.ridesafety;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot Application Class
 * GoCars Ride Safety: live ride monitoring and emergency-incident orchestration
 */
@SpringBootApplication
public class RideSafetyApplication {

    public static void main(String[] args) {
        SpringApplication.run(RideSafetyApplication.class, args);
    }

}
