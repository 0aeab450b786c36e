package com.planningsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main Spring Boot application for the timetable sync service.
 */
@SpringBootApplication
@EnableScheduling
public class PlanningSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlanningSyncApplication.class, args);
    }
}
