package com.whereq.tempo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for WhereQ Tempo.
 * This service runs batch jobs from a persisted queue with as many
 * concurrent workers as the host's memory and CPU allow.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
@EnableScheduling
public class TempoApplication {

    public static void main(String[] args) {
        SpringApplication.run(TempoApplication.class, args);
    }
}
