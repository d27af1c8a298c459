package com.dcruver.compass;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for ACM Compass.
 *
 * Tracks a team's competitive-programming problems and contest results in JSON files
 * under one data directory, and synchronizes that directory through git.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class CompassApplication {

    public static void main(String[] args) {
        log.info("Starting ACM Compass...");
        SpringApplication.run(CompassApplication.class, args);
    }
}
