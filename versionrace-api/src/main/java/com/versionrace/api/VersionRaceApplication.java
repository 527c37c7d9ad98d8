package com.versionrace.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for the version race service.
 */
@SpringBootApplication
@ComponentScan(basePackages = {
    "com.versionrace.api",
    "com.versionrace.engine"
})
public class VersionRaceApplication {

    public static void main(String[] args) {
        SpringApplication.run(VersionRaceApplication.class, args);
    }
}
