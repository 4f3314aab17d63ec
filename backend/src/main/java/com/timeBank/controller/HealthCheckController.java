package com.timeBank.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Liveness check for the hosting platform. Needs no token. */
@RestController
public class HealthCheckController {

    @Value("${spring.application.name}")
    private String applicationName;

    @GetMapping("/api/health")
    public String health() {
        return applicationName + " is up";
    }
}
