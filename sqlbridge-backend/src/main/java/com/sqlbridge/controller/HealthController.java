package com.sqlbridge.controller;

import com.sqlbridge.api.HealthResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;

/**
 * Liveness of the gateway process itself. Open without an API key and never touches a backend.
 */
@RestController
public class HealthController {

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("ok", OffsetDateTime.now());
    }
}
