package com.shopmate.backend.health;

import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and readiness endpoints for the process supervisor.
 */
@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final HealthEndpoint healthEndpoint;

    public HealthController(HealthEndpoint healthEndpoint) {
        this.healthEndpoint = healthEndpoint;
    }

    /**
     * The process is up and serving requests.
     */
    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse("UP", Instant.now().toString());
    }

    /**
     * Ready once the attendance ledger can be read.
     */
    @GetMapping("/readyz")
    public HealthResponse readyz() {
        try {
            HealthComponent healthComponent = healthEndpoint.health();
            String status = healthComponent.getStatus().getCode();

            if (healthComponent instanceof CompositeHealth composite && composite.getComponents() != null) {
                HealthComponent ledger = composite.getComponents().get("ledger");
                if (ledger != null) {
                    status = ledger.getStatus().getCode();
                }
            }

            return new HealthResponse(status, Instant.now().toString());
        } catch (RuntimeException e) {
            log.warn("Readiness check failed", e);
            return new HealthResponse("DOWN", Instant.now().toString());
        }
    }

    public record HealthResponse(
        String status,   // "UP" | "DOWN"
        String timestamp // ISO-8601 timestamp
    ) {}
}
