package com.tokentracker.backend.health;

import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness ({@code /health}, {@code /healthz}) and readiness ({@code /readyz}) probes.
 */
@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse(Status.UP.getCode(), now());
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return healthz();
    }

    /**
     * Ready once the database answers.
     */
    @GetMapping("/readyz")
    public ResponseEntity<HealthResponse> readyz() {
        String status;
        try {
            HealthComponent db = healthEndpoint.healthForPath("db");
            status = db != null ? db.getStatus().getCode() : healthEndpoint.health().getStatus().getCode();
        } catch (RuntimeException e) {
            log.warn("Readiness probe failed", e);
            status = Status.DOWN.getCode();
        }
        HttpStatus httpStatus = Status.UP.getCode().equals(status) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(httpStatus).body(new HealthResponse(status, now()));
    }

    private String now() {
        return Instant.now(clock).toString();
    }

    public record HealthResponse(
            String status,
            String timestamp
    ) {
    }
}
