package com.scaffold.backend.health;

import java.time.Clock;
import java.time.Instant;

import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and readiness checks backed by the actuator health contributors.
 */
@RestController
public class HealthController {

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return toResponse(healthEndpoint.health().getStatus());
    }

    /**
     * Database only.
     */
    @GetMapping("/health/ready")
    public ResponseEntity<HealthResponse> ready() {
        HealthComponent db = healthEndpoint.healthForPath("db");
        return toResponse(db != null ? db.getStatus() : Status.UNKNOWN);
    }

    @GetMapping("/health/live")
    public HealthResponse live() {
        return new HealthResponse(Status.UP.getCode(), Instant.now(clock).toString());
    }

    private ResponseEntity<HealthResponse> toResponse(Status status) {
        HttpStatus httpStatus = Status.UP.equals(status) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(httpStatus)
                .body(new HealthResponse(status.getCode(), Instant.now(clock).toString()));
    }

    public record HealthResponse(
            String status,
            String timestamp
    ) {
    }
}
