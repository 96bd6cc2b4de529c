package fin.lending.intake.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoints; served without authentication
 * Database status comes from the actuator {@code db} health indicator
 */
@Slf4j
@RestController
@Tag(name = "Health", description = "Service health")
public class HealthController {

    private static final String DB_COMPONENT = "db";

    @Autowired
    private HealthEndpoint healthEndpoint;

    @Autowired
    private Clock clock;

    /**
     * Liveness plus database reachability
     */
    @GetMapping({"/health", "/api/health"})
    @Operation(summary = "Health check including database status")
    public ResponseEntity<Map<String, Object>> health() {
        boolean databaseUp = Status.UP.equals(databaseStatus());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", databaseUp ? "healthy" : "degraded");
        body.put("timestamp", Instant.now(clock).toString());
        body.put("database", databaseUp ? "up" : "down");

        HttpStatus status = databaseUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(body);
    }

    private Status databaseStatus() {
        HealthComponent db = healthEndpoint.healthForPath(DB_COMPONENT);
        if (db == null) {
            log.warn("No database health indicator registered");
            return Status.UNKNOWN;
        }
        if (!Status.UP.equals(db.getStatus())) {
            log.warn("Database health check failed: status={}", db.getStatus());
        }
        return db.getStatus();
    }
}
