package com.backstop.dispatch.api;

import com.backstop.core.health.HealthCheckService;
import com.backstop.core.health.HealthStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for engine health.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health: 200 unless a check is DOWN, then 503. Degraded checks keep
     * the 200 but report an overall DEGRADED status.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        List<HealthStatus> checks = healthCheckService.checkAll();

        Map<String, Object> components = new LinkedHashMap<>();
        for (HealthStatus check : checks) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("status", check.status().name());
            entry.put("detail", check.detail());
            if (!check.metadata().isEmpty()) {
                entry.put("metadata", check.metadata());
            }
            components.put(check.component(), entry);
        }

        HealthStatus.Status overall = overall(checks);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", overall.name());
        result.put("components", components);

        return overall == HealthStatus.Status.DOWN
                ? ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(result)
                : ResponseEntity.ok(result);
    }

    private static HealthStatus.Status overall(List<HealthStatus> checks) {
        boolean degraded = false;
        for (HealthStatus check : checks) {
            if (check.status() == HealthStatus.Status.DOWN) {
                return HealthStatus.Status.DOWN;
            }
            degraded |= check.status() == HealthStatus.Status.DEGRADED;
        }
        return degraded ? HealthStatus.Status.DEGRADED : HealthStatus.Status.UP;
    }
}
