package com.backstop.dispatch.api;

import com.backstop.core.engine.ResilienceEngine;
import com.backstop.core.health.SystemHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for system tier and recovery.
 */
@RestController
@RequestMapping("/api/v1/status")
public class StatusController {

    private static final Logger log = LoggerFactory.getLogger(StatusController.class);

    private final ResilienceEngine engine;

    public StatusController(ResilienceEngine engine) {
        this.engine = engine;
    }

    /**
     * GET /api/v1/status: Current system health and recovery statistics.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("health", engine.systemStatus());
        result.put("statistics", engine.recoveryStatistics());
        result.put("glassStyle", engine.glassStyle());
        return ResponseEntity.ok(result);
    }

    /**
     * POST /api/v1/status/recovery: Re-validate and raise recoverable components.
     */
    @PostMapping("/recovery")
    public ResponseEntity<SystemHealth> recover() {
        log.info("System recovery requested via API");
        return ResponseEntity.ok(engine.attemptSystemRecovery());
    }
}
