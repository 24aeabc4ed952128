package com.backstop.dispatch.api;

import com.backstop.core.engine.ResilienceEngine;
import com.backstop.core.glass.GlassRecoveryCoordinator;
import com.backstop.core.model.Renderable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller through which a remote host reports component failures and recoveries.
 * Remote hosts cannot pass a retry callback, so failures always resolve to a fallback
 * or a status message.
 */
@RestController
@RequestMapping("/api/v1/components")
public class ComponentController {

    private static final Logger log = LoggerFactory.getLogger(ComponentController.class);

    private final ResilienceEngine engine;

    public ComponentController(ResilienceEngine engine) {
        this.engine = engine;
    }

    /**
     * POST /api/v1/components/{id}/failures: Report a failure, get the replacement back.
     */
    @PostMapping("/{id}/failures")
    public ResponseEntity<Object> failure(@PathVariable String id, @RequestBody FailureRequest request) {
        if (request.message() == null && request.errorType() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "error_type or message is required"));
        }
        Throwable error = ReportedFailure.from(request);
        log.debug("Failure reported for {}: {}", id, error);

        Renderable renderable = GlassRecoveryCoordinator.DOMAIN.equalsIgnoreCase(request.domain())
                ? engine.onGlassFailure(id, error, null)
                : engine.onFailure(id, error, null);
        return ResponseEntity.ok(renderable);
    }

    /**
     * POST /api/v1/components/{id}/recovered: Host rebuilt the live component.
     */
    @PostMapping("/{id}/recovered")
    public ResponseEntity<Map<String, String>> recovered(@PathVariable String id) {
        if (!engine.markRecovered(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("componentId", id, "status", "RECOVERED"));
    }
}
