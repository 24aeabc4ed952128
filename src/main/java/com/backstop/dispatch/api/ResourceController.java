package com.backstop.dispatch.api;

import com.backstop.core.engine.ResilienceEngine;
import com.backstop.core.glass.DomainValidationReport;
import com.backstop.core.model.ValidationReport;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for on-demand resource validation.
 */
@RestController
@RequestMapping("/api/v1/resources")
public class ResourceController {

    private final ResilienceEngine engine;

    public ResourceController(ResilienceEngine engine) {
        this.engine = engine;
    }

    @GetMapping("/validation")
    public ResponseEntity<ValidationReport> validation() {
        return ResponseEntity.ok(engine.validate());
    }

    @GetMapping("/glass")
    public ResponseEntity<DomainValidationReport> glass() {
        return ResponseEntity.ok(engine.validateAll());
    }
}
