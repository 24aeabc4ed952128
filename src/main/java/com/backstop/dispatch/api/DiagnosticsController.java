package com.backstop.dispatch.api;

import com.backstop.core.diagnostics.DiagnosticLedger;
import com.backstop.core.engine.ResilienceEngine;
import com.backstop.core.model.CrashRecord;
import com.backstop.core.model.DiagnosticReport;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the diagnostic ledger.
 */
@RestController
@RequestMapping("/api/v1/diagnostics")
public class DiagnosticsController {

    private final ResilienceEngine engine;
    private final DiagnosticLedger ledger;

    public DiagnosticsController(ResilienceEngine engine, DiagnosticLedger ledger) {
        this.engine = engine;
        this.ledger = ledger;
    }

    @GetMapping
    public ResponseEntity<DiagnosticReport> report() {
        return ResponseEntity.ok(engine.diagnosticReport());
    }

    /**
     * GET /api/v1/diagnostics/records/{id}: One crash record; 404 once evicted.
     */
    @GetMapping("/records/{id}")
    public ResponseEntity<CrashRecord> record(@PathVariable String id) {
        return ledger.record(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
