package com.backstop.core.health;

import com.backstop.core.diagnostics.DiagnosticLedger;
import com.backstop.core.diagnostics.DiagnosticsProperties;
import com.backstop.core.engine.ResilienceEngine;
import com.backstop.core.glass.GlassTier;
import com.backstop.core.model.RecommendedAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Operator-facing health checks over resources, glass effects, the ledger and the
 * system tier.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ResilienceEngine engine;
    private final DiagnosticLedger ledger;
    private final DiagnosticsProperties diagnosticsProperties;

    public HealthCheckService(ResilienceEngine engine,
                              DiagnosticLedger ledger,
                              DiagnosticsProperties diagnosticsProperties) {
        this.engine = engine;
        this.ledger = ledger;
        this.diagnosticsProperties = diagnosticsProperties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkResources());
        results.add(checkGlass());
        results.add(checkLedger());
        results.add(checkSystem());
        return results;
    }

    private HealthStatus checkResources() {
        try {
            var report = engine.validate();
            Map<String, String> meta = Map.of(
                    "missing", String.valueOf(report.missingCount()),
                    "action", report.recommendedAction().name());
            if (report.recommendedAction() == RecommendedAction.PROCEED_NORMAL) {
                return new HealthStatus("resources", HealthStatus.Status.UP, "All UI resources available", meta);
            }
            if (report.recommendedAction() == RecommendedAction.ABORT) {
                return new HealthStatus("resources", HealthStatus.Status.DOWN,
                        "Missing resources without fallback: " + String.join(", ", report.allMissing()), meta);
            }
            return new HealthStatus("resources", HealthStatus.Status.DEGRADED,
                    report.missingCount() + " resource(s) missing, using " + report.recommendedAction(), meta);
        } catch (Exception e) {
            log.warn("Resource health check failed: {}", e.getMessage());
            return new HealthStatus("resources", HealthStatus.Status.DOWN,
                    "Validation error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkGlass() {
        try {
            var report = engine.validateAll();
            Map<String, String> meta = Map.of(
                    "tier", report.recommendedTier().name(),
                    "missingPercentage", String.format("%.1f", report.missingPercentage()));
            if (report.recommendedTier() == GlassTier.FULL) {
                return new HealthStatus("glass", HealthStatus.Status.UP, "Full glass effects available", meta);
            }
            return new HealthStatus("glass", HealthStatus.Status.DEGRADED,
                    "Glass effects running at " + report.recommendedTier(), meta);
        } catch (Exception e) {
            log.warn("Glass health check failed: {}", e.getMessage());
            return new HealthStatus("glass", HealthStatus.Status.DOWN,
                    "Glass validation error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkLedger() {
        int size = ledger.size();
        int cap = diagnosticsProperties.getMaxCrashReports();
        return new HealthStatus("ledger", HealthStatus.Status.UP,
                size + " of " + cap + " crash records retained",
                Map.of("records", String.valueOf(size), "capacity", String.valueOf(cap)));
    }

    private HealthStatus checkSystem() {
        SystemHealth health = engine.systemStatus();
        Map<String, String> meta = Map.of(
                "tier", health.tier().name(),
                "healthPercentage", String.format("%.1f", health.healthPercentage()));
        return switch (health.tier()) {
            case NORMAL -> new HealthStatus("system", HealthStatus.Status.UP,
                    health.total() + " component(s) tracked", meta);
            case DEGRADED, EMERGENCY -> new HealthStatus("system", HealthStatus.Status.DEGRADED,
                    "System running at " + health.tier(), meta);
            case CRITICAL -> new HealthStatus("system", HealthStatus.Status.DOWN,
                    health.failed() + " of " + health.total() + " component(s) failed", meta);
        };
    }
}
