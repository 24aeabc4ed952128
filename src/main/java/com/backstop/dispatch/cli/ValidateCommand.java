package com.backstop.dispatch.cli;

import com.backstop.core.engine.ResilienceEngine;
import com.backstop.core.glass.DomainValidationReport;
import com.backstop.core.model.RecommendedAction;
import com.backstop.core.model.ResourceKind;
import com.backstop.core.model.ValidationReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: backstop validate
 * <p>
 * Validates the UI and glass resource catalogs. Exits 1 when the UI catalog
 * recommends ABORT.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Validate UI and glass resources")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Option(names = {"--glass-only"}, description = "Only validate the glass resources")
    private boolean glassOnly;

    private final ResilienceEngine engine;

    public ValidateCommand(ResilienceEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        int exit = 0;

        if (!glassOnly) {
            ValidationReport report = engine.validate();
            if (report.allAvailable()) {
                ConsoleOutput.success("UI resources: all available");
            } else {
                ConsoleOutput.warn("UI resources: " + report.missingCount() + " missing, "
                        + report.fallbacksAvailable() + " with fallback");
                for (ResourceKind kind : ResourceKind.values()) {
                    ConsoleOutput.missing(kind.name().toLowerCase(), report.missing(kind));
                }
            }
            ConsoleOutput.info("Recommended action: " + report.recommendedAction());
            if (report.recommendedAction() == RecommendedAction.ABORT) {
                exit = 1;
            }
        }

        DomainValidationReport glass = engine.validateAll();
        ConsoleOutput.separator();
        if (glass.allAvailable()) {
            ConsoleOutput.success("Glass resources: all " + glass.totalResources() + " available");
        } else {
            ConsoleOutput.warn(String.format("Glass resources: %d/%d missing (%.1f%%)",
                    glass.totalMissing(), glass.totalResources(), glass.missingPercentage()));
            glass.perKind().values().forEach(k -> ConsoleOutput.missing(k.kind().name().toLowerCase(), k.missing()));
        }
        ConsoleOutput.info("Advanced effects: " + (glass.advancedEffectsSupported() ? "supported" : "unsupported")
                + ", recommended tier: " + glass.recommendedTier());
        return exit;
    }
}
