package com.backstop.dispatch.cli;

import com.backstop.core.engine.ResilienceEngine;
import com.backstop.core.model.CrashRecord;
import com.backstop.core.model.DiagnosticReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: backstop diagnose
 * <p>
 * Prints the diagnostic report: crash summary, recent records and recommendations.
 */
@Command(name = "diagnose", mixinStandardHelpOptions = true, description = "Print the diagnostic report")
@Component
public class DiagnoseCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Records to list (default: ${DEFAULT-VALUE})",
            defaultValue = "10")
    private int limit;

    private final ResilienceEngine engine;

    public DiagnoseCommand(ResilienceEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        DiagnosticReport report = engine.diagnosticReport();
        var summary = report.summary();
        var device = report.device();

        ConsoleOutput.info("Report v" + report.version() + " at " + report.timestamp());
        System.out.printf("  Device: %s %s (%s), Java %s, %d CPUs, %d/%d MB free%n",
                device.osName(), device.osVersion(), device.arch(), device.javaVersion(),
                device.availableProcessors(), device.freeMemoryMb(), device.totalMemoryMb());
        System.out.printf("  Crashes: %d retained, %d successful recoveries, %.1f attempts on average%n",
                summary.totalCrashes(), summary.successfulRecoveries(), summary.averageRecoveryAttempts());
        if (summary.mostCommonClassification() != null) {
            System.out.println("  Most common: " + summary.mostCommonClassification());
        }

        var records = report.recentRecords();
        if (!records.isEmpty()) {
            System.out.println();
            System.out.printf("  %-32s %-26s %-20s %s%n", "RECORD", "CLASSIFICATION", "COMPONENT", "MESSAGE");
            System.out.println("  " + "-".repeat(96));
            for (CrashRecord r : records.subList(0, Math.min(limit, records.size()))) {
                System.out.printf("  %-32s %-26s %-20s %s%n",
                        r.id(), r.classification(), truncate(r.componentId(), 20), truncate(r.message(), 40));
            }
        }

        ConsoleOutput.separator();
        report.recommendations().forEach(ConsoleOutput::info);
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
