package com.backstop.dispatch.cli;

import com.backstop.core.engine.ResilienceEngine;
import com.backstop.core.health.SystemHealth;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: backstop status
 * <p>
 * Shows the system tier and, with {@code --recover}, runs a system recovery first.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show system tier and component health")
@Component
public class StatusCommand implements Runnable {

    @Option(names = {"--recover", "-r"}, description = "Attempt system recovery before reporting")
    private boolean recover;

    private final ResilienceEngine engine;

    public StatusCommand(ResilienceEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var init = engine.initialize();
        ConsoleOutput.info("Pre-flight tier: " + init.initialTier()
                + " (resources: " + init.resources().recommendedAction()
                + ", glass: " + init.glass().recommendedTier() + ")");

        SystemHealth health = recover ? engine.attemptSystemRecovery() : engine.systemStatus();
        ConsoleOutput.tier(health.tier(), health.healthPercentage());
        System.out.printf("  Components: %d total, %d normal, %d degraded, %d failed%n",
                health.total(), health.normal(), health.degraded(), health.failed());
        health.components().forEach(ConsoleOutput::component);

        var style = engine.glassStyle();
        ConsoleOutput.info(String.format("Glass style: blur=%s shadows=%s alpha=%.1f",
                style.blurEnabled(), style.shadowsEnabled(), style.backgroundAlpha()));
    }
}
