package com.backstop.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for failure handling and recovery.
 */
@Service
public class BackstopMetrics {

    private final MeterRegistry registry;

    public BackstopMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordFailure(String domain, String classification) {
        Counter.builder("backstop.failures.total")
                .tag("domain", domain)
                .tag("classification", classification)
                .register(registry)
                .increment();
    }

    /**
     * Records one retry-path invocation.
     *
     * @param strategy retry strategy that ran
     * @param success  whether it produced a live renderable
     */
    public void recordRetry(String strategy, boolean success) {
        Counter.builder("backstop.retries.total")
                .tag("strategy", strategy)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordFallback(String domain, String tier) {
        Counter.builder("backstop.fallbacks.total")
                .description("Fallback renderables handed back to the host")
                .tag("domain", domain)
                .tag("tier", tier)
                .register(registry)
                .increment();
    }

    public void recordTierChange(String domain, String from, String to) {
        Counter.builder("backstop.tier.changes")
                .tag("domain", domain)
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void recordEviction() {
        Counter.builder("backstop.ledger.evictions")
                .description("Crash records evicted to keep the ledger at its cap")
                .register(registry)
                .increment();
    }

    /**
     * Records a system recovery run.
     *
     * @param raised number of components moved to a better tier
     */
    public void recordSystemRecovery(int raised) {
        Counter.builder("backstop.recovery.runs")
                .register(registry)
                .increment();

        DistributionSummary.builder("backstop.recovery.raised_components")
                .description("Components raised per system recovery run")
                .register(registry)
                .record(raised);
    }

    public void recordValidationDuration(String domain, long ms) {
        Timer.builder("backstop.validation.duration")
                .tag("domain", domain)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
