package com.backstop.testsupport;

import com.backstop.core.config.RecoveryProperties;
import com.backstop.core.diagnostics.DeviceSnapshotCollector;
import com.backstop.core.diagnostics.DiagnosticLedger;
import com.backstop.core.diagnostics.DiagnosticsProperties;
import com.backstop.core.diagnostics.FailureClassifier;
import com.backstop.core.events.EventBus;
import com.backstop.core.glass.GlassRecoveryCoordinator;
import com.backstop.core.glass.GlassResourceValidator;
import com.backstop.core.metrics.BackstopMetrics;
import com.backstop.core.recovery.ComponentRecoveryCoordinator;
import com.backstop.core.recovery.RecoveryCollaborators;
import com.backstop.core.resource.ResourceCatalogValidator;
import com.backstop.core.transaction.ManagedHostEnvironment;
import com.backstop.core.transaction.TransactionSafetyGate;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Instant;

/**
 * Wires the engine's collaborators by hand with in-memory fakes: enrichment runs
 * inline, delayed work waits for {@link ManualDispatcher#runAll()}.
 */
public class EngineFixture {

    public final FakeResourceEnvironment resources = new FakeResourceEnvironment();
    public final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    public final ManualDispatcher dispatcher = new ManualDispatcher();
    public final ManagedHostEnvironment host = new ManagedHostEnvironment();
    public final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    public final BackstopMetrics metrics = new BackstopMetrics(registry);
    public final EventBus eventBus = new EventBus();
    public final DiagnosticsProperties diagnosticsProperties = new DiagnosticsProperties();
    public final RecoveryProperties recoveryProperties = new RecoveryProperties();

    public final ResourceCatalogValidator resourceValidator = new ResourceCatalogValidator(resources, clock);
    public final FailureClassifier classifier = new FailureClassifier(diagnosticsProperties);
    public final DiagnosticLedger ledger = new DiagnosticLedger(classifier, resourceValidator,
            new DeviceSnapshotCollector(), diagnosticsProperties, clock, Runnable::run, metrics);

    private boolean advancedEffects = true;

    public final GlassResourceValidator glassValidator =
            new GlassResourceValidator(resourceValidator, () -> advancedEffects, clock, metrics);

    public RecoveryCollaborators collaborators() {
        return new RecoveryCollaborators(ledger, classifier, new TransactionSafetyGate(), host,
                dispatcher, eventBus, metrics, clock);
    }

    public GlassRecoveryCoordinator glassCoordinator() {
        return new GlassRecoveryCoordinator(collaborators(), recoveryProperties, glassValidator);
    }

    public ComponentRecoveryCoordinator componentCoordinator(GlassRecoveryCoordinator glass) {
        return new ComponentRecoveryCoordinator(collaborators(), recoveryProperties, resourceValidator, glass);
    }

    public void setAdvancedEffects(boolean advancedEffects) {
        this.advancedEffects = advancedEffects;
    }
}
