package com.backstop.core.glass;

import com.backstop.core.model.Renderable;
import com.backstop.core.model.RenderableKind;
import com.backstop.testsupport.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GlassRecoveryCoordinatorTest {

    private EngineFixture fixture;
    private GlassRecoveryCoordinator coordinator;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        coordinator = fixture.glassCoordinator();
    }

    @Test
    @DisplayName("Effects tier starts from validation")
    void initialEffectsTier() {
        assertEquals(GlassTier.FULL, coordinator.effectsTier());
        assertTrue(coordinator.currentStyle().blurEnabled());
    }

    @Test
    @DisplayName("Effects tier starts REDUCED when the device lacks advanced effects")
    void initialWithoutCapability() {
        fixture.setAdvancedEffects(false);

        assertEquals(GlassTier.REDUCED, coordinator.effectsTier());
    }

    @Test
    @DisplayName("degradeEffects steps down once per call and stops at NONE")
    void degradeEffects() {
        assertEquals(GlassTier.REDUCED, coordinator.degradeEffects());
        assertEquals(GlassTier.MINIMAL, coordinator.degradeEffects());
        assertEquals(GlassTier.NONE, coordinator.degradeEffects());
        assertEquals(GlassTier.NONE, coordinator.degradeEffects());
        assertFalse(coordinator.effectsAvailable());

        var snapshot = fixture.ledger.componentStates().stream()
                .filter(s -> s.componentId().equals("GlassEffects"))
                .findFirst()
                .orElseThrow();
        assertEquals("NONE", snapshot.state());
    }

    @Test
    @DisplayName("Failures walk a glass component down to NONE")
    void failuresDegradeComponent() {
        var error = new RuntimeException("blur shader unavailable");

        var first = coordinator.onFailure("GlassCard", error, null);
        assertEquals(GlassTier.REDUCED, coordinator.currentTier("GlassCard"));
        assertEquals(RenderableKind.FALLBACK, first.kind());

        coordinator.onFailure("GlassCard", error, null);
        var third = coordinator.onFailure("GlassCard", error, null);

        assertEquals(GlassTier.NONE, coordinator.currentTier("GlassCard"));
        assertEquals(RenderableKind.PLACEHOLDER, third.kind());
        assertFalse(coordinator.state("GlassCard").orElseThrow().recoverable());
    }

    @Test
    @DisplayName("A retry first lowers the shared effects tier")
    void retryLowersEffects() {
        var live = Renderable.live("GlassDialog", "GlassDialog", Map.of());

        var result = coordinator.onFailure("GlassDialog",
                new IllegalStateException("Can not perform this action after onSaveInstanceState"),
                () -> Optional.of(live));

        assertEquals(RenderableKind.LIVE, result.kind());
        assertEquals(GlassTier.REDUCED, coordinator.effectsTier());
    }

    @Test
    @DisplayName("System recovery raises effects back to the validated tier")
    void systemRecoveryRaisesEffects() {
        coordinator.degradeEffects();
        coordinator.degradeEffects();
        coordinator.onFailure("GlassCard", new RuntimeException("x"), null);

        int raised = coordinator.attemptSystemRecovery();

        assertEquals(1, raised);
        assertEquals(GlassTier.FULL, coordinator.currentTier("GlassCard"));
        assertEquals(GlassTier.FULL, coordinator.effectsTier());
    }
}
