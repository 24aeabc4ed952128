package com.backstop.core.transaction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ManagedHostEnvironmentTest {

    private final ManagedHostEnvironment host = new ManagedHostEnvironment();

    @Test
    @DisplayName("Starts ACTIVE and reports pushed state")
    void update() {
        assertEquals(EnvironmentState.ACTIVE, host.environmentState());

        var saved = new EnvironmentState(false, false, false, true);
        host.update(saved);

        assertEquals(saved, host.environmentState());
    }

    @Test
    @DisplayName("Cleanup requests are drained on read")
    void drain() {
        host.forceCleanup("SettingsFragment");
        host.forceCleanup("GlassDialog");

        assertEquals(Set.of("SettingsFragment", "GlassDialog"), host.drainCleanupRequests());
        assertTrue(host.drainCleanupRequests().isEmpty());
    }
}
