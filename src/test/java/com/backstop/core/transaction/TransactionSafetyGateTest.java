package com.backstop.core.transaction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransactionSafetyGateTest {

    private final TransactionSafetyGate gate = new TransactionSafetyGate();

    @Test
    @DisplayName("Active host is SAFE")
    void active() {
        assertEquals(CommitSafety.SAFE, gate.canCommit(EnvironmentState.ACTIVE));
    }

    @Test
    @DisplayName("Missing state is UNSAFE")
    void missingState() {
        var verdict = gate.evaluate(null);
        assertEquals(CommitSafety.UNSAFE, verdict.safety());
        assertEquals("Host state unavailable", verdict.reason());
    }

    @Test
    @DisplayName("Finishing, destroyed or lost mutation manager is UNSAFE")
    void unsafe() {
        assertEquals(CommitSafety.UNSAFE, gate.canCommit(new EnvironmentState(true, false, false, false)));
        assertEquals(CommitSafety.UNSAFE, gate.canCommit(new EnvironmentState(false, true, false, false)));
        assertEquals(CommitSafety.UNSAFE, gate.canCommit(new EnvironmentState(false, false, true, false)));
    }

    @Test
    @DisplayName("Saved state allows a lossy commit")
    void stateSaved() {
        var verdict = gate.evaluate(new EnvironmentState(false, false, false, true));
        assertEquals(CommitSafety.ALLOW_LOSSY_COMMIT, verdict.safety());
    }

    @Test
    @DisplayName("Unsafe conditions win over saved state")
    void unsafeWins() {
        assertEquals(CommitSafety.UNSAFE, gate.canCommit(new EnvironmentState(true, false, false, true)));
    }
}
