package com.backstop.core.transaction;

import org.springframework.stereotype.Component;

/**
 * Decides whether a structural UI mutation can be committed in a given host state.
 */
@Component
public class TransactionSafetyGate {

    public CommitSafety canCommit(EnvironmentState state) {
        return evaluate(state).safety();
    }

    public TransactionVerdict evaluate(EnvironmentState state) {
        if (state == null) {
            return new TransactionVerdict(CommitSafety.UNSAFE, "Host state unavailable");
        }
        if (state.hostFinishing()) {
            return new TransactionVerdict(CommitSafety.UNSAFE, "Host is finishing");
        }
        if (state.hostDestroyed()) {
            return new TransactionVerdict(CommitSafety.UNSAFE, "Host is destroyed");
        }
        if (state.mutationManagerDestroyed()) {
            return new TransactionVerdict(CommitSafety.UNSAFE, "Mutation manager is destroyed");
        }
        if (state.stateSaved()) {
            return new TransactionVerdict(CommitSafety.ALLOW_LOSSY_COMMIT, "Host state already saved");
        }
        return new TransactionVerdict(CommitSafety.SAFE, "Host active");
    }
}
