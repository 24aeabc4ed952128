package com.backstop.core.recovery;

import com.backstop.core.diagnostics.DiagnosticLedger;
import com.backstop.core.diagnostics.FailureClassifier;
import com.backstop.core.events.EventBus;
import com.backstop.core.metrics.BackstopMetrics;
import com.backstop.core.scheduler.MainThreadDispatcher;
import com.backstop.core.transaction.HostEnvironment;
import com.backstop.core.transaction.TransactionSafetyGate;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Services every recovery coordinator shares, whatever its tier domain.
 */
@Component
public record RecoveryCollaborators(
    DiagnosticLedger ledger,
    FailureClassifier classifier,
    TransactionSafetyGate gate,
    HostEnvironment host,
    MainThreadDispatcher dispatcher,
    EventBus eventBus,
    BackstopMetrics metrics,
    Clock clock
) {}
