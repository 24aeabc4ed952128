package com.backstop.core.recovery;

import com.backstop.core.events.BackstopEvent;
import com.backstop.core.logging.MdcContext;
import com.backstop.core.model.DegradationTier;
import com.backstop.core.model.HealthBucket;
import com.backstop.core.model.Renderable;
import com.backstop.core.scheduler.MainThreadDispatcher.Cancellable;
import com.backstop.core.transaction.CommitSafety;
import com.backstop.core.transaction.TransactionVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-component degradation state machine shared by every tier domain.
 * <p>
 * Each failure moves the component one tier down (the bottom tier is absorbing), records
 * the failure in the ledger and then either runs the retry strategy chosen for the
 * failure kind or returns the deterministic fallback for the new tier. Retries are bounded
 * by {@code maxRetryAttempts} per component until an explicit recovery resets the count.
 * <p>
 * Entry points never throw; the worst case is an inert {@link Renderable#unavailable}.
 *
 * @param <T> the domain's tier enum, best tier first
 */
public abstract class AbstractRecoveryCoordinator<T extends Enum<T> & DegradationTier> {

    private static final Logger log = LoggerFactory.getLogger(AbstractRecoveryCoordinator.class);

    private static final String UNSAFE_MESSAGE = "Update postponed: the screen is closing";

    protected final TierLadder<T> ladder;
    protected final RecoveryCollaborators collaborators;

    private final String domain;
    private final Class<T> tierType;
    private final int maxRetryAttempts;
    private final Duration retryDelay;

    private final ConcurrentHashMap<String, ComponentState<T>> states = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> retryCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Cancellable> pendingRetries = new ConcurrentHashMap<>();
    private final AtomicBoolean destroyed = new AtomicBoolean(false);

    protected AbstractRecoveryCoordinator(String domain,
                                          Class<T> tierType,
                                          RecoveryCollaborators collaborators,
                                          int maxRetryAttempts,
                                          Duration retryDelay) {
        this.domain = domain;
        this.tierType = tierType;
        this.ladder = new TierLadder<>(tierType);
        this.collaborators = collaborators;
        this.maxRetryAttempts = maxRetryAttempts;
        this.retryDelay = retryDelay;
    }

    /**
     * Deterministic replacement for {@code componentId} at {@code tier}. Never null.
     */
    protected abstract Renderable fallbackFor(String componentId, T tier);

    /**
     * Best tier current conditions justify, or empty when re-validation gives no basis
     * for raising any component.
     */
    protected abstract Optional<T> recoveryCeiling();

    /**
     * Called before a retry strategy runs for a component now at {@code tier}.
     */
    protected void onRetry(String componentId, T tier) {
    }

    protected void afterSystemRecovery(Optional<T> ceiling) {
    }

    public String domain() {
        return domain;
    }

    /**
     * Handles a component failure and returns what the host should show instead.
     *
     * @param componentId   the failing component
     * @param error         what it threw
     * @param retryCallback optional attempt to rebuild the live component
     */
    public Renderable onFailure(String componentId, Throwable error, RetryCallback retryCallback) {
        if (destroyed.get()) {
            log.debug("[{}] Ignoring failure of {} after teardown", domain, componentId);
            return Renderable.unavailable(componentId);
        }
        MdcContext.setComponent(domain, componentId);
        try {
            var collab = collaborators;
            String recordId = collab.ledger().recordFailure(error, domain + ".onFailure", componentId);
            FailureKind kind = collab.classifier().classifyKind(error);
            collab.metrics().recordFailure(domain, kind.name());

            AtomicInteger counter = retryCounters.computeIfAbsent(componentId, k -> new AtomicInteger());
            Instant now = collab.clock().instant();
            var previous = new AtomicReference<T>();
            ComponentState<T> state = states.compute(componentId, (id, current) -> {
                ComponentState<T> base = current != null ? current : ComponentState.initial(id, ladder, now);
                previous.set(base.tier());
                return base.withTier(ladder.degrade(base.tier()), messageOf(error), counter.incrementAndGet(),
                        ladder, now);
            });
            int attempt = state.retryCount();
            publishState(state, previous.get());

            TransactionVerdict verdict = collab.gate().evaluate(collab.host().environmentState());
            if (verdict.safety() == CommitSafety.UNSAFE) {
                log.warn("[{}] Not mutating UI for {}: {}", domain, componentId, verdict.reason());
                collab.ledger().recordRecoveryAttempt(recordId, "ABORT_UNSAFE_TRANSACTION", false, verdict.reason());
                return Renderable.statusMessage(componentId, UNSAFE_MESSAGE);
            }

            RetryStrategy strategy = kind.strategy();
            if (attempt <= maxRetryAttempts && retryCallback != null && strategy != RetryStrategy.ABORT) {
                log.info("[{}] Retrying {} with {} (attempt {}/{})",
                        domain, componentId, strategy, attempt, maxRetryAttempts);
                onRetry(componentId, state.tier());
                Optional<Renderable> retried = runStrategy(componentId, recordId, strategy, retryCallback);
                if (retried.isPresent()) {
                    return retried.get();
                }
            }

            Renderable fallback = fallbackFor(componentId, state.tier());
            if (verdict.safety() == CommitSafety.ALLOW_LOSSY_COMMIT) {
                fallback = fallback.withAttribute(Renderable.COMMIT_MODE, Renderable.COMMIT_LOSSY);
            }
            collab.ledger().recordRecoveryAttempt(recordId, "FALLBACK_" + state.tier().name(), true, fallback.label());
            collab.metrics().recordFallback(domain, state.tier().name());
            log.info("[{}] Using {} fallback for {}", domain, state.tier(), componentId);
            return fallback;
        } catch (Throwable t) {
            log.error("[{}] Recovery failed for {}: {}", domain, componentId, t.getMessage(), t);
            return Renderable.unavailable(componentId);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Registers a component at the top tier if it is not tracked yet.
     */
    public ComponentState<T> track(String componentId) {
        ComponentState<T> state = states.computeIfAbsent(componentId,
                id -> ComponentState.initial(id, ladder, collaborators.clock().instant()));
        retryCounters.computeIfAbsent(componentId, k -> new AtomicInteger());
        collaborators.ledger().updateComponentState(componentId, state.tier().name(), details(state));
        return state;
    }

    /**
     * Explicit success: the component is back at the top tier with its counter reset.
     */
    public void markRecovered(String componentId) {
        if (destroyed.get()) {
            return;
        }
        retryCounters.computeIfAbsent(componentId, k -> new AtomicInteger()).set(0);
        var previous = new AtomicReference<T>();
        ComponentState<T> state = states.compute(componentId, (id, current) -> {
            previous.set(current != null ? current.tier() : ladder.top());
            return ComponentState.initial(id, ladder, collaborators.clock().instant());
        });
        collaborators.ledger().updateComponentState(componentId, state.tier().name(), details(state));
        if (previous.get() != state.tier()) {
            log.info("[{}] Component {} recovered from {}", domain, componentId, previous.get());
            collaborators.metrics().recordTierChange(domain, previous.get().name(), state.tier().name());
            collaborators.eventBus().publish(BackstopEvent.of(BackstopEvent.COMPONENT_RECOVERED, componentId,
                    Map.of("domain", domain, "from", previous.get().name(), "to", state.tier().name())));
        }
    }

    /**
     * Raises every recoverable component to the tier re-validation justifies and resets
     * its counter. Never lowers a tier.
     *
     * @return number of components moved to a better tier
     */
    public int attemptSystemRecovery() {
        if (destroyed.get()) {
            return 0;
        }
        Optional<T> ceiling = recoveryCeiling();
        Instant now = collaborators.clock().instant();
        int raised = 0;
        for (String componentId : states.keySet()) {
            var previous = new AtomicReference<T>();
            ComponentState<T> state = states.computeIfPresent(componentId, (id, current) -> {
                previous.set(current.tier());
                if (!current.recoverable()) {
                    return current;
                }
                retryCounters.computeIfAbsent(id, k -> new AtomicInteger()).set(0);
                T target = ceiling.filter(c -> ladder.better(c, current.tier())).orElse(current.tier());
                return current.withTier(target, current.lastError(), 0, ladder, now);
            });
            if (state != null && state.tier() != previous.get()) {
                raised++;
                publishState(state, previous.get());
            }
        }
        afterSystemRecovery(ceiling);
        collaborators.metrics().recordSystemRecovery(raised);
        log.info("[{}] System recovery raised {} component(s), ceiling {}",
                domain, raised, ceiling.map(Enum::name).orElse("unchanged"));
        return raised;
    }

    public Map<String, ComponentState<T>> states() {
        return Map.copyOf(states);
    }

    public Optional<ComponentState<T>> state(String componentId) {
        return Optional.ofNullable(states.get(componentId));
    }

    public T currentTier(String componentId) {
        ComponentState<T> state = states.get(componentId);
        return state != null ? state.tier() : ladder.top();
    }

    public int retryCount(String componentId) {
        AtomicInteger counter = retryCounters.get(componentId);
        return counter != null ? counter.get() : 0;
    }

    public Map<String, HealthBucket> healthBuckets() {
        var buckets = new LinkedHashMap<String, HealthBucket>();
        states.forEach((id, state) -> buckets.put(id, state.tier().bucket()));
        return buckets;
    }

    public Map<String, Object> recoveryStatistics() {
        var perTier = new EnumMap<T, Long>(tierType);
        for (T tier : tierType.getEnumConstants()) {
            perTier.put(tier, 0L);
        }
        states.values().forEach(s -> perTier.merge(s.tier(), 1L, Long::sum));

        var stats = new LinkedHashMap<String, Object>();
        stats.put("domain", domain);
        stats.put("totalComponents", states.size());
        stats.put("componentsByTier", perTier);
        stats.put("totalRetries", retryCounters.values().stream().mapToInt(AtomicInteger::get).sum());
        stats.put("recoverableComponents", states.values().stream().filter(ComponentState::recoverable).count());
        stats.put("pendingRetries", pendingRetries.size());
        stats.put("maxRetryAttempts", maxRetryAttempts);
        return stats;
    }

    public boolean isDestroyed() {
        return destroyed.get();
    }

    /**
     * Stops all activity: pending retries are cancelled and delayed retries that still
     * fire become no-ops.
     */
    public void teardown() {
        if (!destroyed.compareAndSet(false, true)) {
            return;
        }
        pendingRetries.values().forEach(Cancellable::cancel);
        pendingRetries.clear();
        states.clear();
        retryCounters.clear();
        log.info("[{}] Recovery coordinator torn down", domain);
    }

    private Optional<Renderable> runStrategy(String componentId, String recordId,
                                             RetryStrategy strategy, RetryCallback callback) {
        return switch (strategy) {
            case RETRY_ALLOWING_STATE_LOSS -> retryNow(componentId, recordId, callback);
            case RETRY_AFTER_DELAY -> {
                scheduleRetry(componentId, recordId, callback);
                yield Optional.empty();
            }
            case FORCE_CLEANUP -> {
                forceCleanup(componentId, recordId);
                yield Optional.empty();
            }
            case ABORT -> Optional.empty();
        };
    }

    private Optional<Renderable> retryNow(String componentId, String recordId, RetryCallback callback) {
        String strategy = RetryStrategy.RETRY_ALLOWING_STATE_LOSS.name();
        try {
            Optional<Renderable> result = callback.attempt();
            collaborators.ledger().recordRecoveryAttempt(recordId, strategy, result.isPresent(),
                    result.isPresent() ? null : "Retry produced no component");
            collaborators.metrics().recordRetry(strategy, result.isPresent());
            return result.map(r -> r.withAttribute(Renderable.COMMIT_MODE, Renderable.COMMIT_LOSSY));
        } catch (Throwable t) {
            log.warn("[{}] Retry of {} failed: {}", domain, componentId, describe(t), t);
            collaborators.ledger().recordRecoveryAttempt(recordId, strategy, false, describe(t));
            collaborators.metrics().recordRetry(strategy, false);
            return Optional.empty();
        }
    }

    private void scheduleRetry(String componentId, String recordId, RetryCallback callback) {
        var pending = new PendingRetry();
        Cancellable replaced = pendingRetries.put(componentId, pending);
        if (replaced != null) {
            replaced.cancel();
        }
        pending.attach(collaborators.dispatcher().postDelayed(
                () -> runDelayedRetry(componentId, recordId, callback, pending), retryDelay));
        log.debug("[{}] Scheduled retry of {} in {} ms", domain, componentId, retryDelay.toMillis());
    }

    private void runDelayedRetry(String componentId, String recordId, RetryCallback callback, PendingRetry self) {
        pendingRetries.remove(componentId, self);
        if (destroyed.get()) {
            log.debug("[{}] Delayed retry of {} skipped after teardown", domain, componentId);
            return;
        }
        String strategy = RetryStrategy.RETRY_AFTER_DELAY.name();
        try {
            Optional<Renderable> result = callback.attempt();
            collaborators.ledger().recordRecoveryAttempt(recordId, strategy, result.isPresent(),
                    result.isPresent() ? null : "Delayed retry produced no component");
            collaborators.metrics().recordRetry(strategy, result.isPresent());
            result.ifPresent(renderable -> {
                log.info("[{}] Delayed retry of {} succeeded", domain, componentId);
                collaborators.eventBus().publish(BackstopEvent.of(BackstopEvent.COMPONENT_RECOVERED, componentId,
                        Map.of("domain", domain, "strategy", strategy, "renderable", renderable)));
            });
        } catch (Throwable t) {
            log.warn("[{}] Delayed retry of {} failed: {}", domain, componentId, describe(t), t);
            collaborators.ledger().recordRecoveryAttempt(recordId, strategy, false, describe(t));
            collaborators.metrics().recordRetry(strategy, false);
        }
    }

    private void forceCleanup(String componentId, String recordId) {
        Cancellable pending = pendingRetries.remove(componentId);
        if (pending != null) {
            pending.cancel();
        }
        String strategy = RetryStrategy.FORCE_CLEANUP.name();
        try {
            collaborators.host().forceCleanup(componentId);
            collaborators.ledger().recordRecoveryAttempt(recordId, strategy, false, "Host cleanup requested");
        } catch (Throwable t) {
            log.warn("[{}] Host cleanup of {} failed: {}", domain, componentId, describe(t));
            collaborators.ledger().recordRecoveryAttempt(recordId, strategy, false, describe(t));
        }
        collaborators.metrics().recordRetry(strategy, false);
    }

    private void publishState(ComponentState<T> state, T previous) {
        collaborators.ledger().updateComponentState(state.componentId(), state.tier().name(), details(state));
        if (previous == state.tier()) {
            return;
        }
        boolean degraded = state.tier().ordinal() > previous.ordinal();
        if (degraded) {
            log.warn("[{}] Component {} degraded from {} to {}", domain, state.componentId(), previous, state.tier());
        } else {
            log.info("[{}] Component {} raised from {} to {}", domain, state.componentId(), previous, state.tier());
        }
        collaborators.metrics().recordTierChange(domain, previous.name(), state.tier().name());
        collaborators.eventBus().publish(BackstopEvent.of(
                degraded ? BackstopEvent.COMPONENT_DEGRADED : BackstopEvent.COMPONENT_RECOVERED,
                state.componentId(),
                Map.of("domain", domain, "from", previous.name(), "to", state.tier().name(),
                        "retryCount", state.retryCount())));
    }

    private Map<String, Object> details(ComponentState<T> state) {
        return Map.of(
                "domain", domain,
                "retryCount", state.retryCount(),
                "recoverable", state.recoverable(),
                "lastError", state.lastError() != null ? state.lastError() : "none",
                "updatedAt", state.timestamp() != null ? state.timestamp() : Instant.EPOCH);
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static String describe(Throwable t) {
        return t.getClass().getSimpleName() + ": " + messageOf(t);
    }

    /**
     * Registered in {@code pendingRetries} before the task is posted, so a task that fires
     * immediately still finds and removes its own entry.
     */
    private static final class PendingRetry implements Cancellable {
        private volatile Cancellable delegate;
        private volatile boolean cancelled;

        void attach(Cancellable handle) {
            delegate = handle;
            if (cancelled) {
                handle.cancel();
            }
        }

        @Override
        public void cancel() {
            cancelled = true;
            Cancellable current = delegate;
            if (current != null) {
                current.cancel();
            }
        }
    }
}
