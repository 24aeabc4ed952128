package com.backstop.core.engine;

import com.backstop.core.diagnostics.DiagnosticLedger;
import com.backstop.core.events.BackstopEvent;
import com.backstop.core.events.EventBus;
import com.backstop.core.glass.DomainValidationReport;
import com.backstop.core.glass.GlassRecoveryCoordinator;
import com.backstop.core.glass.GlassResourceValidator;
import com.backstop.core.glass.GlassStyle;
import com.backstop.core.health.SystemHealth;
import com.backstop.core.health.SystemHealthAggregator;
import com.backstop.core.health.SystemTier;
import com.backstop.core.model.DiagnosticReport;
import com.backstop.core.model.HealthBucket;
import com.backstop.core.model.Renderable;
import com.backstop.core.model.ResourceDescriptor;
import com.backstop.core.model.ValidationReport;
import com.backstop.core.recovery.AbstractRecoveryCoordinator;
import com.backstop.core.recovery.ComponentRecoveryCoordinator;
import com.backstop.core.recovery.RetryCallback;
import com.backstop.core.resource.ResourceCatalogValidator;
import com.backstop.core.resource.UiResource;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Facade the host talks to. Routes failures to the coordinator of their domain, keeps
 * the system tier current as component tiers change and owns the scope lifecycle.
 */
@Service
public class ResilienceEngine {

    private static final Logger log = LoggerFactory.getLogger(ResilienceEngine.class);

    static final String SYSTEM_COMPONENT = "FallbackSystem";

    private static final Set<String> TIER_EVENTS =
            Set.of(BackstopEvent.COMPONENT_DEGRADED, BackstopEvent.COMPONENT_RECOVERED);

    private final ComponentRecoveryCoordinator componentCoordinator;
    private final GlassRecoveryCoordinator glassCoordinator;
    private final ResourceCatalogValidator resourceValidator;
    private final GlassResourceValidator glassValidator;
    private final DiagnosticLedger ledger;
    private final SystemHealthAggregator aggregator;
    private final EventBus eventBus;

    private final AtomicReference<SystemTier> systemTier = new AtomicReference<>(SystemTier.NORMAL);
    private volatile EventBus.Subscription subscription;

    public ResilienceEngine(ComponentRecoveryCoordinator componentCoordinator,
                            GlassRecoveryCoordinator glassCoordinator,
                            ResourceCatalogValidator resourceValidator,
                            GlassResourceValidator glassValidator,
                            DiagnosticLedger ledger,
                            SystemHealthAggregator aggregator,
                            EventBus eventBus) {
        this.componentCoordinator = componentCoordinator;
        this.glassCoordinator = glassCoordinator;
        this.resourceValidator = resourceValidator;
        this.glassValidator = glassValidator;
        this.ledger = ledger;
        this.aggregator = aggregator;
        this.eventBus = eventBus;
    }

    @PostConstruct
    void subscribe() {
        subscription = eventBus.subscribe(TIER_EVENTS, this::onTierEvent);
    }

    /**
     * Pre-flight: validates both catalogs, derives the starting system tier and
     * initialises the glass effects tier.
     */
    public InitializationResult initialize() {
        ValidationReport resources = resourceValidator.validate(UiResource.CATALOG);
        DomainValidationReport glass = glassValidator.validateAll();
        SystemTier initial = aggregator.initialTier(resources.missingCount() + glass.totalMissing());
        GlassStyle style = GlassStyle.forTier(glassCoordinator.effectsTier());

        systemTier.set(initial);
        ledger.updateComponentState(SYSTEM_COMPONENT, initial.name(), Map.of(
                "recommendedAction", resources.recommendedAction().name(),
                "missingResources", resources.missingCount(),
                "glassTier", glass.recommendedTier().name()));
        log.info("Pre-flight complete: {} UI resources missing ({}), glass tier {}, starting at {}",
                resources.missingCount(), resources.recommendedAction(), glass.recommendedTier(), initial);
        return new InitializationResult(resources, glass, initial, style);
    }

    public Renderable onFailure(String componentId, Throwable error, RetryCallback retryCallback) {
        return componentCoordinator.onFailure(componentId, error, retryCallback);
    }

    public Renderable onGlassFailure(String componentId, Throwable error, RetryCallback retryCallback) {
        return glassCoordinator.onFailure(componentId, error, retryCallback);
    }

    public ValidationReport validate() {
        return resourceValidator.validate(UiResource.CATALOG);
    }

    public ValidationReport validate(List<ResourceDescriptor> descriptors) {
        return resourceValidator.validate(descriptors);
    }

    public DomainValidationReport validateAll() {
        return glassValidator.validateAll();
    }

    public SystemHealth systemStatus() {
        var components = new LinkedHashMap<String, HealthBucket>();
        addBuckets(components, componentCoordinator);
        addBuckets(components, glassCoordinator);
        return aggregator.aggregate(components);
    }

    public DiagnosticReport diagnosticReport() {
        return ledger.report();
    }

    /**
     * Re-validates and raises recoverable components in both domains. Never lowers
     * system health.
     */
    public SystemHealth attemptSystemRecovery() {
        SystemHealth before = systemStatus();
        try {
            int raised = componentCoordinator.attemptSystemRecovery() + glassCoordinator.attemptSystemRecovery();
            eventBus.publish(BackstopEvent.of(BackstopEvent.SYSTEM_RECOVERY, null, Map.of("raised", raised)));
        } catch (Exception e) {
            log.error("System recovery failed: {}", e.getMessage(), e);
        }
        SystemHealth after = systemStatus();
        log.info("System recovery: health {}% -> {}%", format(before.healthPercentage()), format(after.healthPercentage()));
        return after;
    }

    public void track(String componentId, boolean glass) {
        if (glass) {
            glassCoordinator.track(componentId);
        } else {
            componentCoordinator.track(componentId);
        }
    }

    /**
     * Marks a component healthy again in whichever domain tracks it.
     *
     * @return false when no domain tracks {@code componentId}
     */
    public boolean markRecovered(String componentId) {
        boolean found = false;
        if (componentCoordinator.state(componentId).isPresent()) {
            componentCoordinator.markRecovered(componentId);
            found = true;
        }
        if (glassCoordinator.state(componentId).isPresent()) {
            glassCoordinator.markRecovered(componentId);
            found = true;
        }
        return found;
    }

    public SystemTier currentTier() {
        return systemTier.get();
    }

    public GlassStyle glassStyle() {
        return glassCoordinator.currentStyle();
    }

    public Map<String, Object> recoveryStatistics() {
        var stats = new LinkedHashMap<String, Object>();
        stats.put(componentCoordinator.domain(), componentCoordinator.recoveryStatistics());
        stats.put(glassCoordinator.domain(), glassCoordinator.recoveryStatistics());
        stats.put("systemTier", systemTier.get().name());
        stats.put("glassEffectsTier", glassCoordinator.effectsTier().name());
        return stats;
    }

    /**
     * Ends the scope: coordinators stop, pending retries are cancelled and the ledger is
     * cleared.
     */
    @PreDestroy
    public void teardown() {
        EventBus.Subscription current = subscription;
        if (current != null) {
            current.unsubscribe();
            subscription = null;
        }
        componentCoordinator.teardown();
        glassCoordinator.teardown();
        ledger.teardown();
        log.info("Resilience engine torn down");
    }

    private void onTierEvent(BackstopEvent event) {
        SystemHealth health = systemStatus();
        SystemTier previous = systemTier.getAndSet(health.tier());
        if (previous == health.tier()) {
            return;
        }
        if (health.tier().ordinal() > previous.ordinal()) {
            log.warn("System tier changed from {} to {} ({} of {} components normal)",
                    previous, health.tier(), health.normal(), health.total());
        } else {
            log.info("System tier changed from {} to {}", previous, health.tier());
        }
        ledger.updateComponentState(SYSTEM_COMPONENT, health.tier().name(), Map.of(
                "previousTier", previous.name(),
                "healthPercentage", health.healthPercentage(),
                "components", health.total()));
        eventBus.publish(BackstopEvent.of(BackstopEvent.SYSTEM_TIER_CHANGED, null,
                Map.of("from", previous.name(), "to", health.tier().name())));
    }

    private static void addBuckets(Map<String, HealthBucket> target, AbstractRecoveryCoordinator<?> coordinator) {
        coordinator.healthBuckets().forEach((id, bucket) -> target.put(coordinator.domain() + "/" + id, bucket));
    }

    private static String format(double percentage) {
        return String.format("%.1f", percentage);
    }
}
