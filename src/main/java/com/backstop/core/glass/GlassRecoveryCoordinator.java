package com.backstop.core.glass;

import com.backstop.core.config.RecoveryProperties;
import com.backstop.core.model.Renderable;
import com.backstop.core.recovery.AbstractRecoveryCoordinator;
import com.backstop.core.recovery.RecoveryCollaborators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Recovery coordinator for glass components.
 * <p>
 * Besides per-component tiers it keeps one subsystem-wide effects tier, initialised from
 * validation on first use and lowered by {@link #degradeEffects()}. Host code styles every
 * glass surface from {@link #currentStyle()}.
 */
@Service
public class GlassRecoveryCoordinator extends AbstractRecoveryCoordinator<GlassTier> {

    private static final Logger log = LoggerFactory.getLogger(GlassRecoveryCoordinator.class);

    public static final String DOMAIN = "glass";

    private final GlassResourceValidator validator;
    private final AtomicReference<GlassTier> effectsTier = new AtomicReference<>();

    public GlassRecoveryCoordinator(RecoveryCollaborators collaborators,
                                    RecoveryProperties properties,
                                    GlassResourceValidator validator) {
        super(DOMAIN, GlassTier.class, collaborators,
                properties.getGlassMaxRetryAttempts(), Duration.ofMillis(properties.getRetryDelayMs()));
        this.validator = validator;
    }

    @Override
    protected Renderable fallbackFor(String componentId, GlassTier tier) {
        return GlassFallbackCatalog.fallbackFor(componentId, tier);
    }

    @Override
    protected Optional<GlassTier> recoveryCeiling() {
        return Optional.of(validator.validateAll().recommendedTier());
    }

    /**
     * A retry of a glass component first drops the effects one level.
     */
    @Override
    protected void onRetry(String componentId, GlassTier tier) {
        degradeEffects();
    }

    @Override
    protected void afterSystemRecovery(Optional<GlassTier> ceiling) {
        ceiling.ifPresent(target -> {
            GlassTier previous = effectsTier.getAndUpdate(
                    current -> current == null || ladder.better(target, current) ? target : current);
            if (previous != null && ladder.better(target, previous)) {
                log.info("Glass effects raised from {} to {}", previous, target);
            }
        });
    }

    public GlassTier effectsTier() {
        GlassTier tier = effectsTier.get();
        if (tier != null) {
            return tier;
        }
        GlassTier validated = validator.validateAll().recommendedTier();
        return effectsTier.compareAndSet(null, validated) ? validated : effectsTier.get();
    }

    /**
     * Lowers the subsystem effects tier one level; idempotent at {@link GlassTier#NONE}.
     */
    public GlassTier degradeEffects() {
        GlassTier previous = effectsTier();
        GlassTier next = effectsTier.updateAndGet(ladder::degrade);
        if (next != previous) {
            log.warn("Glass effects degraded from {} to {}", previous, next);
            collaborators.ledger().updateComponentState("GlassEffects", next.name(),
                    Map.of("previousLevel", previous.name(), "reason", "error_recovery"));
            collaborators.metrics().recordTierChange(DOMAIN + ".effects", previous.name(), next.name());
        }
        return next;
    }

    public GlassStyle currentStyle() {
        return GlassStyle.forTier(effectsTier());
    }

    public boolean effectsAvailable() {
        return effectsTier() != GlassTier.NONE;
    }
}
