package com.backstop.core.recovery;

import com.backstop.core.config.RecoveryProperties;
import com.backstop.core.glass.GlassRecoveryCoordinator;
import com.backstop.core.model.Renderable;
import com.backstop.core.model.ValidationReport;
import com.backstop.core.resource.ResourceCatalogValidator;
import com.backstop.core.resource.UiResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Recovery coordinator for the generic UI components (toggles, cards, settings screen).
 * Re-validation runs against the {@link UiResource} catalog.
 */
@Service
public class ComponentRecoveryCoordinator extends AbstractRecoveryCoordinator<ComponentTier> {

    private static final Logger log = LoggerFactory.getLogger(ComponentRecoveryCoordinator.class);

    public static final String DOMAIN = "component";

    private final ResourceCatalogValidator resourceValidator;
    private final GlassRecoveryCoordinator glassCoordinator;

    public ComponentRecoveryCoordinator(RecoveryCollaborators collaborators,
                                        RecoveryProperties properties,
                                        ResourceCatalogValidator resourceValidator,
                                        GlassRecoveryCoordinator glassCoordinator) {
        super(DOMAIN, ComponentTier.class, collaborators,
                properties.getMaxRetryAttempts(), Duration.ofMillis(properties.getRetryDelayMs()));
        this.resourceValidator = resourceValidator;
        this.glassCoordinator = glassCoordinator;
    }

    @Override
    protected Renderable fallbackFor(String componentId, ComponentTier tier) {
        return ComponentFallbackCatalog.fallbackFor(componentId, tier);
    }

    @Override
    protected Optional<ComponentTier> recoveryCeiling() {
        ValidationReport report = resourceValidator.validate(UiResource.CATALOG);
        return ceilingFor(report);
    }

    static Optional<ComponentTier> ceilingFor(ValidationReport report) {
        return switch (report.recommendedAction()) {
            case PROCEED_NORMAL -> Optional.of(ComponentTier.NORMAL);
            case USE_FALLBACK_UI -> Optional.of(ComponentTier.REDUCED);
            case USE_EMERGENCY_UI -> Optional.of(ComponentTier.EMERGENCY);
            case ABORT -> Optional.empty();
        };
    }

    /**
     * Glass-backed components retrying at the reduced tier also lower the shared glass
     * effects tier so the retry does not hit the same effect again.
     */
    @Override
    protected void onRetry(String componentId, ComponentTier tier) {
        if (tier == ComponentTier.REDUCED && ComponentKind.fromComponentId(componentId).isGlass()) {
            log.debug("Lowering glass effects before retrying {}", componentId);
            glassCoordinator.degradeEffects();
        }
    }
}
