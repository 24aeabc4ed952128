package com.backstop.core.engine;

import com.backstop.core.glass.DomainValidationReport;
import com.backstop.core.glass.GlassStyle;
import com.backstop.core.health.SystemTier;
import com.backstop.core.model.ValidationReport;

/**
 * Outcome of the pre-flight check run before the host builds its UI.
 *
 * @param resources   validation of the general UI catalog
 * @param glass       validation of the glass catalog
 * @param initialTier system tier to start in, from the total missing count
 * @param glassStyle  style glass surfaces should start with
 */
public record InitializationResult(
    ValidationReport resources,
    DomainValidationReport glass,
    SystemTier initialTier,
    GlassStyle glassStyle
) {}
