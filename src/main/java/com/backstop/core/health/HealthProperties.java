package com.backstop.core.health;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Ratio thresholds for the system tier. Each is compared with "strictly greater than".
 */
@Component
@ConfigurationProperties(prefix = "backstop.health")
public class HealthProperties {

    /** Failed fraction above which the system is CRITICAL. */
    private double criticalRatio = 0.5;

    /** Failed plus near-failed fraction above which the system is EMERGENCY. */
    private double emergencyRatio = 0.3;

    /** Degraded-or-worse fraction above which the system is DEGRADED. */
    private double degradedRatio = 0.1;

    public double getCriticalRatio() { return criticalRatio; }
    public void setCriticalRatio(double criticalRatio) { this.criticalRatio = criticalRatio; }
    public double getEmergencyRatio() { return emergencyRatio; }
    public void setEmergencyRatio(double emergencyRatio) { this.emergencyRatio = emergencyRatio; }
    public double getDegradedRatio() { return degradedRatio; }
    public void setDegradedRatio(double degradedRatio) { this.degradedRatio = degradedRatio; }
}
