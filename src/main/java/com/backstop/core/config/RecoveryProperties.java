package com.backstop.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "backstop.recovery")
public class RecoveryProperties {

    /** Retry-path invocations allowed per generic component before falling back directly. */
    private int maxRetryAttempts = 3;

    private int glassMaxRetryAttempts = 3;

    /** Delay before a {@code RETRY_AFTER_DELAY} retry runs. */
    private long retryDelayMs = 500;

    public int getMaxRetryAttempts() { return maxRetryAttempts; }
    public void setMaxRetryAttempts(int maxRetryAttempts) { this.maxRetryAttempts = maxRetryAttempts; }
    public int getGlassMaxRetryAttempts() { return glassMaxRetryAttempts; }
    public void setGlassMaxRetryAttempts(int glassMaxRetryAttempts) { this.glassMaxRetryAttempts = glassMaxRetryAttempts; }
    public long getRetryDelayMs() { return retryDelayMs; }
    public void setRetryDelayMs(long retryDelayMs) { this.retryDelayMs = retryDelayMs; }
}
