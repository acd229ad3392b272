package com.conductor.core.monitor;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Health monitor defaults, bound from {@code conductor.monitor.*}.
 * CLI flags override these per run through {@link MonitorSettings}.
 */
@Component
@ConfigurationProperties(prefix = "conductor.monitor")
public class MonitorProperties {

    private Duration checkInterval = Duration.ofSeconds(30);
    private boolean autoRestart = false;
    private int maxRestartAttempts = 3;
    private Duration initialRestartDelay = Duration.ofSeconds(5);
    private double backoffMultiplier = 2.0;
    private int checkParallelism = 4;
    private boolean cascadeOnFailure = true;
    /** Count a restart that never turns healthy as a failed attempt. */
    private boolean strictHealth = false;

    public Duration getCheckInterval() { return checkInterval; }
    public void setCheckInterval(Duration checkInterval) { this.checkInterval = checkInterval; }
    public boolean isAutoRestart() { return autoRestart; }
    public void setAutoRestart(boolean autoRestart) { this.autoRestart = autoRestart; }
    public int getMaxRestartAttempts() { return maxRestartAttempts; }
    public void setMaxRestartAttempts(int maxRestartAttempts) { this.maxRestartAttempts = maxRestartAttempts; }
    public Duration getInitialRestartDelay() { return initialRestartDelay; }
    public void setInitialRestartDelay(Duration initialRestartDelay) { this.initialRestartDelay = initialRestartDelay; }
    public double getBackoffMultiplier() { return backoffMultiplier; }
    public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
    public int getCheckParallelism() { return checkParallelism; }
    public void setCheckParallelism(int checkParallelism) { this.checkParallelism = checkParallelism; }
    public boolean isCascadeOnFailure() { return cascadeOnFailure; }
    public void setCascadeOnFailure(boolean cascadeOnFailure) { this.cascadeOnFailure = cascadeOnFailure; }
    public boolean isStrictHealth() { return strictHealth; }
    public void setStrictHealth(boolean strictHealth) { this.strictHealth = strictHealth; }

    public MonitorSettings toSettings() {
        return new MonitorSettings(checkInterval, autoRestart, maxRestartAttempts, initialRestartDelay,
                backoffMultiplier, checkParallelism, cascadeOnFailure, strictHealth);
    }
}
