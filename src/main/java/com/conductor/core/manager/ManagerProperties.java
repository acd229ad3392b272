package com.conductor.core.manager;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Convergence budgets for lifecycle operations, bound from {@code conductor.manager.*}.
 */
@Component
@ConfigurationProperties(prefix = "conductor.manager")
public class ManagerProperties {

    private int startAttempts = 10;
    private Duration startPollInterval = Duration.ofSeconds(1);
    /** Wall-clock ceiling on the start poll, whichever of the two budgets runs out first. */
    private Duration startTimeout = Duration.ofSeconds(30);
    private Duration settleDelay = Duration.ofSeconds(2);
    private int healthAttempts = 30;
    private Duration healthPollInterval = Duration.ofSeconds(2);
    private Duration healthTimeout = Duration.ofSeconds(90);
    private Duration stopTimeout = Duration.ofSeconds(30);

    public int getStartAttempts() { return startAttempts; }
    public void setStartAttempts(int startAttempts) { this.startAttempts = startAttempts; }
    public Duration getStartPollInterval() { return startPollInterval; }
    public void setStartPollInterval(Duration startPollInterval) { this.startPollInterval = startPollInterval; }
    public Duration getStartTimeout() { return startTimeout; }
    public void setStartTimeout(Duration startTimeout) { this.startTimeout = startTimeout; }
    public Duration getSettleDelay() { return settleDelay; }
    public void setSettleDelay(Duration settleDelay) { this.settleDelay = settleDelay; }
    public int getHealthAttempts() { return healthAttempts; }
    public void setHealthAttempts(int healthAttempts) { this.healthAttempts = healthAttempts; }
    public Duration getHealthPollInterval() { return healthPollInterval; }
    public void setHealthPollInterval(Duration healthPollInterval) { this.healthPollInterval = healthPollInterval; }
    public Duration getHealthTimeout() { return healthTimeout; }
    public void setHealthTimeout(Duration healthTimeout) { this.healthTimeout = healthTimeout; }
    public Duration getStopTimeout() { return stopTimeout; }
    public void setStopTimeout(Duration stopTimeout) { this.stopTimeout = stopTimeout; }
}
