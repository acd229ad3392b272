package com.conductor.core.monitor;

import java.time.Duration;

/**
 * Effective, immutable health monitor configuration.
 *
 * @param checkInterval       delay between the end of one poll and the start of the next
 * @param autoRestart         restart services that turn unhealthy
 * @param maxRestartAttempts  failed restarts tolerated before giving up on a service
 * @param initialRestartDelay backoff delay before the first restart attempt
 * @param backoffMultiplier   growth factor of the backoff delay per failed attempt
 * @param checkParallelism    worker threads used to poll services within one tick
 * @param cascadeOnFailure    stop dependents once a service is given up on
 * @param strictHealth        treat a restart that never turns healthy as failed
 */
public record MonitorSettings(
    Duration checkInterval,
    boolean autoRestart,
    int maxRestartAttempts,
    Duration initialRestartDelay,
    double backoffMultiplier,
    int checkParallelism,
    boolean cascadeOnFailure,
    boolean strictHealth
) {

    public MonitorSettings {
        if (checkInterval == null || checkInterval.isZero() || checkInterval.isNegative()) {
            throw new IllegalArgumentException("checkInterval must be positive");
        }
        if (maxRestartAttempts < 0) {
            throw new IllegalArgumentException("maxRestartAttempts must not be negative");
        }
        if (initialRestartDelay == null || initialRestartDelay.isNegative()) {
            throw new IllegalArgumentException("initialRestartDelay must not be negative");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be at least 1.0");
        }
        checkParallelism = Math.max(1, checkParallelism);
    }

    public static MonitorSettings defaults() {
        return new MonitorProperties().toSettings();
    }

    /**
     * Backoff before restart attempt number {@code attempts + 1}:
     * {@code initialRestartDelay * backoffMultiplier^attempts}.
     */
    public Duration restartDelay(int attempts) {
        double millis = initialRestartDelay.toMillis() * Math.pow(backoffMultiplier, attempts);
        return Duration.ofMillis(millis >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) millis);
    }

    public MonitorSettings withCheckInterval(Duration interval) {
        return new MonitorSettings(interval, autoRestart, maxRestartAttempts, initialRestartDelay,
                backoffMultiplier, checkParallelism, cascadeOnFailure, strictHealth);
    }

    public MonitorSettings withAutoRestart(boolean enabled) {
        return new MonitorSettings(checkInterval, enabled, maxRestartAttempts, initialRestartDelay,
                backoffMultiplier, checkParallelism, cascadeOnFailure, strictHealth);
    }

    public MonitorSettings withMaxRestartAttempts(int attempts) {
        return new MonitorSettings(checkInterval, autoRestart, attempts, initialRestartDelay,
                backoffMultiplier, checkParallelism, cascadeOnFailure, strictHealth);
    }

    public MonitorSettings withInitialRestartDelay(Duration delay) {
        return new MonitorSettings(checkInterval, autoRestart, maxRestartAttempts, delay,
                backoffMultiplier, checkParallelism, cascadeOnFailure, strictHealth);
    }

    public MonitorSettings withCascadeOnFailure(boolean enabled) {
        return new MonitorSettings(checkInterval, autoRestart, maxRestartAttempts, initialRestartDelay,
                backoffMultiplier, checkParallelism, enabled, strictHealth);
    }

    public MonitorSettings withStrictHealth(boolean enabled) {
        return new MonitorSettings(checkInterval, autoRestart, maxRestartAttempts, initialRestartDelay,
                backoffMultiplier, checkParallelism, cascadeOnFailure, enabled);
    }
}
