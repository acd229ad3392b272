package com.conductor.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for service supervision.
 */
@Service
public class ConductorMetrics {

    private final MeterRegistry registry;

    public ConductorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCheckDuration(long ms) {
        Timer.builder("conductor.monitor.check.duration")
                .description("Time to poll every registered service once")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param healthy the state the service moved into
     */
    public void recordTransition(String serviceId, boolean healthy) {
        Counter.builder("conductor.monitor.transitions")
                .tag("service", serviceId)
                .tag("to", healthy ? "healthy" : "unhealthy")
                .register(registry)
                .increment();
    }

    /**
     * @param result "succeeded", "degraded" or "failed"
     */
    public void recordRestart(String serviceId, String result) {
        Counter.builder("conductor.monitor.restarts")
                .tag("service", serviceId)
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordRestartDeferred(String serviceId) {
        Counter.builder("conductor.monitor.restarts.deferred")
                .description("Restarts postponed because a dependency was not running")
                .tag("service", serviceId)
                .register(registry)
                .increment();
    }

    public void recordRestartExhausted(String serviceId) {
        Counter.builder("conductor.monitor.restarts.exhausted")
                .tag("service", serviceId)
                .register(registry)
                .increment();
    }

    public void recordCascade(int affectedCount) {
        DistributionSummary.builder("conductor.monitor.cascade.size")
                .description("Dependents stopped per dependency cascade")
                .register(registry)
                .record(affectedCount);
    }

    public void recordLifecycleOperation(String operation, String outcome, long ms) {
        Timer.builder("conductor.lifecycle.duration")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
