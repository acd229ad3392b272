package com.conductor.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConductorMetricsTest {

    private SimpleMeterRegistry registry;
    private ConductorMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ConductorMetrics(registry);
    }

    @Test
    @DisplayName("recordCheckDuration creates a timer")
    void checkDuration() {
        metrics.recordCheckDuration(120);
        var timer = registry.find("conductor.monitor.check.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordRestart counts by result")
    void restarts() {
        metrics.recordRestart("db", "failed");
        metrics.recordRestart("db", "failed");
        metrics.recordRestart("db", "succeeded");

        assertEquals(2.0, registry.find("conductor.monitor.restarts")
                .tag("service", "db").tag("result", "failed").counter().count());
        assertEquals(1.0, registry.find("conductor.monitor.restarts")
                .tag("result", "succeeded").counter().count());
    }

    @Test
    @DisplayName("recordTransition tags the target state")
    void transitions() {
        metrics.recordTransition("db", false);

        assertNotNull(registry.find("conductor.monitor.transitions").tag("to", "unhealthy").counter());
        assertNull(registry.find("conductor.monitor.transitions").tag("to", "healthy").counter());
    }

    @Test
    @DisplayName("recordCascade records the number of affected dependents")
    void cascade() {
        metrics.recordCascade(3);
        var summary = registry.find("conductor.monitor.cascade.size").summary();
        assertNotNull(summary);
        assertEquals(3.0, summary.totalAmount());
    }

    @Test
    @DisplayName("deferred and exhausted restarts are counted per service")
    void deferredAndExhausted() {
        metrics.recordRestartDeferred("api");
        metrics.recordRestartExhausted("api");

        assertEquals(1.0, registry.find("conductor.monitor.restarts.deferred").tag("service", "api").counter().count());
        assertEquals(1.0, registry.find("conductor.monitor.restarts.exhausted").tag("service", "api").counter().count());
    }

    @Test
    @DisplayName("recordLifecycleOperation tags operation and outcome")
    void lifecycle() {
        metrics.recordLifecycleOperation("restart", "degraded", 2500);
        var timer = registry.find("conductor.lifecycle.duration")
                .tag("operation", "restart").tag("outcome", "degraded").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }
}
