package com.conductor.core.monitor;

import com.conductor.core.events.EventBus;
import com.conductor.core.events.MonitorEvent;
import com.conductor.core.events.MonitorEventType;
import com.conductor.core.manager.ServiceManager;
import com.conductor.core.metrics.ConductorMetrics;
import com.conductor.core.model.HealthCheckConfig;
import com.conductor.core.model.LifecycleResult;
import com.conductor.core.model.ProbeHealth;
import com.conductor.core.model.ServiceManifest;
import com.conductor.core.model.ServiceStatus;
import com.conductor.core.registry.DependencyResolver;
import com.conductor.core.registry.ServiceRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class HealthMonitorTest {

    private ServiceRegistry registry;
    private ServiceManager manager;
    private EventBus eventBus;
    private SimpleMeterRegistry meterRegistry;
    private List<MonitorEvent> events;
    private HealthMonitor monitor;

    private static final MonitorSettings FAST = new MonitorSettings(
            Duration.ofHours(1), true, 3, Duration.ofMillis(50), 2.0, 2, true, false);

    @BeforeEach
    void setUp() {
        registry = new ServiceRegistry();
        manager = mock(ServiceManager.class);
        eventBus = new EventBus();
        meterRegistry = new SimpleMeterRegistry();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);
    }

    @AfterEach
    void tearDown() {
        if (monitor != null) {
            monitor.close();
        }
    }

    private HealthMonitor monitor(MonitorSettings settings) {
        monitor = new HealthMonitor(registry, new DependencyResolver(registry), manager, eventBus,
                new ConductorMetrics(meterRegistry), settings);
        return monitor;
    }

    private void register(String id, String... deps) {
        registry.register(ServiceManifest.of(id, "1.0.0", deps));
    }

    private static ServiceStatus running(String id) {
        return ServiceStatus.running(id, ProbeHealth.NONE);
    }

    private List<MonitorEvent> eventsOfType(MonitorEventType type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }

    private CountDownLatch latchFor(MonitorEventType type) {
        var latch = new CountDownLatch(1);
        eventBus.subscribeAll(e -> {
            if (e.type() == type) latch.countDown();
        });
        return latch;
    }

    @Nested
    @DisplayName("transitions")
    class Transitions {

        @Test
        @DisplayName("first healthy observation emits service-healthy")
        void firstHealthy() {
            register("db");
            when(manager.getServiceStatus("db")).thenReturn(running("db"));
            monitor(FAST.withAutoRestart(false));

            monitor.checkAllServices();

            assertEquals(1, eventsOfType(MonitorEventType.SERVICE_HEALTHY).size());
            assertEquals("db", events.get(0).serviceId());
        }

        @Test
        @DisplayName("first unhealthy observation emits service-unhealthy")
        void firstUnhealthy() {
            register("db");
            when(manager.getServiceStatus("db")).thenReturn(ServiceStatus.exited("db", 1));
            monitor(FAST.withAutoRestart(false));

            monitor.checkAllServices();

            assertEquals(1, eventsOfType(MonitorEventType.SERVICE_UNHEALTHY).size());
        }

        @Test
        @DisplayName("steady state emits nothing further")
        void steadyState() {
            register("db");
            when(manager.getServiceStatus("db")).thenReturn(running("db"));
            monitor(FAST.withAutoRestart(false));

            monitor.checkAllServices();
            monitor.checkAllServices();
            monitor.checkAllServices();

            assertEquals(1, events.size());
        }

        @Test
        @DisplayName("healthy to unhealthy and back emits one event per edge")
        void edges() {
            register("db");
            when(manager.getServiceStatus("db")).thenReturn(
                    running("db"), ServiceStatus.exited("db", 137), running("db"));
            monitor(FAST.withAutoRestart(false));

            monitor.checkAllServices();
            monitor.checkAllServices();
            monitor.checkAllServices();

            assertEquals(List.of(MonitorEventType.SERVICE_HEALTHY, MonitorEventType.SERVICE_UNHEALTHY,
                    MonitorEventType.SERVICE_HEALTHY), events.stream().map(MonitorEvent::type).toList());
            assertNotNull(meterRegistry.find("conductor.monitor.transitions")
                    .tag("service", "db").tag("to", "unhealthy").counter());
        }

        @Test
        @DisplayName("a failing check does not stop the others")
        void failingCheckIsolated() {
            register("bad");
            register("good");
            when(manager.getServiceStatus("bad")).thenThrow(new IllegalStateException("boom"));
            when(manager.getServiceStatus("good")).thenReturn(running("good"));
            monitor(FAST.withAutoRestart(false));

            monitor.checkAllServices();

            assertEquals(List.of("good"), eventsOfType(MonitorEventType.SERVICE_HEALTHY).stream()
                    .map(MonitorEvent::serviceId).toList());
            assertNotNull(meterRegistry.find("conductor.monitor.check.duration").timer());
        }

        @Test
        @DisplayName("health-checked service is unhealthy until the probe passes")
        void probeDecides() {
            registry.register(ServiceManifest.of("api", "1.0")
                    .withHealthCheck(new HealthCheckConfig(true, Map.of())));
            when(manager.getServiceStatus("api")).thenReturn(
                    ServiceStatus.running("api", ProbeHealth.UNKNOWN),
                    ServiceStatus.running("api", ProbeHealth.HEALTHY));
            monitor(FAST.withAutoRestart(false));

            monitor.checkAllServices();
            monitor.checkAllServices();

            assertEquals(List.of(MonitorEventType.SERVICE_UNHEALTHY, MonitorEventType.SERVICE_HEALTHY),
                    events.stream().map(MonitorEvent::type).toList());
        }
    }

    @Nested
    @DisplayName("auto-restart")
    class AutoRestart {

        @Test
        @DisplayName("gives up after max attempts with growing delays and never tries a fourth time")
        void exhaustion() throws Exception {
            register("X");
            when(manager.getServiceStatus("X")).thenReturn(running("X"), ServiceStatus.notFound("X"));
            var callTimes = new CopyOnWriteArrayList<Long>();
            when(manager.restartService("X")).thenAnswer(inv -> {
                callTimes.add(System.nanoTime());
                return LifecycleResult.failed("X", "No container found for service X");
            });
            CountDownLatch failed = latchFor(MonitorEventType.SERVICE_RESTART_FAILED);
            monitor(FAST);

            monitor.checkAllServices();
            monitor.checkAllServices();

            assertTrue(failed.await(5, TimeUnit.SECONDS));
            Thread.sleep(300);

            verify(manager, times(3)).restartService("X");
            List<MonitorEvent> failures = eventsOfType(MonitorEventType.SERVICE_RESTART_FAILED);
            assertEquals(1, failures.size());
            assertEquals(3, failures.get(0).attempt());
            assertEquals(0, monitor.pendingRestartCount());

            long firstGap = TimeUnit.NANOSECONDS.toMillis(callTimes.get(1) - callTimes.get(0));
            long secondGap = TimeUnit.NANOSECONDS.toMillis(callTimes.get(2) - callTimes.get(1));
            assertTrue(firstGap >= 100, "second attempt waits initial delay x2, was " + firstGap);
            assertTrue(secondGap >= 200, "third attempt waits initial delay x4, was " + secondGap);
            assertNotNull(meterRegistry.find("conductor.monitor.restarts.exhausted").counter());
        }

        @Test
        @DisplayName("successful restart emits service-restarted and resets attempts")
        void success() throws Exception {
            register("db");
            when(manager.getServiceStatus("db")).thenReturn(running("db"), ServiceStatus.exited("db", 1));
            when(manager.restartService("db")).thenReturn(
                    LifecycleResult.failed("db", "still down"),
                    LifecycleResult.succeeded("db", "Service restarted"));
            CountDownLatch restarted = latchFor(MonitorEventType.SERVICE_RESTARTED);
            monitor(FAST);

            monitor.checkAllServices();
            monitor.checkAllServices();

            assertTrue(restarted.await(5, TimeUnit.SECONDS));
            MonitorEvent event = eventsOfType(MonitorEventType.SERVICE_RESTARTED).get(0);
            assertEquals(2, event.attempt());
            assertEquals(false, event.payload().get("degraded"));
            assertEquals(0, monitor.restartAttempts("db"));
        }

        @Test
        @DisplayName("degraded restart counts as success by default")
        void degradedIsSuccess() throws Exception {
            register("api");
            when(manager.getServiceStatus("api")).thenReturn(ServiceStatus.exited("api", 1));
            when(manager.restartService("api")).thenReturn(LifecycleResult.degraded("api", "never healthy"));
            CountDownLatch restarted = latchFor(MonitorEventType.SERVICE_RESTARTED);
            monitor(FAST);

            monitor.checkAllServices();

            assertTrue(restarted.await(5, TimeUnit.SECONDS));
            assertEquals(true, eventsOfType(MonitorEventType.SERVICE_RESTARTED).get(0).payload().get("degraded"));
        }

        @Test
        @DisplayName("degraded restart counts as failure with strict health")
        void degradedIsFailureWhenStrict() throws Exception {
            register("api");
            when(manager.getServiceStatus("api")).thenReturn(ServiceStatus.exited("api", 1));
            when(manager.restartService("api")).thenReturn(LifecycleResult.degraded("api", "never healthy"));
            CountDownLatch failed = latchFor(MonitorEventType.SERVICE_RESTART_FAILED);
            monitor(FAST.withStrictHealth(true).withMaxRestartAttempts(1));

            monitor.checkAllServices();

            assertTrue(failed.await(5, TimeUnit.SECONDS));
            assertTrue(eventsOfType(MonitorEventType.SERVICE_RESTARTED).isEmpty());
            verify(manager, times(1)).restartService("api");
        }

        @Test
        @DisplayName("never-deployed service is not restarted")
        void neverDeployed() {
            register("ghost");
            when(manager.getServiceStatus("ghost")).thenReturn(ServiceStatus.notFound("ghost"));
            monitor(FAST);

            monitor.checkAllServices();

            assertEquals(1, eventsOfType(MonitorEventType.SERVICE_UNHEALTHY).size());
            assertFalse(monitor.isScheduledForRestart("ghost"));
            assertEquals(0, monitor.pendingRestartCount());
        }

        @Test
        @DisplayName("disabled auto-restart schedules nothing")
        void disabled() {
            register("db");
            when(manager.getServiceStatus("db")).thenReturn(ServiceStatus.exited("db", 1));
            monitor(FAST.withAutoRestart(false));

            monitor.checkAllServices();

            assertEquals(0, monitor.pendingRestartCount());
        }

        @Test
        @DisplayName("at most one restart is pending per service")
        void singlePendingTimer() {
            register("db");
            monitor(FAST.withInitialRestartDelay(Duration.ofMinutes(5)));

            monitor.scheduleRestart("db");
            monitor.scheduleRestart("db");
            monitor.scheduleRestart("db");

            assertEquals(1, monitor.pendingRestartCount());
            assertTrue(monitor.isScheduledForRestart("db"));
        }

        @Test
        @DisplayName("recovery to healthy cancels the pending restart")
        void recoveryCancels() {
            register("db");
            when(manager.getServiceStatus("db")).thenReturn(
                    running("db"), ServiceStatus.exited("db", 1), running("db"));
            monitor(FAST.withInitialRestartDelay(Duration.ofMinutes(5)));

            monitor.checkAllServices();
            monitor.checkAllServices();
            assertTrue(monitor.isScheduledForRestart("db"));

            monitor.checkAllServices();

            assertFalse(monitor.isScheduledForRestart("db"));
            assertEquals(0, monitor.restartAttempts("db"));
            verify(manager, never()).restartService("db");
        }

        @Test
        @DisplayName("restart waits while a dependency is down")
        void deferredOnDependency() throws Exception {
            register("A");
            register("B", "A");
            when(manager.getServiceStatus("A")).thenReturn(ServiceStatus.notFound("A"));
            when(manager.getServiceStatus("B")).thenReturn(ServiceStatus.exited("B", 1));
            monitor(FAST.withInitialRestartDelay(Duration.ofMillis(20)));

            monitor.checkAllServices();
            Thread.sleep(300);

            verify(manager, never()).restartService(anyString());
            assertEquals(0, monitor.restartAttempts("B"));
            var deferred = meterRegistry.find("conductor.monitor.restarts.deferred").tag("service", "B").counter();
            assertNotNull(deferred);
            assertTrue(deferred.count() >= 2);

            monitor.stop();
            assertEquals(0, monitor.pendingRestartCount());
        }
    }

    @Nested
    @DisplayName("dependency cascade")
    class Cascade {

        @Test
        @DisplayName("exhausted service stops its dependents and emits one cascade event")
        void cascadeOnExhaustion() {
            register("A");
            register("B", "A");
            when(manager.getServiceStatus("A")).thenReturn(running("A"), ServiceStatus.exited("A", 1));
            when(manager.getServiceStatus("B")).thenReturn(running("B"));
            when(manager.stopDependents("A")).thenReturn(List.of("B"));
            monitor(FAST.withMaxRestartAttempts(0));

            monitor.checkAllServices();
            monitor.checkAllServices();

            List<MonitorEvent> cascades = eventsOfType(MonitorEventType.DEPENDENCY_CASCADE);
            assertEquals(1, cascades.size());
            assertEquals("A", cascades.get(0).serviceId());
            assertEquals(List.of("B"), cascades.get(0).affectedServices());
            verify(manager).stopDependents("A");
            verify(manager, never()).restartService(anyString());
        }

        @Test
        @DisplayName("no dependents means no cascade event")
        void noDependents() {
            register("A");
            monitor(FAST);

            assertEquals(List.of(), monitor.handleDependencyCascade("A"));
            assertTrue(eventsOfType(MonitorEventType.DEPENDENCY_CASCADE).isEmpty());
            verify(manager, never()).stopDependents(anyString());
        }

        @Test
        @DisplayName("cascade can be disabled")
        void disabled() {
            register("A");
            register("B", "A");
            when(manager.getServiceStatus("A")).thenReturn(ServiceStatus.exited("A", 1));
            when(manager.getServiceStatus("B")).thenReturn(running("B"));
            monitor(FAST.withMaxRestartAttempts(0).withCascadeOnFailure(false));

            monitor.checkAllServices();

            assertEquals(1, eventsOfType(MonitorEventType.SERVICE_RESTART_FAILED).size());
            assertTrue(eventsOfType(MonitorEventType.DEPENDENCY_CASCADE).isEmpty());
            verify(manager, never()).stopDependents(anyString());
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("start polls periodically until stopped")
        void startAndStop() {
            register("db");
            when(manager.getServiceStatus("db")).thenReturn(running("db"));
            monitor(FAST.withCheckInterval(Duration.ofMillis(20)));

            monitor.start();
            assertTrue(monitor.isRunning());
            verify(manager, timeout(2000).atLeast(3)).getServiceStatus("db");

            monitor.stop();
            assertFalse(monitor.isRunning());
        }

        @Test
        @DisplayName("stop cancels pending restarts")
        void stopCancelsTimers() {
            register("db");
            when(manager.getServiceStatus("db")).thenReturn(ServiceStatus.exited("db", 1));
            monitor(FAST.withInitialRestartDelay(Duration.ofMinutes(5)));

            monitor.checkAllServices();
            assertEquals(1, monitor.pendingRestartCount());

            monitor.stop();

            assertEquals(0, monitor.pendingRestartCount());
            monitor.scheduleRestart("db");
            assertEquals(0, monitor.pendingRestartCount());
        }

        @Test
        @DisplayName("updateSettings replaces the effective configuration")
        void updateSettings() {
            monitor(FAST);

            monitor.updateSettings(FAST.withCheckInterval(Duration.ofSeconds(5)).withAutoRestart(false));

            assertEquals(Duration.ofSeconds(5), monitor.getSettings().checkInterval());
            assertFalse(monitor.getSettings().autoRestart());
        }

        @Test
        @DisplayName("snapshot reports last status and restart bookkeeping")
        void snapshot() {
            register("db");
            register("cache");
            when(manager.getServiceStatus("db")).thenReturn(running("db"));
            when(manager.getServiceStatus("cache")).thenReturn(ServiceStatus.exited("cache", 1));
            monitor(FAST.withInitialRestartDelay(Duration.ofMinutes(5)));

            monitor.checkAllServices();
            MonitorSnapshot snapshot = monitor.getStatus();

            assertFalse(snapshot.running());
            assertEquals(List.of("db", "cache"), List.copyOf(snapshot.services().keySet()));
            assertTrue(snapshot.services().get("db").status().running());
            assertTrue(snapshot.services().get("cache").scheduledForRestart());
            assertFalse(snapshot.services().get("db").scheduledForRestart());
        }

        @Test
        @DisplayName("unregistered services are forgotten")
        void forgetsUnregistered() {
            register("db");
            when(manager.getServiceStatus("db")).thenReturn(ServiceStatus.exited("db", 1));
            monitor(FAST.withInitialRestartDelay(Duration.ofMinutes(5)));

            monitor.checkAllServices();
            registry.unregister("db");
            monitor.checkAllServices();

            assertTrue(monitor.lastObservedStatus("db").isEmpty());
            assertEquals(0, monitor.pendingRestartCount());
        }
    }
}
