package com.conductor.core.monitor;

import com.conductor.core.events.EventBus;
import com.conductor.core.events.MonitorEvent;
import com.conductor.core.logging.MdcContext;
import com.conductor.core.manager.ServiceManager;
import com.conductor.core.metrics.ConductorMetrics;
import com.conductor.core.model.LifecycleResult;
import com.conductor.core.model.ServiceManifest;
import com.conductor.core.model.ServiceState;
import com.conductor.core.model.ServiceStatus;
import com.conductor.core.registry.DependencyResolver;
import com.conductor.core.registry.ServiceRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Continuously polls every registered service and reacts to health transitions.
 *
 * <p>Only edges produce action: a service turning healthy resets its restart budget;
 * a service turning unhealthy is announced and, with auto-restart enabled, scheduled
 * for a restart with exponential backoff. A restart waits while any dependency is
 * down, and a service whose restart budget is spent triggers a dependency cascade that
 * stops its dependents.
 *
 * <p>Threads: a scheduler drives the poll and the restart timers, a bounded pool runs
 * the per-service checks of one poll, and restarts execute on their own workers.
 * Restart bookkeeping for a service is guarded by that service's {@link RestartState}.
 */
@Service
public class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final ServiceRegistry registry;
    private final DependencyResolver resolver;
    private final ServiceManager serviceManager;
    private final EventBus eventBus;
    private final ConductorMetrics metrics;

    private final ConcurrentHashMap<String, ServiceStatus> lastStatus = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RestartState> restartStates = new ConcurrentHashMap<>();
    /** Services observed present at least once; never-deployed services are not auto-restarted. */
    private final Set<String> deployed = ConcurrentHashMap.newKeySet();

    private final ScheduledExecutorService scheduler;
    private final ThreadPoolExecutor checkPool;
    private final ExecutorService restartWorkers;

    private volatile MonitorSettings settings;
    private volatile boolean running;
    private volatile boolean halted;
    private ScheduledFuture<?> tick;

    @Autowired
    public HealthMonitor(ServiceRegistry registry, DependencyResolver resolver, ServiceManager serviceManager,
                         EventBus eventBus, @Autowired(required = false) ConductorMetrics metrics,
                         MonitorProperties properties) {
        this(registry, resolver, serviceManager, eventBus, metrics, properties.toSettings());
    }

    public HealthMonitor(ServiceRegistry registry, DependencyResolver resolver, ServiceManager serviceManager,
                         EventBus eventBus, ConductorMetrics metrics, MonitorSettings settings) {
        this.registry = registry;
        this.resolver = resolver;
        this.serviceManager = serviceManager;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.settings = settings;
        this.scheduler = Executors.newScheduledThreadPool(2, daemonThreads("health-monitor"));
        this.checkPool = new ThreadPoolExecutor(settings.checkParallelism(), settings.checkParallelism(),
                60, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), daemonThreads("health-check"));
        this.restartWorkers = Executors.newCachedThreadPool(daemonThreads("health-restart"));
    }

    // -- lifecycle ------------------------------------------------------------

    /**
     * Starts the periodic poll. The first poll runs immediately.
     */
    public synchronized void start() {
        if (running) {
            log.info("Health monitor is already running");
            return;
        }
        MonitorSettings current = settings;
        log.info("Starting service health monitor (check interval {}ms, auto-restart {}, max restart attempts {})",
                current.checkInterval().toMillis(),
                current.autoRestart() ? "enabled" : "disabled",
                current.maxRestartAttempts());
        halted = false;
        running = true;
        tick = scheduler.scheduleWithFixedDelay(this::runTick, 0,
                current.checkInterval().toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Halts the periodic poll and cancels every pending or executing restart.
     */
    public synchronized void stop() {
        halted = true;
        if (tick != null) {
            tick.cancel(false);
            tick = null;
        }
        int cancelled = 0;
        for (RestartState state : restartStates.values()) {
            synchronized (state) {
                if (state.isBusy()) cancelled++;
                state.cancelAll();
            }
        }
        if (running) {
            running = false;
            log.info("Stopped service health monitor ({} pending restarts cancelled)", cancelled);
        } else {
            log.info("Health monitor is not running");
        }
    }

    @PreDestroy
    public void close() {
        stop();
        scheduler.shutdownNow();
        checkPool.shutdownNow();
        restartWorkers.shutdownNow();
    }

    public boolean isRunning() {
        return running;
    }

    public MonitorSettings getSettings() {
        return settings;
    }

    /**
     * Replaces the configuration. A new check interval takes effect immediately when
     * the monitor is running.
     */
    public synchronized void updateSettings(MonitorSettings updated) {
        MonitorSettings previous = settings;
        settings = updated;
        if (updated.checkParallelism() != previous.checkParallelism()) {
            resizeCheckPool(updated.checkParallelism());
        }
        if (running && !updated.checkInterval().equals(previous.checkInterval())) {
            tick.cancel(false);
            tick = scheduler.scheduleWithFixedDelay(this::runTick, updated.checkInterval().toMillis(),
                    updated.checkInterval().toMillis(), TimeUnit.MILLISECONDS);
        }
        log.info("Monitor configuration updated: {}", updated);
    }

    // -- polling --------------------------------------------------------------

    /**
     * Polls every registered service once and processes the resulting transitions.
     * Services are checked concurrently; a failure checking one never affects another.
     */
    public void checkAllServices() {
        long startMs = System.currentTimeMillis();
        List<ServiceManifest> services = registry.getAllServices();
        forgetUnregistered(services);

        var checks = new ArrayList<Callable<Void>>(services.size());
        for (ServiceManifest service : services) {
            checks.add(() -> {
                checkService(service);
                return null;
            });
        }
        try {
            checkPool.invokeAll(checks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Health check interrupted");
        }
        if (metrics != null) {
            metrics.recordCheckDuration(System.currentTimeMillis() - startMs);
        }
    }

    private void runTick() {
        try {
            checkAllServices();
        } catch (RuntimeException e) {
            // an exception escaping here would silently cancel the periodic task
            log.error("Health check tick failed: {}", e.getMessage(), e);
        }
    }

    void checkService(ServiceManifest manifest) {
        String serviceId = manifest.id();
        try (var scope = MdcContext.service(serviceId, "health-check")) {
            ServiceStatus status = serviceManager.getServiceStatus(serviceId);
            ServiceStatus previous = lastStatus.put(serviceId, status);
            if (status.state() != ServiceState.NOT_FOUND) {
                deployed.add(serviceId);
            }

            ServiceHealth before = ServiceHealth.of(previous, manifest);
            ServiceHealth now = ServiceHealth.of(status, manifest);
            switch (before.transitionTo(now)) {
                case BECAME_HEALTHY -> onHealthy(serviceId, status);
                case BECAME_UNHEALTHY -> onUnhealthy(serviceId, status, before);
                case NONE -> { }
            }
        } catch (RuntimeException e) {
            log.error("Error checking service {}: {}", serviceId, e.getMessage(), e);
        }
    }

    private void onHealthy(String serviceId, ServiceStatus status) {
        log.info("Service {} is now healthy", serviceId);
        if (metrics != null) metrics.recordTransition(serviceId, true);
        RestartState state = restartStates.get(serviceId);
        if (state != null) {
            synchronized (state) {
                state.reset();
            }
        }
        eventBus.publish(MonitorEvent.healthy(serviceId, status));
    }

    private void onUnhealthy(String serviceId, ServiceStatus status, ServiceHealth before) {
        if (before == ServiceHealth.UNKNOWN) {
            log.warn("Service {} is unhealthy on initial check ({})", serviceId, status.state());
        } else {
            log.warn("Service {} is now unhealthy ({})", serviceId, status.state());
        }
        if (metrics != null) metrics.recordTransition(serviceId, false);
        eventBus.publish(MonitorEvent.unhealthy(serviceId, status));

        if (!settings.autoRestart()) return;
        if (status.state() == ServiceState.NOT_FOUND && !deployed.contains(serviceId)) {
            log.info("Service {} has never been deployed, not restarting", serviceId);
            return;
        }
        scheduleRestart(serviceId);
    }

    // -- restart scheduling ---------------------------------------------------

    /**
     * Arms a backoff timer for the service unless one is pending or a restart is already
     * executing. Once the restart budget is spent, reports the failure and cascades to
     * dependents instead.
     */
    void scheduleRestart(String serviceId) {
        if (halted || !registry.contains(serviceId)) return;
        RestartState state = restartStates.computeIfAbsent(serviceId, k -> new RestartState());
        MonitorSettings current = settings;
        int attempts;
        synchronized (state) {
            if (halted) return;
            if (state.isBusy()) {
                log.debug("Restart of {} already pending", serviceId);
                return;
            }
            attempts = state.attempts();
            if (attempts < current.maxRestartAttempts()) {
                Duration delay = current.restartDelay(attempts);
                log.info("Scheduling restart for {} in {}ms (attempt {}/{})",
                        serviceId, delay.toMillis(), attempts + 1, current.maxRestartAttempts());
                state.arm(scheduler.schedule(() -> onRestartTimer(serviceId, state),
                        delay.toMillis(), TimeUnit.MILLISECONDS));
                return;
            }
            if (!state.reportExhaustion()) return;
        }

        log.error("Service {} has exceeded maximum restart attempts ({})", serviceId, current.maxRestartAttempts());
        if (metrics != null) metrics.recordRestartExhausted(serviceId);
        eventBus.publish(MonitorEvent.restartFailed(serviceId, attempts));
        if (current.cascadeOnFailure()) {
            handleDependencyCascade(serviceId);
        }
    }

    private void onRestartTimer(String serviceId, RestartState state) {
        synchronized (state) {
            if (halted) {
                state.timerDiscarded();
                return;
            }
            state.fired(restartWorkers.submit(() -> runRestart(serviceId, state)));
        }
    }

    private void runRestart(String serviceId, RestartState state) {
        boolean rearm;
        try (var scope = MdcContext.service(serviceId, "auto-restart")) {
            rearm = attemptRestart(serviceId, state);
        } catch (RuntimeException e) {
            log.error("Error restarting {}: {}", serviceId, e.getMessage(), e);
            synchronized (state) {
                state.recordFailure();
            }
            rearm = true;
        } finally {
            synchronized (state) {
                state.finished();
            }
        }
        if (rearm) {
            scheduleRestart(serviceId);
        }
    }

    /**
     * @return true when another attempt should be scheduled
     */
    private boolean attemptRestart(String serviceId, RestartState state) {
        int attempt;
        synchronized (state) {
            attempt = state.attempts() + 1;
        }

        Optional<String> blocker = firstDownDependency(serviceId);
        if (blocker.isPresent()) {
            log.info("Delaying restart of {} due to unhealthy dependency: {}", serviceId, blocker.get());
            if (metrics != null) metrics.recordRestartDeferred(serviceId);
            return true;
        }
        if (halted) return false;

        MonitorSettings current = settings;
        log.info("Attempting to restart {} (attempt {}/{})", serviceId, attempt, current.maxRestartAttempts());
        LifecycleResult result = serviceManager.restartService(serviceId);
        boolean success = result.isSuccess() && !(result.isDegraded() && current.strictHealth());

        if (success) {
            synchronized (state) {
                state.reset();
            }
            log.info("Successfully restarted {}{}", serviceId, result.isDegraded() ? " (health unresolved)" : "");
            if (metrics != null) metrics.recordRestart(serviceId, result.isDegraded() ? "degraded" : "succeeded");
            eventBus.publish(MonitorEvent.restarted(serviceId, attempt, result.isDegraded()));
            return false;
        }

        synchronized (state) {
            state.recordFailure();
        }
        log.error("Failed to restart {} (attempt {}/{}): {}", serviceId, attempt,
                current.maxRestartAttempts(), result.detail());
        if (metrics != null) metrics.recordRestart(serviceId, "failed");
        return true;
    }

    /**
     * The first transitive dependency whose last known status is not running.
     */
    private Optional<String> firstDownDependency(String serviceId) {
        for (String dependency : resolver.resolveDependencies(serviceId)) {
            ServiceStatus status = lastStatus.get(dependency);
            if (status == null || !status.running()) {
                return Optional.of(dependency);
            }
        }
        return Optional.empty();
    }

    // -- cascade --------------------------------------------------------------

    /**
     * Stops every service that depends on a failed service and announces the affected
     * set in a single event.
     *
     * @return the affected dependents
     */
    public List<String> handleDependencyCascade(String failedServiceId) {
        List<String> affected = resolver.getServiceDependents(failedServiceId);
        if (affected.isEmpty()) {
            log.debug("No dependents affected by {} failure", failedServiceId);
            return List.of();
        }
        log.warn("Services affected by {} failure: {}", failedServiceId, String.join(", ", affected));
        if (metrics != null) metrics.recordCascade(affected.size());
        eventBus.publish(MonitorEvent.cascade(failedServiceId, affected));

        List<String> stopped = serviceManager.stopDependents(failedServiceId);
        if (stopped.size() < affected.size()) {
            log.warn("Stopped {} of {} dependents of {}", stopped.size(), affected.size(), failedServiceId);
        }
        return affected;
    }

    // -- inspection -----------------------------------------------------------

    public MonitorSnapshot getStatus() {
        var services = new LinkedHashMap<String, MonitorSnapshot.ServiceSnapshot>();
        for (ServiceManifest manifest : registry.getAllServices()) {
            ServiceStatus status = lastStatus.get(manifest.id());
            if (status == null) continue;
            services.put(manifest.id(), new MonitorSnapshot.ServiceSnapshot(
                    status, restartAttempts(manifest.id()), isScheduledForRestart(manifest.id())));
        }
        return new MonitorSnapshot(running, settings, services);
    }

    public Optional<ServiceStatus> lastObservedStatus(String serviceId) {
        return Optional.ofNullable(lastStatus.get(serviceId));
    }

    public int restartAttempts(String serviceId) {
        RestartState state = restartStates.get(serviceId);
        if (state == null) return 0;
        synchronized (state) {
            return state.attempts();
        }
    }

    public boolean isScheduledForRestart(String serviceId) {
        RestartState state = restartStates.get(serviceId);
        if (state == null) return false;
        synchronized (state) {
            return state.isScheduled();
        }
    }

    /** Services with a restart timer pending or a restart executing. */
    public int pendingRestartCount() {
        int count = 0;
        for (RestartState state : restartStates.values()) {
            synchronized (state) {
                if (state.isBusy()) count++;
            }
        }
        return count;
    }

    // -- internals ------------------------------------------------------------

    private void forgetUnregistered(List<ServiceManifest> services) {
        Set<String> registered = ConcurrentHashMap.newKeySet();
        services.forEach(s -> registered.add(s.id()));
        lastStatus.keySet().removeIf(id -> !registered.contains(id));
        deployed.removeIf(id -> !registered.contains(id));
        restartStates.entrySet().removeIf(entry -> {
            if (registered.contains(entry.getKey())) return false;
            synchronized (entry.getValue()) {
                entry.getValue().cancelAll();
            }
            return true;
        });
    }

    private void resizeCheckPool(int size) {
        if (size > checkPool.getMaximumPoolSize()) {
            checkPool.setMaximumPoolSize(size);
            checkPool.setCorePoolSize(size);
        } else {
            checkPool.setCorePoolSize(size);
            checkPool.setMaximumPoolSize(size);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
