package com.conductor.core.manager;

import com.conductor.core.error.ConductorException;
import com.conductor.core.error.ConvergenceTimeoutException;
import com.conductor.core.error.ServiceNotFoundException;
import com.conductor.core.error.SupervisorException;
import com.conductor.core.logging.MdcContext;
import com.conductor.core.metrics.ConductorMetrics;
import com.conductor.core.model.LifecycleResult;
import com.conductor.core.model.ProbeHealth;
import com.conductor.core.model.ServiceManifest;
import com.conductor.core.model.ServiceStatus;
import com.conductor.core.registry.DependencyResolver;
import com.conductor.core.registry.ServiceRegistry;
import com.conductor.supervisor.ProcessSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Lifecycle operations for registered services.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Delegates process control to {@link ProcessSupervisor}</li>
 *   <li>Waits for convergence with bounded polling (start, restart health gate)</li>
 *   <li>Orders multi-service operations through {@link DependencyResolver}</li>
 * </ul>
 *
 * <p>Start, stop and restart require the service to be registered. Status reads do not.
 */
@Service
public class ServiceManager {

    private static final Logger log = LoggerFactory.getLogger(ServiceManager.class);

    private final ServiceRegistry registry;
    private final DependencyResolver resolver;
    private final ProcessSupervisor supervisor;
    private final ManagerProperties properties;
    private final ConductorMetrics metrics;

    public ServiceManager(ServiceRegistry registry, DependencyResolver resolver, ProcessSupervisor supervisor,
                          ManagerProperties properties, @Autowired(required = false) ConductorMetrics metrics) {
        this.registry = registry;
        this.resolver = resolver;
        this.supervisor = supervisor;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Read-through status. Never throws for supervisor trouble: unknown services come
     * back {@code not_found}, failed queries come back with state {@code error}.
     */
    public ServiceStatus getServiceStatus(String serviceId) {
        try {
            ServiceStatus status = supervisor.status(serviceId);
            return status != null ? status : ServiceStatus.notFound(serviceId);
        } catch (RuntimeException e) {
            log.error("Failed to get status for {}: {}", serviceId, e.getMessage());
            return ServiceStatus.error(serviceId, e.getMessage());
        }
    }

    /**
     * Issues a start and polls until the process is running.
     * Fails when the process exits non-zero first or the poll budget runs out.
     *
     * @throws ServiceNotFoundException if the service is not registered
     */
    public LifecycleResult startService(String serviceId) {
        registry.require(serviceId);
        long startMs = System.currentTimeMillis();
        try (var scope = MdcContext.service(serviceId, "start")) {
            LifecycleResult result = doStart(serviceId);
            record("start", result, startMs);
            return result;
        }
    }

    /**
     * Starts the service after its transitive dependencies, in resolved order, skipping
     * whatever is already running. The first failure aborts the whole operation.
     *
     * @throws com.conductor.core.error.CircularDependencyException if the graph has a cycle reachable from the service
     * @throws ServiceNotFoundException if the service or one of its dependencies is not registered
     */
    public LifecycleResult startWithDependencies(String serviceId) {
        registry.require(serviceId);
        log.info("Resolving dependencies for {}...", serviceId);
        List<String> dependencies = resolver.resolveDependencies(serviceId);
        for (String dependency : dependencies) {
            if (!registry.contains(dependency)) {
                throw new ServiceNotFoundException(dependency,
                        "Service " + serviceId + " depends on unregistered service " + dependency);
            }
        }

        var order = new ArrayList<>(dependencies);
        order.add(serviceId);
        log.info("Starting services in order: {}", String.join(" -> ", order));

        int started = 0;
        for (String service : order) {
            ServiceStatus status = getServiceStatus(service);
            if (status.running()) {
                log.info("Service {} is already running", service);
                continue;
            }
            LifecycleResult result = startService(service);
            if (!result.isSuccess()) {
                log.error("Failed to start dependency {} of {}", service, serviceId);
                return LifecycleResult.failed(serviceId,
                        service.equals(serviceId)
                                ? result.detail()
                                : "Dependency " + service + " failed to start: " + result.detail(),
                        result.cause());
            }
            started++;
        }
        return LifecycleResult.succeeded(serviceId,
                "Started " + started + " of " + order.size() + " services (" + String.join(" -> ", order) + ")");
    }

    public LifecycleResult stopService(String serviceId) {
        return stopService(serviceId, properties.getStopTimeout());
    }

    /**
     * Gracefully stops a running service. Succeeds without contacting the supervisor's
     * stop command when the service is not running.
     *
     * @throws ServiceNotFoundException if the service is not registered
     */
    public LifecycleResult stopService(String serviceId, Duration timeout) {
        registry.require(serviceId);
        long startMs = System.currentTimeMillis();
        try (var scope = MdcContext.service(serviceId, "stop")) {
            LifecycleResult result = doStop(serviceId, timeout);
            record("stop", result, startMs);
            return result;
        }
    }

    /**
     * Stops every service that transitively depends on {@code serviceId}, outermost
     * dependents first.
     *
     * @return the dependents that are stopped afterwards
     */
    public List<String> stopDependents(String serviceId) {
        List<String> dependents = resolver.shutdownOrder(resolver.getServiceDependents(serviceId));
        if (dependents.isEmpty()) {
            return List.of();
        }
        log.info("Found dependent services of {}: {}", serviceId, String.join(", ", dependents));
        var stopped = new ArrayList<String>();
        for (String dependent : dependents) {
            LifecycleResult result = stopService(dependent);
            if (result.isSuccess()) {
                stopped.add(dependent);
            } else {
                log.warn("Could not stop dependent {}: {}", dependent, result.detail());
            }
        }
        return stopped;
    }

    /**
     * Stop, settle, start. When the manifest enables health checking, also waits for the
     * probe to report healthy; a process that comes up without turning healthy is a
     * {@link LifecycleResult.Outcome#DEGRADED} success.
     *
     * @throws ServiceNotFoundException if the service is not registered
     */
    public LifecycleResult restartService(String serviceId) {
        ServiceManifest manifest = registry.require(serviceId);
        long startMs = System.currentTimeMillis();
        try (var scope = MdcContext.service(serviceId, "restart")) {
            LifecycleResult result = doRestart(manifest);
            record("restart", result, startMs);
            return result;
        }
    }

    // -- internals ------------------------------------------------------------

    private LifecycleResult doStart(String serviceId) {
        log.info("Starting service: {}", serviceId);
        try {
            supervisor.start(serviceId);
            var poller = new ConvergencePoller(properties.getStartAttempts(),
                    properties.getStartPollInterval(), properties.getStartTimeout());
            ServiceStatus status = poller.await(serviceId, "running",
                    () -> getServiceStatus(serviceId),
                    ServiceStatus::running,
                    ServiceStatus::exitedWithFailure);
            if (status.running()) {
                log.info("Service {} started successfully", serviceId);
                return LifecycleResult.succeeded(serviceId, "Service started");
            }
            log.error("Service {} exited with code {}", serviceId, status.exitCode());
            return LifecycleResult.failed(serviceId, "Service exited with code " + status.exitCode());
        } catch (ConvergenceTimeoutException e) {
            log.error("Service {} failed to start within timeout: {}", serviceId, e.getMessage());
            return LifecycleResult.failed(serviceId, e.getMessage(), e);
        } catch (ConductorException e) {
            log.error("Failed to start {}: {}", serviceId, e.getMessage());
            return LifecycleResult.failed(serviceId, e.getMessage(), e);
        }
    }

    private LifecycleResult doStop(String serviceId, Duration timeout) {
        log.info("Stopping service: {}", serviceId);
        ServiceStatus status = getServiceStatus(serviceId);
        if (!status.running()) {
            log.info("Service {} is not running", serviceId);
            return LifecycleResult.succeeded(serviceId, "Service already stopped");
        }
        try {
            supervisor.stop(serviceId, (int) Math.max(0, timeout.toSeconds()));
            log.info("Service {} stopped successfully", serviceId);
            return LifecycleResult.succeeded(serviceId, "Service stopped");
        } catch (SupervisorException e) {
            log.error("Failed to stop {}: {}", serviceId, e.getMessage());
            return LifecycleResult.failed(serviceId, e.getMessage(), e);
        }
    }

    private LifecycleResult doRestart(ServiceManifest manifest) {
        String serviceId = manifest.id();
        log.info("Restarting service: {}", serviceId);

        LifecycleResult stop = doStop(serviceId, properties.getStopTimeout());
        if (!stop.isSuccess()) {
            log.error("Failed to stop {} for restart", serviceId);
            return LifecycleResult.failed(serviceId, "Failed to stop for restart: " + stop.detail(), stop.cause());
        }

        try {
            settle();
        } catch (ConductorException e) {
            return LifecycleResult.failed(serviceId, e.getMessage(), e);
        }

        LifecycleResult start = doStart(serviceId);
        if (!start.isSuccess()) {
            log.error("Failed to start {} after stop", serviceId);
            return LifecycleResult.failed(serviceId, "Failed to start after stop: " + start.detail(), start.cause());
        }

        if (!manifest.healthCheckEnabled()) {
            return LifecycleResult.succeeded(serviceId, "Service restarted");
        }

        log.info("Waiting for {} to be healthy...", serviceId);
        var poller = new ConvergencePoller(properties.getHealthAttempts(),
                properties.getHealthPollInterval(), properties.getHealthTimeout());
        try {
            poller.await(serviceId, "healthy",
                    () -> getServiceStatus(serviceId),
                    status -> status.health() == ProbeHealth.HEALTHY,
                    status -> false);
            log.info("Service {} is healthy", serviceId);
            return LifecycleResult.succeeded(serviceId, "Service restarted and healthy");
        } catch (ConvergenceTimeoutException e) {
            log.warn("Service {} restarted but health check timed out", serviceId);
            return LifecycleResult.degraded(serviceId, "Service restarted but never reported healthy");
        } catch (ConductorException e) {
            return LifecycleResult.failed(serviceId, e.getMessage(), e);
        }
    }

    private void settle() {
        Duration delay = properties.getSettleDelay();
        if (delay.isZero() || delay.isNegative()) return;
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConductorException("Interrupted during restart settle delay", e);
        }
    }

    private void record(String operation, LifecycleResult result, long startMs) {
        if (metrics != null) {
            metrics.recordLifecycleOperation(operation, result.outcome().name().toLowerCase(),
                    System.currentTimeMillis() - startMs);
        }
    }
}
