package com.conductor.supervisor;

import com.conductor.core.error.SupervisorException;
import com.conductor.core.model.ProbeHealth;
import com.conductor.core.model.PublishedPort;
import com.conductor.core.model.ServiceState;
import com.conductor.core.model.ServiceStatus;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ContainerPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Docker-based ProcessSupervisor.
 *
 * <p>A service maps to the container carrying the Compose label
 * {@code com.docker.compose.service=<serviceId>} (restricted to one Compose project
 * when configured). When no labelled container exists, a container named exactly
 * after the service is used. Containers are expected to exist already, created by
 * {@code docker compose create} or equivalent; this supervisor only starts, stops and
 * inspects them.
 *
 * <p>Every docker-java failure, including transport errors when the daemon is
 * unreachable, surfaces as a {@link SupervisorException}.
 */
public class DockerProcessSupervisor implements ProcessSupervisor {

    private static final Logger log = LoggerFactory.getLogger(DockerProcessSupervisor.class);

    static final String SERVICE_LABEL = "com.docker.compose.service";
    static final String PROJECT_LABEL = "com.docker.compose.project";

    private final DockerClient dockerClient;
    private final String composeProject;

    public DockerProcessSupervisor(DockerClient dockerClient, String composeProject) {
        this.dockerClient = dockerClient;
        this.composeProject = composeProject != null ? composeProject : "";
    }

    @Override
    public void start(String serviceId) {
        Container container = findContainer(serviceId)
                .orElseThrow(() -> new SupervisorException(
                        "No container found for service " + serviceId + "; create it with docker compose first"));
        try {
            dockerClient.startContainerCmd(container.getId()).exec();
            log.info("Container {} started for service {}", shortId(container.getId()), serviceId);
        } catch (NotModifiedException e) {
            log.debug("Container for {} already running", serviceId);
        } catch (RuntimeException e) {
            throw new SupervisorException("Failed to start container for " + serviceId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void stop(String serviceId, int timeoutSeconds) {
        Optional<Container> container = findContainer(serviceId);
        if (container.isEmpty()) {
            log.debug("No container for {}, nothing to stop", serviceId);
            return;
        }
        try {
            dockerClient.stopContainerCmd(container.get().getId())
                    .withTimeout(timeoutSeconds)
                    .exec();
            log.info("Container {} stopped for service {}", shortId(container.get().getId()), serviceId);
        } catch (NotModifiedException e) {
            log.debug("Container for {} already stopped", serviceId);
        } catch (NotFoundException e) {
            log.debug("Container for {} disappeared before stop", serviceId);
        } catch (RuntimeException e) {
            throw new SupervisorException("Failed to stop container for " + serviceId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public ServiceStatus status(String serviceId) {
        Optional<Container> found = findContainer(serviceId);
        if (found.isEmpty()) {
            return ServiceStatus.notFound(serviceId);
        }
        Container container = found.get();
        try {
            var inspect = dockerClient.inspectContainerCmd(container.getId()).exec();
            var state = inspect.getState();
            if (state == null) {
                throw new SupervisorException("Docker returned no state for container of " + serviceId);
            }
            boolean running = Boolean.TRUE.equals(state.getRunning());
            ServiceState serviceState = running ? ServiceState.RUNNING : ServiceState.fromContainerState(state.getStatus());
            if (serviceState == ServiceState.NOT_FOUND) {
                serviceState = ServiceState.EXITED;
            }
            var health = state.getHealth();
            ProbeHealth probe = health != null ? ProbeHealth.fromProbeStatus(health.getStatus()) : ProbeHealth.NONE;
            Long exitCode = state.getExitCodeLong();
            return new ServiceStatus(
                    serviceId,
                    serviceState,
                    running,
                    probe,
                    exitCode != null ? exitCode.intValue() : null,
                    publishedPorts(container),
                    null);
        } catch (NotFoundException e) {
            return ServiceStatus.notFound(serviceId);
        } catch (SupervisorException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SupervisorException("Failed to inspect container for " + serviceId + ": " + e.getMessage(), e);
        }
    }

    /**
     * Prefers a running container when the service is scaled to several replicas.
     */
    Optional<Container> findContainer(String serviceId) {
        List<Container> containers;
        try {
            var labels = new HashMap<String, String>();
            labels.put(SERVICE_LABEL, serviceId);
            if (!composeProject.isBlank()) {
                labels.put(PROJECT_LABEL, composeProject);
            }
            containers = dockerClient.listContainersCmd()
                    .withShowAll(true)
                    .withLabelFilter(labels)
                    .exec();
            if (containers == null || containers.isEmpty()) {
                containers = dockerClient.listContainersCmd()
                        .withShowAll(true)
                        .withNameFilter(List.of(serviceId))
                        .exec();
                if (containers != null) {
                    containers = containers.stream().filter(c -> hasExactName(c, serviceId)).toList();
                }
            }
        } catch (RuntimeException e) {
            throw new SupervisorException("Failed to list containers for " + serviceId + ": " + e.getMessage(), e);
        }
        if (containers == null || containers.isEmpty()) {
            return Optional.empty();
        }
        Container first = containers.get(0);
        return containers.stream()
                .filter(c -> "running".equalsIgnoreCase(c.getState()))
                .findFirst()
                .or(() -> Optional.of(first));
    }

    private static boolean hasExactName(Container container, String serviceId) {
        String[] names = container.getNames();
        return names != null && Arrays.stream(names)
                .anyMatch(n -> n.equals("/" + serviceId) || n.equals(serviceId));
    }

    private static List<PublishedPort> publishedPorts(Container container) {
        ContainerPort[] ports = container.getPorts();
        if (ports == null) return List.of();
        var result = new ArrayList<PublishedPort>();
        for (ContainerPort port : ports) {
            if (port.getPublicPort() == null || port.getPrivatePort() == null) continue;
            var published = new PublishedPort(port.getPublicPort(), port.getPrivatePort(),
                    port.getType() != null ? port.getType() : "tcp");
            if (!result.contains(published)) {
                result.add(published); // IPv4 and IPv6 bindings repeat the same mapping
            }
        }
        return result;
    }

    private static String shortId(String containerId) {
        return containerId != null && containerId.length() > 12 ? containerId.substring(0, 12) : containerId;
    }
}
