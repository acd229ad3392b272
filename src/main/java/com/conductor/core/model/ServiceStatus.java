package com.conductor.core.model;

import java.util.List;

/**
 * Point-in-time snapshot of a service as observed through the supervisor.
 * A new instance is produced on every poll.
 *
 * @param id             service identifier
 * @param state          process state
 * @param running        whether the process is up
 * @param health         probe result
 * @param exitCode       last exit code, or {@code null} when unknown
 * @param publishedPorts ports published on the host
 * @param error          supervisor error message when {@code state} is ERROR
 */
public record ServiceStatus(
    String id,
    ServiceState state,
    boolean running,
    ProbeHealth health,
    Integer exitCode,
    List<PublishedPort> publishedPorts,
    String error
) {

    public ServiceStatus {
        publishedPorts = publishedPorts != null ? List.copyOf(publishedPorts) : List.of();
    }

    public static ServiceStatus notFound(String id) {
        return new ServiceStatus(id, ServiceState.NOT_FOUND, false, ProbeHealth.UNKNOWN, null, List.of(), null);
    }

    public static ServiceStatus error(String id, String message) {
        return new ServiceStatus(id, ServiceState.ERROR, false, ProbeHealth.UNKNOWN, null, List.of(), message);
    }

    public static ServiceStatus running(String id, ProbeHealth health) {
        return new ServiceStatus(id, ServiceState.RUNNING, true, health, null, List.of(), null);
    }

    public static ServiceStatus exited(String id, Integer exitCode) {
        return new ServiceStatus(id, ServiceState.EXITED, false, ProbeHealth.NONE, exitCode, List.of(), null);
    }

    public boolean exitedWithFailure() {
        return state == ServiceState.EXITED && exitCode != null && exitCode != 0;
    }
}
