package com.conductor.supervisor;

import com.conductor.core.model.ServiceStatus;

/**
 * Abstraction over whatever actually runs a service's process.
 * Implementations: {@link DockerProcessSupervisor}.
 */
public interface ProcessSupervisor {

    /**
     * Asks the supervisor to start the service. Returns once the request is accepted;
     * callers poll {@link #status} to observe the process coming up.
     *
     * @throws com.conductor.core.error.SupervisorException if the request fails
     */
    void start(String serviceId);

    /**
     * Gracefully stops the service, allowing {@code timeoutSeconds} before it is killed.
     *
     * @throws com.conductor.core.error.SupervisorException if the request fails
     */
    void stop(String serviceId, int timeoutSeconds);

    /**
     * Current status of the service. Unknown ids yield a {@code not_found} status
     * rather than an exception.
     *
     * @throws com.conductor.core.error.SupervisorException if the supervisor cannot be queried
     */
    ServiceStatus status(String serviceId);
}
