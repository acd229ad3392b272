package com.conductor.core.error;

/**
 * Thrown when an operation names a service id that is not registered.
 */
public class ServiceNotFoundException extends ConductorException {

    private final String serviceId;

    public ServiceNotFoundException(String serviceId) {
        this(serviceId, "Service " + serviceId + " not found in registry");
    }

    public ServiceNotFoundException(String serviceId, String message) {
        super(message);
        this.serviceId = serviceId;
    }

    public String getServiceId() {
        return serviceId;
    }
}
