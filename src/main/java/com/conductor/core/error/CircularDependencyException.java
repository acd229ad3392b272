package com.conductor.core.error;

import java.util.List;

/**
 * Thrown when a start is requested for a service whose dependency graph contains a cycle.
 */
public class CircularDependencyException extends ConductorException {

    private final List<String> cycle;

    public CircularDependencyException(String serviceId, List<String> cycle) {
        super("Circular dependency detected for " + serviceId
                + (cycle.isEmpty() ? "" : ": " + String.join(" -> ", cycle)));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
