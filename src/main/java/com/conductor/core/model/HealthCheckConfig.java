package com.conductor.core.model;

import java.util.Map;

/**
 * Health check declaration from the catalog. The probe parameters are passed through
 * untouched; only {@code enabled} is interpreted by the orchestrator.
 *
 * @param enabled    whether the service's probe result gates its health
 * @param parameters probe parameters (interval, path, retries, ...)
 */
public record HealthCheckConfig(boolean enabled, Map<String, Object> parameters) {

    public HealthCheckConfig {
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
    }

    public static HealthCheckConfig disabled() {
        return new HealthCheckConfig(false, Map.of());
    }
}
