package com.conductor.core.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Declared identity and shape of a managed service.
 *
 * @param id                unique service identifier (also the Compose service name)
 * @param version           service version, "latest" when the catalog omits it
 * @param port              primary port, or {@code null}
 * @param dependencies      ids of services that must be running first, in declared order
 * @param lifecycleConfig   opaque lifecycle settings passed through to the supervisor
 * @param healthCheckConfig health check declaration
 */
public record ServiceManifest(
    String id,
    String version,
    Integer port,
    List<String> dependencies,
    Map<String, Object> lifecycleConfig,
    HealthCheckConfig healthCheckConfig
) {

    public ServiceManifest {
        // duplicates collapse to their first declared position
        dependencies = dependencies != null
                ? List.copyOf(new LinkedHashSet<>(dependencies))
                : List.of();
        lifecycleConfig = lifecycleConfig != null ? Map.copyOf(lifecycleConfig) : Map.of();
        healthCheckConfig = healthCheckConfig != null ? healthCheckConfig : HealthCheckConfig.disabled();
    }

    public static ServiceManifest of(String id, String version, String... dependencies) {
        return new ServiceManifest(id, version, null, List.of(dependencies), Map.of(), null);
    }

    public boolean healthCheckEnabled() {
        return healthCheckConfig.enabled();
    }

    public ServiceManifest withHealthCheck(HealthCheckConfig config) {
        return new ServiceManifest(id, version, port, dependencies, lifecycleConfig, config);
    }
}
