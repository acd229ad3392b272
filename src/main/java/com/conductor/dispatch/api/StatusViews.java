package com.conductor.dispatch.api;

import com.conductor.core.model.LifecycleResult;
import com.conductor.core.model.PublishedPort;
import com.conductor.core.model.ServiceStatus;
import com.conductor.core.monitor.MonitorSettings;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON shapes shared by the REST controllers. States and health use their wire names.
 */
final class StatusViews {

    private StatusViews() {
    }

    static Map<String, Object> status(ServiceStatus status) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", status.id());
        body.put("status", status.state().wireName());
        body.put("running", status.running());
        body.put("health", status.health().wireName());
        if (status.exitCode() != null) body.put("exitCode", status.exitCode());
        List<Map<String, Object>> ports = status.publishedPorts().stream().map(StatusViews::port).toList();
        body.put("publishedPorts", ports);
        if (status.error() != null) body.put("error", status.error());
        return body;
    }

    static Map<String, Object> result(LifecycleResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("serviceId", result.serviceId());
        body.put("outcome", result.outcome().name());
        body.put("detail", result.detail());
        return body;
    }

    static Map<String, Object> settings(MonitorSettings settings) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("checkIntervalMs", settings.checkInterval().toMillis());
        body.put("autoRestart", settings.autoRestart());
        body.put("maxRestartAttempts", settings.maxRestartAttempts());
        body.put("initialRestartDelayMs", settings.initialRestartDelay().toMillis());
        body.put("backoffMultiplier", settings.backoffMultiplier());
        body.put("checkParallelism", settings.checkParallelism());
        body.put("cascadeOnFailure", settings.cascadeOnFailure());
        body.put("strictHealth", settings.strictHealth());
        return body;
    }

    private static Map<String, Object> port(PublishedPort port) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("published", port.publishedPort());
        body.put("target", port.targetPort());
        body.put("protocol", port.protocol());
        return body;
    }
}
