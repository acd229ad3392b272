package com.conductor.core.events;

import com.conductor.core.model.ServiceStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * An event emitted by the health monitor, consumed by logging, CLI and alerting
 * subscribers. Events are not persisted.
 *
 * @param type      event type
 * @param serviceId the service this event is about (the failed service for cascades)
 * @param payload   event-specific fields: {@code status}, {@code attempt}, {@code degraded},
 *                  {@code attempts} or {@code affectedServices}
 * @param timestamp when the event occurred
 */
public record MonitorEvent(
    MonitorEventType type,
    String serviceId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public MonitorEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    public static MonitorEvent healthy(String serviceId, ServiceStatus status) {
        return new MonitorEvent(MonitorEventType.SERVICE_HEALTHY, serviceId, Map.of("status", status), Instant.now());
    }

    public static MonitorEvent unhealthy(String serviceId, ServiceStatus status) {
        return new MonitorEvent(MonitorEventType.SERVICE_UNHEALTHY, serviceId, Map.of("status", status), Instant.now());
    }

    public static MonitorEvent restarted(String serviceId, int attempt, boolean degraded) {
        return new MonitorEvent(MonitorEventType.SERVICE_RESTARTED, serviceId,
                Map.of("attempt", attempt, "degraded", degraded), Instant.now());
    }

    public static MonitorEvent restartFailed(String serviceId, int attempts) {
        return new MonitorEvent(MonitorEventType.SERVICE_RESTART_FAILED, serviceId,
                Map.of("attempts", attempts), Instant.now());
    }

    public static MonitorEvent cascade(String failedServiceId, List<String> affectedServices) {
        return new MonitorEvent(MonitorEventType.DEPENDENCY_CASCADE, failedServiceId,
                Map.of("affectedServices", List.copyOf(affectedServices)), Instant.now());
    }

    @SuppressWarnings("unchecked")
    public List<String> affectedServices() {
        return (List<String>) payload.getOrDefault("affectedServices", List.of());
    }

    public int attempt() {
        Object value = payload.containsKey("attempt") ? payload.get("attempt") : payload.get("attempts");
        return value instanceof Integer i ? i : 0;
    }
}
