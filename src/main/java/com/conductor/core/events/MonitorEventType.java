package com.conductor.core.events;

public enum MonitorEventType {
    SERVICE_HEALTHY("service-healthy"),
    SERVICE_UNHEALTHY("service-unhealthy"),
    SERVICE_RESTARTED("service-restarted"),
    SERVICE_RESTART_FAILED("service-restart-failed"),
    DEPENDENCY_CASCADE("dependency-cascade");

    private final String wireName;

    MonitorEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
