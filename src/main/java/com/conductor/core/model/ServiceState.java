package com.conductor.core.model;

/**
 * Process-level state of a managed service as reported by the supervisor.
 */
public enum ServiceState {
    RUNNING("running"),
    EXITED("exited"),
    NOT_FOUND("not_found"),
    ERROR("error");

    private final String wireName;

    ServiceState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Maps a raw container state ("running", "exited", "created", "paused", ...) onto
     * the four states the orchestrator distinguishes. Anything that is not running is
     * treated as exited.
     */
    public static ServiceState fromContainerState(String raw) {
        if (raw == null || raw.isBlank()) return NOT_FOUND;
        return "running".equalsIgnoreCase(raw.trim()) ? RUNNING : EXITED;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
