package com.conductor.core.model;

/**
 * Result of the container's own health probe.
 */
public enum ProbeHealth {
    HEALTHY("healthy"),
    UNHEALTHY("unhealthy"),
    /** No probe configured for the container. */
    NONE("none"),
    UNKNOWN("unknown");

    private final String wireName;

    ProbeHealth(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ProbeHealth fromProbeStatus(String raw) {
        if (raw == null || raw.isBlank()) return NONE;
        return switch (raw.trim().toLowerCase()) {
            case "healthy" -> HEALTHY;
            case "unhealthy" -> UNHEALTHY;
            case "none" -> NONE;
            default -> UNKNOWN; // "starting" and anything unrecognised
        };
    }

    @Override
    public String toString() {
        return wireName;
    }
}
