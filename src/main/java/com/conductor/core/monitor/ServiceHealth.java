package com.conductor.core.monitor;

import com.conductor.core.model.ProbeHealth;
import com.conductor.core.model.ServiceManifest;
import com.conductor.core.model.ServiceState;
import com.conductor.core.model.ServiceStatus;

/**
 * Health of a service as the monitor sees it. UNKNOWN stands for "never observed".
 */
public enum ServiceHealth {
    UNKNOWN,
    HEALTHY,
    UNHEALTHY;

    /**
     * not_found and not running are unhealthy; with a health check enabled the probe
     * decides; otherwise running means healthy.
     */
    public static boolean isServiceHealthy(ServiceStatus status, ServiceManifest manifest) {
        if (status.state() == ServiceState.NOT_FOUND) {
            return false;
        }
        if (!status.running()) {
            return false;
        }
        if (manifest != null && manifest.healthCheckEnabled()) {
            return status.health() == ProbeHealth.HEALTHY;
        }
        return true;
    }

    public static ServiceHealth of(ServiceStatus status, ServiceManifest manifest) {
        if (status == null) return UNKNOWN;
        return isServiceHealthy(status, manifest) ? HEALTHY : UNHEALTHY;
    }

    /**
     * The edge taken when moving from this state to {@code next}. Only edges into
     * HEALTHY or UNHEALTHY from a different state produce action.
     */
    public Transition transitionTo(ServiceHealth next) {
        if (next == this || next == UNKNOWN) return Transition.NONE;
        return next == HEALTHY ? Transition.BECAME_HEALTHY : Transition.BECAME_UNHEALTHY;
    }

    public enum Transition {
        NONE,
        BECAME_HEALTHY,
        BECAME_UNHEALTHY
    }
}
