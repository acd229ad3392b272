package com.conductor.core.monitor;

import com.conductor.core.model.ServiceStatus;

import java.util.Map;

/**
 * Point-in-time view of the health monitor.
 *
 * @param running  whether the periodic poll is active
 * @param settings effective configuration
 * @param services last observation per service, in registration order
 */
public record MonitorSnapshot(boolean running, MonitorSettings settings, Map<String, ServiceSnapshot> services) {

    /**
     * @param status               last observed status
     * @param restartAttempts      failed restart attempts in the current incident
     * @param scheduledForRestart  a restart timer is pending
     */
    public record ServiceSnapshot(ServiceStatus status, int restartAttempts, boolean scheduledForRestart) {}
}
