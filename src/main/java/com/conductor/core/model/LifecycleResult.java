package com.conductor.core.model;

/**
 * Outcome of a lifecycle operation on one service.
 *
 * @param serviceId the service acted upon
 * @param outcome   overall outcome
 * @param detail    human-readable explanation
 * @param cause     underlying failure, or {@code null}
 */
public record LifecycleResult(String serviceId, Outcome outcome, String detail, Throwable cause) {

    public enum Outcome {
        SUCCEEDED,
        /** Process is up but its health check never reported healthy. */
        DEGRADED,
        FAILED
    }

    public static LifecycleResult succeeded(String serviceId, String detail) {
        return new LifecycleResult(serviceId, Outcome.SUCCEEDED, detail, null);
    }

    public static LifecycleResult degraded(String serviceId, String detail) {
        return new LifecycleResult(serviceId, Outcome.DEGRADED, detail, null);
    }

    public static LifecycleResult failed(String serviceId, String detail) {
        return new LifecycleResult(serviceId, Outcome.FAILED, detail, null);
    }

    public static LifecycleResult failed(String serviceId, String detail, Throwable cause) {
        return new LifecycleResult(serviceId, Outcome.FAILED, detail, cause);
    }

    /** True for SUCCEEDED and DEGRADED: the process is up. */
    public boolean isSuccess() {
        return outcome != Outcome.FAILED;
    }

    public boolean isDegraded() {
        return outcome == Outcome.DEGRADED;
    }
}
