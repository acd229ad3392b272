package com.conductor.core.error;

import java.time.Duration;

/**
 * Thrown when bounded status polling runs out of attempts (or time) before the
 * desired state is observed.
 */
public class ConvergenceTimeoutException extends ConductorException {

    private final int attempts;

    public ConvergenceTimeoutException(String serviceId, String desiredState, int attempts, Duration elapsed) {
        super("Service " + serviceId + " did not reach " + desiredState
                + " after " + attempts + " attempts (" + elapsed.toMillis() + "ms)");
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
