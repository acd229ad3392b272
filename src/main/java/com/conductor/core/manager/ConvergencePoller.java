package com.conductor.core.manager;

import com.conductor.core.error.ConductorException;
import com.conductor.core.error.ConvergenceTimeoutException;
import com.conductor.core.model.ServiceStatus;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Polls a service's status until a desired state is observed, a terminal failure is
 * observed, or the budget runs out. The budget is a number of attempts plus a
 * wall-clock deadline.
 */
final class ConvergencePoller {

    private final int maxAttempts;
    private final Duration interval;
    private final Duration deadline;

    ConvergencePoller(int maxAttempts, Duration interval, Duration deadline) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.interval = interval;
        this.deadline = deadline;
    }

    /**
     * @return the first status satisfying {@code reached} or {@code failed}
     * @throws ConvergenceTimeoutException when neither is observed within the budget
     * @throws ConductorException when the waiting thread is interrupted
     */
    ServiceStatus await(String serviceId, String desiredState, Supplier<ServiceStatus> probe,
                        Predicate<ServiceStatus> reached, Predicate<ServiceStatus> failed) {
        long startNanos = System.nanoTime();
        int attempts = 0;
        while (attempts < maxAttempts) {
            ServiceStatus status = probe.get();
            attempts++;
            if (reached.test(status) || failed.test(status)) {
                return status;
            }
            if (attempts >= maxAttempts || elapsed(startNanos).compareTo(deadline) >= 0) {
                break;
            }
            pause(serviceId, desiredState);
        }
        throw new ConvergenceTimeoutException(serviceId, desiredState, attempts, elapsed(startNanos));
    }

    private void pause(String serviceId, String desiredState) {
        if (interval.isZero() || interval.isNegative()) return;
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConductorException("Interrupted while waiting for " + serviceId + " to become " + desiredState, e);
        }
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
