package com.conductor.core.monitor;

import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;

/**
 * Restart bookkeeping for one service. All access happens while holding this
 * object's monitor, which makes it the per-service lock for restart scheduling.
 */
final class RestartState {

    private int attempts;
    private ScheduledFuture<?> timer;
    private Future<?> inFlight;
    private boolean exhaustionReported;

    int attempts() {
        return attempts;
    }

    /** A restart timer is pending. */
    boolean isScheduled() {
        return timer != null;
    }

    /** A timer is pending or a restart is executing. */
    boolean isBusy() {
        return timer != null || inFlight != null;
    }

    void arm(ScheduledFuture<?> timer) {
        this.timer = timer;
    }

    /** The timer fired and handed off to the restart worker. */
    void fired(Future<?> inFlight) {
        this.timer = null;
        this.inFlight = inFlight;
    }

    /** The timer fired after the monitor was halted; nothing runs. */
    void timerDiscarded() {
        this.timer = null;
    }

    void finished() {
        this.inFlight = null;
    }

    void recordFailure() {
        attempts++;
    }

    /**
     * Marks exhaustion as reported.
     *
     * @return true the first time it is called in an incident
     */
    boolean reportExhaustion() {
        if (exhaustionReported) return false;
        exhaustionReported = true;
        return true;
    }

    /** Recovery: attempts back to zero, any pending timer cancelled. */
    void reset() {
        attempts = 0;
        exhaustionReported = false;
        cancelTimer();
    }

    void cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
    }

    void cancelAll() {
        cancelTimer();
        if (inFlight != null) {
            inFlight.cancel(true);
            inFlight = null;
        }
    }
}
