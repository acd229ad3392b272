package com.conductor.core.monitor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MonitorSettingsTest {

    @Test
    @DisplayName("defaults match the bound properties")
    void defaults() {
        MonitorSettings settings = MonitorSettings.defaults();

        assertEquals(Duration.ofSeconds(30), settings.checkInterval());
        assertFalse(settings.autoRestart());
        assertEquals(3, settings.maxRestartAttempts());
        assertEquals(Duration.ofSeconds(5), settings.initialRestartDelay());
        assertEquals(2.0, settings.backoffMultiplier());
        assertTrue(settings.cascadeOnFailure());
        assertFalse(settings.strictHealth());
    }

    @Test
    @DisplayName("restart delay grows exponentially with attempts")
    void backoff() {
        MonitorSettings settings = MonitorSettings.defaults();

        assertEquals(Duration.ofSeconds(5), settings.restartDelay(0));
        assertEquals(Duration.ofSeconds(10), settings.restartDelay(1));
        assertEquals(Duration.ofSeconds(20), settings.restartDelay(2));
        assertEquals(Duration.ofSeconds(40), settings.restartDelay(3));
    }

    @Test
    @DisplayName("restart delay is monotonic and saturates instead of overflowing")
    void monotonic() {
        MonitorSettings settings = MonitorSettings.defaults();
        Duration previous = Duration.ZERO;
        for (int attempts = 0; attempts < 80; attempts++) {
            Duration delay = settings.restartDelay(attempts);
            assertTrue(delay.compareTo(previous) >= 0, "attempt " + attempts);
            previous = delay;
        }
    }

    @Test
    @DisplayName("rejects invalid values")
    void validation() {
        MonitorSettings settings = MonitorSettings.defaults();

        assertThrows(IllegalArgumentException.class, () -> settings.withCheckInterval(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> settings.withMaxRestartAttempts(-1));
        assertThrows(IllegalArgumentException.class, () -> settings.withInitialRestartDelay(Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class, () -> new MonitorSettings(
                Duration.ofSeconds(1), false, 3, Duration.ofSeconds(1), 0.5, 1, true, false));
    }

    @Test
    @DisplayName("check parallelism is at least one")
    void parallelismClamped() {
        var settings = new MonitorSettings(Duration.ofSeconds(1), false, 3, Duration.ofSeconds(1), 2.0, 0, true, false);

        assertEquals(1, settings.checkParallelism());
    }
}
