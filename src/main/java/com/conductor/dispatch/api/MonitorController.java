package com.conductor.dispatch.api;

import com.conductor.core.monitor.HealthMonitor;
import com.conductor.core.monitor.MonitorSettings;
import com.conductor.core.monitor.MonitorSnapshot;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for the health monitor.
 */
@RestController
@RequestMapping("/api/v1/monitor")
public class MonitorController {

    private final HealthMonitor healthMonitor;

    public MonitorController(HealthMonitor healthMonitor) {
        this.healthMonitor = healthMonitor;
    }

    /**
     * GET /api/v1/monitor: running flag, effective settings and per-service state.
     */
    @GetMapping
    public Map<String, Object> getStatus() {
        MonitorSnapshot snapshot = healthMonitor.getStatus();
        Map<String, Object> services = new LinkedHashMap<>();
        snapshot.services().forEach((id, service) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("status", StatusViews.status(service.status()));
            entry.put("restartAttempts", service.restartAttempts());
            entry.put("scheduledForRestart", service.scheduledForRestart());
            services.put(id, entry);
        });

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("running", snapshot.running());
        body.put("settings", StatusViews.settings(snapshot.settings()));
        body.put("services", services);
        return body;
    }

    @PostMapping("/start")
    public Map<String, Object> start() {
        healthMonitor.start();
        return Map.of("running", healthMonitor.isRunning());
    }

    @PostMapping("/stop")
    public Map<String, Object> stop() {
        healthMonitor.stop();
        return Map.of("running", healthMonitor.isRunning());
    }

    /**
     * PUT /api/v1/monitor/settings: partial update; absent fields keep their value.
     */
    @PutMapping("/settings")
    public ResponseEntity<Map<String, Object>> updateSettings(@RequestBody SettingsUpdate update) {
        MonitorSettings current = healthMonitor.getSettings();
        MonitorSettings updated = new MonitorSettings(
                update.checkIntervalMs() != null ? Duration.ofMillis(update.checkIntervalMs()) : current.checkInterval(),
                update.autoRestart() != null ? update.autoRestart() : current.autoRestart(),
                update.maxRestartAttempts() != null ? update.maxRestartAttempts() : current.maxRestartAttempts(),
                update.initialRestartDelayMs() != null
                        ? Duration.ofMillis(update.initialRestartDelayMs()) : current.initialRestartDelay(),
                update.backoffMultiplier() != null ? update.backoffMultiplier() : current.backoffMultiplier(),
                update.checkParallelism() != null ? update.checkParallelism() : current.checkParallelism(),
                update.cascadeOnFailure() != null ? update.cascadeOnFailure() : current.cascadeOnFailure(),
                update.strictHealth() != null ? update.strictHealth() : current.strictHealth());
        healthMonitor.updateSettings(updated);
        return ResponseEntity.ok(StatusViews.settings(updated));
    }

    public record SettingsUpdate(
            Long checkIntervalMs,
            Boolean autoRestart,
            Integer maxRestartAttempts,
            Long initialRestartDelayMs,
            Double backoffMultiplier,
            Integer checkParallelism,
            Boolean cascadeOnFailure,
            Boolean strictHealth
    ) {}
}
