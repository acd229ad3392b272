package com.conductor.dispatch.cli;

import com.conductor.core.events.EventBus;
import com.conductor.core.monitor.HealthMonitor;
import com.conductor.core.monitor.MonitorSettings;
import com.conductor.core.monitor.MonitorSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CLI command: conductor monitor [--interval N] [--max-restarts N] [--[no-]auto-restart]
 * <p>
 * Runs the health monitor in the foreground and prints its events until
 * interrupted, or for {@code --duration} seconds. {@code --once} performs a
 * single check of every service and prints the result.
 */
@Command(name = "monitor", mixinStandardHelpOptions = true, description = "Monitor service health")
@Component
public class MonitorCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MonitorCommand.class);

    @Option(names = {"--interval", "-i"}, description = "Check interval in seconds (default: configured)")
    private Integer intervalSeconds;

    @Option(names = {"--max-restarts"}, description = "Restart attempts before giving up (default: configured)")
    private Integer maxRestarts;

    @Option(names = {"--auto-restart"}, negatable = true,
            description = "Restart services that turn unhealthy (default: configured)")
    private Boolean autoRestart;

    @Option(names = {"--once"}, description = "Check every service once and exit")
    private boolean once;

    @Option(names = {"--duration"}, description = "Stop after this many seconds (default: run until interrupted)")
    private Long durationSeconds;

    private final HealthMonitor healthMonitor;
    private final EventBus eventBus;

    public MonitorCommand(HealthMonitor healthMonitor, EventBus eventBus) {
        this.healthMonitor = healthMonitor;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        MonitorSettings settings;
        try {
            settings = applyOverrides(healthMonitor.getSettings());
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid monitor settings: " + e.getMessage());
            return 2;
        }
        healthMonitor.updateSettings(settings);

        var subscription = eventBus.subscribeAll(ConsoleOutput::event);
        try {
            if (once) {
                healthMonitor.checkAllServices();
                return printSnapshot(healthMonitor.getStatus());
            }
            return runUntilStopped(settings);
        } finally {
            subscription.unsubscribe();
        }
    }

    private int runUntilStopped(MonitorSettings settings) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info(String.format("Monitoring every %ds (auto-restart %s, max restarts %d)",
                settings.checkInterval().toSeconds(),
                settings.autoRestart() ? "on" : "off",
                settings.maxRestartAttempts()));

        var stopped = new CountDownLatch(1);
        Thread hook = new Thread(stopped::countDown, "monitor-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        healthMonitor.start();
        try {
            if (durationSeconds != null) {
                stopped.await(durationSeconds, TimeUnit.SECONDS);
            } else {
                stopped.await();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            healthMonitor.stop();
            removeHook(hook);
        }
        ConsoleOutput.info("Monitor stopped.");
        return 0;
    }

    private MonitorSettings applyOverrides(MonitorSettings settings) {
        if (intervalSeconds != null) settings = settings.withCheckInterval(Duration.ofSeconds(intervalSeconds));
        if (maxRestarts != null) settings = settings.withMaxRestartAttempts(maxRestarts);
        if (autoRestart != null) settings = settings.withAutoRestart(autoRestart);
        return settings;
    }

    private static int printSnapshot(MonitorSnapshot snapshot) {
        if (snapshot.services().isEmpty()) {
            ConsoleOutput.info("No services registered");
            return 0;
        }
        System.out.printf("  %-20s %-10s %-10s %s%n", "SERVICE", "STATE", "HEALTH", "DETAILS");
        System.out.println("  " + "-".repeat(60));
        boolean allRunning = true;
        for (Map.Entry<String, MonitorSnapshot.ServiceSnapshot> entry : snapshot.services().entrySet()) {
            ConsoleOutput.status(entry.getValue().status());
            allRunning &= entry.getValue().status().running();
        }
        return allRunning ? 0 : 1;
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM shutting down, shutdown hook left in place");
        }
    }
}
