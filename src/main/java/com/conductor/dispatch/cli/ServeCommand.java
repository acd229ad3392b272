package com.conductor.dispatch.cli;

import com.conductor.core.events.EventBus;
import com.conductor.core.events.MonitorEventType;
import com.conductor.core.monitor.HealthMonitor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.EnumSet;

/**
 * CLI command: conductor serve
 * <p>
 * Runs Conductor as a long-running server exposing the REST API, with the health
 * monitor started. The web server is enabled by
 * {@link com.conductor.ConductorApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli in that mode. The banner is printed once the
 * embedded server is ready. Restart failures and dependency cascades are echoed to
 * the server console.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Conductor HTTP server and health monitor")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    private final HealthMonitor healthMonitor;
    private final EventBus eventBus;

    public ServeCommand(HealthMonitor healthMonitor, EventBus eventBus) {
        this.healthMonitor = healthMonitor;
        this.eventBus = eventBus;
    }

    @Override
    public void run() {
        // only reached through picocli (e.g. --help); CliRunner skips picocli in serve mode
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        eventBus.subscribe(EnumSet.of(MonitorEventType.SERVICE_RESTART_FAILED, MonitorEventType.DEPENDENCY_CASCADE),
                ConsoleOutput::event);
        healthMonitor.start();
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Conductor server running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1/services");
        System.out.println("  Monitor:    http://localhost:" + port + "/api/v1/monitor");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
