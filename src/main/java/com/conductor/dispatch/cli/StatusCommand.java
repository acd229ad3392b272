package com.conductor.dispatch.cli;

import com.conductor.core.manager.ServiceManager;
import com.conductor.core.model.ServiceManifest;
import com.conductor.core.model.ServiceState;
import com.conductor.core.model.ServiceStatus;
import com.conductor.core.registry.ServiceRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: conductor status [service]
 * <p>
 * Without an argument, lists every registered service.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show service status")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Service ID (default: all registered services)")
    private String serviceId;

    private final ServiceManager serviceManager;
    private final ServiceRegistry registry;

    public StatusCommand(ServiceManager serviceManager, ServiceRegistry registry) {
        this.serviceManager = serviceManager;
        this.registry = registry;
    }

    @Override
    public Integer call() {
        List<String> ids = serviceId != null
                ? List.of(serviceId)
                : registry.getAllServices().stream().map(ServiceManifest::id).toList();
        if (ids.isEmpty()) {
            ConsoleOutput.info("No services registered");
            return 0;
        }

        System.out.printf("  %-20s %-10s %-10s %s%n", "SERVICE", "STATE", "HEALTH", "DETAILS");
        System.out.println("  " + "-".repeat(60));
        boolean allRunning = true;
        for (String id : ids) {
            ServiceStatus status = serviceManager.getServiceStatus(id);
            ConsoleOutput.status(status);
            allRunning &= status.state() == ServiceState.RUNNING;
        }
        // a single service that is not running is an error for scripts
        return serviceId != null && !allRunning ? 1 : 0;
    }
}
