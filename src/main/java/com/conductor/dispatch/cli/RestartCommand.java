package com.conductor.dispatch.cli;

import com.conductor.core.error.ConductorException;
import com.conductor.core.manager.ServiceManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: conductor restart &lt;service&gt;
 */
@Command(name = "restart", mixinStandardHelpOptions = true, description = "Restart a service")
@Component
public class RestartCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Service ID")
    private String serviceId;

    private final ServiceManager serviceManager;

    public RestartCommand(ServiceManager serviceManager) {
        this.serviceManager = serviceManager;
    }

    @Override
    public Integer call() {
        ConsoleOutput.info("Restarting " + serviceId + "...");
        try {
            return ConsoleOutput.result(serviceManager.restartService(serviceId));
        } catch (ConductorException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
