package com.conductor.dispatch.cli;

import com.conductor.core.error.ConductorException;
import com.conductor.core.manager.ServiceManager;
import com.conductor.core.model.LifecycleResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: conductor stop &lt;service&gt; [--stop-deps] [--timeout N]
 * <p>
 * With {@code --stop-deps} every service depending on the target is stopped
 * first, dependents before the services they need.
 */
@Command(name = "stop", mixinStandardHelpOptions = true, description = "Stop a service")
@Component
public class StopCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Service ID")
    private String serviceId;

    @Option(names = {"--stop-deps"}, description = "Stop dependent services first")
    private boolean stopDependents;

    @Option(names = {"--timeout", "-t"}, description = "Graceful stop timeout in seconds (default: configured)")
    private Integer timeoutSeconds;

    private final ServiceManager serviceManager;

    public StopCommand(ServiceManager serviceManager) {
        this.serviceManager = serviceManager;
    }

    @Override
    public Integer call() {
        try {
            if (stopDependents) {
                List<String> stopped = serviceManager.stopDependents(serviceId);
                if (!stopped.isEmpty()) {
                    ConsoleOutput.info("Stopped dependents: " + String.join(", ", stopped));
                }
            }
            LifecycleResult result = timeoutSeconds != null
                    ? serviceManager.stopService(serviceId, Duration.ofSeconds(timeoutSeconds))
                    : serviceManager.stopService(serviceId);
            return ConsoleOutput.result(result);
        } catch (ConductorException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
