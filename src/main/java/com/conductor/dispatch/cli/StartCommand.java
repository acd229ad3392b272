package com.conductor.dispatch.cli;

import com.conductor.core.error.ConductorException;
import com.conductor.core.manager.ServiceManager;
import com.conductor.core.model.LifecycleResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: conductor start &lt;service&gt; [--with-deps]
 */
@Command(name = "start", mixinStandardHelpOptions = true, description = "Start a service")
@Component
public class StartCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Service ID")
    private String serviceId;

    @Option(names = {"--with-deps", "-d"}, description = "Start dependencies first, in dependency order")
    private boolean withDependencies;

    private final ServiceManager serviceManager;

    public StartCommand(ServiceManager serviceManager) {
        this.serviceManager = serviceManager;
    }

    @Override
    public Integer call() {
        ConsoleOutput.info("Starting " + serviceId + (withDependencies ? " with dependencies" : "") + "...");
        try {
            LifecycleResult result = withDependencies
                    ? serviceManager.startWithDependencies(serviceId)
                    : serviceManager.startService(serviceId);
            return ConsoleOutput.result(result);
        } catch (ConductorException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
