package com.conductor.dispatch.cli;

import com.conductor.core.error.CircularDependencyException;
import com.conductor.core.model.DependencyReport;
import com.conductor.core.registry.DependencyResolver;
import com.conductor.core.registry.ServiceRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: conductor deps &lt;service&gt; | --all
 */
@Command(name = "deps", mixinStandardHelpOptions = true,
        description = "Show a service's dependencies or validate the whole catalog")
@Component
public class DepsCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Service ID")
    private String serviceId;

    @Option(names = "--all", description = "Validate every registered service")
    private boolean all;

    private final DependencyResolver resolver;
    private final ServiceRegistry registry;

    public DepsCommand(DependencyResolver resolver, ServiceRegistry registry) {
        this.resolver = resolver;
        this.registry = registry;
    }

    @Override
    public Integer call() {
        if (all == (serviceId != null)) {
            ConsoleOutput.error("Specify either a service ID or --all");
            return 2;
        }
        return all ? validateAll() : showService(serviceId);
    }

    private int showService(String serviceId) {
        if (!registry.contains(serviceId)) {
            ConsoleOutput.error("Service not found: " + serviceId);
            return 1;
        }
        try {
            List<String> dependencies = resolver.resolveDependencies(serviceId);
            ConsoleOutput.info("Startup order for " + serviceId + ": "
                    + String.join(" -> ", append(dependencies, serviceId)));
        } catch (CircularDependencyException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        List<String> dependents = resolver.getServiceDependents(serviceId);
        ConsoleOutput.info("Dependents: " + (dependents.isEmpty() ? "none" : String.join(", ", dependents)));
        return 0;
    }

    private int validateAll() {
        DependencyReport report = resolver.validate();
        for (List<String> cycle : report.circularDependencies()) {
            ConsoleOutput.error("Circular dependency: " + String.join(" -> ", cycle));
        }
        for (DependencyReport.MissingDependency missing : report.missingDependencies()) {
            ConsoleOutput.error(missing.service() + " depends on unregistered " + missing.missingDependency());
        }
        for (DependencyReport.Warning warning : report.warnings()) {
            ConsoleOutput.warn(warning.service() + ": " + warning.message());
        }
        if (!report.valid()) {
            ConsoleOutput.error("Dependency graph is invalid");
            return 1;
        }
        ConsoleOutput.success("Dependency graph is valid");
        if (!report.startupOrder().isEmpty()) {
            ConsoleOutput.info("Startup order: " + String.join(" -> ", report.startupOrder()));
        }
        return 0;
    }

    private static List<String> append(List<String> list, String last) {
        var result = new ArrayList<>(list);
        result.add(last);
        return result;
    }
}
