package com.conductor.core.model;

import java.util.List;
import java.util.Map;

/**
 * Whole-registry dependency validation.
 *
 * @param valid                 no cycles and no missing dependencies
 * @param circularDependencies  distinct cycles, each listed once without repeating its first node
 * @param missingDependencies   declared dependencies that are not registered
 * @param warnings              non-fatal findings
 * @param dependencyGraph       service id to declared dependencies
 * @param startupOrder          every registered service in a safe start order; empty if cyclic
 */
public record DependencyReport(
    boolean valid,
    List<List<String>> circularDependencies,
    List<MissingDependency> missingDependencies,
    List<Warning> warnings,
    Map<String, List<String>> dependencyGraph,
    List<String> startupOrder
) {

    public record MissingDependency(String service, String missingDependency) {}

    public record Warning(String service, String type, String message) {}
}
