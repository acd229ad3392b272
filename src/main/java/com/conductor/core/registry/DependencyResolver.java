package com.conductor.core.registry;

import com.conductor.core.error.CircularDependencyException;
import com.conductor.core.model.DependencyReport;
import com.conductor.core.model.DependencyReport.MissingDependency;
import com.conductor.core.model.DependencyReport.Warning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes start orders and detects cycles over the dependency graph held by
 * {@link ServiceRegistry}.
 * <p>
 * Every query works on a snapshot of the graph taken at call time, so results are a
 * pure function of the manifests registered at that moment. Ids without a manifest
 * contribute no dependencies of their own.
 */
@Service
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    /** Direct dependency count above which validation warns. */
    static final int HIGH_DEPENDENCY_COUNT = 5;

    private final ServiceRegistry registry;

    public DependencyResolver(ServiceRegistry registry) {
        this.registry = registry;
    }

    /**
     * Transitive dependencies of a service in safe start order, excluding the service
     * itself. Each dependency appears once, before anything that depends on it; declared
     * order is preserved and a shared dependency sits at its first-required position.
     *
     * @throws CircularDependencyException if a cycle is reachable from {@code serviceId}
     */
    public List<String> resolveDependencies(String serviceId) {
        var graph = registry.dependencyGraph();
        List<String> cycle = findCycle(graph, serviceId);
        if (!cycle.isEmpty()) {
            throw new CircularDependencyException(serviceId, cycle);
        }
        var order = postOrder(graph, serviceId);
        log.debug("Resolved dependencies for {}: {}", serviceId, order);
        return order;
    }

    /**
     * DFS with a recursion stack; true as soon as a back edge is found.
     */
    public boolean hasCircularDependency(String serviceId) {
        return !findCycle(registry.dependencyGraph(), serviceId).isEmpty();
    }

    /**
     * The first cycle reachable from {@code serviceId}, as a path that starts and ends
     * with the same id (e.g. {@code [a, b, a]}); empty if there is none.
     */
    public List<String> findCycle(String serviceId) {
        return findCycle(registry.dependencyGraph(), serviceId);
    }

    /**
     * Registered services whose transitive dependencies include {@code serviceId},
     * in registration order.
     */
    public List<String> getServiceDependents(String serviceId) {
        var graph = registry.dependencyGraph();
        var dependents = new ArrayList<String>();
        for (String candidate : graph.keySet()) {
            if (candidate.equals(serviceId)) continue;
            if (postOrder(graph, candidate).contains(serviceId)) {
                dependents.add(candidate);
            }
        }
        return dependents;
    }

    /**
     * Orders the given services so that each comes before anything it depends on:
     * the reverse of a start order, restricted to {@code serviceIds}.
     */
    public List<String> shutdownOrder(Collection<String> serviceIds) {
        var graph = registry.dependencyGraph();
        var members = new LinkedHashSet<>(serviceIds);
        var done = new LinkedHashSet<String>();
        var entered = new HashSet<String>();
        for (String id : members) {
            visitWithin(graph, id, members, done, entered);
        }
        var order = new ArrayList<>(done);
        Collections.reverse(order);
        return order;
    }

    /**
     * Every registered service in a safe start order. Dependencies without a manifest
     * are left out.
     *
     * @throws CircularDependencyException if the registry contains a cycle
     */
    public List<String> startupOrder() {
        var graph = registry.dependencyGraph();
        for (String id : graph.keySet()) {
            List<String> cycle = findCycle(graph, id);
            if (!cycle.isEmpty()) {
                throw new CircularDependencyException(id, cycle);
            }
        }
        var visited = new LinkedHashSet<String>();
        for (String id : graph.keySet()) {
            visitRegistered(graph, id, visited);
        }
        return new ArrayList<>(visited);
    }

    /**
     * Validates the whole registry: cycles, missing dependencies, and warnings for
     * services with many dependencies or with neither dependencies nor dependents.
     */
    public DependencyReport validate() {
        var graph = registry.dependencyGraph();

        var cycles = new ArrayList<List<String>>();
        var cycleKeys = new HashSet<Set<String>>();
        for (String id : graph.keySet()) {
            List<String> cycle = findCycle(graph, id);
            if (cycle.isEmpty()) continue;
            var members = cycle.subList(0, cycle.size() - 1);
            if (cycleKeys.add(new TreeSet<>(members))) {
                cycles.add(List.copyOf(members));
            }
        }

        var missing = new ArrayList<MissingDependency>();
        var hasDependents = new HashSet<String>();
        graph.forEach((id, deps) -> {
            for (String dep : deps) {
                hasDependents.add(dep);
                if (!graph.containsKey(dep)) {
                    missing.add(new MissingDependency(id, dep));
                }
            }
        });

        var warnings = new ArrayList<Warning>();
        graph.forEach((id, deps) -> {
            if (deps.size() > HIGH_DEPENDENCY_COUNT) {
                warnings.add(new Warning(id, "high-dependency-count",
                        "Service has " + deps.size() + " dependencies, consider refactoring"));
            }
        });
        graph.forEach((id, deps) -> {
            if (deps.isEmpty() && !hasDependents.contains(id)) {
                warnings.add(new Warning(id, "orphaned", "Service has no dependencies and no dependents"));
            }
        });

        List<String> order = cycles.isEmpty() ? startupOrder() : List.of();
        boolean valid = cycles.isEmpty() && missing.isEmpty();
        return new DependencyReport(valid, cycles, missing, warnings, graph, order);
    }

    // -- graph traversal ------------------------------------------------------

    private static List<String> postOrder(Map<String, List<String>> graph, String serviceId) {
        var done = new LinkedHashSet<String>();
        visitPostOrder(graph, serviceId, done, new HashSet<>());
        done.remove(serviceId);
        return new ArrayList<>(done);
    }

    /**
     * Post-order DFS; {@code done} doubles as the output order. {@code entered} keeps the
     * walk finite when the graph is cyclic.
     */
    private static void visitPostOrder(Map<String, List<String>> graph, String id,
                                       Set<String> done, Set<String> entered) {
        if (!entered.add(id)) return;
        for (String dep : graph.getOrDefault(id, List.of())) {
            visitPostOrder(graph, dep, done, entered);
        }
        done.add(id);
    }

    private static void visitWithin(Map<String, List<String>> graph, String id, Set<String> members,
                                    Set<String> done, Set<String> entered) {
        if (!entered.add(id)) return;
        for (String dep : graph.getOrDefault(id, List.of())) {
            if (members.contains(dep)) {
                visitWithin(graph, dep, members, done, entered);
            }
        }
        done.add(id);
    }

    private static void visitRegistered(Map<String, List<String>> graph, String id, Set<String> done) {
        if (done.contains(id)) return;
        for (String dep : graph.getOrDefault(id, List.of())) {
            if (graph.containsKey(dep)) {
                visitRegistered(graph, dep, done);
            }
        }
        done.add(id);
    }

    private static List<String> findCycle(Map<String, List<String>> graph, String start) {
        var path = new ArrayList<String>();
        var onPath = new HashSet<String>();
        var visited = new HashSet<String>();
        return detect(graph, start, path, onPath, visited) ? path : List.of();
    }

    /**
     * On success {@code path} holds the cycle, closed by repeating its first node.
     */
    private static boolean detect(Map<String, List<String>> graph, String id, List<String> path,
                                  Set<String> onPath, Set<String> visited) {
        visited.add(id);
        onPath.add(id);
        path.add(id);
        for (String dep : graph.getOrDefault(id, List.of())) {
            if (onPath.contains(dep)) {
                var cycle = new ArrayList<>(path.subList(path.indexOf(dep), path.size()));
                cycle.add(dep);
                path.clear();
                path.addAll(cycle);
                return true;
            }
            if (!visited.contains(dep) && detect(graph, dep, path, onPath, visited)) {
                return true;
            }
        }
        onPath.remove(id);
        path.remove(path.size() - 1);
        return false;
    }
}
