package com.conductor.core.registry;

import com.conductor.core.error.ManifestValidationException;
import com.conductor.core.error.ServiceNotFoundException;
import com.conductor.core.model.CompatibilityResult;
import com.conductor.core.model.ServiceManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory catalog of service manifests and their declared dependencies.
 * <p>
 * Reads may run concurrently (the health monitor polls from a worker pool);
 * registration and unregistration are serialized. Iteration order is registration order.
 */
@Service
public class ServiceRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServiceRegistry.class);

    private final Map<String, ServiceManifest> manifests = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Registers a manifest, replacing any previous manifest with the same id.
     *
     * @throws ManifestValidationException if id or version is missing
     */
    public void register(ServiceManifest manifest) {
        if (manifest == null || isBlank(manifest.id()) || isBlank(manifest.version())) {
            throw new ManifestValidationException("Service manifest must include id and version");
        }
        lock.writeLock().lock();
        try {
            ServiceManifest previous = manifests.put(manifest.id(), manifest);
            if (previous != null) {
                log.debug("Re-registered service {} ({} -> {})", manifest.id(), previous.version(), manifest.version());
            } else {
                log.debug("Registered service {} {} (deps: {})", manifest.id(), manifest.version(), manifest.dependencies());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes a manifest and its dependency edges. Does nothing if the id is unknown.
     *
     * @return true if a manifest was removed
     */
    public boolean unregister(String serviceId) {
        lock.writeLock().lock();
        try {
            boolean removed = manifests.remove(serviceId) != null;
            if (removed) {
                log.debug("Unregistered service {}", serviceId);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<ServiceManifest> find(String serviceId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(manifests.get(serviceId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @throws ServiceNotFoundException if the id is not registered
     */
    public ServiceManifest require(String serviceId) {
        return find(serviceId).orElseThrow(() -> new ServiceNotFoundException(serviceId));
    }

    public boolean contains(String serviceId) {
        return find(serviceId).isPresent();
    }

    public List<ServiceManifest> getAllServices() {
        lock.readLock().lock();
        try {
            return List.copyOf(manifests.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Declared dependencies of one service; empty when the service has no manifest.
     */
    public List<String> dependenciesOf(String serviceId) {
        return find(serviceId).map(ServiceManifest::dependencies).orElse(List.of());
    }

    /**
     * Snapshot of the dependency graph: service id to declared dependency ids,
     * in registration order.
     */
    public Map<String, List<String>> dependencyGraph() {
        lock.readLock().lock();
        try {
            var graph = new LinkedHashMap<String, List<String>>();
            manifests.forEach((id, manifest) -> graph.put(id, manifest.dependencies()));
            return graph;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return manifests.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Checks whether a requested version is compatible with the registered one.
     * Versions are compatible when their major components match.
     */
    public CompatibilityResult validateCompatibility(String serviceId, String version) {
        var manifest = find(serviceId);
        if (manifest.isEmpty()) {
            return new CompatibilityResult(false, "Service not found in registry");
        }
        String registered = manifest.get().version();
        if (!majorOf(registered).equals(majorOf(version))) {
            return new CompatibilityResult(false,
                    "Major version mismatch: " + registered + " vs " + version);
        }
        return new CompatibilityResult(true, "Versions are compatible");
    }

    private static String majorOf(String version) {
        if (version == null) return "";
        String v = version.startsWith("v") ? version.substring(1) : version;
        int dot = v.indexOf('.');
        return dot < 0 ? v : v.substring(0, dot);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
