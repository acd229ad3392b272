package com.conductor.dispatch.api;

import com.conductor.core.manager.ServiceManager;
import com.conductor.core.model.DependencyReport;
import com.conductor.core.model.LifecycleResult;
import com.conductor.core.model.ServiceManifest;
import com.conductor.core.registry.DependencyResolver;
import com.conductor.core.registry.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for registered services and their lifecycle.
 */
@RestController
@RequestMapping("/api/v1/services")
public class ServiceController {

    private static final Logger log = LoggerFactory.getLogger(ServiceController.class);

    private final ServiceRegistry registry;
    private final DependencyResolver resolver;
    private final ServiceManager serviceManager;

    public ServiceController(ServiceRegistry registry, DependencyResolver resolver, ServiceManager serviceManager) {
        this.registry = registry;
        this.resolver = resolver;
        this.serviceManager = serviceManager;
    }

    /**
     * GET /api/v1/services: registered services with their declared dependencies.
     */
    @GetMapping
    public List<Map<String, Object>> listServices() {
        List<Map<String, Object>> services = new ArrayList<>();
        for (ServiceManifest manifest : registry.getAllServices()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", manifest.id());
            entry.put("version", manifest.version());
            if (manifest.port() != null) entry.put("port", manifest.port());
            entry.put("dependencies", manifest.dependencies());
            entry.put("healthCheck", manifest.healthCheckEnabled());
            services.add(entry);
        }
        return services;
    }

    /**
     * GET /api/v1/services/{id}/status: live status from the supervisor.
     * Unknown services report {@code not_found}.
     */
    @GetMapping("/{id}/status")
    public Map<String, Object> getStatus(@PathVariable String id) {
        return StatusViews.status(serviceManager.getServiceStatus(id));
    }

    /**
     * GET /api/v1/services/{id}/dependencies: resolved startup order and dependents.
     */
    @GetMapping("/{id}/dependencies")
    public Map<String, Object> getDependencies(@PathVariable String id) {
        registry.require(id);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", id);
        body.put("dependencies", resolver.resolveDependencies(id));
        body.put("dependents", resolver.getServiceDependents(id));
        return body;
    }

    /**
     * GET /api/v1/services/validation: dependency report over the whole registry.
     */
    @GetMapping("/validation")
    public DependencyReport validate() {
        return resolver.validate();
    }

    /**
     * GET /api/v1/services/{id}/compatibility?version=X
     */
    @GetMapping("/{id}/compatibility")
    public Map<String, Object> checkCompatibility(@PathVariable String id, @RequestParam String version) {
        var result = registry.validateCompatibility(id, version);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("compatible", result.compatible());
        if (result.reason() != null) body.put("reason", result.reason());
        return body;
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<Map<String, Object>> start(@PathVariable String id,
                                                     @RequestParam(defaultValue = "false") boolean withDependencies) {
        log.info("API start request for {} (with dependencies: {})", id, withDependencies);
        LifecycleResult result = withDependencies
                ? serviceManager.startWithDependencies(id)
                : serviceManager.startService(id);
        return respond(result);
    }

    @PostMapping("/{id}/stop")
    public ResponseEntity<Map<String, Object>> stop(@PathVariable String id,
                                                    @RequestParam(required = false) Integer timeoutSeconds) {
        log.info("API stop request for {}", id);
        LifecycleResult result = timeoutSeconds != null
                ? serviceManager.stopService(id, Duration.ofSeconds(timeoutSeconds))
                : serviceManager.stopService(id);
        return respond(result);
    }

    @PostMapping("/{id}/restart")
    public ResponseEntity<Map<String, Object>> restart(@PathVariable String id) {
        log.info("API restart request for {}", id);
        return respond(serviceManager.restartService(id));
    }

    private static ResponseEntity<Map<String, Object>> respond(LifecycleResult result) {
        HttpStatus status = result.isSuccess() ? HttpStatus.OK : HttpStatus.BAD_GATEWAY;
        return ResponseEntity.status(status).body(StatusViews.result(result));
    }
}
