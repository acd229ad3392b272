package com.conductor.catalog;

import com.conductor.core.error.ConductorException;
import com.conductor.core.model.ServiceManifest;
import com.conductor.core.registry.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Registers the catalog's manifests when the application context starts.
 * A missing or unreadable catalog leaves the registry empty and is logged,
 * not fatal; an invalid entry is skipped.
 */
@Component
public class CatalogBootstrap implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(CatalogBootstrap.class);

    private final CatalogLoader loader;
    private final ServiceRegistry registry;
    private final CatalogProperties properties;

    public CatalogBootstrap(CatalogLoader loader, ServiceRegistry registry, CatalogProperties properties) {
        this.loader = loader;
        this.registry = registry;
        this.properties = properties;
    }

    @Override
    public void afterPropertiesSet() {
        if (properties.isLoadOnStartup()) {
            reload();
        }
    }

    /**
     * Loads the catalog and registers every entry.
     *
     * @return number of manifests registered
     */
    public int reload() {
        List<ServiceManifest> manifests;
        try {
            manifests = loader.load();
        } catch (CatalogException e) {
            log.warn("Service catalog not loaded: {}", e.getMessage());
            return 0;
        }

        int registered = 0;
        for (ServiceManifest manifest : manifests) {
            try {
                registry.register(manifest);
                registered++;
            } catch (ConductorException e) {
                log.warn("Skipping catalog entry {}: {}", manifest.id(), e.getMessage());
            }
        }
        log.info("Registered {} services from catalog", registered);
        return registered;
    }
}
