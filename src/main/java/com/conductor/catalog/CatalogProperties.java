package com.conductor.catalog;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Catalog location, bound from {@code conductor.catalog.*}.
 */
@Component
@ConfigurationProperties(prefix = "conductor.catalog")
public class CatalogProperties {

    private String path = System.getProperty("user.home") + "/.conductor/catalog.json";
    private boolean loadOnStartup = true;

    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }
    public boolean isLoadOnStartup() { return loadOnStartup; }
    public void setLoadOnStartup(boolean loadOnStartup) { this.loadOnStartup = loadOnStartup; }
}
