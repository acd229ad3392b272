package com.conductor.catalog;

import com.conductor.core.model.ServiceManifest;

import java.util.List;

/**
 * Source of service manifests.
 */
public interface CatalogLoader {

    /**
     * @return manifests in catalog order
     * @throws CatalogException when the catalog cannot be read or parsed
     */
    List<ServiceManifest> load();
}
