package com.conductor.catalog;

import com.conductor.core.model.HealthCheckConfig;
import com.conductor.core.model.ServiceManifest;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the JSON service catalog:
 * <pre>
 * {"servers": [
 *   {"id": "db", "source": {"version": "15.2"}, "config": {"port": 5432},
 *    "dependencies": [], "lifecycle": {...}, "healthCheck": {"enabled": true, ...}}
 * ]}
 * </pre>
 * Missing versions default to {@code latest}; missing dependencies to none. A health
 * check is only enabled by an explicit {@code "enabled": true}. Entries without an id
 * are skipped; an unreadable file or a missing {@code servers} array fails the load.
 */
public class JsonCatalogLoader implements CatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(JsonCatalogLoader.class);

    static final String DEFAULT_VERSION = "latest";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Path catalogPath;
    private final ObjectMapper objectMapper;

    public JsonCatalogLoader(Path catalogPath, ObjectMapper objectMapper) {
        this.catalogPath = catalogPath;
        this.objectMapper = objectMapper;
    }

    public Path getCatalogPath() {
        return catalogPath;
    }

    @Override
    public List<ServiceManifest> load() {
        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readString(catalogPath));
        } catch (IOException e) {
            throw new CatalogException("Failed to read catalog " + catalogPath + ": " + e.getMessage(), e);
        }
        if (root == null || !root.path("servers").isArray()) {
            throw new CatalogException("Catalog " + catalogPath + " has no 'servers' array");
        }

        var manifests = new ArrayList<ServiceManifest>();
        int index = 0;
        for (JsonNode server : root.get("servers")) {
            try {
                manifests.add(toManifest(server, index));
            } catch (CatalogException e) {
                log.warn("Skipping catalog entry: {}", e.getMessage());
            }
            index++;
        }
        return manifests;
    }

    private ServiceManifest toManifest(JsonNode server, int index) {
        String id = server.path("id").asText("");
        if (id.isBlank()) {
            throw new CatalogException("Catalog entry " + index + " has no id");
        }

        String version = server.path("source").path("version").asText("");
        if (version.isBlank()) version = DEFAULT_VERSION;

        JsonNode portNode = server.path("config").path("port");
        Integer port = portNode.canConvertToInt() ? portNode.asInt() : null;

        var dependencies = new ArrayList<String>();
        for (JsonNode dependency : server.path("dependencies")) {
            if (!dependency.asText("").isBlank()) {
                dependencies.add(dependency.asText());
            }
        }

        Map<String, Object> lifecycle = toMap(server.path("lifecycle"));
        return new ServiceManifest(id, version, port, dependencies, lifecycle, toHealthCheck(server.path("healthCheck")));
    }

    private HealthCheckConfig toHealthCheck(JsonNode node) {
        if (!node.isObject()) return HealthCheckConfig.disabled();
        Map<String, Object> parameters = new LinkedHashMap<>(toMap(node));
        parameters.remove("enabled");
        // only an explicit "enabled": true gates health on the probe
        boolean enabled = node.path("enabled").asBoolean(false);
        return new HealthCheckConfig(enabled, parameters);
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (!node.isObject()) return Map.of();
        Map<String, Object> values = objectMapper.convertValue(node, MAP_TYPE);
        values.values().removeIf(v -> v == null);
        return values;
    }
}
