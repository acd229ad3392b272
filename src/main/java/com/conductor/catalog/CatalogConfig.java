package com.conductor.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class CatalogConfig {

    @Bean
    @ConditionalOnMissingBean(CatalogLoader.class)
    public CatalogLoader catalogLoader(CatalogProperties properties, ObjectMapper objectMapper) {
        return new JsonCatalogLoader(Path.of(properties.getPath()), objectMapper);
    }
}
