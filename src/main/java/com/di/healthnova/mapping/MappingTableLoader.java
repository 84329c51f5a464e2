package com.di.healthnova.mapping;

import com.di.healthnova.config.HealthNovaProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads the canonical mapping table from YAML ({@code healthnova.mapping.table-location}).
 * A missing or invalid table stops startup.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MappingTableLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ResourceLoader resourceLoader;
    private final HealthNovaProperties properties;
    private final UnitConverter unitConverter;

    public CanonicalMappingTable load() {
        return load(properties.getMapping().getTableLocation());
    }

    public CanonicalMappingTable load(String location) {
        Resource resource = resourceLoader.getResource(location.trim());
        if (!resource.exists()) {
            throw new IllegalStateException("Mapping table not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            MappingTableDocument document = YAML_MAPPER.readValue(in, MappingTableDocument.class);
            CanonicalMappingTable table = CanonicalMappingTable.from(document, unitConverter);
            log.info("[MAPPING] Loaded mapping table version {} ({} entries) from {}", table.getVersion(), table.size(), location);
            return table;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read mapping table " + location + ": " + e.getMessage(), e);
        }
    }
}
