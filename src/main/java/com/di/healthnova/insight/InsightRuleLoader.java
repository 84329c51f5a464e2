package com.di.healthnova.insight;

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
 * Loads insight rules from YAML ({@code healthnova.insights.rules-location}).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InsightRuleLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ResourceLoader resourceLoader;
    private final HealthNovaProperties properties;

    public InsightRuleCatalog load() {
        return load(properties.getInsights().getRulesLocation());
    }

    public InsightRuleCatalog load(String location) {
        Resource resource = resourceLoader.getResource(location.trim());
        if (!resource.exists()) {
            throw new IllegalStateException("Insight rules not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            InsightRuleCatalog catalog = InsightRuleCatalog.from(YAML_MAPPER.readValue(in, InsightRulesDocument.class));
            log.info("[INSIGHT] Loaded {} rule(s), version {}, from {}", catalog.getRules().size(), catalog.getVersion(), location);
            return catalog;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read insight rules " + location + ": " + e.getMessage(), e);
        }
    }
}
