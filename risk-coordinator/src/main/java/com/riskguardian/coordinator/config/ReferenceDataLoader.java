package com.riskguardian.coordinator.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskguardian.analysis.reference.CategoryMapping;
import com.riskguardian.analysis.reference.PriceHistory;
import com.riskguardian.common.model.ScenarioRecord;
import com.riskguardian.knowledge.ScenarioCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the read-only reference tables from the classpath at startup. Any missing or malformed
 * file stops the application: the coordinator never runs on partial reference data.
 */
public class ReferenceDataLoader {

    private static final Logger log = LoggerFactory.getLogger(ReferenceDataLoader.class);

    private final ObjectMapper objectMapper;

    public ReferenceDataLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<ScenarioRecord> loadScenarios(String location) {
        try (InputStream json = new ClassPathResource(location).getInputStream()) {
            List<ScenarioRecord> scenarios = ScenarioCatalog.read(json, objectMapper);
            log.info("Scenario catalog loaded. location={} scenarios={}", location, scenarios.size());
            return scenarios;
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load scenario catalog from " + location, e);
        }
    }

    public CategoryMapping loadCategoryMapping(String location) {
        Map<String, List<String>> symbolsByCategory =
            read(location, new TypeReference<LinkedHashMap<String, List<String>>>() {});
        CategoryMapping mapping = CategoryMapping.fromCategories(symbolsByCategory);
        log.info("Category mapping loaded. location={} categories={} symbols={}",
                 location, symbolsByCategory.size(), mapping.size());
        return mapping;
    }

    public PriceHistory loadPriceHistory(String location) {
        Map<String, List<Double>> closesBySymbol =
            read(location, new TypeReference<LinkedHashMap<String, List<Double>>>() {});
        PriceHistory history = PriceHistory.of(closesBySymbol);
        log.info("Price history loaded. location={} symbols={}", location, history.symbols().size());
        return history;
    }

    private <T> T read(String location, TypeReference<T> type) {
        try (InputStream json = new ClassPathResource(location).getInputStream()) {
            return objectMapper.readValue(json, type);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load reference data from " + location, e);
        }
    }
}
