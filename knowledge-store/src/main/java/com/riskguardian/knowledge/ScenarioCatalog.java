package com.riskguardian.knowledge;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskguardian.common.model.ScenarioRecord;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the scenario catalog JSON (an array of {@link ScenarioRecord}) in file order.
 * Scenario ids must be unique and non-blank; every entry needs a display name and a period
 * label, since both backends quote them in scenario excerpts.
 */
public final class ScenarioCatalog {

    /** Classpath location of the bundled catalog. */
    public static final String DEFAULT_LOCATION = "data/historical-scenarios.json";

    private ScenarioCatalog() {}

    /** Loads the catalog bundled with this module. */
    public static List<ScenarioRecord> loadDefault(ObjectMapper mapper) throws IOException {
        try (InputStream json = ScenarioCatalog.class.getClassLoader().getResourceAsStream(DEFAULT_LOCATION)) {
            if (json == null) {
                throw new IOException("Scenario catalog not found on classpath: " + DEFAULT_LOCATION);
            }
            return read(json, mapper);
        }
    }

    public static List<ScenarioRecord> read(InputStream json, ObjectMapper mapper) throws IOException {
        List<ScenarioRecord> scenarios = mapper.readValue(json, new TypeReference<List<ScenarioRecord>>() {});
        Set<String> seen = new HashSet<>();
        for (ScenarioRecord scenario : scenarios) {
            if (scenario.scenarioId() == null || scenario.scenarioId().isBlank()) {
                throw new IOException("Scenario catalog entry without scenarioId");
            }
            if (!seen.add(scenario.scenarioId())) {
                throw new IOException("Duplicate scenarioId in catalog: " + scenario.scenarioId());
            }
            requireText(scenario.scenarioId(), "displayName", scenario.displayName());
            requireText(scenario.scenarioId(), "periodLabel", scenario.periodLabel());
        }
        return List.copyOf(scenarios);
    }

    private static void requireText(String scenarioId, String field, String value) throws IOException {
        if (value == null || value.isBlank()) {
            throw new IOException("Scenario " + scenarioId + " has no " + field);
        }
    }
}
