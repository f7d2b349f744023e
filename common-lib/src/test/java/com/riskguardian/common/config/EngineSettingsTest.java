package com.riskguardian.common.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EngineSettingsTest {

    @Test
    @DisplayName("defaults match the documented engine configuration")
    void defaults() {
        EngineSettings s = EngineSettings.defaults();
        assertEquals(90, s.windowDays());
        assertEquals(60.0, s.dangerThreshold());
        assertEquals(40.0, s.moderateThreshold());
        assertEquals(85, s.compoundingCorrelationThreshold());
        assertEquals(Duration.ofSeconds(10), s.perCallTimeout());
        assertEquals(Duration.ofSeconds(60), s.overallDeadline());
        assertEquals(KnowledgeBackend.GRAPH, s.knowledgeBackend());
        assertEquals(Duration.ofSeconds(2), s.knowledgeLookupTimeout());
        assertEquals(0.5, s.maxExcludedValueShare());
        assertEquals("ETH", s.referenceSymbol());
    }

    @Test
    @DisplayName("with-methods change one concern and keep the rest")
    void withers() {
        EngineSettings s = EngineSettings.defaults().withThresholds(50.0, 30.0, 80);
        assertEquals(50.0, s.dangerThreshold());
        assertEquals(30.0, s.moderateThreshold());
        assertEquals(80, s.compoundingCorrelationThreshold());
        assertEquals(90, s.windowDays());
    }

    @Test
    @DisplayName("moderate above danger rejected")
    void invertedThresholds() {
        assertThrows(IllegalArgumentException.class,
            () -> EngineSettings.defaults().withThresholds(30.0, 50.0, 85));
    }

    @Test
    @DisplayName("missing optional fields fall back to defaults")
    void nullsDefaulted() {
        EngineSettings s = new EngineSettings(30, 60, 40, 85, null, null, null, null, 0.5, null);
        assertEquals(EngineSettings.DEFAULT_PER_CALL_TIMEOUT, s.perCallTimeout());
        assertEquals(KnowledgeBackend.GRAPH, s.knowledgeBackend());
        assertEquals("ETH", s.referenceSymbol());
    }

    @Test
    @DisplayName("non-positive or out-of-range thresholds rejected")
    void thresholdRange() {
        assertThrows(IllegalArgumentException.class, () -> EngineSettings.defaults().withThresholds(60.0, 0.0, 85));
        assertThrows(IllegalArgumentException.class, () -> EngineSettings.defaults().withThresholds(60.0, 40.0, 0));
        assertThrows(IllegalArgumentException.class, () -> EngineSettings.defaults().withThresholds(120.0, 40.0, 85));
    }

    // ── JSON overrides ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("request payload")
    class JsonPayload {

        private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

        @Test
        @DisplayName("partial override keeps defaults for every absent field")
        void partialOverride() throws Exception {
            EngineSettings s = mapper.readValue("{\"windowDays\":90,\"dangerThreshold\":50}", EngineSettings.class);

            assertEquals(50.0, s.dangerThreshold());
            assertEquals(EngineSettings.DEFAULT_MODERATE_THRESHOLD, s.moderateThreshold());
            assertEquals(EngineSettings.DEFAULT_COMPOUNDING_THRESHOLD, s.compoundingCorrelationThreshold());
            assertEquals(EngineSettings.DEFAULT_MAX_EXCLUDED_VALUE_SHARE, s.maxExcludedValueShare());
            assertEquals(EngineSettings.DEFAULT_OVERALL_DEADLINE, s.overallDeadline());
            assertEquals("ETH", s.referenceSymbol());
        }

        @Test
        @DisplayName("empty object equals the defaults")
        void emptyOverride() throws Exception {
            assertEquals(EngineSettings.defaults(), mapper.readValue("{}", EngineSettings.class));
        }

        @Test
        @DisplayName("timeouts and backend are read when present")
        void fullFields() throws Exception {
            EngineSettings s = mapper.readValue(
                "{\"perCallTimeout\":\"PT3S\",\"knowledgeBackend\":\"TABLE\",\"compoundingCorrelationThreshold\":90}",
                EngineSettings.class);

            assertEquals(Duration.ofSeconds(3), s.perCallTimeout());
            assertEquals(KnowledgeBackend.TABLE, s.knowledgeBackend());
            assertEquals(90, s.compoundingCorrelationThreshold());
            assertEquals(EngineSettings.DEFAULT_WINDOW_DAYS, s.windowDays());
        }

        @Test
        @DisplayName("explicit zero threshold is refused instead of silently applied")
        void explicitZeroRejected() {
            assertThrows(ValueInstantiationException.class,
                () -> mapper.readValue("{\"moderateThreshold\":0}", EngineSettings.class));
        }
    }
}
