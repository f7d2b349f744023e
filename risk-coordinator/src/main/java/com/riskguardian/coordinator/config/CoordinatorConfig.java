package com.riskguardian.coordinator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.riskguardian.analysis.analyzer.ConcentrationAnalyzer;
import com.riskguardian.analysis.analyzer.CorrelationAnalyzer;
import com.riskguardian.analysis.channel.AnalyzerChannel;
import com.riskguardian.analysis.channel.LocalAnalyzerChannel;
import com.riskguardian.analysis.reference.CategoryMapping;
import com.riskguardian.analysis.reference.PriceHistory;
import com.riskguardian.common.config.EngineSettings;
import com.riskguardian.common.config.KnowledgeBackend;
import com.riskguardian.common.knowledge.HistoricalKnowledgeStore;
import com.riskguardian.common.model.ConcentrationResult;
import com.riskguardian.common.model.CorrelationResult;
import com.riskguardian.coordinator.logger.AnalysisFlowLogger;
import com.riskguardian.coordinator.report.ReportRenderer;
import com.riskguardian.coordinator.service.RiskCoordinator;
import com.riskguardian.coordinator.synthesis.RuleBasedSynthesisEngine;
import com.riskguardian.coordinator.synthesis.SynthesisEngine;
import com.riskguardian.knowledge.KnowledgeStoreFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class CoordinatorConfig {

    @Value("${guardian.engine.window-days:90}")
    private int windowDays;

    @Value("${guardian.engine.danger-threshold:60}")
    private double dangerThreshold;

    @Value("${guardian.engine.moderate-threshold:40}")
    private double moderateThreshold;

    @Value("${guardian.engine.compounding-correlation-threshold:85}")
    private int compoundingCorrelationThreshold;

    @Value("${guardian.engine.per-call-timeout-ms:10000}")
    private long perCallTimeoutMs;

    @Value("${guardian.engine.overall-deadline-ms:60000}")
    private long overallDeadlineMs;

    @Value("${guardian.engine.knowledge-backend:GRAPH}")
    private KnowledgeBackend knowledgeBackend;

    @Value("${guardian.engine.knowledge-lookup-timeout-ms:2000}")
    private long knowledgeLookupTimeoutMs;

    @Value("${guardian.engine.max-excluded-value-share:0.5}")
    private double maxExcludedValueShare;

    @Value("${guardian.engine.reference-symbol:ETH}")
    private String referenceSymbol;

    @Value("${guardian.data.scenarios:data/historical-scenarios.json}")
    private String scenariosLocation;

    @Value("${guardian.data.category-mappings:data/category-mappings.json}")
    private String categoryMappingsLocation;

    @Value("${guardian.data.price-history:data/price-history.json}")
    private String priceHistoryLocation;

    @Bean
    public EngineSettings engineSettings() {
        return new EngineSettings(windowDays, dangerThreshold, moderateThreshold, compoundingCorrelationThreshold,
            Duration.ofMillis(perCallTimeoutMs), Duration.ofMillis(overallDeadlineMs), knowledgeBackend,
            Duration.ofMillis(knowledgeLookupTimeoutMs), maxExcludedValueShare, referenceSymbol);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public ReferenceDataLoader referenceDataLoader(ObjectMapper objectMapper) {
        return new ReferenceDataLoader(objectMapper);
    }

    @Bean
    public HistoricalKnowledgeStore historicalKnowledgeStore(ReferenceDataLoader loader, EngineSettings settings) {
        return KnowledgeStoreFactory.create(settings.knowledgeBackend(), loader.loadScenarios(scenariosLocation),
            settings.knowledgeLookupTimeout());
    }

    @Bean
    public PriceHistory priceHistory(ReferenceDataLoader loader) {
        return loader.loadPriceHistory(priceHistoryLocation);
    }

    @Bean
    public CategoryMapping categoryMapping(ReferenceDataLoader loader) {
        return loader.loadCategoryMapping(categoryMappingsLocation);
    }

    @Bean
    public AnalyzerChannel<CorrelationResult> correlationChannel(PriceHistory priceHistory,
                                                                 HistoricalKnowledgeStore knowledgeStore) {
        return new LocalAnalyzerChannel<>(new CorrelationAnalyzer(priceHistory, knowledgeStore));
    }

    @Bean
    public AnalyzerChannel<ConcentrationResult> concentrationChannel(CategoryMapping categoryMapping,
                                                                     HistoricalKnowledgeStore knowledgeStore) {
        return new LocalAnalyzerChannel<>(new ConcentrationAnalyzer(categoryMapping, knowledgeStore));
    }

    @Bean
    public SynthesisEngine synthesisEngine(HistoricalKnowledgeStore knowledgeStore) {
        return new RuleBasedSynthesisEngine(knowledgeStore);
    }

    @Bean
    public RiskCoordinator riskCoordinator(AnalyzerChannel<CorrelationResult> correlationChannel,
                                           AnalyzerChannel<ConcentrationResult> concentrationChannel,
                                           SynthesisEngine synthesisEngine,
                                           AnalysisFlowLogger flowLogger,
                                           EngineSettings settings) {
        return new RiskCoordinator(correlationChannel, concentrationChannel, synthesisEngine, flowLogger, settings);
    }

    @Bean
    public ReportRenderer reportRenderer() {
        return new ReportRenderer();
    }
}
