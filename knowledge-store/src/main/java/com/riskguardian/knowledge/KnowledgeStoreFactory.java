package com.riskguardian.knowledge;

import com.riskguardian.common.config.KnowledgeBackend;
import com.riskguardian.common.knowledge.HistoricalKnowledgeStore;
import com.riskguardian.common.model.ScenarioRecord;
import com.riskguardian.knowledge.graph.ScenarioGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Builds the failover store for a configured {@link KnowledgeBackend}.
 *
 * <pre>
 *   GRAPH → Failover(primary = graph, fallback = table)
 *   TABLE → Failover(primary = table, fallback = none)
 * </pre>
 */
public final class KnowledgeStoreFactory {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeStoreFactory.class);

    private KnowledgeStoreFactory() {}

    public static HistoricalKnowledgeStore create(KnowledgeBackend backend, List<ScenarioRecord> scenarios,
                                                  Duration lookupTimeout) {
        TableKnowledgeBackend table = new TableKnowledgeBackend(scenarios);
        if (backend == KnowledgeBackend.TABLE) {
            log.info("Knowledge store ready. backend=TABLE scenarios={}", scenarios.size());
            return new FailoverKnowledgeStore(table, null, lookupTimeout);
        }
        ScenarioGraph graph = ScenarioGraph.fromScenarios(scenarios);
        log.info("Knowledge store ready. backend=GRAPH scenarios={} facts={}", scenarios.size(), graph.factCount());
        return new FailoverKnowledgeStore(new GraphKnowledgeBackend(graph), table, lookupTimeout);
    }
}
