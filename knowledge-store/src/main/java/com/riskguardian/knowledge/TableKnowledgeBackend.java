package com.riskguardian.knowledge;

import com.riskguardian.common.knowledge.HistoricalKnowledgeStore;
import com.riskguardian.common.model.CoMovementBracket;
import com.riskguardian.common.model.OpportunityCost;
import com.riskguardian.common.model.ScenarioExcerpt;
import com.riskguardian.common.model.ScenarioRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Deterministic backend: direct map lookups over the pre-loaded scenario records.
 * Serves as the fallback for every other backend and never fails on valid input.
 */
public class TableKnowledgeBackend implements HistoricalKnowledgeStore {

    private final List<ScenarioRecord> scenarios;

    public TableKnowledgeBackend(List<ScenarioRecord> scenarios) {
        this.scenarios = List.copyOf(scenarios);
    }

    @Override
    public List<ScenarioExcerpt> lookupBracketPerformance(CoMovementBracket bracket) {
        List<ScenarioExcerpt> excerpts = new ArrayList<>();
        for (ScenarioRecord scenario : scenarios) {
            Double loss = scenario.bracketLossTable().get(bracket);
            if (loss != null) {
                excerpts.add(ScenarioExcerpt.of(scenario, loss));
            }
        }
        return List.copyOf(excerpts);
    }

    @Override
    public List<ScenarioExcerpt> lookupCategoryPerformance(String categoryName) {
        List<ScenarioExcerpt> excerpts = new ArrayList<>();
        for (ScenarioRecord scenario : scenarios) {
            Double loss = scenario.categoryLossTable().get(categoryName);
            if (loss != null) {
                excerpts.add(ScenarioExcerpt.of(scenario, loss));
            }
        }
        return List.copyOf(excerpts);
    }

    @Override
    public String lookupOpportunityCost(String categoryName) {
        List<String> sentences = new ArrayList<>();
        for (ScenarioRecord scenario : scenarios) {
            if (!scenario.categoryLossTable().containsKey(categoryName)) {
                continue;
            }
            String recovery = scenario.recoveryPeriodLabel() == null ? "" : scenario.recoveryPeriodLabel();
            OpportunityCost best = RecoveryNarratives.pickBest(scenario.opportunityCosts(), categoryName);
            if (best != null) {
                sentences.add(RecoveryNarratives.bestAlternative(scenario.displayName(), recovery, best));
            } else if (!scenario.recoveryWinners().isEmpty()) {
                sentences.add(RecoveryNarratives.recoveryLeaders(scenario.displayName(), recovery,
                    List.copyOf(scenario.recoveryWinners())));
            }
        }
        return String.join(" ", sentences);
    }

    @Override
    public List<ScenarioExcerpt> lookupJointPerformance(CoMovementBracket bracket, String categoryName) {
        List<ScenarioExcerpt> excerpts = new ArrayList<>();
        for (ScenarioRecord scenario : scenarios) {
            Map<String, Double> byCategory = scenario.jointLossTable().get(bracket);
            Double loss = byCategory == null ? null : byCategory.get(categoryName);
            if (loss != null) {
                excerpts.add(ScenarioExcerpt.of(scenario, loss));
            }
        }
        return List.copyOf(excerpts);
    }
}
