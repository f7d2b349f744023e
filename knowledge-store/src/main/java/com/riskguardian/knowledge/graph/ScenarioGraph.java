package com.riskguardian.knowledge.graph;

import com.riskguardian.common.model.OpportunityCost;
import com.riskguardian.common.model.ScenarioRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable fact graph built from the scenario catalog, queried by conjunctive pattern
 * matching.
 *
 * <p>Query semantics:
 * <ul>
 *   <li>Clauses are joined left to right; a variable bound by an earlier clause constrains
 *       every later one</li>
 *   <li>Solutions come back in fact insertion order of the first clause, then the second, and
 *       so on; facts are inserted scenario by scenario, so scenario load order is preserved</li>
 *   <li>No clause ever mutates the graph; concurrent queries need no locking</li>
 * </ul>
 */
public final class ScenarioGraph {

    private final Map<Relation, List<Fact>> factsByRelation;
    private final int factCount;

    private ScenarioGraph(List<Fact> facts) {
        Map<Relation, List<Fact>> index = new EnumMap<>(Relation.class);
        for (Fact fact : facts) {
            index.computeIfAbsent(fact.relation(), r -> new ArrayList<>()).add(fact);
        }
        index.replaceAll((relation, list) -> Collections.unmodifiableList(list));
        this.factsByRelation = Collections.unmodifiableMap(index);
        this.factCount = facts.size();
    }

    public static ScenarioGraph fromScenarios(List<ScenarioRecord> scenarios) {
        List<Fact> facts = new ArrayList<>();
        for (ScenarioRecord s : scenarios) {
            String id = s.scenarioId();
            facts.add(Fact.of(Relation.SCENARIO, id, s.displayName(), s.periodLabel(),
                s.referenceAssetDrawdownPct(), s.marketAverageLossPct(), nullToEmpty(s.recoveryPeriodLabel())));
            s.bracketLossTable().forEach((bracket, loss) ->
                facts.add(Fact.of(Relation.BRACKET_LOSS, id, bracket, loss)));
            s.categoryLossTable().forEach((category, loss) ->
                facts.add(Fact.of(Relation.CATEGORY_LOSS, id, category, loss)));
            s.jointLossTable().forEach((bracket, byCategory) ->
                byCategory.forEach((category, loss) ->
                    facts.add(Fact.of(Relation.JOINT_LOSS, id, bracket, category, loss))));
            for (String winner : s.recoveryWinners()) {
                facts.add(Fact.of(Relation.RECOVERY_WINNER, id, winner));
            }
            for (OpportunityCost cost : s.opportunityCosts()) {
                facts.add(Fact.of(Relation.OPPORTUNITY_COST, id, cost.category(), cost.bestPerformer(),
                    cost.recoveryGainPct(), nullToEmpty(cost.reason())));
            }
        }
        return new ScenarioGraph(facts);
    }

    /** Returns every solution satisfying all {@code clauses}; empty when none does. */
    public List<Bindings> query(Pattern... clauses) {
        List<Bindings> solutions = List.of(Bindings.EMPTY);
        for (Pattern clause : clauses) {
            List<Fact> candidates = factsByRelation.getOrDefault(clause.relation(), List.of());
            List<Bindings> extended = new ArrayList<>();
            for (Bindings partial : solutions) {
                for (Fact fact : candidates) {
                    partial.unify(clause, fact).ifPresent(extended::add);
                }
            }
            if (extended.isEmpty()) {
                return List.of();
            }
            solutions = extended;
        }
        return solutions;
    }

    public int factCount() {
        return factCount;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
