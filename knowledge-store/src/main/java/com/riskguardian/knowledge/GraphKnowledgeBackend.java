package com.riskguardian.knowledge;

import com.riskguardian.common.knowledge.HistoricalKnowledgeStore;
import com.riskguardian.common.model.CoMovementBracket;
import com.riskguardian.common.model.OpportunityCost;
import com.riskguardian.common.model.ScenarioExcerpt;
import com.riskguardian.knowledge.graph.Bindings;
import com.riskguardian.knowledge.graph.Pattern;
import com.riskguardian.knowledge.graph.Relation;
import com.riskguardian.knowledge.graph.ScenarioGraph;

import java.util.ArrayList;
import java.util.List;

import static com.riskguardian.knowledge.graph.Variable.var;

/**
 * Answers lookups by pattern matching over a {@link ScenarioGraph}.
 *
 * <p>Every lookup joins the keyed fact with its {@code SCENARIO} fact, so an excerpt is only
 * produced for scenarios that are fully described in the graph. Output is identical to
 * {@link TableKnowledgeBackend} for the same catalog.
 */
public class GraphKnowledgeBackend implements HistoricalKnowledgeStore {

    private final ScenarioGraph graph;

    public GraphKnowledgeBackend(ScenarioGraph graph) {
        this.graph = graph;
    }

    @Override
    public List<ScenarioExcerpt> lookupBracketPerformance(CoMovementBracket bracket) {
        return excerpts(graph.query(
            scenarioClause(),
            Pattern.of(Relation.BRACKET_LOSS, var("s"), bracket, var("loss"))));
    }

    @Override
    public List<ScenarioExcerpt> lookupCategoryPerformance(String categoryName) {
        return excerpts(graph.query(
            scenarioClause(),
            Pattern.of(Relation.CATEGORY_LOSS, var("s"), categoryName, var("loss"))));
    }

    @Override
    public String lookupOpportunityCost(String categoryName) {
        List<String> sentences = new ArrayList<>();
        for (Bindings hit : graph.query(
                scenarioClause(),
                Pattern.of(Relation.CATEGORY_LOSS, var("s"), categoryName, var("loss")))) {
            String scenarioId = hit.text("s");
            String name       = hit.text("name");
            String recovery   = hit.text("recovery");

            List<OpportunityCost> alternatives = new ArrayList<>();
            for (Bindings alt : graph.query(Pattern.of(Relation.OPPORTUNITY_COST,
                    scenarioId, var("category"), var("performer"), var("gain"), var("reason")))) {
                alternatives.add(new OpportunityCost(alt.text("category"), alt.text("performer"),
                    alt.number("gain"), alt.text("reason")));
            }
            OpportunityCost best = RecoveryNarratives.pickBest(alternatives, categoryName);
            if (best != null) {
                sentences.add(RecoveryNarratives.bestAlternative(name, recovery, best));
                continue;
            }
            List<String> winners = new ArrayList<>();
            for (Bindings w : graph.query(Pattern.of(Relation.RECOVERY_WINNER, scenarioId, var("symbol")))) {
                winners.add(w.text("symbol"));
            }
            if (!winners.isEmpty()) {
                sentences.add(RecoveryNarratives.recoveryLeaders(name, recovery, winners));
            }
        }
        return String.join(" ", sentences);
    }

    @Override
    public List<ScenarioExcerpt> lookupJointPerformance(CoMovementBracket bracket, String categoryName) {
        return excerpts(graph.query(
            scenarioClause(),
            Pattern.of(Relation.JOINT_LOSS, var("s"), bracket, categoryName, var("loss"))));
    }

    // ── helpers ─────────────────────────────────────────────────────────────

    private static Pattern scenarioClause() {
        return Pattern.of(Relation.SCENARIO,
            var("s"), var("name"), var("period"), var("ref"), var("market"), var("recovery"));
    }

    private static List<ScenarioExcerpt> excerpts(List<Bindings> solutions) {
        List<ScenarioExcerpt> excerpts = new ArrayList<>(solutions.size());
        for (Bindings b : solutions) {
            excerpts.add(new ScenarioExcerpt(b.text("s"), b.text("name"), b.text("period"),
                b.number("loss"), b.number("ref"), b.number("market")));
        }
        return List.copyOf(excerpts);
    }
}
