package com.riskguardian.knowledge.graph;

/**
 * Fact kinds held by {@link ScenarioGraph}, with their fixed argument layout.
 *
 * <pre>
 * SCENARIO          (scenarioId, displayName, periodLabel, referenceDrawdownPct, marketAverageLossPct, recoveryPeriodLabel)
 * BRACKET_LOSS      (scenarioId, bracket, lossPct)
 * CATEGORY_LOSS     (scenarioId, category, lossPct)
 * JOINT_LOSS        (scenarioId, bracket, category, lossPct)
 * RECOVERY_WINNER   (scenarioId, symbol)
 * OPPORTUNITY_COST  (scenarioId, category, bestPerformer, recoveryGainPct, reason)
 * </pre>
 */
public enum Relation {
    SCENARIO(6),
    BRACKET_LOSS(3),
    CATEGORY_LOSS(3),
    JOINT_LOSS(4),
    RECOVERY_WINNER(2),
    OPPORTUNITY_COST(5);

    private final int arity;

    Relation(int arity) {
        this.arity = arity;
    }

    public int arity() {
        return arity;
    }
}
