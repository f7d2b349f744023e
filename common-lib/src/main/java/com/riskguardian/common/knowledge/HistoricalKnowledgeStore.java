package com.riskguardian.common.knowledge;

import com.riskguardian.common.model.CoMovementBracket;
import com.riskguardian.common.model.ScenarioExcerpt;

import java.util.List;

/**
 * Read-only lookups over historical stress scenarios.
 *
 * <p>Contract shared by every implementation:
 * <ul>
 *   <li><b>Ordered</b>      : excerpts come back in scenario load order, one per scenario that
 *                              carries a figure for the requested key</li>
 *   <li><b>Backend-blind</b>: identical input yields identical output whichever backend served it</li>
 *   <li><b>Thread-safe</b>  : the underlying tables are never mutated after load</li>
 * </ul>
 *
 * <p>Individual backends may throw; callers outside the knowledge module only ever see the
 * failover store, which turns any failure into an empty result.
 */
public interface HistoricalKnowledgeStore {

    /** Expected loss of portfolios in {@code bracket}, per scenario. */
    List<ScenarioExcerpt> lookupBracketPerformance(CoMovementBracket bracket);

    /** Loss of {@code categoryName}, per scenario. */
    List<ScenarioExcerpt> lookupCategoryPerformance(String categoryName);

    /**
     * Narrative of what other categories returned during the recovery that followed each
     * scenario in which {@code categoryName} was hit; empty string when nothing is known.
     */
    String lookupOpportunityCost(String categoryName);

    /** Loss of portfolios that were both in {@code bracket} and concentrated in {@code categoryName}. */
    List<ScenarioExcerpt> lookupJointPerformance(CoMovementBracket bracket, String categoryName);
}
