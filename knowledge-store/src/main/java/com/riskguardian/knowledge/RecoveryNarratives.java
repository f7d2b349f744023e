package com.riskguardian.knowledge;

import com.riskguardian.common.model.OpportunityCost;

import java.util.List;
import java.util.Locale;

/**
 * Sentence templates for opportunity-cost answers. Both backends render through here so
 * that their output stays character-for-character identical.
 */
final class RecoveryNarratives {

    private RecoveryNarratives() {}

    static String bestAlternative(String scenarioName, String recoveryPeriod, OpportunityCost best) {
        StringBuilder sb = new StringBuilder()
            .append("After the ").append(scenarioName).append(", ")
            .append(best.category()).append(" tokens like ").append(best.bestPerformer())
            .append(" gained ").append(String.format(Locale.ROOT, "%.0f", best.recoveryGainPct()))
            .append("% during the recovery");
        if (!recoveryPeriod.isEmpty()) {
            sb.append(" (").append(recoveryPeriod).append(')');
        }
        sb.append('.');
        if (best.reason() != null && !best.reason().isBlank()) {
            sb.append(' ').append(best.reason().trim());
        }
        return sb.toString();
    }

    static String recoveryLeaders(String scenarioName, String recoveryPeriod, List<String> winners) {
        StringBuilder sb = new StringBuilder()
            .append("After the ").append(scenarioName).append(", the recovery");
        if (!recoveryPeriod.isEmpty()) {
            sb.append(" (").append(recoveryPeriod).append(')');
        }
        return sb.append(" was led by ").append(String.join(", ", winners)).append('.').toString();
    }

    /** Picks the highest-gain alternative outside {@code category}; the earliest wins a tie. */
    static OpportunityCost pickBest(List<OpportunityCost> candidates, String category) {
        OpportunityCost best = null;
        for (OpportunityCost candidate : candidates) {
            if (candidate.category().equals(category)) {
                continue;
            }
            if (best == null || candidate.recoveryGainPct() > best.recoveryGainPct()) {
                best = candidate;
            }
        }
        return best;
    }
}
