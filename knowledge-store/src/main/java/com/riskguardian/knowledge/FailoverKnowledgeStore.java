package com.riskguardian.knowledge;

import com.riskguardian.common.knowledge.HistoricalKnowledgeStore;
import com.riskguardian.common.model.CoMovementBracket;
import com.riskguardian.common.model.ScenarioExcerpt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * The only {@link HistoricalKnowledgeStore} analyzers ever see.
 *
 * <p>Each lookup runs on the primary backend under {@code lookupTimeout}. Any primary
 * error, the timeout included, triggers exactly one retry on the fallback
 * ({@code KNOWLEDGE_LOOKUP_DEGRADED}, WARN). If the fallback fails as well, or no distinct
 * fallback exists, the lookup answers with an empty list or empty string
 * ({@code KNOWLEDGE_LOOKUP_UNAVAILABLE}, ERROR). Nothing is ever thrown to the caller.
 *
 * <p>Lookups block the calling thread for at most {@code 2 × lookupTimeout}; call them from
 * a thread that may block, such as one of {@link Schedulers#boundedElastic()}.
 */
public class FailoverKnowledgeStore implements HistoricalKnowledgeStore {

    private static final Logger log = LoggerFactory.getLogger(FailoverKnowledgeStore.class);

    private final HistoricalKnowledgeStore primary;
    private final HistoricalKnowledgeStore fallback;
    private final Duration lookupTimeout;

    /**
     * @param primary       backend tried first
     * @param fallback      backend retried once on primary failure; {@code null} when there is
     *                      no distinct fallback
     * @param lookupTimeout upper bound for a single backend call
     */
    public FailoverKnowledgeStore(HistoricalKnowledgeStore primary, HistoricalKnowledgeStore fallback,
                                  Duration lookupTimeout) {
        this.primary = primary;
        this.fallback = fallback;
        this.lookupTimeout = lookupTimeout;
    }

    @Override
    public List<ScenarioExcerpt> lookupBracketPerformance(CoMovementBracket bracket) {
        return lookup("bracketPerformance[" + bracket + "]",
            store -> store.lookupBracketPerformance(bracket), List.of());
    }

    @Override
    public List<ScenarioExcerpt> lookupCategoryPerformance(String categoryName) {
        return lookup("categoryPerformance[" + categoryName + "]",
            store -> store.lookupCategoryPerformance(categoryName), List.of());
    }

    @Override
    public String lookupOpportunityCost(String categoryName) {
        return lookup("opportunityCost[" + categoryName + "]",
            store -> store.lookupOpportunityCost(categoryName), "");
    }

    @Override
    public List<ScenarioExcerpt> lookupJointPerformance(CoMovementBracket bracket, String categoryName) {
        return lookup("jointPerformance[" + bracket + "," + categoryName + "]",
            store -> store.lookupJointPerformance(bracket, categoryName), List.of());
    }

    // ── failover pipeline ───────────────────────────────────────────────────

    @FunctionalInterface
    private interface Lookup<T> {
        T apply(HistoricalKnowledgeStore store);
    }

    private <T> T lookup(String description, Lookup<T> lookup, T empty) {
        Mono<T> onFallback = fallback == null
            ? Mono.error(new KnowledgeLookupException("no fallback backend configured"))
            : timed(() -> lookup.apply(fallback));

        return timed(() -> lookup.apply(primary))
            .onErrorResume(primaryError -> {
                log.warn("KNOWLEDGE_LOOKUP_DEGRADED lookup={} primary={} reason={}",
                         description, backendName(primary), reason(primaryError));
                return onFallback.onErrorResume(fallbackError -> {
                    log.error("KNOWLEDGE_LOOKUP_UNAVAILABLE lookup={} fallback={} reason={}",
                              description, backendName(fallback), reason(fallbackError));
                    return Mono.just(empty);
                });
            })
            .defaultIfEmpty(empty)
            .block();
    }

    private <T> Mono<T> timed(Callable<T> call) {
        return Mono.fromCallable(call)
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(lookupTimeout);
    }

    private static String backendName(HistoricalKnowledgeStore store) {
        return store == null ? "none" : store.getClass().getSimpleName();
    }

    private static String reason(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
