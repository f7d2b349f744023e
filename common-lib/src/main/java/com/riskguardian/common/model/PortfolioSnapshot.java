package com.riskguardian.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskguardian.common.exception.InvalidPortfolioException;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Immutable holdings snapshot handed to both analyzers.
 *
 * <p>{@code totalValue} must equal the sum of the holding values within
 * {@value #RELATIVE_TOLERANCE} relative tolerance. Use {@link #of} to have it computed.
 */
public record PortfolioSnapshot(
    @JsonProperty("ownerIdentifier") String ownerIdentifier,
    @JsonProperty("holdings")        List<Holding> holdings,
    @JsonProperty("totalValue")      double totalValue,
    @JsonProperty("snapshotTime")    Instant snapshotTime
) {
    public static final double RELATIVE_TOLERANCE = 1e-6;

    public PortfolioSnapshot {
        if (holdings == null || holdings.isEmpty()) {
            throw new InvalidPortfolioException("Portfolio snapshot requires at least one holding");
        }
        holdings = List.copyOf(holdings);
        double sum = sumOf(holdings);
        if (Math.abs(totalValue - sum) > RELATIVE_TOLERANCE * Math.max(1.0, Math.abs(sum))) {
            throw new InvalidPortfolioException(String.format(Locale.ROOT,
                "totalValue (%.6f) does not match sum of holding values (%.6f)", totalValue, sum));
        }
        ownerIdentifier = ownerIdentifier == null ? "" : ownerIdentifier;
        snapshotTime = snapshotTime == null ? Instant.now() : snapshotTime;
    }

    public static PortfolioSnapshot of(String ownerIdentifier, List<Holding> holdings, Instant snapshotTime) {
        if (holdings == null || holdings.isEmpty()) {
            throw new InvalidPortfolioException("Portfolio snapshot requires at least one holding");
        }
        return new PortfolioSnapshot(ownerIdentifier, holdings, sumOf(holdings), snapshotTime);
    }

    /** Accepts payloads without a {@code totalValue}; the total is then computed. */
    @JsonCreator
    public static PortfolioSnapshot fromJson(@JsonProperty("ownerIdentifier") String ownerIdentifier,
                                      @JsonProperty("holdings") List<Holding> holdings,
                                      @JsonProperty("totalValue") Double totalValue,
                                      @JsonProperty("snapshotTime") Instant snapshotTime) {
        if (totalValue == null) {
            return of(ownerIdentifier, holdings, snapshotTime);
        }
        return new PortfolioSnapshot(ownerIdentifier, holdings, totalValue, snapshotTime);
    }

    private static double sumOf(List<Holding> holdings) {
        double sum = 0.0;
        for (Holding h : holdings) sum += h.value();
        return sum;
    }
}
