package com.riskguardian.analysis.reference;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable daily closes per symbol, oldest-first. Loaded once and shared by all requests.
 * Symbols are matched case-insensitively.
 */
public final class PriceHistory {

    private final Map<String, List<Double>> closesBySymbol;

    private PriceHistory(Map<String, List<Double>> closesBySymbol) {
        this.closesBySymbol = closesBySymbol;
    }

    /**
     * @param closesBySymbol closes per symbol, oldest-first; every close must be positive and finite
     * @throws IllegalArgumentException on a non-positive or non-finite close
     */
    public static PriceHistory of(Map<String, List<Double>> closesBySymbol) {
        Map<String, List<Double>> copy = new LinkedHashMap<>();
        closesBySymbol.forEach((symbol, closes) -> {
            for (Double close : closes) {
                if (close == null || !(close > 0) || Double.isInfinite(close)) {
                    throw new IllegalArgumentException("Invalid close for " + symbol + ": " + close);
                }
            }
            copy.put(normalize(symbol), List.copyOf(closes));
        });
        return new PriceHistory(Map.copyOf(copy));
    }

    /**
     * The last {@code windowDays + 1} closes of {@code symbol}, enough for {@code windowDays}
     * daily returns; empty when the symbol is unknown or its history is shorter.
     */
    public Optional<List<Double>> trailingCloses(String symbol, int windowDays) {
        List<Double> closes = closesBySymbol.get(normalize(symbol));
        int needed = windowDays + 1;
        if (closes == null || closes.size() < needed) {
            return Optional.empty();
        }
        return Optional.of(closes.subList(closes.size() - needed, closes.size()));
    }

    public int daysAvailable(String symbol) {
        List<Double> closes = closesBySymbol.get(normalize(symbol));
        return closes == null ? 0 : closes.size();
    }

    public Set<String> symbols() {
        return closesBySymbol.keySet();
    }

    private static String normalize(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
