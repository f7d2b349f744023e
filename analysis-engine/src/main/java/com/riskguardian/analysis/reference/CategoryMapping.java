package com.riskguardian.analysis.reference;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Immutable symbol → category table. A symbol belongs to at most one category. */
public final class CategoryMapping {

    private final Map<String, String> categoryBySymbol;

    private CategoryMapping(Map<String, String> categoryBySymbol) {
        this.categoryBySymbol = Map.copyOf(categoryBySymbol);
    }

    /**
     * @param symbolsByCategory member symbols per category name
     * @throws IllegalArgumentException when a symbol is listed under two categories
     */
    public static CategoryMapping fromCategories(Map<String, List<String>> symbolsByCategory) {
        Map<String, String> index = new LinkedHashMap<>();
        symbolsByCategory.forEach((category, symbols) -> {
            for (String symbol : symbols) {
                String previous = index.put(normalize(symbol), category);
                if (previous != null && !previous.equals(category)) {
                    throw new IllegalArgumentException("Symbol " + symbol + " mapped to both "
                        + previous + " and " + category);
                }
            }
        });
        return new CategoryMapping(index);
    }

    public Optional<String> categoryOf(String symbol) {
        return Optional.ofNullable(categoryBySymbol.get(normalize(symbol)));
    }

    public int size() {
        return categoryBySymbol.size();
    }

    private static String normalize(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
