package com.riskguardian.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskguardian.common.exception.InvalidPortfolioException;

/**
 * A single position in a portfolio snapshot. {@code value} is always
 * {@code quantity × unitPrice}; it is derived, never supplied.
 */
@JsonIgnoreProperties(value = "value", allowGetters = true)
public record Holding(
    @JsonProperty("symbol")    String symbol,
    @JsonProperty("quantity")  double quantity,
    @JsonProperty("unitPrice") double unitPrice
) {
    public Holding {
        if (symbol == null || symbol.isBlank()) {
            throw new InvalidPortfolioException("Holding symbol must not be blank");
        }
        if (!(quantity > 0) || Double.isInfinite(quantity)) {
            throw new InvalidPortfolioException("Holding " + symbol + " quantity must be positive, was " + quantity);
        }
        if (!(unitPrice > 0) || Double.isInfinite(unitPrice)) {
            throw new InvalidPortfolioException("Holding " + symbol + " unitPrice must be positive, was " + unitPrice);
        }
        symbol = symbol.trim();
    }

    @JsonProperty("value")
    public double value() {
        return quantity * unitPrice;
    }
}
