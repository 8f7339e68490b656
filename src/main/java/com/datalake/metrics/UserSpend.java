package com.datalake.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.util.List;

/**
 * A user's total spend with its per-transaction-type breakdown.
 * The total is the sum of the rounded breakdown amounts.
 */
@JsonPropertyOrder({"user_id", "total", "breakdown"})
public final class UserSpend {

    @JsonProperty("user_id")
    private final String userId;

    @JsonProperty("total")
    private final BigDecimal total;

    @JsonProperty("breakdown")
    private final List<SpendBreakdown> breakdown;

    public UserSpend(String userId, BigDecimal total, List<SpendBreakdown> breakdown) {
        this.userId = userId;
        this.total = total;
        this.breakdown = List.copyOf(breakdown);
    }

    public String getUserId() {
        return userId;
    }

    public BigDecimal getTotal() {
        return total;
    }

    public List<SpendBreakdown> getBreakdown() {
        return breakdown;
    }

    @Override
    public String toString() {
        return userId + "=" + total + breakdown;
    }
}
