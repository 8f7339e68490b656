package com.datalake.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * One user's spend for one transaction type
 */
public final class SpendBreakdown {

    @JsonProperty("transaction_type")
    private final String transactionType;

    @JsonProperty("amount")
    private final BigDecimal amount;

    @JsonProperty("count")
    private final long count;

    public SpendBreakdown(String transactionType, BigDecimal amount, long count) {
        this.transactionType = transactionType;
        this.amount = amount;
        this.count = count;
    }

    public String getTransactionType() {
        return transactionType;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public long getCount() {
        return count;
    }

    @Override
    public String toString() {
        return transactionType + "=" + amount + "(" + count + ")";
    }
}
