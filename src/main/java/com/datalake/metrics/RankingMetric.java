package com.datalake.metrics;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a product ranking sums, picked from the fields the merged data has
 */
public enum RankingMetric {
    QUANTITY("quantity"),
    AMOUNT("amount_usd"),
    PURCHASE_COUNT("purchase_count");

    private final String value;

    RankingMetric(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
