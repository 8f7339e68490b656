package com.datalake.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;

@JsonPropertyOrder({"rank", "product_id", "metric", "value", "purchase_count"})
public final class ProductRanking {

    @JsonProperty("rank")
    private final int rank;

    @JsonProperty("product_id")
    private final String productId;

    @JsonProperty("metric")
    private final RankingMetric metric;

    @JsonProperty("value")
    private final BigDecimal value;

    @JsonProperty("purchase_count")
    private final long purchaseCount;

    public ProductRanking(int rank, String productId, RankingMetric metric, BigDecimal value, long purchaseCount) {
        this.rank = rank;
        this.productId = productId;
        this.metric = metric;
        this.value = value;
        this.purchaseCount = purchaseCount;
    }

    public int getRank() {
        return rank;
    }

    public String getProductId() {
        return productId;
    }

    public RankingMetric getMetric() {
        return metric;
    }

    public BigDecimal getValue() {
        return value;
    }

    public long getPurchaseCount() {
        return purchaseCount;
    }

    @Override
    public String toString() {
        return rank + ". " + productId + "(" + value.toPlainString() + " " + metric.getValue() + ")";
    }
}
