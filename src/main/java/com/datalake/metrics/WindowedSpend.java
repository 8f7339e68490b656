package com.datalake.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Spend of purchases and payments inside {@code [window_start, window_end]}
 */
@JsonPropertyOrder({"total", "count", "window_start", "window_end", "window_minutes"})
public final class WindowedSpend {

    @JsonProperty("total")
    private final BigDecimal total;

    @JsonProperty("count")
    private final long count;

    @JsonProperty("window_start")
    private final LocalDateTime windowStart;

    @JsonProperty("window_end")
    private final LocalDateTime windowEnd;

    @JsonProperty("window_minutes")
    private final int windowMinutes;

    public WindowedSpend(BigDecimal total, long count, LocalDateTime windowStart, LocalDateTime windowEnd,
                         int windowMinutes) {
        this.total = total;
        this.count = count;
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
        this.windowMinutes = windowMinutes;
    }

    public BigDecimal getTotal() {
        return total;
    }

    public long getCount() {
        return count;
    }

    public LocalDateTime getWindowStart() {
        return windowStart;
    }

    public LocalDateTime getWindowEnd() {
        return windowEnd;
    }

    public int getWindowMinutes() {
        return windowMinutes;
    }

    @Override
    public String toString() {
        return "WindowedSpend{total=" + total + ", count=" + count
            + ", window=[" + windowStart + ", " + windowEnd + "]}";
    }
}
