package com.datalake.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Filter options offered to callers: example values for categorical fields and
 * value ranges for numeric fields.
 */
public final class FilterVocabulary {

    @JsonProperty("categorical")
    private final Map<String, List<String>> categorical;

    @JsonProperty("numeric")
    private final Map<String, NumericRange> numeric;

    @JsonProperty("source")
    private final String source;

    @JsonProperty("fallback")
    private final boolean fallback;

    @JsonCreator
    public FilterVocabulary(
            @JsonProperty("categorical") Map<String, List<String>> categorical,
            @JsonProperty("numeric") Map<String, NumericRange> numeric,
            @JsonProperty("source") String source,
            @JsonProperty("fallback") boolean fallback) {
        this.categorical = categorical == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(categorical));
        this.numeric = numeric == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(numeric));
        this.source = source;
        this.fallback = fallback;
    }

    public Map<String, List<String>> getCategorical() {
        return categorical;
    }

    public Map<String, NumericRange> getNumeric() {
        return numeric;
    }

    public String getSource() {
        return source;
    }

    public boolean isFallback() {
        return fallback;
    }

    /**
     * Copy flagged as the static fallback, with no source
     */
    FilterVocabulary asFallback() {
        return new FilterVocabulary(categorical, numeric, null, true);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return categorical.isEmpty() && numeric.isEmpty();
    }

    @Override
    public String toString() {
        return "FilterVocabulary{source=" + source + ", fallback=" + fallback
            + ", categorical=" + categorical.keySet() + ", numeric=" + numeric.keySet() + "}";
    }

    /**
     * Inclusive {@code [min, max]} of a numeric field
     */
    public static final class NumericRange {

        @JsonProperty("min")
        private final double min;

        @JsonProperty("max")
        private final double max;

        @JsonCreator
        public NumericRange(@JsonProperty("min") double min, @JsonProperty("max") double max) {
            this.min = min;
            this.max = max;
        }

        public double getMin() {
            return min;
        }

        public double getMax() {
            return max;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof NumericRange)) return false;
            NumericRange that = (NumericRange) o;
            return Double.compare(min, that.min) == 0 && Double.compare(max, that.max) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(min, max);
        }

        @Override
        public String toString() {
            return "[" + min + ", " + max + "]";
        }
    }
}
