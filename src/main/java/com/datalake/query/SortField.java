package com.datalake.query;

import com.datalake.domain.TransactionFields;

/**
 * Represents a sort field with order. Nulls always sort last, whatever the order.
 */
public class SortField {

    public static final SortField DEFAULT = new SortField(TransactionFields.TIMESTAMP, "desc");

    private final String field;
    private final String order;

    public SortField(String field, String order) {
        this.field = field;
        this.order = order;
    }

    /**
     * Parse {@code FIELD} or {@code -FIELD} (descending)
     */
    public static SortField parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return DEFAULT;
        }
        String trimmed = expression.trim();
        if (trimmed.startsWith("-")) {
            return new SortField(trimmed.substring(1), "desc");
        }
        return new SortField(trimmed, "asc");
    }

    public String getField() {
        return field;
    }

    public String getOrder() {
        return order;
    }

    public boolean isAscending() {
        return "asc".equalsIgnoreCase(order);
    }

    @Override
    public String toString() {
        return field + " " + (isAscending() ? "asc" : "desc");
    }
}
