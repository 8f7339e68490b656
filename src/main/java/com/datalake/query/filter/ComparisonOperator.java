package com.datalake.query.filter;

/**
 * Numeric comparison operators supported by {@link ComparisonClause}
 */
public enum ComparisonOperator {

    GT(">", "gt"),
    LT("<", "lt"),
    EQ("=", "eq");

    private final String sql;
    private final String suffix;

    ComparisonOperator(String sql, String suffix) {
        this.sql = sql;
        this.suffix = suffix;
    }

    public String getSql() {
        return sql;
    }

    /**
     * Request parameter suffix, e.g. {@code amount_gt}
     */
    public String getSuffix() {
        return suffix;
    }

    /**
     * Whether {@code left op right} holds
     */
    public boolean test(double left, double right) {
        int cmp = Double.compare(left, right);
        switch (this) {
            case GT:
                return cmp > 0;
            case LT:
                return cmp < 0;
            default:
                return cmp == 0;
        }
    }
}
