package com.datalake.query.filter;

import java.util.Objects;

/**
 * Represents a numeric comparison (field op number).
 * A record satisfies it only when the field is non-null, numeric and the comparison holds.
 */
public class ComparisonClause implements FilterClause {
    private final String field;
    private final ComparisonOperator operator;
    private final double value;

    public ComparisonClause(String field, ComparisonOperator operator, double value) {
        this.field = Objects.requireNonNull(field, "field");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.value = value;
    }

    @Override
    public String getField() {
        return field;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComparisonClause)) return false;
        ComparisonClause that = (ComparisonClause) o;
        return field.equals(that.field) && operator == that.operator
            && Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, value);
    }

    @Override
    public String toString() {
        return field + " " + operator.getSql() + " " + value;
    }
}
