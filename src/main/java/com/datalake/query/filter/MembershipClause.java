package com.datalake.query.filter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Represents a membership test (field IN values). A null field value never matches.
 */
public class MembershipClause implements FilterClause {
    private final String field;
    private final Set<String> values;

    public MembershipClause(String field, Collection<String> values) {
        this.field = Objects.requireNonNull(field, "field");
        this.values = Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    @Override
    public String getField() {
        return field;
    }

    public Set<String> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MembershipClause)) return false;
        MembershipClause that = (MembershipClause) o;
        return field.equals(that.field) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, values);
    }

    @Override
    public String toString() {
        return field + " IN " + values;
    }
}
