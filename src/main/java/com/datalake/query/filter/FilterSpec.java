package com.datalake.query.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Backend-neutral filter: an ordered conjunction of clauses.
 * An empty filter matches every record.
 */
public final class FilterSpec {

    private static final FilterSpec EMPTY = new FilterSpec(List.of());

    private final List<FilterClause> clauses;

    private FilterSpec(List<FilterClause> clauses) {
        this.clauses = clauses;
    }

    public static FilterSpec empty() {
        return EMPTY;
    }

    public static FilterSpec of(FilterClause... clauses) {
        return of(List.of(clauses));
    }

    public static FilterSpec of(List<? extends FilterClause> clauses) {
        return clauses.isEmpty() ? EMPTY : new FilterSpec(Collections.unmodifiableList(new ArrayList<>(clauses)));
    }

    /**
     * A new filter with one more clause
     */
    public FilterSpec and(FilterClause clause) {
        List<FilterClause> extended = new ArrayList<>(clauses);
        extended.add(clause);
        return new FilterSpec(Collections.unmodifiableList(extended));
    }

    public List<FilterClause> getClauses() {
        return clauses;
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterSpec)) return false;
        return clauses.equals(((FilterSpec) o).clauses);
    }

    @Override
    public int hashCode() {
        return clauses.hashCode();
    }

    @Override
    public String toString() {
        return clauses.isEmpty() ? "FilterSpec[*]" : "FilterSpec" + clauses;
    }
}
