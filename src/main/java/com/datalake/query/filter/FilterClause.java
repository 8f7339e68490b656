package com.datalake.query.filter;

/**
 * A single predicate over one record field. Clauses of a {@link FilterSpec} are combined with AND.
 */
public interface FilterClause {

    /**
     * Name of the field the clause reads
     */
    String getField();
}
