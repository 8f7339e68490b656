package com.datalake.query.filter;

import java.util.Collections;
import java.util.List;

/**
 * Parameterized SQL statement for the relational store.
 * Every value is carried in {@link #getParameters()}; the SQL text only holds
 * validated identifiers and {@code ?} placeholders.
 */
public class SqlQuery {

    private final String sql;
    private final List<Object> parameters;

    public SqlQuery(String sql, List<Object> parameters) {
        this.sql = sql;
        this.parameters = Collections.unmodifiableList(parameters);
    }

    /**
     * Get the SQL string for execution
     */
    public String getSql() {
        return sql;
    }

    public List<Object> getParameters() {
        return parameters;
    }

    public Object[] getParameterArray() {
        return parameters.toArray();
    }

    @Override
    public String toString() {
        return sql + " " + parameters;
    }
}
