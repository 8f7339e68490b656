package com.datalake.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Enumeration of the physical backends a collection can live in.
 * The kind decides where filtering happens: file partitions are filtered in memory
 * after materialization, tables get the filter pushed into the SQL query.
 */
public enum SourceKind {

    /**
     * Directory of immutable Parquet batch files
     */
    FILE("file", "Parquet partitions on the data lake"),

    /**
     * Table in the relational store
     */
    TABLE("table", "Rows in the relational table store");

    private final String value;
    private final String description;

    SourceKind(String value, String description) {
        this.value = value;
        this.description = description;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Parse a string value to SourceKind
     */
    public static SourceKind fromValue(String value) {
        for (SourceKind kind : SourceKind.values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown SourceKind value: " + value);
    }
}
