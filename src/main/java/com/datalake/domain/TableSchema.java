package com.datalake.domain;

import java.sql.Types;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Column names and JDBC types of one relational table, as reported by the driver.
 */
public final class TableSchema {

    private final String table;
    private final Map<String, Integer> columnTypes;

    public TableSchema(String table, Map<String, Integer> columnTypes) {
        this.table = table;
        this.columnTypes = Collections.unmodifiableMap(new LinkedHashMap<>(columnTypes));
    }

    public String getTable() {
        return table;
    }

    public Set<String> getColumns() {
        return columnTypes.keySet();
    }

    public boolean contains(String column) {
        return columnTypes.containsKey(column);
    }

    /**
     * Whether the column holds numbers the driver hands back as Java numbers
     */
    public boolean isNumeric(String column) {
        Integer type = columnTypes.get(column);
        if (type == null) {
            return false;
        }
        switch (type) {
            case Types.TINYINT:
            case Types.SMALLINT:
            case Types.INTEGER:
            case Types.BIGINT:
            case Types.FLOAT:
            case Types.REAL:
            case Types.DOUBLE:
            case Types.NUMERIC:
            case Types.DECIMAL:
                return true;
            default:
                return false;
        }
    }

    /**
     * Whether the column holds booleans (MariaDB reports {@code TINYINT(1)} as BIT)
     */
    public boolean isBoolean(String column) {
        Integer type = columnTypes.get(column);
        return type != null && (type == Types.BOOLEAN || type == Types.BIT);
    }

    @Override
    public String toString() {
        return table + columnTypes.keySet();
    }
}
