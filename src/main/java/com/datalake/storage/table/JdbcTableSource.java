package com.datalake.storage.table;

import com.datalake.domain.RecordBatch;
import com.datalake.domain.Schema;
import com.datalake.domain.TableSchema;
import com.datalake.domain.Values;
import com.datalake.query.filter.SqlFilterTranslator;
import com.datalake.query.filter.SqlQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Component;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link TableSource} over a JDBC connection pool.
 *
 * Only tables whose names start with the configured prefix are exposed; the loader
 * that copies Parquet batches into the database names its tables that way.
 */
@Component
public class JdbcTableSource implements TableSource {

    private static final Logger log = LoggerFactory.getLogger(JdbcTableSource.class);

    private final JdbcTemplate jdbcTemplate;
    private final SqlFilterTranslator sqlTranslator;
    private final String tablePrefix;

    public JdbcTableSource(
            @Qualifier("relationalJdbcTemplate") JdbcTemplate jdbcTemplate,
            SqlFilterTranslator sqlTranslator,
            @Value("${datalake.storage.relational.table-prefix:sql_}") String tablePrefix) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlTranslator = sqlTranslator;
        this.tablePrefix = tablePrefix == null ? "" : tablePrefix.toLowerCase(Locale.ROOT);
    }

    @Override
    public List<String> listTables() {
        List<String> tables = jdbcTemplate.execute((ConnectionCallback<List<String>>) connection -> {
            List<String> names = new ArrayList<>();
            DatabaseMetaData metaData = connection.getMetaData();
            try (ResultSet rs = metaData.getTables(connection.getCatalog(), null, "%", null)) {
                while (rs.next()) {
                    String name = rs.getString("TABLE_NAME");
                    if (name != null && name.toLowerCase(Locale.ROOT).startsWith(tablePrefix)) {
                        names.add(name);
                    }
                }
            }
            return names;
        });
        List<String> result = tables == null ? new ArrayList<>() : tables;
        result.sort(String::compareTo);
        log.debug("Found {} relational tables with prefix '{}'", result.size(), tablePrefix);
        return result;
    }

    @Override
    public TableSchema describe(String table) {
        SqlQuery describe = sqlTranslator.describeQuery(table);
        return jdbcTemplate.query(describe.getSql(), rs -> {
            ResultSetMetaData metaData = rs.getMetaData();
            Map<String, Integer> columns = new LinkedHashMap<>();
            for (int i = 1; i <= metaData.getColumnCount(); i++) {
                columns.put(metaData.getColumnLabel(i), metaData.getColumnType(i));
            }
            return new TableSchema(table, columns);
        });
    }

    @Override
    public RecordBatch runQuery(SqlQuery query) {
        long startTime = System.currentTimeMillis();
        log.debug("Executing relational query: {}", query);

        RecordBatch batch = jdbcTemplate.query(query.getSql(), recordBatchExtractor(), query.getParameterArray());
        if (batch == null) {
            batch = RecordBatch.empty();
        }

        log.debug("Relational query completed in {}ms, returned {} rows",
            System.currentTimeMillis() - startTime, batch.size());
        return batch;
    }

    @Override
    public long countRows(String table) {
        Long count = jdbcTemplate.queryForObject(sqlTranslator.countQuery(table).getSql(), Long.class);
        return count == null ? 0L : count;
    }

    /**
     * Materialize a whole ResultSet, keeping column order and coercing driver types
     */
    private static ResultSetExtractor<RecordBatch> recordBatchExtractor() {
        return rs -> {
            ResultSetMetaData metaData = rs.getMetaData();
            int columnCount = metaData.getColumnCount();
            List<String> columns = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                columns.add(metaData.getColumnLabel(i));
            }

            List<Map<String, Object>> rows = new ArrayList<>();
            while (rs.next()) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= columnCount; i++) {
                    Object value = rs.getObject(i);
                    if (value instanceof java.sql.Time) {
                        value = ((java.sql.Time) value).toLocalTime().toString();
                    } else if (value instanceof java.sql.Clob) {
                        java.sql.Clob clob = (java.sql.Clob) value;
                        value = clob.getSubString(1, (int) clob.length());
                    }
                    row.put(columns.get(i - 1), Values.coerce(value));
                }
                rows.add(row);
            }
            return RecordBatch.of(Schema.of(columns), rows);
        };
    }
}
