package com.datalake.storage.table;

import com.datalake.domain.RecordBatch;
import com.datalake.domain.TableSchema;
import com.datalake.query.filter.SqlQuery;

import java.util.List;

/**
 * Relational side of the data lake: tables loaded from the Parquet batches.
 *
 * Implementations throw {@link org.springframework.dao.DataAccessException} when the
 * store cannot be reached; callers decide whether that degrades or fails the request.
 */
public interface TableSource {

    /**
     * Names of the tables that belong to the data lake, sorted
     */
    List<String> listTables();

    /**
     * Column names and JDBC types of a table
     */
    TableSchema describe(String table);

    /**
     * Run a parameterized SELECT and materialize every row
     */
    RecordBatch runQuery(SqlQuery query);

    long countRows(String table);
}
