package com.datalake.query.filter;

import com.datalake.domain.SourceKind;
import com.datalake.domain.TableSchema;
import com.datalake.query.SourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Compiles a {@link FilterSpec} into a parameterized SELECT against one relational table.
 *
 * Values never enter the SQL text: each one becomes a {@code ?} placeholder with
 * its value in the parameter list. Identifiers are checked against the table's
 * column set and a strict name pattern before they are emitted.
 *
 * The generated WHERE clause keeps exactly the rows {@link InMemoryFilterTranslator}
 * keeps on the same data:
 * <ul>
 *   <li>comparisons are guarded with {@code IS NOT NULL} so NULL never matches</li>
 *   <li>a clause on a column the table does not have is {@code 1 = 0}, because the
 *       in-memory side reads a missing field as null</li>
 *   <li>a comparison on a non-numeric column is {@code 1 = 0}, because only numbers compare</li>
 *   <li>text membership is byte-exact ({@code BINARY col IN (...)}) so case-insensitive,
 *       pad-space collations do not widen the match</li>
 *   <li>boolean membership binds {@link Boolean} values, and only {@code true}/{@code false} match</li>
 * </ul>
 * Binary text comparison is MariaDB/MySQL syntax and can be switched off for other
 * stores whose default comparison is already exact.
 */
@Component
public class SqlFilterTranslator {

    private static final Logger logger = LoggerFactory.getLogger(SqlFilterTranslator.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final String NEVER = "1 = 0";

    private final boolean binaryTextMatch;

    public SqlFilterTranslator() {
        this(true);
    }

    @Autowired
    public SqlFilterTranslator(@Value("${datalake.relational.binary-text-match:true}") boolean binaryTextMatch) {
        this.binaryTextMatch = binaryTextMatch;
    }

    /**
     * Build {@code SELECT * FROM table [WHERE ...]} for the filter.
     *
     * @throws SourceNotFoundException if the table name is not a plain identifier
     */
    public SqlQuery translate(TableSchema table, FilterSpec spec) {
        String tableName = requireIdentifier(table.getTable());
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(tableName);
        List<Object> parameters = new ArrayList<>();

        if (spec != null && !spec.isEmpty()) {
            StringJoiner where = new StringJoiner(" AND ", " WHERE ", "");
            for (FilterClause clause : spec.getClauses()) {
                where.add("(" + buildClauseSql(table, clause, parameters) + ")");
            }
            sql.append(where);
        }

        SqlQuery query = new SqlQuery(sql.toString(), parameters);
        logger.debug("Translated {} for table {} to: {}", spec, tableName, query);
        return query;
    }

    /**
     * Build {@code SELECT COUNT(*) FROM table}
     */
    public SqlQuery countQuery(String table) {
        return new SqlQuery("SELECT COUNT(*) FROM " + requireIdentifier(table), List.of());
    }

    /**
     * Build a zero-row SELECT used to read a table's column metadata
     */
    public SqlQuery describeQuery(String table) {
        return new SqlQuery("SELECT * FROM " + requireIdentifier(table) + " WHERE 1 = 0", List.of());
    }

    private String buildClauseSql(TableSchema table, FilterClause clause, List<Object> parameters) {
        String field = clause.getField();
        if (!IDENTIFIER.matcher(field).matches() || !table.contains(field)) {
            logger.debug("Column {} not in table {}, clause {} matches nothing", field, table.getTable(), clause);
            return NEVER;
        }
        if (clause instanceof MembershipClause) {
            return buildMembershipSql(table, (MembershipClause) clause, parameters);
        } else if (clause instanceof ComparisonClause) {
            return buildComparisonSql(table, (ComparisonClause) clause, parameters);
        }
        throw new IllegalArgumentException("Unsupported filter clause: " + clause);
    }

    private String buildMembershipSql(TableSchema table, MembershipClause clause, List<Object> parameters) {
        String field = clause.getField();
        List<Object> members = new ArrayList<>();
        String column = field;
        if (table.isNumeric(field)) {
            for (String value : clause.getValues()) {
                FilterSpecParser.parseNumber(value).ifPresent(members::add);
            }
        } else if (table.isBoolean(field)) {
            for (String value : clause.getValues()) {
                if ("true".equals(value) || "false".equals(value)) {
                    members.add(Boolean.valueOf(value));
                }
            }
        } else {
            members.addAll(clause.getValues());
            if (binaryTextMatch) {
                column = "BINARY " + field;
            }
        }
        if (members.isEmpty()) {
            return NEVER;
        }
        StringJoiner placeholders = new StringJoiner(", ", "(", ")");
        for (Object member : members) {
            placeholders.add("?");
            parameters.add(member);
        }
        return field + " IS NOT NULL AND " + column + " IN " + placeholders;
    }

    private String buildComparisonSql(TableSchema table, ComparisonClause clause, List<Object> parameters) {
        String field = clause.getField();
        if (!table.isNumeric(field)) {
            return NEVER;
        }
        parameters.add(clause.getValue());
        return field + " IS NOT NULL AND " + field + " " + clause.getOperator().getSql() + " ?";
    }

    private static String requireIdentifier(String table) {
        if (table == null || !IDENTIFIER.matcher(table).matches()) {
            throw new SourceNotFoundException(SourceKind.TABLE, table);
        }
        return table;
    }
}
