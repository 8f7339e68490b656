package com.datalake.query.filter;

import com.datalake.domain.Values;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Compiles a {@link FilterSpec} into a row predicate for materialized record batches.
 *
 * Semantics match {@link SqlFilterTranslator}: a null or missing field never
 * satisfies any clause, comparisons need a numeric value, and membership against
 * a numeric value compares numerically.
 */
@Component
public class InMemoryFilterTranslator {

    /**
     * Conjunction of all clauses; the empty filter accepts everything.
     */
    public Predicate<Map<String, Object>> compile(FilterSpec spec) {
        if (spec == null || spec.isEmpty()) {
            return record -> true;
        }
        List<Predicate<Map<String, Object>>> predicates = new ArrayList<>(spec.getClauses().size());
        for (FilterClause clause : spec.getClauses()) {
            predicates.add(compileClause(clause));
        }
        return record -> {
            for (Predicate<Map<String, Object>> predicate : predicates) {
                if (!predicate.test(record)) {
                    return false;
                }
            }
            return true;
        };
    }

    private Predicate<Map<String, Object>> compileClause(FilterClause clause) {
        if (clause instanceof MembershipClause) {
            return membership((MembershipClause) clause);
        } else if (clause instanceof ComparisonClause) {
            return comparison((ComparisonClause) clause);
        }
        throw new IllegalArgumentException("Unsupported filter clause: " + clause);
    }

    private Predicate<Map<String, Object>> membership(MembershipClause clause) {
        String field = clause.getField();
        Set<String> members = clause.getValues();
        List<Double> numericMembers = new ArrayList<>();
        for (String member : members) {
            FilterSpecParser.parseNumber(member).ifPresent(numericMembers::add);
        }
        return record -> {
            Object value = record.get(field);
            if (value == null) {
                return false;
            }
            if (value instanceof Number) {
                Optional<Double> number = Values.asDouble(value);
                return number.isPresent() && numericMembers.contains(number.get());
            }
            return members.contains(Values.asKey(value));
        };
    }

    private Predicate<Map<String, Object>> comparison(ComparisonClause clause) {
        String field = clause.getField();
        ComparisonOperator operator = clause.getOperator();
        double bound = clause.getValue();
        return record -> {
            Optional<Double> number = Values.asDouble(record.get(field));
            return number.isPresent() && operator.test(number.get(), bound);
        };
    }
}
