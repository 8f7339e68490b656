package com.datalake.query.filter;

import com.datalake.domain.TransactionFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds a {@link FilterSpec} from request parameters.
 *
 * Parsing is tolerant: a parameter whose value cannot be read yields no clause and
 * the rest of the request proceeds. Recognized parameters:
 * <ul>
 *   <li>membership aliases such as {@code transaction_type=purchase,payment}</li>
 *   <li>numeric aliases with a {@code _gt}, {@code _lt} or {@code _eq} suffix,
 *       e.g. {@code amount_gt=100}, {@code rating_gt=3}</li>
 *   <li>raw column names: {@code AMOUNT_USD_gt=10}, {@code STATUS_in=completed,pending}</li>
 * </ul>
 * Other parameters (paging, sorting) are ignored.
 */
@Component
public class FilterSpecParser {

    private static final Logger log = LoggerFactory.getLogger(FilterSpecParser.class);

    private static final Pattern COLUMN_NAME = Pattern.compile("[A-Z][A-Z0-9_]*");
    private static final String MEMBERSHIP_SUFFIX = "_in";

    private static final Map<String, String> MEMBERSHIP_ALIASES = Map.ofEntries(
        Map.entry("transaction_type", TransactionFields.TRANSACTION_TYPE),
        Map.entry("status", TransactionFields.STATUS),
        Map.entry("payment_method", TransactionFields.PAYMENT_METHOD),
        Map.entry("product_category", TransactionFields.PRODUCT_CATEGORY),
        Map.entry("currency", TransactionFields.CURRENCY),
        Map.entry("location_country", TransactionFields.LOCATION_COUNTRY),
        Map.entry("location_city", TransactionFields.LOCATION_CITY),
        Map.entry("device_os", TransactionFields.DEVICE_OS),
        Map.entry("user_id", TransactionFields.USER_ID),
        Map.entry("product_id", TransactionFields.PRODUCT_ID)
    );

    private static final Map<String, String> NUMERIC_ALIASES = Map.of(
        "amount", TransactionFields.AMOUNT_USD,
        "rating", TransactionFields.CUSTOMER_RATING,
        "quantity", TransactionFields.QUANTITY,
        "tax", TransactionFields.TAX_AMOUNT
    );

    /**
     * Parse every recognized parameter. Never throws for bad values.
     */
    public FilterSpec parse(Map<String, String> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return FilterSpec.empty();
        }
        List<FilterClause> clauses = new ArrayList<>();
        parameters.forEach((name, value) -> parseClause(name, value).ifPresent(clauses::add));
        FilterSpec spec = FilterSpec.of(clauses);
        log.debug("Parsed {} filter clauses from {} parameters: {}", clauses.size(), parameters.size(), spec);
        return spec;
    }

    /**
     * Parse one parameter into a clause. Empty when the parameter is not a filter
     * or its value cannot be used.
     */
    public Optional<FilterClause> parseClause(String name, String rawValue) {
        if (name == null || rawValue == null) {
            return Optional.empty();
        }
        String key = name.trim();

        String membershipField = MEMBERSHIP_ALIASES.get(key);
        if (membershipField == null && key.endsWith(MEMBERSHIP_SUFFIX)) {
            membershipField = columnName(key.substring(0, key.length() - MEMBERSHIP_SUFFIX.length()));
        }
        if (membershipField != null) {
            return parseMembership(membershipField, rawValue);
        }

        for (ComparisonOperator operator : ComparisonOperator.values()) {
            String suffix = "_" + operator.getSuffix();
            if (key.endsWith(suffix)) {
                String prefix = key.substring(0, key.length() - suffix.length());
                String field = NUMERIC_ALIASES.containsKey(prefix) ? NUMERIC_ALIASES.get(prefix) : columnName(prefix);
                if (field == null) {
                    break;
                }
                return parseNumber(rawValue)
                    .<FilterClause>map(number -> new ComparisonClause(field, operator, number))
                    .or(() -> {
                        log.debug("Dropping filter {}={}: not a number", key, rawValue);
                        return Optional.empty();
                    });
            }
        }
        return Optional.empty();
    }

    private Optional<FilterClause> parseMembership(String field, String rawValue) {
        Set<String> values = new LinkedHashSet<>();
        for (String part : rawValue.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                values.add(trimmed);
            }
        }
        if (values.isEmpty()) {
            log.debug("Dropping membership filter on {}: no values", field);
            return Optional.empty();
        }
        return Optional.of(new MembershipClause(field, values));
    }

    /**
     * Finite decimal number, or empty
     */
    static Optional<Double> parseNumber(String rawValue) {
        String trimmed = rawValue.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        try {
            double parsed = Double.parseDouble(trimmed);
            return Double.isFinite(parsed) ? Optional.of(parsed) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static String columnName(String candidate) {
        return COLUMN_NAME.matcher(candidate).matches() ? candidate : null;
    }
}
