package com.datalake.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Scalar helpers shared by the loaders, the filter translators and the metrics engine.
 *
 * Record values are restricted to String, Long, Double, Boolean, LocalDateTime and null.
 * Everything a driver or a Parquet reader hands back is coerced into that set here.
 */
public final class Values {

    private Values() {
    }

    /**
     * Coerce a raw backend value into the record value domain.
     * NaN and infinite floating point values become null.
     */
    public static Object coerce(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof String || raw instanceof Long || raw instanceof Boolean
                || raw instanceof LocalDateTime) {
            return raw;
        }
        if (raw instanceof Double) {
            double d = (Double) raw;
            return Double.isNaN(d) || Double.isInfinite(d) ? null : raw;
        }
        if (raw instanceof Float) {
            float f = (Float) raw;
            return Float.isNaN(f) || Float.isInfinite(f) ? null : Double.valueOf(Float.toString(f));
        }
        if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof BigInteger) {
            return ((BigInteger) raw).longValue();
        }
        if (raw instanceof BigDecimal) {
            return ((BigDecimal) raw).doubleValue();
        }
        if (raw instanceof java.sql.Timestamp) {
            return ((java.sql.Timestamp) raw).toLocalDateTime();
        }
        if (raw instanceof java.sql.Date) {
            return ((java.sql.Date) raw).toLocalDate().atStartOfDay();
        }
        if (raw instanceof LocalDate) {
            return ((LocalDate) raw).atStartOfDay();
        }
        if (raw instanceof CharSequence) {
            return raw.toString();
        }
        if (raw instanceof ByteBuffer) {
            ByteBuffer buffer = ((ByteBuffer) raw).duplicate();
            byte[] bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            return new String(bytes, StandardCharsets.UTF_8);
        }
        // Temporal values with zone information are left for the timestamp normalizer
        return raw;
    }

    /**
     * Numeric view of a record value. Only numbers qualify; strings are not parsed
     * so that in-memory comparisons agree with typed SQL columns.
     */
    public static Optional<Double> asDouble(Object value) {
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Double.isNaN(d) ? Optional.empty() : Optional.of(d);
        }
        return Optional.empty();
    }

    /**
     * Exact decimal view of a numeric record value, for money sums.
     */
    public static Optional<BigDecimal> asDecimal(Object value) {
        if (value instanceof Long || value instanceof Integer) {
            return Optional.of(BigDecimal.valueOf(((Number) value).longValue()));
        }
        if (value instanceof BigDecimal) {
            return Optional.of((BigDecimal) value);
        }
        return asDouble(value).map(BigDecimal::valueOf);
    }

    /**
     * Grouping/membership key of a value. Integral doubles render without a fraction
     * so that {@code 3L} and {@code 3.0} share a key.
     */
    public static String asKey(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
        }
        return value.toString();
    }

    /**
     * Total order over non-null record values used for sorting.
     * Values of different types are ordered by type first: numbers, booleans,
     * timestamps, strings, then anything else. Within a type numbers compare
     * numerically, timestamps chronologically and the rest by natural or string order.
     */
    public static int compare(Object left, Object right) {
        int byType = Integer.compare(typeRank(left), typeRank(right));
        if (byType != 0) {
            return byType;
        }
        if (left instanceof Number) {
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
        }
        if (left instanceof Boolean) {
            return ((Boolean) left).compareTo((Boolean) right);
        }
        if (left instanceof LocalDateTime) {
            return ((LocalDateTime) left).compareTo((LocalDateTime) right);
        }
        if (left instanceof String) {
            return ((String) left).compareTo((String) right);
        }
        int byClass = left.getClass().getName().compareTo(right.getClass().getName());
        return byClass != 0 ? byClass : left.toString().compareTo(right.toString());
    }

    private static int typeRank(Object value) {
        if (value instanceof Number) {
            return 0;
        }
        if (value instanceof Boolean) {
            return 1;
        }
        if (value instanceof LocalDateTime) {
            return 2;
        }
        if (value instanceof String) {
            return 3;
        }
        return 4;
    }
}
