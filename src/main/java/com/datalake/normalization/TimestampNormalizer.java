package com.datalake.normalization;

import com.datalake.domain.RecordBatch;
import com.datalake.domain.TransactionFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites timestamp columns into timezone-naive {@link LocalDateTime} values.
 *
 * Offsets are dropped, not converted: {@code 2024-03-01T10:00:00+02:00} becomes
 * {@code 2024-03-01T10:00}. All downstream comparisons and windows work on this
 * wall-clock representation. Values that cannot be read become null; this class
 * never throws for bad data.
 */
@Component
public class TimestampNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TimestampNormalizer.class);

    /**
     * Date and time separated by 'T' or a space, optional fraction, optional offset or zone.
     */
    private static final DateTimeFormatter FLEXIBLE_FORMATTER = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart().appendLiteral('T').optionalEnd()
        .optionalStart().appendLiteral(' ').optionalEnd()
        .appendValue(ChronoField.HOUR_OF_DAY, 2)
        .appendLiteral(':')
        .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
        .optionalStart()
        .appendLiteral(':')
        .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
        .optionalStart()
        .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
        .optionalEnd()
        .optionalEnd()
        .optionalStart().appendLiteral(' ').optionalEnd()
        .optionalStart().appendOffset("+HH:MM:ss", "Z").optionalEnd()
        .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
        .optionalStart().appendLiteral('[').appendZoneRegionId().appendLiteral(']').optionalEnd()
        .toFormatter();

    private static final int DATE_ONLY_LENGTH = 10;

    // Epoch magnitude thresholds (absolute value) for seconds, millis and micros
    private static final long MAX_EPOCH_SECONDS = 100_000_000_000L;
    private static final long MAX_EPOCH_MILLIS = 100_000_000_000_000L;
    private static final long MAX_EPOCH_MICROS = 100_000_000_000_000_000L;

    /**
     * Normalize the default transaction timestamp columns.
     */
    public RecordBatch normalize(RecordBatch batch) {
        return normalize(batch, TransactionFields.TIMESTAMP_FIELDS);
    }

    /**
     * Normalize the given timestamp columns of a batch. Columns absent from the
     * batch schema are ignored. Returns a new batch; the input is not modified.
     */
    public RecordBatch normalize(RecordBatch batch, Collection<String> timestampFields) {
        if (batch == null || batch.isEmpty()) {
            return batch == null ? RecordBatch.empty() : batch;
        }
        List<String> present = new ArrayList<>();
        for (String field : timestampFields) {
            if (batch.getSchema().contains(field)) {
                present.add(field);
            }
        }
        if (present.isEmpty()) {
            return batch;
        }

        int unparseable = 0;
        List<Map<String, Object>> rewritten = new ArrayList<>(batch.size());
        for (Map<String, Object> record : batch.getRecords()) {
            Map<String, Object> copy = new LinkedHashMap<>(record);
            for (String field : present) {
                Object raw = record.get(field);
                LocalDateTime value = toLocalDateTime(raw);
                if (raw != null && value == null) {
                    unparseable++;
                }
                copy.put(field, value);
            }
            rewritten.add(copy);
        }
        if (unparseable > 0) {
            log.debug("Nulled {} unparseable timestamp values in fields {}", unparseable, present);
        }
        return RecordBatch.of(batch.getSchema(), rewritten);
    }

    /**
     * Convert a single value to a naive timestamp, or null when it cannot be read.
     */
    public LocalDateTime toLocalDateTime(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toLocalDateTime();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toLocalDateTime();
        }
        if (value instanceof java.sql.Timestamp) {
            return ((java.sql.Timestamp) value).toLocalDateTime();
        }
        if (value instanceof Instant) {
            return LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
        }
        if (value instanceof java.util.Date) {
            return LocalDateTime.ofInstant(((java.util.Date) value).toInstant(), ZoneOffset.UTC);
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        if (value instanceof Long || value instanceof Integer) {
            return fromEpoch(((Number) value).longValue());
        }
        if (value instanceof CharSequence) {
            return parse(value.toString());
        }
        return null;
    }

    private LocalDateTime parse(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            if (trimmed.length() == DATE_ONLY_LENGTH) {
                return LocalDate.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay();
            }
            TemporalAccessor parsed = FLEXIBLE_FORMATTER.parse(trimmed);
            return LocalDateTime.of(LocalDate.from(parsed), LocalTime.from(parsed));
        } catch (DateTimeException e) {
            log.trace("Unparseable timestamp '{}': {}", trimmed, e.getMessage());
            return null;
        }
    }

    private LocalDateTime fromEpoch(long epoch) {
        long magnitude = Math.abs(epoch);
        Instant instant;
        if (magnitude < MAX_EPOCH_SECONDS) {
            instant = Instant.ofEpochSecond(epoch);
        } else if (magnitude < MAX_EPOCH_MILLIS) {
            instant = Instant.ofEpochMilli(epoch);
        } else if (magnitude < MAX_EPOCH_MICROS) {
            instant = Instant.ofEpochSecond(Math.floorDiv(epoch, 1_000_000L), Math.floorMod(epoch, 1_000_000L) * 1_000L);
        } else {
            instant = Instant.ofEpochSecond(Math.floorDiv(epoch, 1_000_000_000L), Math.floorMod(epoch, 1_000_000_000L));
        }
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
