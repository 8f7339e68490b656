package com.datalake.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Immutable, ordered set of records sharing a logical origin (one partition file,
 * one query result, or a merge of several of those).
 *
 * Every record carries every field of the batch schema; fields a record did not
 * have at the source hold {@code null}. Records are exposed as unmodifiable maps
 * that may contain null values.
 */
public final class RecordBatch {

    private static final RecordBatch EMPTY = new RecordBatch(Schema.empty(), List.of());

    private final Schema schema;
    private final List<Map<String, Object>> records;

    private RecordBatch(Schema schema, List<Map<String, Object>> records) {
        this.schema = schema;
        this.records = records;
    }

    public static RecordBatch empty() {
        return EMPTY;
    }

    /**
     * Build a batch whose schema is the union of the field sets of the given rows.
     */
    public static RecordBatch of(List<? extends Map<String, ?>> rows) {
        LinkedHashMap<String, Boolean> fields = new LinkedHashMap<>();
        for (Map<String, ?> row : rows) {
            for (String field : row.keySet()) {
                fields.putIfAbsent(field, Boolean.TRUE);
            }
        }
        return of(Schema.of(fields.keySet()), rows);
    }

    /**
     * Build a batch with an explicit schema. Row fields outside the schema are
     * dropped and schema fields missing from a row are filled with null.
     */
    public static RecordBatch of(Schema schema, List<? extends Map<String, ?>> rows) {
        if (rows == null || rows.isEmpty()) {
            return schema == null || schema.isEmpty() ? EMPTY : new RecordBatch(schema, List.of());
        }
        List<Map<String, Object>> aligned = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            aligned.add(align(schema, row));
        }
        return new RecordBatch(schema, Collections.unmodifiableList(aligned));
    }

    /**
     * Concatenate batches from possibly different origins.
     *
     * The merged schema is the union of all input schemas and records keep their
     * relative order (batch by batch). Disjoint field sets are legal.
     */
    public static RecordBatch merge(Collection<RecordBatch> batches) {
        List<Schema> schemas = new ArrayList<>();
        int total = 0;
        for (RecordBatch batch : batches) {
            if (batch != null) {
                schemas.add(batch.schema);
                total += batch.size();
            }
        }
        Schema merged = Schema.union(schemas);
        List<Map<String, Object>> rows = new ArrayList<>(total);
        for (RecordBatch batch : batches) {
            if (batch != null) {
                rows.addAll(batch.records);
            }
        }
        return of(merged, rows);
    }

    private static Map<String, Object> align(Schema schema, Map<String, ?> row) {
        Map<String, Object> aligned = new LinkedHashMap<>(Math.max(16, schema.size() * 2));
        for (String field : schema.getFields()) {
            aligned.put(field, row.get(field));
        }
        return Collections.unmodifiableMap(aligned);
    }

    public Schema getSchema() {
        return schema;
    }

    public List<Map<String, Object>> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Keep the records matching the predicate, preserving order and schema.
     */
    public RecordBatch filter(Predicate<Map<String, Object>> predicate) {
        List<Map<String, Object>> kept = new ArrayList<>();
        for (Map<String, Object> record : records) {
            if (predicate.test(record)) {
                kept.add(record);
            }
        }
        return new RecordBatch(schema, Collections.unmodifiableList(kept));
    }

    /**
     * Reorder records. The list must hold records of this batch.
     */
    public RecordBatch withOrder(List<Map<String, Object>> reordered) {
        return new RecordBatch(schema, Collections.unmodifiableList(new ArrayList<>(reordered)));
    }

    @Override
    public String toString() {
        return "RecordBatch{schema=" + schema + ", size=" + records.size() + "}";
    }
}
