package com.datalake.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, duplicate-free set of field names shared by the records of a batch.
 */
public final class Schema {

    private static final Schema EMPTY = new Schema(List.of());

    private final List<String> fields;
    private final Set<String> lookup;

    private Schema(Collection<String> fields) {
        LinkedHashSet<String> ordered = new LinkedHashSet<>(fields);
        this.fields = Collections.unmodifiableList(new ArrayList<>(ordered));
        this.lookup = Collections.unmodifiableSet(ordered);
    }

    public static Schema empty() {
        return EMPTY;
    }

    public static Schema of(Collection<String> fields) {
        return fields == null || fields.isEmpty() ? EMPTY : new Schema(fields);
    }

    public static Schema of(String... fields) {
        return of(List.of(fields));
    }

    /**
     * Union of several schemas. Field order follows first appearance, so merging
     * sources with disjoint field sets never fails.
     */
    public static Schema union(Collection<Schema> schemas) {
        LinkedHashSet<String> merged = new LinkedHashSet<>();
        for (Schema schema : schemas) {
            if (schema != null) {
                merged.addAll(schema.fields);
            }
        }
        return of(merged);
    }

    public List<String> getFields() {
        return fields;
    }

    public boolean contains(String field) {
        return lookup.contains(field);
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Schema)) return false;
        return fields.equals(((Schema) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Schema" + fields;
    }
}
