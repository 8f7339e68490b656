package com.datalake.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.Objects;

/**
 * Catalog entry for one collection. Identity is {@code (kind, name)}.
 *
 * For file collections the item count is the number of partition files, not rows.
 */
public final class CollectionInfo {

    public static final Comparator<CollectionInfo> ORDER =
        Comparator.comparing(CollectionInfo::getKind).thenComparing(CollectionInfo::getName);

    @JsonProperty("name")
    private final String name;

    @JsonProperty("kind")
    private final SourceKind kind;

    @JsonProperty("item_count")
    private final long itemCount;

    public CollectionInfo(String name, SourceKind kind, long itemCount) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.itemCount = itemCount;
    }

    public String getName() {
        return name;
    }

    public SourceKind getKind() {
        return kind;
    }

    public long getItemCount() {
        return itemCount;
    }

    public String getQualifiedName() {
        return kind.getValue() + ":" + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CollectionInfo)) return false;
        CollectionInfo that = (CollectionInfo) o;
        return name.equals(that.name) && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind);
    }

    @Override
    public String toString() {
        return getQualifiedName() + "(" + itemCount + ")";
    }
}
