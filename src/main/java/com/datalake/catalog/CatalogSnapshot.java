package com.datalake.catalog;

import com.datalake.domain.CollectionInfo;
import com.datalake.domain.SourceKind;
import com.datalake.domain.SourceRef;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable view of the cataloged sources at one refresh.
 * A request captures one snapshot at its start and uses it throughout.
 */
public final class CatalogSnapshot {

    @JsonProperty("version")
    private final long version;

    @JsonProperty("refreshed_at")
    private final Instant refreshedAt;

    @JsonProperty("relational_available")
    private final boolean relationalAvailable;

    @JsonProperty("collections")
    private final List<CollectionInfo> collections;

    public CatalogSnapshot(long version, Instant refreshedAt, boolean relationalAvailable,
                           List<CollectionInfo> collections) {
        this.version = version;
        this.refreshedAt = refreshedAt;
        this.relationalAvailable = relationalAvailable;
        List<CollectionInfo> sorted = new ArrayList<>(collections);
        sorted.sort(CollectionInfo.ORDER);
        this.collections = List.copyOf(sorted);
    }

    public static CatalogSnapshot empty() {
        return new CatalogSnapshot(0L, Instant.EPOCH, false, List.of());
    }

    public long getVersion() {
        return version;
    }

    public Instant getRefreshedAt() {
        return refreshedAt;
    }

    public boolean isRelationalAvailable() {
        return relationalAvailable;
    }

    /**
     * All sources, sorted by kind then name
     */
    public List<CollectionInfo> getCollections() {
        return collections;
    }

    @JsonIgnore
    public List<CollectionInfo> getCollections(SourceKind kind) {
        List<CollectionInfo> result = new ArrayList<>();
        for (CollectionInfo info : collections) {
            if (info.getKind() == kind) {
                result.add(info);
            }
        }
        return result;
    }

    /**
     * Resolve a caller identifier. A bare name prefers a file collection over a table.
     */
    public Optional<CollectionInfo> resolve(SourceRef ref) {
        if (ref == null) {
            return Optional.empty();
        }
        Optional<SourceKind> kind = ref.getKind();
        if (kind.isPresent()) {
            return find(kind.get(), ref.getName());
        }
        Optional<CollectionInfo> file = find(SourceKind.FILE, ref.getName());
        return file.isPresent() ? file : find(SourceKind.TABLE, ref.getName());
    }

    private Optional<CollectionInfo> find(SourceKind kind, String name) {
        for (CollectionInfo info : collections) {
            if (info.getKind() == kind && info.getName().equals(name)) {
                return Optional.of(info);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "CatalogSnapshot{version=" + version + ", relationalAvailable=" + relationalAvailable
            + ", collections=" + collections + "}";
    }
}
