package com.datalake.storage.file;

import java.util.Objects;

/**
 * Opaque reference to one immutable partition file of a collection.
 * Size and modification time are part of the identity so a rewritten file
 * never matches a cached read of its predecessor.
 */
public final class PartitionHandle {

    private final String collection;
    private final String location;
    private final long sizeBytes;
    private final long lastModifiedMillis;

    public PartitionHandle(String collection, String location, long sizeBytes, long lastModifiedMillis) {
        this.collection = Objects.requireNonNull(collection, "collection");
        this.location = Objects.requireNonNull(location, "location");
        this.sizeBytes = sizeBytes;
        this.lastModifiedMillis = lastModifiedMillis;
    }

    public String getCollection() {
        return collection;
    }

    public String getLocation() {
        return location;
    }

    /**
     * File name without directories, for logs and failure reports
     */
    public String getFileName() {
        int slash = Math.max(location.lastIndexOf('/'), location.lastIndexOf('\\'));
        return slash >= 0 ? location.substring(slash + 1) : location;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public long getLastModifiedMillis() {
        return lastModifiedMillis;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartitionHandle)) return false;
        PartitionHandle that = (PartitionHandle) o;
        return sizeBytes == that.sizeBytes
            && lastModifiedMillis == that.lastModifiedMillis
            && collection.equals(that.collection)
            && location.equals(that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(collection, location, sizeBytes, lastModifiedMillis);
    }

    @Override
    public String toString() {
        return collection + "/" + getFileName();
    }
}
