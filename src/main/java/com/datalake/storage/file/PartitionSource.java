package com.datalake.storage.file;

import com.datalake.domain.RecordBatch;

import java.io.IOException;
import java.util.List;

/**
 * File side of the storage collaborators: named collections of immutable partition files.
 */
public interface PartitionSource {

    /**
     * Names of the collections currently present, sorted
     */
    List<String> listCollections() throws IOException;

    /**
     * Partition files of a collection in a stable order. Empty if the collection vanished.
     */
    List<PartitionHandle> listPartitions(String collection) throws IOException;

    /**
     * Read one partition completely
     *
     * @throws IOException if the file is unreadable or not a valid partition
     */
    RecordBatch readPartition(PartitionHandle handle) throws IOException;
}
