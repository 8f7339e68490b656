package com.datalake.query;

import com.datalake.domain.CollectionInfo;
import com.datalake.domain.RecordBatch;
import com.datalake.domain.SourceFailure;

import java.util.List;

/**
 * Filtered and sorted records of one source, plus the partitions that were skipped
 */
public final class QueryOutcome {

    private final CollectionInfo source;
    private final RecordBatch batch;
    private final List<SourceFailure> failures;

    public QueryOutcome(CollectionInfo source, RecordBatch batch, List<SourceFailure> failures) {
        this.source = source;
        this.batch = batch;
        this.failures = List.copyOf(failures);
    }

    public CollectionInfo getSource() {
        return source;
    }

    public RecordBatch getBatch() {
        return batch;
    }

    public List<SourceFailure> getFailures() {
        return failures;
    }

    public boolean isPartial() {
        return !failures.isEmpty();
    }

    @Override
    public String toString() {
        return "QueryOutcome{source=" + source + ", records=" + batch.size() + ", failures=" + failures.size() + "}";
    }
}
