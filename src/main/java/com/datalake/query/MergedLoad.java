package com.datalake.query;

import com.datalake.domain.RecordBatch;
import com.datalake.domain.SourceFailure;

import java.util.List;

/**
 * Every cataloged source loaded, normalized and merged under the union schema.
 *
 * {@code sourceCount} counts the sources attempted; {@code readableCount} those that
 * contributed (a collection counts when at least one of its partitions was read).
 */
public final class MergedLoad {

    private final RecordBatch batch;
    private final int sourceCount;
    private final int readableCount;
    private final List<SourceFailure> failures;

    public MergedLoad(RecordBatch batch, int sourceCount, int readableCount, List<SourceFailure> failures) {
        this.batch = batch;
        this.sourceCount = sourceCount;
        this.readableCount = readableCount;
        this.failures = List.copyOf(failures);
    }

    public RecordBatch getBatch() {
        return batch;
    }

    public int getSourceCount() {
        return sourceCount;
    }

    public int getReadableCount() {
        return readableCount;
    }

    public List<SourceFailure> getFailures() {
        return failures;
    }

    /**
     * True when there was something to read and nothing could be read
     */
    public boolean isUnreadable() {
        return sourceCount > 0 && readableCount == 0;
    }
}
