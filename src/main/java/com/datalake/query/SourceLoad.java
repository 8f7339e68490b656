package com.datalake.query;

import com.datalake.domain.CollectionInfo;
import com.datalake.domain.RecordBatch;
import com.datalake.domain.SourceFailure;

import java.util.List;

/**
 * Result of loading one source inside a fan-out
 */
final class SourceLoad {

    private final CollectionInfo source;
    private final RecordBatch batch;
    private final List<SourceFailure> failures;
    private final boolean readable;

    SourceLoad(CollectionInfo source, RecordBatch batch, List<SourceFailure> failures, boolean readable) {
        this.source = source;
        this.batch = batch;
        this.failures = List.copyOf(failures);
        this.readable = readable;
    }

    static SourceLoad failed(CollectionInfo source, SourceFailure failure) {
        return new SourceLoad(source, RecordBatch.empty(), List.of(failure), false);
    }

    CollectionInfo getSource() {
        return source;
    }

    RecordBatch getBatch() {
        return batch;
    }

    List<SourceFailure> getFailures() {
        return failures;
    }

    boolean isReadable() {
        return readable;
    }
}
