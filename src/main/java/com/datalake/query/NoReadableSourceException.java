package com.datalake.query;

import com.datalake.domain.SourceFailure;

import java.util.List;

/**
 * Thrown when a request had sources to read but every one of them failed.
 */
public class NoReadableSourceException extends DatalakeQueryException {

    private final List<SourceFailure> failures;

    public NoReadableSourceException(String message, List<SourceFailure> failures) {
        super(message);
        this.failures = List.copyOf(failures);
    }

    public List<SourceFailure> getFailures() {
        return failures;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " [Failures: " + failures.size() + "]";
    }
}
