package com.datalake.query;

import com.datalake.domain.SourceKind;

/**
 * Thrown when a source identifier does not resolve to a cataloged collection or table
 */
public class SourceNotFoundException extends DatalakeQueryException {

    public SourceNotFoundException(String source) {
        super("Unknown source", null, source);
    }

    public SourceNotFoundException(SourceKind kind, String source) {
        super("Unknown source", kind, source);
    }
}
