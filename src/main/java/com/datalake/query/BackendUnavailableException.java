package com.datalake.query;

import com.datalake.domain.SourceKind;

/**
 * Thrown when the relational store cannot serve a request that needs it.
 * Catalog and metrics paths degrade to file-only results instead of throwing this.
 */
public class BackendUnavailableException extends DatalakeQueryException {

    public BackendUnavailableException(String message, String source, Throwable cause) {
        super(message, SourceKind.TABLE, source, cause);
    }
}
