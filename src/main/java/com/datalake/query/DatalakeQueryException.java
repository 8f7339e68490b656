package com.datalake.query;

import com.datalake.domain.SourceKind;

/**
 * Base class of the structured errors the query layer surfaces to its callers.
 * Provides context about which source was involved, when there is one.
 */
public class DatalakeQueryException extends RuntimeException {

    private final SourceKind kind;
    private final String source;

    public DatalakeQueryException(String message) {
        super(message);
        this.kind = null;
        this.source = null;
    }

    public DatalakeQueryException(String message, Throwable cause) {
        super(message, cause);
        this.kind = null;
        this.source = null;
    }

    public DatalakeQueryException(String message, SourceKind kind, String source) {
        super(message);
        this.kind = kind;
        this.source = source;
    }

    public DatalakeQueryException(String message, SourceKind kind, String source, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.source = source;
    }

    public SourceKind getKind() {
        return kind;
    }

    public String getSource() {
        return source;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (kind != null) {
            sb.append(" [Kind: ").append(kind.getValue()).append("]");
        }
        if (source != null) {
            sb.append(" [Source: ").append(source).append("]");
        }
        return sb.toString();
    }
}
