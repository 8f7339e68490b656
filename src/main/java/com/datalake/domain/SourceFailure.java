package com.datalake.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;

/**
 * A partition file or table that could not be read during a request.
 * Failures are recorded on the outcome and logged; they never fail the request on their own.
 */
public final class SourceFailure {

    /**
     * Deterministic reporting order: kind, source, then item
     */
    public static final Comparator<SourceFailure> ORDER = Comparator.comparing(SourceFailure::getKind)
        .thenComparing(SourceFailure::getSource)
        .thenComparing(failure -> failure.getItem() == null ? "" : failure.getItem());

    @JsonProperty("kind")
    private final SourceKind kind;

    @JsonProperty("source")
    private final String source;

    @JsonProperty("item")
    private final String item;

    @JsonProperty("reason")
    private final String reason;

    @JsonProperty("timed_out")
    private final boolean timedOut;

    public SourceFailure(SourceKind kind, String source, String item, String reason, boolean timedOut) {
        this.kind = kind;
        this.source = source;
        this.item = item;
        this.reason = reason;
        this.timedOut = timedOut;
    }

    public SourceKind getKind() {
        return kind;
    }

    public String getSource() {
        return source;
    }

    public String getItem() {
        return item;
    }

    public String getReason() {
        return reason;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    @Override
    public String toString() {
        return kind.getValue() + ":" + source + (item != null ? "/" + item : "")
            + (timedOut ? " timed out" : " failed: " + reason);
    }
}
