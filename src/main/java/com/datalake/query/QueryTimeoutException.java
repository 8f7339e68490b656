package com.datalake.query;

import java.time.Duration;

/**
 * Thrown when a whole request exceeds its deadline.
 * Per-source timeouts never raise this; they are recorded as failed sources.
 */
public class QueryTimeoutException extends DatalakeQueryException {

    private final Duration timeout;

    public QueryTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(operation + " timed out after " + timeout.toMillis() + "ms", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
