package com.datalake.query;

/**
 * Thrown for structurally invalid requests that cannot be clamped or ignored,
 * such as a page number below one.
 */
public class QueryValidationException extends DatalakeQueryException {

    private final String parameter;

    public QueryValidationException(String message, String parameter) {
        super(message);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }

    @Override
    public String getMessage() {
        return parameter == null ? super.getMessage() : super.getMessage() + " [Parameter: " + parameter + "]";
    }
}
