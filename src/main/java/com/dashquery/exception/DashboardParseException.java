package com.dashquery.exception;

/**
 * Thrown when a dashboard definition is structurally unusable.
 * Fatal to the analysis run.
 */
public class DashboardParseException extends DashQueryException {

    public DashboardParseException(String message) {
        super(message);
    }

    public DashboardParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
