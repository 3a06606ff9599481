package com.dashquery.exception;

/**
 * Thrown when the SQL engine cannot be reached at all.
 * Fatal to the analysis run, unlike per-query failures.
 */
public class EngineUnreachableException extends DashQueryException {

    public EngineUnreachableException(String message) {
        super(message);
    }

    public EngineUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
