package com.dashquery.exception;

/**
 * Thrown when queries are submitted to a coordinator that cannot accept them.
 * Typically because the coordinator has been shut down.
 */
public class ExecutionRejectedException extends DashQueryException {

    public ExecutionRejectedException(String message) {
        super(message);
    }
}
