package com.dashquery.exception;

/**
 * Base exception for the dashboard query core.
 */
public class DashQueryException extends RuntimeException {

    public DashQueryException(String message) {
        super(message);
    }

    public DashQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
