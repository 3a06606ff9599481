package com.dashquery.exception;

/**
 * Thrown when a time expression cannot be parsed or a time range is inverted.
 */
public class InvalidTimeSpecException extends DashQueryException {

    private final String expression;

    public InvalidTimeSpecException(String expression, String message) {
        super("Invalid time spec '" + expression + "': " + message);
        this.expression = expression;
    }

    public InvalidTimeSpecException(String expression, String message, Throwable cause) {
        super("Invalid time spec '" + expression + "': " + message, cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
