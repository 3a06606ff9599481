package com.dashquery.exception;

/**
 * Thrown when a variable is looked up that the dashboard never declared.
 */
public class UnknownVariableException extends DashQueryException {

    private final String variableName;

    public UnknownVariableException(String variableName) {
        super("Unknown variable: " + variableName);
        this.variableName = variableName;
    }

    public String getVariableName() {
        return variableName;
    }
}
