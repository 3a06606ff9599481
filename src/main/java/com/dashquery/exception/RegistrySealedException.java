package com.dashquery.exception;

/**
 * Thrown when a sealed variable registry is modified.
 */
public class RegistrySealedException extends DashQueryException {

    public RegistrySealedException(String message) {
        super(message);
    }
}
