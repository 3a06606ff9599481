package com.dashquery.engine;

import com.dashquery.query.QueryErrorKind;

import java.sql.SQLException;
import java.sql.SQLInvalidAuthorizationSpecException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLSyntaxErrorException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;
import java.util.List;
import java.util.Locale;

/**
 * Maps JDBC exceptions to query error categories.
 * Uses the exception subclass first, then the SQLSTATE class, then known driver phrases in the message.
 * Anything unrecognized is a non-retryable syntax failure.
 */
public final class SqlErrorClassifier {

    private static final List<String> SYNTAX_PREFIXES = List.of(
            "parser error", "catalog error", "binder error", "syntax error", "conversion error");

    // Whole driver phrases only; single words like "connection" also appear in table names
    private static final List<String> PERMISSION_PHRASES = List.of(
            "permission denied", "access denied", "not authorized");
    private static final List<String> TIMEOUT_PHRASES = List.of(
            "query timed out", "statement timeout", "query timeout exceeded", "interrupt error");
    private static final List<String> TRANSIENT_PHRASES = List.of(
            "connection refused", "connection reset", "could not connect", "connection is closed",
            "temporarily unavailable", "broken pipe");

    private SqlErrorClassifier() {
    }

    public static QueryErrorKind classify(SQLException e) {
        if (e instanceof SQLTimeoutException) {
            return QueryErrorKind.TIMEOUT;
        }
        if (e instanceof SQLInvalidAuthorizationSpecException) {
            return QueryErrorKind.PERMISSION;
        }
        if (e instanceof SQLSyntaxErrorException) {
            return QueryErrorKind.SYNTAX;
        }
        if (e instanceof SQLTransientException || e instanceof SQLRecoverableException
                || e instanceof SQLNonTransientConnectionException) {
            return QueryErrorKind.TRANSIENT;
        }

        String state = e.getSQLState();
        String stateClass = state != null && state.length() >= 2 ? state.substring(0, 2) : "";
        if (stateClass.equals("08")) {
            return QueryErrorKind.TRANSIENT;
        }
        if (stateClass.equals("28") || "42501".equals(state)) {
            return QueryErrorKind.PERMISSION;
        }
        if (stateClass.equals("42")) {
            return QueryErrorKind.SYNTAX;
        }
        if ("57014".equals(state)) {
            return QueryErrorKind.TIMEOUT;
        }

        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        // Parser and catalog errors quote object names, which may contain any of the phrases below
        if (startsWithAny(message, SYNTAX_PREFIXES)) {
            return QueryErrorKind.SYNTAX;
        }
        if (containsAny(message, PERMISSION_PHRASES)) {
            return QueryErrorKind.PERMISSION;
        }
        if (containsAny(message, TIMEOUT_PHRASES)) {
            return QueryErrorKind.TIMEOUT;
        }
        if (containsAny(message, TRANSIENT_PHRASES)) {
            return QueryErrorKind.TRANSIENT;
        }
        return QueryErrorKind.SYNTAX;
    }

    private static boolean startsWithAny(String message, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (message.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAny(String message, List<String> phrases) {
        for (String phrase : phrases) {
            if (message.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
