package com.dashquery.time;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Concrete time boundaries in epoch milliseconds, from &lt;= to.
 *
 * @param fromMillis Lower boundary
 * @param toMillis   Upper boundary
 */
public record ResolvedTimeRange(long fromMillis, long toMillis) {

    private static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    public ResolvedTimeRange {
        if (fromMillis > toMillis) {
            throw new IllegalArgumentException("Time range start " + fromMillis + " is after end " + toMillis);
        }
    }

    /**
     * Lower boundary as a quoted ISO-8601 SQL literal.
     */
    public String fromLiteral() {
        return literal(fromMillis);
    }

    /**
     * Upper boundary as a quoted ISO-8601 SQL literal.
     */
    public String toLiteral() {
        return literal(toMillis);
    }

    public long durationMillis() {
        return toMillis - fromMillis;
    }

    /**
     * Format epoch millis as a single-quoted ISO-8601 UTC literal with millisecond precision.
     */
    public static String literal(long epochMillis) {
        return "'" + ISO_MILLIS.format(Instant.ofEpochMilli(epochMillis)) + "'";
    }
}
