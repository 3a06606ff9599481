package com.dashquery.time;

import com.dashquery.exception.InvalidTimeSpecException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

/**
 * Parses dashboard time expressions.
 * <p>
 * Accepted forms:
 * <ul>
 *   <li>{@code now}</li>
 *   <li>{@code now-7d}, {@code now+1h} (single offset, units s m h d w M y)</li>
 *   <li>epoch milliseconds, e.g. {@code 1700000000000}</li>
 *   <li>ISO-8601 instants and offset date-times, local date-times (UTC), and dates (UTC midnight)</li>
 * </ul>
 */
public final class TimeSpecParser {

    private static final String NOW = "now";

    private static final List<Function<String, Instant>> DATE_PARSERS = List.of(
            Instant::parse,
            text -> OffsetDateTime.parse(text).toInstant(),
            text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
            text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    private final String input;
    private int pos;

    private TimeSpecParser(String input) {
        this.input = input;
        this.pos = 0;
    }

    /**
     * Parse a time expression.
     *
     * @param expression Raw expression
     * @return The parsed spec
     * @throws InvalidTimeSpecException if the expression is not recognized
     */
    public static TimeSpec parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidTimeSpecException(String.valueOf(expression), "empty expression");
        }
        String trimmed = expression.trim();
        if (trimmed.startsWith(NOW)) {
            return new TimeSpecParser(trimmed).parseRelative();
        }
        if (isEpochMillis(trimmed)) {
            try {
                return new TimeSpec.Absolute(Long.parseLong(trimmed));
            } catch (NumberFormatException e) {
                throw new InvalidTimeSpecException(trimmed, "epoch value out of range", e);
            }
        }
        return parseAbsoluteDate(trimmed);
    }

    private TimeSpec parseRelative() {
        pos = NOW.length();
        if (isAtEnd()) {
            return TimeSpec.now();
        }

        char sign = advance();
        if (sign != '-' && sign != '+') {
            throw error("expected '+' or '-' after 'now'");
        }

        int digitsStart = pos;
        while (!isAtEnd() && Character.isDigit(peek())) {
            advance();
        }
        if (pos == digitsStart) {
            throw error("missing amount");
        }
        long amount;
        try {
            amount = Long.parseLong(input.substring(digitsStart, pos));
        } catch (NumberFormatException e) {
            throw new InvalidTimeSpecException(input, "amount out of range", e);
        }

        if (isAtEnd()) {
            throw error("missing unit");
        }
        char symbol = advance();
        RelativeUnit unit = RelativeUnit.fromSymbol(symbol)
                .orElseThrow(() -> error("unknown unit '" + symbol + "'"));

        if (!isAtEnd()) {
            throw error("unexpected trailing text '" + input.substring(pos) + "'");
        }
        return new TimeSpec.Relative(sign == '-' ? -amount : amount, unit);
    }

    private static TimeSpec parseAbsoluteDate(String text) {
        DateTimeParseException lastError = null;
        for (Function<String, Instant> parser : DATE_PARSERS) {
            try {
                return new TimeSpec.Absolute(parser.apply(text).toEpochMilli());
            } catch (DateTimeParseException e) {
                lastError = e;
            }
        }
        throw new InvalidTimeSpecException(text, "not a relative expression, epoch value or ISO-8601 date", lastError);
    }

    private static boolean isEpochMillis(String text) {
        int start = text.charAt(0) == '-' ? 1 : 0;
        if (start == text.length()) {
            return false;
        }
        for (int i = start; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private InvalidTimeSpecException error(String message) {
        return new InvalidTimeSpecException(input, message + " at position " + pos);
    }
}
