package com.dashquery.time;

import java.util.Optional;

/**
 * Units accepted in relative time expressions such as now-7d.
 * Month and year are fixed approximations (30.44 and 365.25 days), matching the
 * approximations dashboards themselves apply to relative ranges.
 */
public enum RelativeUnit {
    SECOND('s', 1L),
    MINUTE('m', 60L),
    HOUR('h', 3_600L),
    DAY('d', 86_400L),
    WEEK('w', 604_800L),
    MONTH('M', 2_629_800L),
    YEAR('y', 31_557_600L);

    private final char symbol;
    private final long seconds;

    RelativeUnit(char symbol, long seconds) {
        this.symbol = symbol;
        this.seconds = seconds;
    }

    public char getSymbol() {
        return symbol;
    }

    public long getSeconds() {
        return seconds;
    }

    public long getMillis() {
        return seconds * 1000L;
    }

    /**
     * Look up a unit by its symbol. Case-sensitive: 'm' is minutes, 'M' is months.
     */
    public static Optional<RelativeUnit> fromSymbol(char symbol) {
        for (RelativeUnit unit : values()) {
            if (unit.symbol == symbol) {
                return Optional.of(unit);
            }
        }
        return Optional.empty();
    }
}
