package com.dashquery.time;

import java.util.Objects;

/**
 * Dashboard time range as declared, before evaluation against a clock.
 *
 * @param from Lower boundary
 * @param to   Upper boundary
 */
public record TimeRange(TimeSpec from, TimeSpec to) {

    public TimeRange {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    /**
     * Parse both boundaries.
     *
     * @throws com.dashquery.exception.InvalidTimeSpecException if either boundary is unparseable
     */
    public static TimeRange parse(String from, String to) {
        return new TimeRange(TimeSpecParser.parse(from), TimeSpecParser.parse(to));
    }

    /**
     * The last given amount of time up to now, e.g. last(1, HOUR) is now-1h..now.
     */
    public static TimeRange last(long amount, RelativeUnit unit) {
        return new TimeRange(new TimeSpec.Relative(-amount, unit), TimeSpec.now());
    }
}
