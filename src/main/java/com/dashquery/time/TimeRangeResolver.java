package com.dashquery.time;

import com.dashquery.exception.InvalidTimeSpecException;

import java.time.Instant;

/**
 * Converts time specs into epoch-millisecond boundaries against a fixed "now".
 */
public class TimeRangeResolver {

    /**
     * Resolve a single spec.
     *
     * @param spec Spec to resolve
     * @param now  Evaluation instant
     * @return Epoch milliseconds
     * @throws InvalidTimeSpecException if the offset overflows
     */
    public long resolve(TimeSpec spec, Instant now) {
        if (spec instanceof TimeSpec.Absolute absolute) {
            return absolute.epochMillis();
        }
        if (spec instanceof TimeSpec.Relative relative) {
            try {
                long offset = Math.multiplyExact(relative.amount(), relative.unit().getMillis());
                return Math.addExact(now.toEpochMilli(), offset);
            } catch (ArithmeticException e) {
                throw new InvalidTimeSpecException(relative.toString(), "offset overflows", e);
            }
        }
        throw new InvalidTimeSpecException(String.valueOf(spec), "unsupported time spec");
    }

    /**
     * Parse and resolve a raw expression.
     */
    public long resolve(String expression, Instant now) {
        return resolve(TimeSpecParser.parse(expression), now);
    }

    /**
     * Resolve both boundaries of a range.
     *
     * @throws InvalidTimeSpecException if the resolved start lies after the resolved end
     */
    public ResolvedTimeRange resolveRange(TimeRange range, Instant now) {
        long from = resolve(range.from(), now);
        long to = resolve(range.to(), now);
        if (from > to) {
            throw new InvalidTimeSpecException(range.from() + ".." + range.to(),
                    "start resolves after end");
        }
        return new ResolvedTimeRange(from, to);
    }
}
