package com.dashquery.time;

import java.util.Objects;

/**
 * A time boundary, either relative to "now" or absolute.
 */
public interface TimeSpec {

    /**
     * Offset from the evaluation instant. Negative amounts lie in the past.
     *
     * @param amount Signed number of units
     * @param unit   Unit of the offset
     */
    record Relative(long amount, RelativeUnit unit) implements TimeSpec {
        public Relative {
            Objects.requireNonNull(unit, "unit");
        }

        @Override
        public String toString() {
            if (amount == 0) {
                return "now";
            }
            return "now" + (amount > 0 ? "+" : "") + amount + unit.getSymbol();
        }
    }

    /**
     * A fixed instant.
     *
     * @param epochMillis Milliseconds since the epoch
     */
    record Absolute(long epochMillis) implements TimeSpec {
        @Override
        public String toString() {
            return Long.toString(epochMillis);
        }
    }

    /**
     * The evaluation instant itself.
     */
    static TimeSpec now() {
        return new Relative(0, RelativeUnit.SECOND);
    }
}
