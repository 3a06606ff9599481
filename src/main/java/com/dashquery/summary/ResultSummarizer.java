package com.dashquery.summary;

import com.dashquery.config.SummaryConfig;
import com.dashquery.query.ColumnSpec;
import com.dashquery.query.ColumnType;
import com.dashquery.query.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reduces a query result to one {@link ColumnSummary} per column in a single pass over the rows.
 * <p>
 * Numeric columns get min, max and mean. Every column gets a null count and a distinct-count
 * estimate taken over at most {@code cardinalitySampleSize} non-null values.
 */
public class ResultSummarizer {

    private static final Logger log = LoggerFactory.getLogger(ResultSummarizer.class);

    private final int sampleSize;

    public ResultSummarizer() {
        this(SummaryConfig.defaults());
    }

    public ResultSummarizer(SummaryConfig config) {
        this.sampleSize = config.cardinalitySampleSize();
    }

    /**
     * Summarize a result. An empty result yields an empty list.
     */
    public List<ColumnSummary> summarize(QueryResult result) {
        if (result == null || result.isEmpty()) {
            return List.of();
        }

        List<ColumnSpec> columns = result.columns();
        List<Accumulator> accumulators = new ArrayList<>(columns.size());
        for (ColumnSpec column : columns) {
            accumulators.add(new Accumulator(column, sampleSize));
        }

        for (List<Object> row : result.rows()) {
            for (int i = 0; i < accumulators.size(); i++) {
                accumulators.get(i).add(i < row.size() ? row.get(i) : null);
            }
        }

        List<ColumnSummary> summaries = new ArrayList<>(accumulators.size());
        for (Accumulator accumulator : accumulators) {
            summaries.add(accumulator.toSummary());
        }
        log.debug("Summarized panel {}: {} rows, {} columns", result.panelId(), result.rowCount(), columns.size());
        return summaries;
    }

    private static final class Accumulator {

        private final ColumnSpec column;
        private final int sampleSize;
        private final Set<Object> sample = new HashSet<>();

        private boolean allNumbers = true;
        private long count;
        private long nullCount;
        private long numericCount;
        private double min = Double.POSITIVE_INFINITY;
        private double max = Double.NEGATIVE_INFINITY;
        private double sum;
        private boolean capped;

        Accumulator(ColumnSpec column, int sampleSize) {
            this.column = column;
            this.sampleSize = sampleSize;
        }

        void add(Object value) {
            count++;
            if (value == null) {
                nullCount++;
                return;
            }
            Object key = distinctKey(value);
            if (sample.size() < sampleSize) {
                sample.add(key);
            } else if (!sample.contains(key)) {
                capped = true;
            }

            if (value instanceof Number number) {
                double d = number.doubleValue();
                if (!Double.isNaN(d)) {
                    numericCount++;
                    min = Math.min(min, d);
                    max = Math.max(max, d);
                    sum += d;
                }
            } else {
                allNumbers = false;
            }
        }

        /**
         * Equal values of different representations share a key: 1, 1L, 1.0 and 1.00 are one
         * value, and byte arrays compare by content.
         */
        private static Object distinctKey(Object value) {
            if (value instanceof BigDecimal decimal) {
                return decimal.stripTrailingZeros();
            }
            if (value instanceof BigInteger integer) {
                return new BigDecimal(integer);
            }
            if (value instanceof Double || value instanceof Float) {
                double d = ((Number) value).doubleValue();
                return Double.isFinite(d) ? BigDecimal.valueOf(d).stripTrailingZeros() : d;
            }
            if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return BigDecimal.valueOf(((Number) value).longValue());
            }
            if (value instanceof byte[] bytes) {
                return ByteBuffer.wrap(bytes);
            }
            return value;
        }

        ColumnSummary toSummary() {
            // Untyped columns count as numeric when every non-null value is a number
            boolean numeric = column.type().isNumeric() || (column.type() == ColumnType.OTHER && allNumbers);
            boolean hasStats = numeric && numericCount > 0;
            return new ColumnSummary(
                    column.name(),
                    column.type(),
                    count,
                    nullCount,
                    hasStats ? min : null,
                    hasStats ? max : null,
                    hasStats ? sum / numericCount : null,
                    sample.size(),
                    capped
            );
        }
    }
}
