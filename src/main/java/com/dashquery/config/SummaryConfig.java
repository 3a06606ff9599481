package com.dashquery.config;

import com.dashquery.exception.ConfigurationException;

/**
 * Settings for the result summarizer.
 *
 * @param cardinalitySampleSize Non-null values sampled per column for the distinct-count estimate
 */
public record SummaryConfig(int cardinalitySampleSize) {

    public SummaryConfig {
        if (cardinalitySampleSize < 1) {
            throw new ConfigurationException("cardinality-sample-size must be >= 1, got " + cardinalitySampleSize);
        }
    }

    public static SummaryConfig defaults() {
        return new SummaryConfig(10_000);
    }
}
