package com.sift.searchanalytics;

/**
 * Outcome of a successful search, as far as analytics are concerned.
 *
 * @param processingTimeMs     time spent answering, in milliseconds
 * @param degraded             whether the search was cut short and returned partial results
 * @param usedNegativeOperator whether the query excluded words with {@code -}
 */
public record SearchResult(long processingTimeMs, boolean degraded, boolean usedNegativeOperator) {

    public SearchResult {
        if (processingTimeMs < 0) {
            throw new IllegalArgumentException("processingTimeMs must not be negative");
        }
    }
}
