package com.sift.searchanalytics;

/**
 * Hybrid search parameters.
 *
 * @param semanticRatio weight of the semantic results, between 0 and 1
 * @param embedder      embedder used for the semantic part
 */
public record HybridQuery(double semanticRatio, String embedder) {

    public static final double DEFAULT_SEMANTIC_RATIO = 0.5;

    /** Whether the ratio differs from {@link #DEFAULT_SEMANTIC_RATIO}. */
    public boolean customRatio() {
        return semanticRatio != DEFAULT_SEMANTIC_RATIO;
    }
}
