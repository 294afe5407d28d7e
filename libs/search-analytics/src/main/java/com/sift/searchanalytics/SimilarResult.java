package com.sift.searchanalytics;

/**
 * Outcome of a successful similar-documents request.
 *
 * @param id               reference document id
 * @param processingTimeMs time spent answering, in milliseconds
 */
public record SimilarResult(String id, long processingTimeMs) {

    public SimilarResult {
        if (processingTimeMs < 0) {
            throw new IllegalArgumentException("processingTimeMs must not be negative");
        }
    }
}
