package com.sift.searchanalytics;

/**
 * Strategy used to match query words against documents.
 */
public enum MatchingStrategy {
    LAST("Last"),
    ALL("All"),
    FREQUENCY("Frequency");

    private final String label;

    MatchingStrategy(String label) {
        this.label = label;
    }

    /** Name reported in analytics. */
    public String label() {
        return label;
    }
}
