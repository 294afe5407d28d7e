package com.sift.analytics;

/**
 * Kind of record delivered to the analytics endpoint.
 */
public enum RecordType {

    /** A named event with properties (per-kind rollups, launches). */
    TRACK("track"),

    /** Traits describing the instance itself (the periodic snapshot). */
    IDENTIFY("identify");

    private final String value;

    RecordType(String value) {
        this.value = value;
    }

    /** Wire name of the record type. */
    public String value() {
        return value;
    }
}
