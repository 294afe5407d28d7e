package com.sift.analytics;

/**
 * Raised by an {@link AnalyticsSink} when a record cannot be accepted or delivered.
 * <p>
 * Analytics is best-effort: callers inside this library log and discard it.
 */
public class SinkException extends Exception {

    public SinkException(String message) {
        super(message);
    }

    public SinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
