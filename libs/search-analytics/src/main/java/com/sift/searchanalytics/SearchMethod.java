package com.sift.searchanalytics;

/**
 * HTTP method a search request came in with. GET and POST searches are reported as separate events.
 */
public enum SearchMethod {
    GET,
    POST
}
