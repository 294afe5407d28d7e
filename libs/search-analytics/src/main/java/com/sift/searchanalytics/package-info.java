/**
 * Analytics kinds of the search routes: single search (GET and POST), multi-search and similar
 * documents (GET and POST), with the request and response shapes they are built from.
 */
package com.sift.searchanalytics;
