package com.sift.searchanalytics;

import java.util.List;

/**
 * A multi-search request: several queries, each on one index, optionally merged into a single
 * result list.
 *
 * @param queries    the queries, in request order
 * @param federation merge parameters, {@code null} when every query gets its own result list
 */
public record FederatedSearch(List<IndexedQuery> queries, Federation federation) {

    public FederatedSearch {
        queries = queries == null ? List.of() : List.copyOf(queries);
    }

    /**
     * One query of a multi-search.
     *
     * @param indexUid target index
     * @param query    search parameters
     */
    public record IndexedQuery(String indexUid, SearchQuery query) {

        public IndexedQuery {
            if (indexUid == null || indexUid.isBlank()) {
                throw new IllegalArgumentException("indexUid must not be null or blank");
            }
            if (query == null) {
                throw new IllegalArgumentException("query must not be null");
            }
        }
    }

    /**
     * Pagination of the merged result list.
     */
    public record Federation(int offset, int limit) {

        public static Federation defaults() {
            return new Federation(SearchQuery.DEFAULT_OFFSET, SearchQuery.DEFAULT_LIMIT);
        }
    }
}
