package com.sift.searchanalytics;

import com.sift.analytics.AggregateKind;
import com.sift.analytics.AggregateKindRegistry;
import java.util.List;

/**
 * Every event kind of the search routes.
 */
public final class SearchAnalyticsKinds {

    public static final List<AggregateKind<?>> ALL = List.of(
            SearchAggregator.SEARCH_GET,
            SearchAggregator.SEARCH_POST,
            MultiSearchAggregator.MULTI_SEARCH,
            SimilarAggregator.SIMILAR_GET,
            SimilarAggregator.SIMILAR_POST);

    private SearchAnalyticsKinds() {
        // utility class
    }

    /**
     * Adds the search kinds to a registry.
     */
    public static AggregateKindRegistry registerAll(AggregateKindRegistry registry) {
        return registry.registerAll(ALL);
    }

    /** A new registry holding only the search kinds. */
    public static AggregateKindRegistry registry() {
        return registerAll(new AggregateKindRegistry());
    }
}
