package com.sift.analyticsservice.recording;

import com.sift.analytics.Analytics;
import com.sift.searchanalytics.FederatedSearch;
import com.sift.searchanalytics.MultiSearchAggregator;
import com.sift.searchanalytics.SearchAggregator;
import com.sift.searchanalytics.SearchMethod;
import com.sift.searchanalytics.SearchQuery;
import com.sift.searchanalytics.SearchResult;
import com.sift.searchanalytics.SimilarAggregator;
import com.sift.searchanalytics.SimilarQuery;
import com.sift.searchanalytics.SimilarResult;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Entry point of the search routes into analytics.
 *
 * <p>Routes call it once per request, after answering; a {@code null} result means the request
 * failed. Recording never throws and never blocks.
 */
@Component
public class SearchAnalyticsRecorder {

    private final Analytics analytics;

    public SearchAnalyticsRecorder(Analytics analytics) {
        this.analytics = analytics;
    }

    public boolean searched(SearchMethod method, SearchQuery query, SearchResult result, Set<String> sources) {
        if (!analytics.isEnabled()) {
            return false;
        }
        SearchAggregator aggregate = SearchAggregator.fromQuery(method, query);
        if (result != null) {
            aggregate.succeed(result);
        }
        return analytics.publish(aggregate, sources);
    }

    public boolean multiSearched(FederatedSearch search, boolean succeeded, Set<String> sources) {
        if (!analytics.isEnabled()) {
            return false;
        }
        MultiSearchAggregator aggregate = MultiSearchAggregator.fromFederatedSearch(search);
        if (succeeded) {
            aggregate.succeed();
        }
        return analytics.publish(aggregate, sources);
    }

    public boolean similarSearched(
            SearchMethod method, SimilarQuery query, SimilarResult result, Set<String> sources) {
        if (!analytics.isEnabled()) {
            return false;
        }
        SimilarAggregator aggregate = SimilarAggregator.fromQuery(method, query);
        if (result != null) {
            aggregate.succeed(result);
        }
        return analytics.publish(aggregate, sources);
    }
}
