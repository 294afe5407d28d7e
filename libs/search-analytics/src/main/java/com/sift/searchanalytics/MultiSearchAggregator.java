package com.sift.searchanalytics;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sift.analytics.Aggregate;
import com.sift.analytics.AggregateKind;
import com.sift.analytics.AnalyticsJson;
import com.sift.analytics.Saturating;
import com.sift.analytics.Statistics;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Usage of the multi-search route: how many queries and indexes a request spans, and whether
 * results are federated.
 */
public final class MultiSearchAggregator implements Aggregate<MultiSearchAggregator> {

    public static final AggregateKind<MultiSearchAggregator> MULTI_SEARCH = AggregateKind.of(
            "multi_search.post", "Documents Searched by Multi-Search POST", MultiSearchAggregator.class);

    private final long totalReceived;
    private long totalSucceeded;
    private final long totalDistinctIndexCount;
    private final long totalSingleIndex;
    private final long totalSearchCount;
    private final boolean showRankingScore;
    private final boolean showRankingScoreDetails;
    private final boolean useFederation;

    private MultiSearchAggregator(
            long totalReceived,
            long totalSucceeded,
            long totalDistinctIndexCount,
            long totalSingleIndex,
            long totalSearchCount,
            boolean showRankingScore,
            boolean showRankingScoreDetails,
            boolean useFederation) {
        this.totalReceived = totalReceived;
        this.totalSucceeded = totalSucceeded;
        this.totalDistinctIndexCount = totalDistinctIndexCount;
        this.totalSingleIndex = totalSingleIndex;
        this.totalSearchCount = totalSearchCount;
        this.showRankingScore = showRankingScore;
        this.showRankingScoreDetails = showRankingScoreDetails;
        this.useFederation = useFederation;
    }

    /**
     * Statistics of one received multi-search.
     */
    public static MultiSearchAggregator fromFederatedSearch(FederatedSearch search) {
        if (search == null) {
            throw new IllegalArgumentException("search must not be null");
        }
        Set<String> distinctIndexes = search.queries().stream()
                .map(FederatedSearch.IndexedQuery::indexUid)
                .collect(Collectors.toSet());
        return new MultiSearchAggregator(
                1,
                0,
                distinctIndexes.size(),
                distinctIndexes.size() == 1 ? 1 : 0,
                search.queries().size(),
                search.queries().stream().anyMatch(q -> q.query().showRankingScore()),
                search.queries().stream().anyMatch(q -> q.query().showRankingScoreDetails()),
                search.federation() != null);
    }

    /**
     * Records that the multi-search answered.
     */
    public void succeed() {
        totalSucceeded = Saturating.add(totalSucceeded, 1);
    }

    @Override
    public AggregateKind<MultiSearchAggregator> kind() {
        return MULTI_SEARCH;
    }

    @Override
    public MultiSearchAggregator aggregate(MultiSearchAggregator other) {
        return new MultiSearchAggregator(
                Saturating.add(totalReceived, other.totalReceived),
                Saturating.add(totalSucceeded, other.totalSucceeded),
                Saturating.add(totalDistinctIndexCount, other.totalDistinctIndexCount),
                Saturating.add(totalSingleIndex, other.totalSingleIndex),
                Saturating.add(totalSearchCount, other.totalSearchCount),
                showRankingScore || other.showRankingScore,
                showRankingScoreDetails || other.showRankingScoreDetails,
                useFederation || other.useFederation);
    }

    @Override
    public ObjectNode intoEvent() {
        ObjectNode event = AnalyticsJson.object();

        ObjectNode requests = event.putObject("requests");
        requests.put("total_succeeded", totalSucceeded);
        requests.put("total_failed", Saturating.sub(totalReceived, totalSucceeded));
        requests.put("total_received", totalReceived);

        ObjectNode indexes = event.putObject("indexes");
        indexes.put("total_single_index", totalSingleIndex);
        indexes.put("total_distinct_index_count", totalDistinctIndexCount);
        indexes.put("avg_distinct_index_count", Statistics.ratio(totalDistinctIndexCount, totalReceived));

        ObjectNode searches = event.putObject("searches");
        searches.put("total_search_count", totalSearchCount);
        searches.put("avg_search_count", Statistics.ratio(totalSearchCount, totalReceived));

        ObjectNode scoring = event.putObject("scoring");
        scoring.put("show_ranking_score", showRankingScore);
        scoring.put("show_ranking_score_details", showRankingScoreDetails);

        event.putObject("federation").put("use_federation", useFederation);
        return event;
    }

    @Override
    public String toString() {
        return "MultiSearchAggregator[received=" + totalReceived + ", succeeded=" + totalSucceeded + "]";
    }
}
