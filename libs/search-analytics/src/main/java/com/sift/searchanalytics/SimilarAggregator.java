package com.sift.searchanalytics;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sift.analytics.Aggregate;
import com.sift.analytics.AggregateKind;
import com.sift.analytics.AnalyticsJson;

/**
 * Usage of the similar-documents route. GET and POST requests are distinct kinds.
 */
public final class SimilarAggregator implements Aggregate<SimilarAggregator> {

    public static final AggregateKind<SimilarAggregator> SIMILAR_GET =
            AggregateKind.of("similar.get", "Similar GET", SimilarAggregator.class);

    public static final AggregateKind<SimilarAggregator> SIMILAR_POST =
            AggregateKind.of("similar.post", "Similar POST", SimilarAggregator.class);

    private final AggregateKind<SimilarAggregator> kind;
    private RequestStats requests = new RequestStats();
    private FilterStats filter = new FilterStats();
    private boolean retrieveVectors;
    private long maxLimit;
    private long maxOffset;
    private long maxAttributesToRetrieve;
    private boolean showRankingScore;
    private boolean showRankingScoreDetails;
    private boolean rankingScoreThreshold;

    private SimilarAggregator(AggregateKind<SimilarAggregator> kind) {
        this.kind = kind;
    }

    /** Kind for similar requests received with the given method. */
    public static AggregateKind<SimilarAggregator> kindFor(SearchMethod method) {
        return method == SearchMethod.GET ? SIMILAR_GET : SIMILAR_POST;
    }

    /**
     * Statistics of one received similar-documents request.
     */
    public static SimilarAggregator fromQuery(SearchMethod method, SimilarQuery query) {
        if (method == null) {
            throw new IllegalArgumentException("method must not be null");
        }
        if (query == null) {
            throw new IllegalArgumentException("query must not be null");
        }
        SimilarAggregator aggregate = new SimilarAggregator(kindFor(method));
        aggregate.requests = RequestStats.received();
        aggregate.filter = FilterStats.of(query.filter());
        aggregate.maxLimit = query.limit();
        aggregate.maxOffset = query.offset();
        aggregate.maxAttributesToRetrieve =
                query.attributesToRetrieve() == null ? 0 : query.attributesToRetrieve().size();
        aggregate.showRankingScore = query.showRankingScore();
        aggregate.showRankingScoreDetails = query.showRankingScoreDetails();
        aggregate.rankingScoreThreshold = query.rankingScoreThreshold() != null;
        aggregate.retrieveVectors = query.retrieveVectors();
        return aggregate;
    }

    /**
     * Records that the request answered.
     */
    public void succeed(SimilarResult result) {
        requests.succeed(result.processingTimeMs());
    }

    @Override
    public AggregateKind<SimilarAggregator> kind() {
        return kind;
    }

    @Override
    public SimilarAggregator aggregate(SimilarAggregator other) {
        SimilarAggregator merged = new SimilarAggregator(kind);
        merged.requests = requests.copy();
        merged.requests.mergeFrom(other.requests);
        merged.filter = filter.copy();
        merged.filter.mergeFrom(other.filter);
        merged.retrieveVectors = retrieveVectors || other.retrieveVectors;
        merged.maxLimit = Math.max(maxLimit, other.maxLimit);
        merged.maxOffset = Math.max(maxOffset, other.maxOffset);
        merged.maxAttributesToRetrieve = Math.max(maxAttributesToRetrieve, other.maxAttributesToRetrieve);
        merged.showRankingScore = showRankingScore || other.showRankingScore;
        merged.showRankingScoreDetails = showRankingScoreDetails || other.showRankingScoreDetails;
        merged.rankingScoreThreshold = rankingScoreThreshold || other.rankingScoreThreshold;
        return merged;
    }

    @Override
    public ObjectNode intoEvent() {
        ObjectNode event = AnalyticsJson.object();
        requests.writeTo(event);
        filter.writeTo(event);
        event.putObject("vector").put("retrieve_vectors", retrieveVectors);

        ObjectNode pagination = event.putObject("pagination");
        pagination.put("max_limit", maxLimit);
        pagination.put("max_offset", maxOffset);

        event.putObject("formatting").put("max_attributes_to_retrieve", maxAttributesToRetrieve);

        ObjectNode scoring = event.putObject("scoring");
        scoring.put("show_ranking_score", showRankingScore);
        scoring.put("show_ranking_score_details", showRankingScoreDetails);
        scoring.put("ranking_score_threshold", rankingScoreThreshold);
        return event;
    }

    @Override
    public String toString() {
        return "SimilarAggregator[" + kind.key() + ", received=" + requests.totalReceived + "]";
    }
}
