package com.sift.searchanalytics;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sift.analytics.Aggregate;
import com.sift.analytics.AggregateKind;
import com.sift.analytics.AnalyticsJson;
import com.sift.analytics.Saturating;
import com.sift.analytics.Statistics;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Usage of the search route: which parameters requests use and how the searches went.
 * <p>
 * Build one per request with {@link #fromQuery}, call {@link #succeed} once the search answered,
 * then publish it. GET and POST searches are distinct kinds.
 */
public final class SearchAggregator implements Aggregate<SearchAggregator> {

    public static final AggregateKind<SearchAggregator> SEARCH_GET =
            AggregateKind.of("search.get", "Documents Searched GET", SearchAggregator.class);

    public static final AggregateKind<SearchAggregator> SEARCH_POST =
            AggregateKind.of("search.post", "Documents Searched POST", SearchAggregator.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    static final String EXHAUSTIVE_NAVIGATION = "exhaustive";
    static final String ESTIMATED_NAVIGATION = "estimated";

    private final AggregateKind<SearchAggregator> kind;

    // requests
    private RequestStats requests = new RequestStats();
    private long totalDegraded;
    private long totalUsedNegativeOperator;

    // sort
    private boolean sortWithGeoPoint;
    private long sortSumOfCriteriaTerms;
    private long sortTotalNumberOfCriteria;

    private boolean distinct;

    private FilterStats filter = new FilterStats();

    private long attributesToSearchOnTotalNumberOfUses;

    private long maxTermsNumber;

    // vector
    private long maxVectorSize;
    private boolean semanticRatio;
    private boolean hybrid;
    private boolean retrieveVectors;

    private Map<String, Long> matchingStrategy = new HashMap<>();

    private Set<String> locales = new TreeSet<>();

    // pagination
    private long maxLimit;
    private long maxOffset;
    private long finitePagination;

    // formatting
    private long maxAttributesToRetrieve;
    private long maxAttributesToHighlight;
    private boolean highlightPreTag;
    private boolean highlightPostTag;
    private long maxAttributesToCrop;
    private boolean cropMarker;
    private boolean showMatchesPosition;
    private boolean cropLength;

    // facets
    private long facetsSumOfTerms;
    private long facetsTotalNumberOfFacets;

    // scoring
    private boolean showRankingScore;
    private boolean showRankingScoreDetails;
    private boolean rankingScoreThreshold;

    private SearchAggregator(AggregateKind<SearchAggregator> kind) {
        this.kind = kind;
    }

    /** Kind for searches received with the given method. */
    public static AggregateKind<SearchAggregator> kindFor(SearchMethod method) {
        return method == SearchMethod.GET ? SEARCH_GET : SEARCH_POST;
    }

    /**
     * Statistics of one received search.
     */
    public static SearchAggregator fromQuery(SearchMethod method, SearchQuery query) {
        if (method == null) {
            throw new IllegalArgumentException("method must not be null");
        }
        if (query == null) {
            throw new IllegalArgumentException("query must not be null");
        }
        SearchAggregator aggregate = new SearchAggregator(kindFor(method));
        aggregate.requests = RequestStats.received();

        if (query.sort() != null) {
            aggregate.sortTotalNumberOfCriteria = 1;
            aggregate.sortWithGeoPoint = query.sort().stream().anyMatch(s -> s.contains("_geoPoint("));
            aggregate.sortSumOfCriteriaTerms = query.sort().size();
        }

        aggregate.distinct = query.distinct() != null;
        aggregate.filter = FilterStats.of(query.filter());

        if (query.attributesToSearchOn() != null) {
            aggregate.attributesToSearchOnTotalNumberOfUses = 1;
        }
        if (query.q() != null) {
            aggregate.maxTermsNumber = countTerms(query.q());
        }
        if (query.vector() != null) {
            aggregate.maxVectorSize = query.vector().size();
        }
        aggregate.retrieveVectors = query.retrieveVectors();

        if (query.isFinitePagination()) {
            long limit = query.hitsPerPage() != null ? query.hitsPerPage() : SearchQuery.DEFAULT_LIMIT;
            long page = query.page() != null ? query.page() : 1;
            aggregate.maxLimit = limit;
            aggregate.maxOffset = Saturating.mul(Saturating.sub(page, 1), limit);
            aggregate.finitePagination = 1;
        } else {
            aggregate.maxLimit = query.limit();
            aggregate.maxOffset = query.offset();
        }

        aggregate.matchingStrategy.put(query.matchingStrategy().label(), 1L);
        if (query.locales() != null) {
            aggregate.locales.addAll(query.locales());
        }

        aggregate.maxAttributesToRetrieve = sizeOf(query.attributesToRetrieve());
        aggregate.maxAttributesToHighlight = sizeOf(query.attributesToHighlight());
        aggregate.maxAttributesToCrop = sizeOf(query.attributesToCrop());
        aggregate.highlightPreTag = !SearchQuery.DEFAULT_HIGHLIGHT_PRE_TAG.equals(query.highlightPreTag());
        aggregate.highlightPostTag = !SearchQuery.DEFAULT_HIGHLIGHT_POST_TAG.equals(query.highlightPostTag());
        aggregate.cropMarker = !SearchQuery.DEFAULT_CROP_MARKER.equals(query.cropMarker());
        aggregate.cropLength = query.cropLength() != SearchQuery.DEFAULT_CROP_LENGTH;
        aggregate.showMatchesPosition = query.showMatchesPosition();

        if (query.facets() != null) {
            aggregate.facetsSumOfTerms = query.facets().size();
            aggregate.facetsTotalNumberOfFacets = 1;
        }

        aggregate.showRankingScore = query.showRankingScore();
        aggregate.showRankingScoreDetails = query.showRankingScoreDetails();
        aggregate.rankingScoreThreshold = query.rankingScoreThreshold() != null;

        if (query.hybrid() != null) {
            aggregate.semanticRatio = query.hybrid().customRatio();
            aggregate.hybrid = true;
        }
        return aggregate;
    }

    private static long countTerms(String q) {
        return WHITESPACE.splitAsStream(q).filter(term -> !term.isEmpty()).count();
    }

    private static long sizeOf(List<?> values) {
        return values == null ? 0 : values.size();
    }

    /**
     * Records that the search answered.
     */
    public void succeed(SearchResult result) {
        requests.succeed(result.processingTimeMs());
        if (result.degraded()) {
            totalDegraded = Saturating.add(totalDegraded, 1);
        }
        if (result.usedNegativeOperator()) {
            totalUsedNegativeOperator = Saturating.add(totalUsedNegativeOperator, 1);
        }
    }

    @Override
    public AggregateKind<SearchAggregator> kind() {
        return kind;
    }

    @Override
    public SearchAggregator aggregate(SearchAggregator other) {
        SearchAggregator merged = copy();

        merged.requests.mergeFrom(other.requests);
        merged.totalDegraded = Saturating.add(totalDegraded, other.totalDegraded);
        merged.totalUsedNegativeOperator =
                Saturating.add(totalUsedNegativeOperator, other.totalUsedNegativeOperator);

        merged.sortWithGeoPoint |= other.sortWithGeoPoint;
        merged.sortSumOfCriteriaTerms = Saturating.add(sortSumOfCriteriaTerms, other.sortSumOfCriteriaTerms);
        merged.sortTotalNumberOfCriteria =
                Saturating.add(sortTotalNumberOfCriteria, other.sortTotalNumberOfCriteria);

        merged.distinct |= other.distinct;
        merged.filter.mergeFrom(other.filter);

        merged.attributesToSearchOnTotalNumberOfUses = Saturating.add(
                attributesToSearchOnTotalNumberOfUses, other.attributesToSearchOnTotalNumberOfUses);

        merged.maxTermsNumber = Math.max(maxTermsNumber, other.maxTermsNumber);

        merged.maxVectorSize = Math.max(maxVectorSize, other.maxVectorSize);
        merged.retrieveVectors |= other.retrieveVectors;
        merged.semanticRatio |= other.semanticRatio;
        merged.hybrid |= other.hybrid;

        merged.maxLimit = Math.max(maxLimit, other.maxLimit);
        merged.maxOffset = Math.max(maxOffset, other.maxOffset);
        merged.finitePagination = Saturating.add(finitePagination, other.finitePagination);

        merged.maxAttributesToRetrieve = Math.max(maxAttributesToRetrieve, other.maxAttributesToRetrieve);
        merged.maxAttributesToHighlight = Math.max(maxAttributesToHighlight, other.maxAttributesToHighlight);
        merged.highlightPreTag |= other.highlightPreTag;
        merged.highlightPostTag |= other.highlightPostTag;
        merged.maxAttributesToCrop = Math.max(maxAttributesToCrop, other.maxAttributesToCrop);
        merged.cropMarker |= other.cropMarker;
        merged.showMatchesPosition |= other.showMatchesPosition;
        merged.cropLength |= other.cropLength;

        merged.facetsSumOfTerms = Saturating.add(facetsSumOfTerms, other.facetsSumOfTerms);
        merged.facetsTotalNumberOfFacets =
                Saturating.add(facetsTotalNumberOfFacets, other.facetsTotalNumberOfFacets);

        merged.matchingStrategy = Statistics.mergeFrequencies(matchingStrategy, other.matchingStrategy);

        merged.showRankingScore |= other.showRankingScore;
        merged.showRankingScoreDetails |= other.showRankingScoreDetails;
        merged.rankingScoreThreshold |= other.rankingScoreThreshold;

        merged.locales.addAll(other.locales);
        return merged;
    }

    private SearchAggregator copy() {
        SearchAggregator copy = new SearchAggregator(kind);
        copy.requests = requests.copy();
        copy.totalDegraded = totalDegraded;
        copy.totalUsedNegativeOperator = totalUsedNegativeOperator;
        copy.sortWithGeoPoint = sortWithGeoPoint;
        copy.sortSumOfCriteriaTerms = sortSumOfCriteriaTerms;
        copy.sortTotalNumberOfCriteria = sortTotalNumberOfCriteria;
        copy.distinct = distinct;
        copy.filter = filter.copy();
        copy.attributesToSearchOnTotalNumberOfUses = attributesToSearchOnTotalNumberOfUses;
        copy.maxTermsNumber = maxTermsNumber;
        copy.maxVectorSize = maxVectorSize;
        copy.semanticRatio = semanticRatio;
        copy.hybrid = hybrid;
        copy.retrieveVectors = retrieveVectors;
        copy.matchingStrategy = new HashMap<>(matchingStrategy);
        copy.locales = new TreeSet<>(locales);
        copy.maxLimit = maxLimit;
        copy.maxOffset = maxOffset;
        copy.finitePagination = finitePagination;
        copy.maxAttributesToRetrieve = maxAttributesToRetrieve;
        copy.maxAttributesToHighlight = maxAttributesToHighlight;
        copy.highlightPreTag = highlightPreTag;
        copy.highlightPostTag = highlightPostTag;
        copy.maxAttributesToCrop = maxAttributesToCrop;
        copy.cropMarker = cropMarker;
        copy.showMatchesPosition = showMatchesPosition;
        copy.cropLength = cropLength;
        copy.facetsSumOfTerms = facetsSumOfTerms;
        copy.facetsTotalNumberOfFacets = facetsTotalNumberOfFacets;
        copy.showRankingScore = showRankingScore;
        copy.showRankingScoreDetails = showRankingScoreDetails;
        copy.rankingScoreThreshold = rankingScoreThreshold;
        return copy;
    }

    @Override
    public ObjectNode intoEvent() {
        ObjectNode event = AnalyticsJson.object();

        ObjectNode requestsNode = requests.writeTo(event);
        requestsNode.put("total_degraded", totalDegraded);
        requestsNode.put("total_used_negative_operator", totalUsedNegativeOperator);

        ObjectNode sort = event.putObject("sort");
        sort.put("with_geoPoint", sortWithGeoPoint);
        sort.put("avg_criteria_number", Statistics.formatRatio(sortSumOfCriteriaTerms, sortTotalNumberOfCriteria));

        event.put("distinct", distinct);
        filter.writeTo(event);

        event.putObject("attributes_to_search_on")
                .put("total_number_of_uses", attributesToSearchOnTotalNumberOfUses);
        event.putObject("q").put("max_terms_number", maxTermsNumber);

        ObjectNode vector = event.putObject("vector");
        vector.put("max_vector_size", maxVectorSize);
        vector.put("retrieve_vectors", retrieveVectors);

        ObjectNode hybridNode = event.putObject("hybrid");
        hybridNode.put("enabled", hybrid);
        hybridNode.put("semantic_ratio", semanticRatio);

        ObjectNode pagination = event.putObject("pagination");
        pagination.put("max_limit", maxLimit);
        pagination.put("max_offset", maxOffset);
        pagination.put("most_used_navigation",
                finitePagination > requests.totalReceived / 2 ? EXHAUSTIVE_NAVIGATION : ESTIMATED_NAVIGATION);

        ObjectNode formatting = event.putObject("formatting");
        formatting.put("max_attributes_to_retrieve", maxAttributesToRetrieve);
        formatting.put("max_attributes_to_highlight", maxAttributesToHighlight);
        formatting.put("highlight_pre_tag", highlightPreTag);
        formatting.put("highlight_post_tag", highlightPostTag);
        formatting.put("max_attributes_to_crop", maxAttributesToCrop);
        formatting.put("crop_marker", cropMarker);
        formatting.put("show_matches_position", showMatchesPosition);
        formatting.put("crop_length", cropLength);

        event.putObject("facets")
                .put("avg_facets_number", Statistics.formatRatio(facetsSumOfTerms, facetsTotalNumberOfFacets));
        event.putObject("matching_strategy")
                .put("most_used_strategy", Statistics.mostUsed(matchingStrategy).orElse(null));
        event.set("locales", AnalyticsJson.strings(locales));

        ObjectNode scoring = event.putObject("scoring");
        scoring.put("show_ranking_score", showRankingScore);
        scoring.put("show_ranking_score_details", showRankingScoreDetails);
        scoring.put("ranking_score_threshold", rankingScoreThreshold);
        return event;
    }

    @Override
    public String toString() {
        return "SearchAggregator[" + kind.key() + ", received=" + requests.totalReceived + "]";
    }
}
