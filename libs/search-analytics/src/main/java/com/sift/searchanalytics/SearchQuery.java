package com.sift.searchanalytics;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Parameters of a search request.
 * <p>
 * Unset optional values are {@code null}; tags, crop marker, crop length and matching strategy
 * fall back to their defaults. Use {@link #builder()} to set only what a request carries.
 */
public record SearchQuery(
        String q,
        List<Float> vector,
        int offset,
        int limit,
        Integer page,
        Integer hitsPerPage,
        List<String> attributesToRetrieve,
        boolean retrieveVectors,
        List<String> attributesToCrop,
        int cropLength,
        List<String> attributesToHighlight,
        boolean showMatchesPosition,
        boolean showRankingScore,
        boolean showRankingScoreDetails,
        JsonNode filter,
        List<String> sort,
        String distinct,
        List<String> facets,
        String highlightPreTag,
        String highlightPostTag,
        String cropMarker,
        MatchingStrategy matchingStrategy,
        List<String> attributesToSearchOn,
        HybridQuery hybrid,
        Double rankingScoreThreshold,
        List<String> locales) {

    public static final int DEFAULT_OFFSET = 0;
    public static final int DEFAULT_LIMIT = 20;
    public static final int DEFAULT_CROP_LENGTH = 10;
    public static final String DEFAULT_CROP_MARKER = "…";
    public static final String DEFAULT_HIGHLIGHT_PRE_TAG = "<em>";
    public static final String DEFAULT_HIGHLIGHT_POST_TAG = "</em>";

    public SearchQuery {
        if (offset < 0 || limit < 0) {
            throw new IllegalArgumentException("offset and limit must not be negative");
        }
        if (page != null && page < 0) {
            throw new IllegalArgumentException("page must not be negative");
        }
        if (hitsPerPage != null && hitsPerPage < 0) {
            throw new IllegalArgumentException("hitsPerPage must not be negative");
        }
        vector = copy(vector);
        attributesToRetrieve = copy(attributesToRetrieve);
        attributesToCrop = copy(attributesToCrop);
        attributesToHighlight = copy(attributesToHighlight);
        sort = copy(sort);
        facets = copy(facets);
        attributesToSearchOn = copy(attributesToSearchOn);
        locales = copy(locales);
        highlightPreTag = highlightPreTag == null ? DEFAULT_HIGHLIGHT_PRE_TAG : highlightPreTag;
        highlightPostTag = highlightPostTag == null ? DEFAULT_HIGHLIGHT_POST_TAG : highlightPostTag;
        cropMarker = cropMarker == null ? DEFAULT_CROP_MARKER : cropMarker;
        matchingStrategy = matchingStrategy == null ? MatchingStrategy.LAST : matchingStrategy;
    }

    private static <E> List<E> copy(List<E> values) {
        return values == null ? null : List.copyOf(values);
    }

    /**
     * Page-based navigation: set when the request asks for a page or a page size, which makes the
     * engine count every hit instead of estimating the total.
     */
    public boolean isFinitePagination() {
        return page != null || hitsPerPage != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder starting from an empty query with default pagination.
     */
    public static final class Builder {

        private String q;
        private List<Float> vector;
        private int offset = DEFAULT_OFFSET;
        private int limit = DEFAULT_LIMIT;
        private Integer page;
        private Integer hitsPerPage;
        private List<String> attributesToRetrieve;
        private boolean retrieveVectors;
        private List<String> attributesToCrop;
        private int cropLength = DEFAULT_CROP_LENGTH;
        private List<String> attributesToHighlight;
        private boolean showMatchesPosition;
        private boolean showRankingScore;
        private boolean showRankingScoreDetails;
        private JsonNode filter;
        private List<String> sort;
        private String distinct;
        private List<String> facets;
        private String highlightPreTag;
        private String highlightPostTag;
        private String cropMarker;
        private MatchingStrategy matchingStrategy;
        private List<String> attributesToSearchOn;
        private HybridQuery hybrid;
        private Double rankingScoreThreshold;
        private List<String> locales;

        private Builder() {
        }

        public Builder q(String q) {
            this.q = q;
            return this;
        }

        public Builder vector(List<Float> vector) {
            this.vector = vector;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder page(Integer page) {
            this.page = page;
            return this;
        }

        public Builder hitsPerPage(Integer hitsPerPage) {
            this.hitsPerPage = hitsPerPage;
            return this;
        }

        public Builder attributesToRetrieve(List<String> attributesToRetrieve) {
            this.attributesToRetrieve = attributesToRetrieve;
            return this;
        }

        public Builder retrieveVectors(boolean retrieveVectors) {
            this.retrieveVectors = retrieveVectors;
            return this;
        }

        public Builder attributesToCrop(List<String> attributesToCrop) {
            this.attributesToCrop = attributesToCrop;
            return this;
        }

        public Builder cropLength(int cropLength) {
            this.cropLength = cropLength;
            return this;
        }

        public Builder attributesToHighlight(List<String> attributesToHighlight) {
            this.attributesToHighlight = attributesToHighlight;
            return this;
        }

        public Builder showMatchesPosition(boolean showMatchesPosition) {
            this.showMatchesPosition = showMatchesPosition;
            return this;
        }

        public Builder showRankingScore(boolean showRankingScore) {
            this.showRankingScore = showRankingScore;
            return this;
        }

        public Builder showRankingScoreDetails(boolean showRankingScoreDetails) {
            this.showRankingScoreDetails = showRankingScoreDetails;
            return this;
        }

        public Builder filter(JsonNode filter) {
            this.filter = filter;
            return this;
        }

        public Builder sort(List<String> sort) {
            this.sort = sort;
            return this;
        }

        public Builder distinct(String distinct) {
            this.distinct = distinct;
            return this;
        }

        public Builder facets(List<String> facets) {
            this.facets = facets;
            return this;
        }

        public Builder highlightPreTag(String highlightPreTag) {
            this.highlightPreTag = highlightPreTag;
            return this;
        }

        public Builder highlightPostTag(String highlightPostTag) {
            this.highlightPostTag = highlightPostTag;
            return this;
        }

        public Builder cropMarker(String cropMarker) {
            this.cropMarker = cropMarker;
            return this;
        }

        public Builder matchingStrategy(MatchingStrategy matchingStrategy) {
            this.matchingStrategy = matchingStrategy;
            return this;
        }

        public Builder attributesToSearchOn(List<String> attributesToSearchOn) {
            this.attributesToSearchOn = attributesToSearchOn;
            return this;
        }

        public Builder hybrid(HybridQuery hybrid) {
            this.hybrid = hybrid;
            return this;
        }

        public Builder rankingScoreThreshold(Double rankingScoreThreshold) {
            this.rankingScoreThreshold = rankingScoreThreshold;
            return this;
        }

        public Builder locales(List<String> locales) {
            this.locales = locales;
            return this;
        }

        public SearchQuery build() {
            return new SearchQuery(
                    q, vector, offset, limit, page, hitsPerPage, attributesToRetrieve, retrieveVectors,
                    attributesToCrop, cropLength, attributesToHighlight, showMatchesPosition,
                    showRankingScore, showRankingScoreDetails, filter, sort, distinct, facets,
                    highlightPreTag, highlightPostTag, cropMarker, matchingStrategy,
                    attributesToSearchOn, hybrid, rankingScoreThreshold, locales);
        }
    }
}
