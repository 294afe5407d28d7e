package com.sift.searchanalytics;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Request for documents similar to a reference document.
 *
 * @param id                      reference document id
 * @param embedder                embedder to compare with, {@code null} for the default one
 * @param offset                  number of hits to skip
 * @param limit                   maximum number of hits
 * @param attributesToRetrieve    displayed attributes, {@code null} for all
 * @param retrieveVectors         whether hits carry their vectors
 * @param showRankingScore        whether hits carry their ranking score
 * @param showRankingScoreDetails whether hits carry the ranking score details
 * @param filter                  filter expression (string or array), {@code null} if none
 * @param rankingScoreThreshold   minimum ranking score, {@code null} if none
 */
public record SimilarQuery(
        String id,
        String embedder,
        int offset,
        int limit,
        List<String> attributesToRetrieve,
        boolean retrieveVectors,
        boolean showRankingScore,
        boolean showRankingScoreDetails,
        JsonNode filter,
        Double rankingScoreThreshold) {

    public SimilarQuery {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (offset < 0 || limit < 0) {
            throw new IllegalArgumentException("offset and limit must not be negative");
        }
        attributesToRetrieve = attributesToRetrieve == null ? null : List.copyOf(attributesToRetrieve);
    }

    /**
     * Query with default pagination and no option set.
     */
    public static SimilarQuery of(String id) {
        return new SimilarQuery(
                id, null, SearchQuery.DEFAULT_OFFSET, SearchQuery.DEFAULT_LIMIT,
                null, false, false, false, null, null);
    }
}
