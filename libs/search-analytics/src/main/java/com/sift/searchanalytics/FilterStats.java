package com.sift.searchanalytics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sift.analytics.Saturating;
import com.sift.analytics.Statistics;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Filter usage accumulated across requests.
 * <p>
 * A filter is analysed through its JSON text: the syntax is {@code "string"}, {@code "array"},
 * {@code "mixed"} (an array with an element combining conditions) or {@code "none"}; the number
 * of criteria is the number of pieces between {@code AND}/{@code OR} operators.
 */
final class FilterStats {

    static final String STRING_SYNTAX = "string";
    static final String ARRAY_SYNTAX = "array";
    static final String MIXED_SYNTAX = "mixed";
    static final String NO_SYNTAX = "none";

    private static final Pattern OPERATOR = Pattern.compile("AND | OR");

    boolean withGeoRadius;
    boolean withGeoBoundingBox;
    long sumOfCriteriaTerms;
    long totalNumberOfCriteria;
    Map<String, Long> usedSyntax = new HashMap<>();

    FilterStats() {
    }

    /**
     * Stats of one request; {@code filter} is {@code null} when the request has none.
     */
    static FilterStats of(JsonNode filter) {
        FilterStats stats = new FilterStats();
        if (filter == null) {
            return stats;
        }
        String text = filter.toString();
        stats.totalNumberOfCriteria = 1;
        stats.usedSyntax.put(syntax(filter), 1L);
        stats.withGeoRadius = text.contains("_geoRadius(");
        stats.withGeoBoundingBox = text.contains("_geoBoundingBox(");
        stats.sumOfCriteriaTerms = OPERATOR.split(text, -1).length;
        return stats;
    }

    static String syntax(JsonNode filter) {
        if (filter.isTextual()) {
            return STRING_SYNTAX;
        }
        if (filter.isArray()) {
            for (JsonNode element : filter) {
                if (OPERATOR.matcher(element.toString()).find()) {
                    return MIXED_SYNTAX;
                }
            }
            return ARRAY_SYNTAX;
        }
        return NO_SYNTAX;
    }

    FilterStats copy() {
        FilterStats copy = new FilterStats();
        copy.withGeoRadius = withGeoRadius;
        copy.withGeoBoundingBox = withGeoBoundingBox;
        copy.sumOfCriteriaTerms = sumOfCriteriaTerms;
        copy.totalNumberOfCriteria = totalNumberOfCriteria;
        copy.usedSyntax = new HashMap<>(usedSyntax);
        return copy;
    }

    void mergeFrom(FilterStats other) {
        withGeoRadius |= other.withGeoRadius;
        withGeoBoundingBox |= other.withGeoBoundingBox;
        sumOfCriteriaTerms = Saturating.add(sumOfCriteriaTerms, other.sumOfCriteriaTerms);
        totalNumberOfCriteria = Saturating.add(totalNumberOfCriteria, other.totalNumberOfCriteria);
        usedSyntax = Statistics.mergeFrequencies(usedSyntax, other.usedSyntax);
    }

    void writeTo(ObjectNode event) {
        ObjectNode filter = event.putObject("filter");
        filter.put("with_geoRadius", withGeoRadius);
        filter.put("with_geoBoundingBox", withGeoBoundingBox);
        filter.put("avg_criteria_number", Statistics.formatRatio(sumOfCriteriaTerms, totalNumberOfCriteria));
        filter.put("most_used_syntax", Statistics.mostUsed(usedSyntax).orElse(null));
    }
}
