package com.sift.analytics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Statistical summaries shared by the concrete aggregators.
 * <p>
 * Percentiles are nearest-rank over a sorted copy of the samples (no interpolation). Frequency
 * tables map a variant name to its number of observations and are merged key-wise.
 */
public final class Statistics {

    /** Percentile reported as the "99th response time". */
    public static final int RESPONSE_TIME_PERCENTILE = 99;

    private Statistics() {
        // utility class
    }

    /**
     * Returns the nearest-rank percentile of the samples: the element at index
     * {@code floor(size * percentile / 100)} of the sorted samples.
     *
     * @param samples    the samples, in any order (not modified)
     * @param percentile the percentile, between 0 and 100 inclusive
     * @return the selected sample, or empty when there are no samples or the index falls past the end
     */
    public static OptionalLong nearestRank(List<Long> samples, int percentile) {
        if (percentile < 0 || percentile > 100) {
            throw new IllegalArgumentException("percentile must be between 0 and 100");
        }
        if (samples.isEmpty()) {
            return OptionalLong.empty();
        }
        List<Long> sorted = new ArrayList<>(samples);
        Collections.sort(sorted);
        int index = (int) ((long) sorted.size() * percentile / 100);
        if (index >= sorted.size()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(sorted.get(index));
    }

    /**
     * Nearest-rank 99th percentile.
     */
    public static OptionalLong percentile99(List<Long> samples) {
        return nearestRank(samples, RESPONSE_TIME_PERCENTILE);
    }

    /**
     * Returns the most frequently observed key. Ties go to the lexicographically smallest key so
     * the answer does not depend on merge order.
     */
    public static Optional<String> mostUsed(Map<String, Long> frequencies) {
        String best = null;
        long bestCount = 0;
        for (Map.Entry<String, Long> entry : frequencies.entrySet()) {
            long count = entry.getValue();
            if (best == null
                    || count > bestCount
                    || (count == bestCount && entry.getKey().compareTo(best) < 0)) {
                best = entry.getKey();
                bestCount = count;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Merges two frequency tables key-wise with saturating addition. Neither input is modified.
     */
    public static Map<String, Long> mergeFrequencies(Map<String, Long> a, Map<String, Long> b) {
        Map<String, Long> merged = new HashMap<>(a);
        b.forEach((key, count) -> merged.merge(key, count, Saturating::add));
        return merged;
    }

    /**
     * Concatenates two sample lists into a new list.
     */
    public static List<Long> concat(List<Long> a, List<Long> b) {
        List<Long> merged = new ArrayList<>(a.size() + b.size());
        merged.addAll(a);
        merged.addAll(b);
        return merged;
    }

    /**
     * Formats {@code numerator / denominator} with two decimals. A zero denominator yields
     * {@code "NaN"} (or an infinity for a non-zero numerator); callers accept that value.
     */
    public static String formatRatio(long numerator, long denominator) {
        return String.format(Locale.ROOT, "%.2f", ratio(numerator, denominator));
    }

    /**
     * Plain floating point ratio; {@code NaN} when both operands are zero.
     */
    public static double ratio(long numerator, long denominator) {
        return (double) numerator / (double) denominator;
    }
}
