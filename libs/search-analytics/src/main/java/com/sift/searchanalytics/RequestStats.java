package com.sift.searchanalytics;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sift.analytics.Saturating;
import com.sift.analytics.Statistics;
import java.util.ArrayList;
import java.util.List;

/**
 * Received and succeeded counters plus the response times of succeeded requests.
 */
final class RequestStats {

    long totalReceived;
    long totalSucceeded;
    List<Long> timeSpent = new ArrayList<>();

    static RequestStats received() {
        RequestStats stats = new RequestStats();
        stats.totalReceived = 1;
        return stats;
    }

    void succeed(long processingTimeMs) {
        totalSucceeded = Saturating.add(totalSucceeded, 1);
        timeSpent.add(processingTimeMs);
    }

    RequestStats copy() {
        RequestStats copy = new RequestStats();
        copy.totalReceived = totalReceived;
        copy.totalSucceeded = totalSucceeded;
        copy.timeSpent = new ArrayList<>(timeSpent);
        return copy;
    }

    void mergeFrom(RequestStats other) {
        totalReceived = Saturating.add(totalReceived, other.totalReceived);
        totalSucceeded = Saturating.add(totalSucceeded, other.totalSucceeded);
        timeSpent = Statistics.concat(timeSpent, other.timeSpent);
    }

    /**
     * Writes the {@code requests} section and returns it so callers can add their own counters.
     */
    ObjectNode writeTo(ObjectNode event) {
        ObjectNode requests = event.putObject("requests");
        Statistics.percentile99(timeSpent).ifPresentOrElse(
                p99 -> requests.put("99th_response_time", String.valueOf(p99)),
                () -> requests.putNull("99th_response_time"));
        requests.put("total_succeeded", totalSucceeded);
        requests.put("total_failed", Saturating.sub(totalReceived, totalSucceeded));
        requests.put("total_received", totalReceived);
        return requests;
    }
}
