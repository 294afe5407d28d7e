package com.sift.analytics.snapshot;

import com.sift.analytics.AnalyticsRecord;
import java.util.Optional;

/**
 * Produces the instance snapshot pushed at the start of every flush cycle.
 */
@FunctionalInterface
public interface SnapshotProvider {

    /** Provider that never produces a snapshot. */
    SnapshotProvider NONE = userId -> Optional.empty();

    /**
     * Builds the snapshot record for the given identity.
     *
     * @param userId the instance identity the snapshot describes
     * @return the record, or empty if no snapshot can be produced for this cycle
     */
    Optional<AnalyticsRecord> snapshot(String userId);
}
