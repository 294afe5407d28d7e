package com.sift.analytics.snapshot;

/**
 * Reads the current {@link InstanceStats} from the host.
 */
@FunctionalInterface
public interface InstanceStatsSource {

    /**
     * @throws Exception if the statistics cannot be computed; the snapshot is skipped
     */
    InstanceStats current() throws Exception;
}
