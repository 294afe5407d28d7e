package com.sift.analytics.snapshot;

import java.util.List;
import java.util.Map;

/**
 * Instance-level statistics gathered fresh for every snapshot.
 *
 * @param databaseSize       size of the database on disk, in bytes
 * @param documentsPerIndex  number of documents of each index
 * @param infos              configuration facts and enabled features; sensitive values (paths,
 *                           addresses, keys) must already be reduced to booleans
 */
public record InstanceStats(long databaseSize, List<Long> documentsPerIndex, Map<String, Object> infos) {

    public InstanceStats {
        documentsPerIndex = documentsPerIndex == null ? List.of() : List.copyOf(documentsPerIndex);
        infos = infos == null ? Map.of() : Map.copyOf(infos);
    }

    /** Number of indexes. */
    public int indexesNumber() {
        return documentsPerIndex.size();
    }
}
