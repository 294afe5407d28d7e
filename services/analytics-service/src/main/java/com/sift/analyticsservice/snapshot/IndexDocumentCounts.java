package com.sift.analyticsservice.snapshot;

import java.util.List;

/**
 * Current number of documents of each index, as reported in snapshots.
 * <p>
 * The component that owns the indexes exposes an implementation as a bean. Without one, snapshots
 * report no indexes.
 */
@FunctionalInterface
public interface IndexDocumentCounts {

    /** Reports no indexes. */
    IndexDocumentCounts NONE = List::of;

    List<Long> documentsPerIndex();
}
