package com.sift.analyticsservice.snapshot;

import com.sift.analytics.snapshot.InstanceStats;
import com.sift.analytics.snapshot.InstanceStatsSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Instance statistics read from the data directory.
 * <p>
 * The database size is the total size of the regular files below the directory. Document counts
 * come from the host's {@link IndexDocumentCounts}; configuration facts are fixed at construction.
 */
public final class DataDirectoryStats implements InstanceStatsSource {

    private final Path dataDir;
    private final IndexDocumentCounts documentCounts;
    private final Map<String, Object> infos;

    /**
     * @param dataDir           database directory
     * @param documentCounts    current number of documents of each index
     * @param infos             configuration facts, sensitive values already reduced to booleans
     */
    public DataDirectoryStats(Path dataDir, IndexDocumentCounts documentCounts, Map<String, Object> infos) {
        if (dataDir == null) {
            throw new IllegalArgumentException("dataDir must not be null");
        }
        this.dataDir = dataDir;
        this.documentCounts = documentCounts != null ? documentCounts : IndexDocumentCounts.NONE;
        this.infos = infos != null ? new LinkedHashMap<>(infos) : Map.of();
    }

    @Override
    public InstanceStats current() throws IOException {
        return new InstanceStats(sizeOf(dataDir), documentCounts.documentsPerIndex(), infos);
    }

    static long sizeOf(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        try (Stream<Path> files = Files.walk(directory)) {
            return files.filter(Files::isRegularFile).mapToLong(DataDirectoryStats::fileSize).sum();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private static long fileSize(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
