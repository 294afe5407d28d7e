package com.sift.analytics.snapshot;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sift.analytics.AnalyticsJson;
import com.sift.analytics.AnalyticsRecord;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Snapshot of the host and of the instance: static {@link SystemFacts}, uptime, and
 * {@link InstanceStats} read on every call.
 * <p>
 * The record is an identify record with traits:
 * <pre>
 * {
 *   "start_since_days": 3,
 *   "system": { "distribution", "kernel_version", "cores", "ram_size", "disk_size", "server_provider" },
 *   "stats": { "database_size", "indexes_number", "documents_number": [..] },
 *   "infos": { .. }
 * }
 * </pre>
 * and context {@code {"app": {"version": ..}}}.
 */
public final class HostSnapshotProvider implements SnapshotProvider {

    private static final Logger log = LoggerFactory.getLogger(HostSnapshotProvider.class);

    private final SystemFacts system;
    private final Instant startedAt;
    private final Clock clock;
    private final String version;
    private final InstanceStatsSource stats;

    /**
     * @param system    host facts captured at startup
     * @param startedAt when the process started
     * @param clock     clock used to compute the uptime
     * @param version   application version reported in the context
     * @param stats     source of the per-call instance statistics
     */
    public HostSnapshotProvider(
            SystemFacts system, Instant startedAt, Clock clock, String version, InstanceStatsSource stats) {
        if (system == null) {
            throw new IllegalArgumentException("system must not be null");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("version must not be null or blank");
        }
        if (stats == null) {
            throw new IllegalArgumentException("stats must not be null");
        }
        this.system = system;
        this.startedAt = startedAt;
        this.clock = clock;
        this.version = version;
        this.stats = stats;
    }

    @Override
    public Optional<AnalyticsRecord> snapshot(String userId) {
        InstanceStats current;
        try {
            current = stats.current();
        } catch (Exception e) {
            log.debug("Skipping analytics snapshot, instance statistics unavailable: {}", e.getMessage());
            return Optional.empty();
        }

        ObjectNode traits = AnalyticsJson.object();
        traits.put("start_since_days", Duration.between(startedAt, clock.instant()).toDays());
        traits.set("system", systemNode());
        traits.set("stats", statsNode(current));
        traits.set("infos", AnalyticsJson.objectMapper().valueToTree(current.infos()));

        ObjectNode context = AnalyticsJson.object();
        context.putObject("app").put("version", version);

        return Optional.of(AnalyticsRecord.identify(userId, traits, context));
    }

    private ObjectNode systemNode() {
        ObjectNode node = AnalyticsJson.object();
        node.put("distribution", system.distribution());
        node.put("kernel_version", system.kernelVersion());
        node.put("cores", system.cores());
        node.put("ram_size", system.ramSize());
        node.put("disk_size", system.diskSize());
        node.put("server_provider", system.serverProvider());
        return node;
    }

    private static ObjectNode statsNode(InstanceStats current) {
        ObjectNode node = AnalyticsJson.object();
        node.put("database_size", current.databaseSize());
        node.put("indexes_number", current.indexesNumber());
        ArrayNode documents = node.putArray("documents_number");
        current.documentsPerIndex().forEach(documents::add);
        return node;
    }
}
