package com.sift.analyticsservice.config;

import com.sift.analytics.AnalyticsSettings;
import jakarta.validation.constraints.PositiveOrZero;
import java.nio.file.Path;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Analytics configuration, bound from the {@code sift.analytics.*} prefix:
 *
 * <pre>
 * sift:
 *   analytics:
 *     enabled: true
 *     endpoint: https://telemetry.example.com
 *     write-key: ${SIFT_ANALYTICS_WRITE_KEY}
 *     data-dir: /var/lib/sift/data.sift
 *     flush-interval: 1h
 * </pre>
 *
 * @param enabled         whether telemetry is collected at all (default true)
 * @param serviceName     service tag of the pipeline's own metrics (default "sift")
 * @param version         application version reported in snapshots (default "development")
 * @param endpoint        base URL of the analytics endpoint
 * @param writeKey        key identifying this source at the endpoint
 * @param dataDir         database directory, primary location of the instance uid
 * @param configDir       user configuration directory, secondary copy of the instance uid
 * @param mailboxCapacity events waiting for the aggregator before new ones are dropped (0 = default)
 * @param flushInterval   period between two flushes (default 1h)
 * @param connectTimeout  TCP connect timeout of the delivery client (default 10s)
 */
@ConfigurationProperties(prefix = "sift.analytics")
@Validated
public record AnalyticsProperties(
        Boolean enabled,
        String serviceName,
        String version,
        String endpoint,
        String writeKey,
        Path dataDir,
        Path configDir,
        @PositiveOrZero int mailboxCapacity,
        Duration flushInterval,
        Duration connectTimeout) {

    public static final Path DEFAULT_DATA_DIR = Path.of("data.sift");

    /**
     * Applies defaults for optional values. Runs before Bean Validation.
     */
    public AnalyticsProperties {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = AnalyticsSettings.DEFAULT_SERVICE_NAME;
        }
        if (version == null || version.isBlank()) {
            version = "development";
        }
        if (dataDir == null) {
            dataDir = DEFAULT_DATA_DIR;
        }
        if (configDir == null) {
            configDir = Path.of(System.getProperty("user.home"), ".config", "sift");
        }
        if (flushInterval == null) {
            flushInterval = AnalyticsSettings.DEFAULT_FLUSH_INTERVAL;
        }
        if (connectTimeout == null) {
            connectTimeout = Duration.ofSeconds(10);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** Engine tuning derived from these properties. */
    public AnalyticsSettings toSettings() {
        return new AnalyticsSettings(serviceName, mailboxCapacity, flushInterval);
    }
}
