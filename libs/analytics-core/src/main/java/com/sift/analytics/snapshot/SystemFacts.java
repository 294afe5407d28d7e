package com.sift.analytics.snapshot;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.FileStore;
import java.nio.file.FileSystems;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Host facts that do not change while the process runs. Captured once at startup.
 *
 * @param distribution   operating system name
 * @param kernelVersion  operating system version, without the distribution suffix
 * @param cores          available processors
 * @param ramSize        total physical memory in bytes, or {@code null} if unknown
 * @param diskSize       size of the largest file store in bytes, or {@code null} if unknown
 * @param serverProvider hosting provider label from {@value #SERVER_PROVIDER_ENV}, or {@code null}
 */
public record SystemFacts(
        String distribution,
        String kernelVersion,
        int cores,
        Long ramSize,
        Long diskSize,
        String serverProvider) {

    /** Environment variable naming the hosting provider. */
    public static final String SERVER_PROVIDER_ENV = "SIFT_SERVER_PROVIDER";

    private static final Logger log = LoggerFactory.getLogger(SystemFacts.class);

    /**
     * Captures the facts of the running host.
     *
     * @param environment process environment, used for the provider override
     */
    public static SystemFacts capture(Map<String, String> environment) {
        String provider = environment.get(SERVER_PROVIDER_ENV);
        return new SystemFacts(
                System.getProperty("os.name"),
                kernelVersion(System.getProperty("os.version")),
                Runtime.getRuntime().availableProcessors(),
                totalMemory(),
                largestDisk(),
                provider == null || provider.isBlank() ? null : provider);
    }

    /**
     * Keeps the part of a version before the first {@code '-'}: {@code 6.8.0-45-generic}
     * becomes {@code 6.8.0}. A version without a suffix, such as {@code 14.4.1}, is kept whole.
     */
    static String kernelVersion(String osVersion) {
        if (osVersion == null) {
            return null;
        }
        int dash = osVersion.indexOf('-');
        return dash < 0 ? osVersion : osVersion.substring(0, dash);
    }

    private static Long totalMemory() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            return sunOs.getTotalMemorySize();
        }
        return null;
    }

    private static Long largestDisk() {
        long largest = -1;
        for (FileStore store : FileSystems.getDefault().getFileStores()) {
            try {
                largest = Math.max(largest, store.getTotalSpace());
            } catch (IOException e) {
                log.trace("Ignoring unreadable file store {}: {}", store, e.getMessage());
            }
        }
        return largest < 0 ? null : largest;
    }
}
