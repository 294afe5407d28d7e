package com.sift.analytics;

import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;

/**
 * Extracts the client labels of a request.
 * <p>
 * SDKs announce themselves in {@value #CLIENT_HEADER} as a {@code ;}-separated list
 * ({@code "sift-js (v0.41.0); sift-react (v0.8.1)"}); other clients are identified by their
 * {@code User-Agent}.
 */
public final class UserAgents {

    /** Header SDKs use to identify themselves. */
    public static final String CLIENT_HEADER = "X-Sift-Client";

    /** Label used when the request identifies itself in no way. */
    public static final String UNKNOWN = "unknown";

    private UserAgents() {
        // utility class
    }

    /**
     * @param clientHeader    value of {@value #CLIENT_HEADER}, may be {@code null}
     * @param userAgentHeader value of {@code User-Agent}, may be {@code null}
     * @return the trimmed labels; never empty
     */
    public static Set<String> extract(String clientHeader, String userAgentHeader) {
        String raw = clientHeader != null ? clientHeader : userAgentHeader;
        if (raw == null) {
            raw = UNKNOWN;
        }
        Set<String> labels = new TreeSet<>();
        Arrays.stream(raw.split(";")).map(String::trim).forEach(labels::add);
        return labels;
    }
}
