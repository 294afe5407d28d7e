package com.sift.analytics;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Used when analytics are turned off or the delivery client cannot be built.
 */
final class DisabledAnalytics implements Analytics {

    static final DisabledAnalytics INSTANCE = new DisabledAnalytics();

    private DisabledAnalytics() {
    }

    @Override
    public <T extends Aggregate<T>> boolean publish(T payload, Set<String> sources) {
        return false;
    }

    @Override
    public Optional<UUID> instanceUid() {
        return Optional.empty();
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public String toString() {
        return "DisabledAnalytics";
    }
}
