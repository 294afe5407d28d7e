package com.sift.analytics.identity;

import java.util.UUID;

/**
 * Identity of this instance in the analytics stream.
 *
 * @param uid          the instance uid
 * @param firstTimeRun true if no uid had been persisted before this start
 */
public record InstanceIdentity(UUID uid, boolean firstTimeRun) {

    public InstanceIdentity {
        if (uid == null) {
            throw new IllegalArgumentException("uid must not be null");
        }
    }

    /** The uid as sent to the analytics endpoint. */
    public String userId() {
        return uid.toString();
    }
}
