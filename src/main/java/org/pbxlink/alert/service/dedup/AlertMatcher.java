package org.pbxlink.alert.service.dedup;

import org.pbxlink.alert.domain.model.AlertRecord;
import org.pbxlink.alert.service.model.NormalizedCallEvent;

import java.util.Optional;

/**
 * A way of recognizing that a call was already alerted.
 */
public interface AlertMatcher {

    String name();

    boolean appliesTo(NormalizedCallEvent call);

    Optional<AlertRecord> findMatch(NormalizedCallEvent call);

    /**
     * Key identifying the physical event for this matcher, used to serialize concurrent deliveries.
     */
    String claimKey(NormalizedCallEvent call);

    /**
     * When true the claim key is also stored on the alert under a unique constraint.
     */
    default boolean backedByUniqueKey() {
        return false;
    }
}
