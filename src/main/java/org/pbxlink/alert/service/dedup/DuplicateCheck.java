package org.pbxlink.alert.service.dedup;

import lombok.Value;

import java.util.List;

/**
 * Outcome of the deduplication gate. Claimed keys must be released if the run fails later.
 */
@Value
public class DuplicateCheck {

    boolean duplicate;
    String matcher;
    Long matchedAlertId;
    List<String> claimedKeys;
    // stored on the new alert; null when no applicable matcher is backed by the unique constraint
    String dedupKey;

    public static DuplicateCheck duplicateOf(String matcher, Long alertId) {
        return new DuplicateCheck(true, matcher, alertId, List.of(), null);
    }

    public static DuplicateCheck fresh(List<String> claimedKeys, String dedupKey) {
        return new DuplicateCheck(false, null, null, claimedKeys, dedupKey);
    }
}
