package org.pbxlink.alert.service.dedup;

import lombok.extern.slf4j.Slf4j;
import org.pbxlink.alert.domain.model.AlertRecord;
import org.pbxlink.alert.service.model.NormalizedCallEvent;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a normalized call was already alerted.
 * Applicable matchers are consulted in order against stored alerts; a fresh call then
 * claims every applicable key so a concurrent redelivery sees it as a duplicate.
 */
@Service
@Slf4j
public class DeduplicationGate {

    private final List<AlertMatcher> matchers;
    private final AlertClaimService alertClaimService;

    public DeduplicationGate(List<AlertMatcher> matchers, AlertClaimService alertClaimService) {
        this.matchers = matchers;
        this.alertClaimService = alertClaimService;
    }

    public DuplicateCheck check(NormalizedCallEvent call) {
        List<AlertMatcher> applicable = matchers.stream()
                .filter(m -> m.appliesTo(call))
                .toList();

        for (AlertMatcher matcher : applicable) {
            Optional<AlertRecord> match = matcher.findMatch(call);
            if (match.isPresent()) {
                log.info("Duplicate detected via {}: property={}, alert={}",
                        matcher.name(), call.getPropertyId(), match.get().getId());
                return DuplicateCheck.duplicateOf(matcher.name(), match.get().getId());
            }
        }

        List<String> claimed = new ArrayList<>();
        for (AlertMatcher matcher : applicable) {
            String key = matcher.claimKey(call);
            if (!alertClaimService.claim(key)) {
                alertClaimService.release(claimed);
                log.info("Duplicate detected via concurrent {} claim: property={}", matcher.name(), call.getPropertyId());
                return DuplicateCheck.duplicateOf(matcher.name(), null);
            }
            claimed.add(key);
        }
        String dedupKey = applicable.stream()
                .filter(AlertMatcher::backedByUniqueKey)
                .map(m -> m.claimKey(call))
                .findFirst()
                .orElse(null);
        return DuplicateCheck.fresh(claimed, dedupKey);
    }

    public void release(DuplicateCheck check) {
        alertClaimService.release(check.getClaimedKeys());
    }
}
