package org.pbxlink.alert.service.dedup;

import org.pbxlink.alert.domain.model.AlertRecord;
import org.pbxlink.alert.domain.repository.AlertRecordRepository;
import org.pbxlink.alert.service.model.NormalizedCallEvent;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Alert type + property + local time (to the second) + extension.
 * Skipped for the vendor's test enterprise, whose calls are always alerted.
 */
@Component
@Order(2)
public class NaturalKeyAlertMatcher implements AlertMatcher {

    private final AlertRecordRepository alertRecordRepository;
    private final String bypassEnterpriseId;

    public NaturalKeyAlertMatcher(AlertRecordRepository alertRecordRepository,
                                  @Value("${pbx.alert.dedup.bypass-enterprise-id:}") String bypassEnterpriseId) {
        this.alertRecordRepository = alertRecordRepository;
        this.bypassEnterpriseId = bypassEnterpriseId;
    }

    @Override
    public String name() {
        return "natural-key";
    }

    @Override
    public boolean appliesTo(NormalizedCallEvent call) {
        String enterpriseId = call.getEvent().getEnterpriseId();
        return bypassEnterpriseId.isEmpty() || !bypassEnterpriseId.equals(enterpriseId);
    }

    @Override
    public Optional<AlertRecord> findMatch(NormalizedCallEvent call) {
        return alertRecordRepository.findFirstByAlertTypeAndEventTimeAndExtensionAndPropertyId(
                AlertRecord.EMERGENCY_ALERT_TYPE, call.getLocalTime(), call.getExtension(), call.getPropertyId());
    }

    @Override
    public String claimKey(NormalizedCallEvent call) {
        return AlertRecord.EMERGENCY_ALERT_TYPE + ":" + call.getPropertyId() + ":key:"
                + call.getLocalTime() + ":" + call.getExtension();
    }

    @Override
    public boolean backedByUniqueKey() {
        return true;
    }
}
