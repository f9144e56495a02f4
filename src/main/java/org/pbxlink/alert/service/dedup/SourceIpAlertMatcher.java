package org.pbxlink.alert.service.dedup;

import lombok.extern.slf4j.Slf4j;
import org.pbxlink.alert.domain.model.AlertRecord;
import org.pbxlink.alert.domain.model.Property;
import org.pbxlink.alert.domain.model.enums.PbxIntegrationType;
import org.pbxlink.alert.domain.repository.AlertRecordRepository;
import org.pbxlink.alert.service.model.NormalizedCallEvent;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Vendors that redeliver with a stable source address: an alert of the same type for the
 * same property already stamped with that address is the same call.
 */
@Component
@Order(1)
@Slf4j
public class SourceIpAlertMatcher implements AlertMatcher {

    private final AlertRecordRepository alertRecordRepository;
    private final Set<PbxIntegrationType> ipVendorTypes;

    public SourceIpAlertMatcher(AlertRecordRepository alertRecordRepository,
                                @Value("${pbx.alert.dedup.ip-vendor-types:OOMA,PEERLESS}") String ipVendorTypes) {
        this.alertRecordRepository = alertRecordRepository;
        this.ipVendorTypes = EnumSet.noneOf(PbxIntegrationType.class);
        Arrays.stream(ipVendorTypes.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(String::toUpperCase)
                .map(PbxIntegrationType::valueOf)
                .forEach(this.ipVendorTypes::add);
    }

    @Override
    public String name() {
        return "source-ip";
    }

    @Override
    public boolean appliesTo(NormalizedCallEvent call) {
        Property property = call.getProperty();
        return !property.isLegacy()
                && ipVendorTypes.contains(property.getPbxIntegrationType())
                && call.getEvent().hasSourceIp();
    }

    @Override
    public Optional<AlertRecord> findMatch(NormalizedCallEvent call) {
        return alertRecordRepository.findFirstByAlertTypeAndPropertyIdAndAcknowledgedIp(
                AlertRecord.EMERGENCY_ALERT_TYPE, call.getPropertyId(), call.getEvent().getSourceIp());
    }

    @Override
    public String claimKey(NormalizedCallEvent call) {
        return AlertRecord.EMERGENCY_ALERT_TYPE + ":" + call.getPropertyId() + ":ip:" + call.getEvent().getSourceIp();
    }
}
