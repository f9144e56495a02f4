package org.pbxlink.alert.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pbxlink.alert.api.exception.AlertNotFoundException;
import org.pbxlink.alert.domain.model.AlertRecord;
import org.pbxlink.alert.domain.model.enums.AcknowledgementStatus;
import org.pbxlink.alert.domain.repository.AlertRecordRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Queries and acknowledges emitted alerts for the pop-up console.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertService {

    private final AlertRecordRepository alertRecordRepository;

    public Page<AlertRecord> listForProperty(Long propertyId, boolean unacknowledgedOnly, Pageable pageable) {
        if (unacknowledgedOnly) {
            return alertRecordRepository.findByPropertyIdAndAcknowledgementStatus(
                    propertyId, AcknowledgementStatus.PENDING, pageable);
        }
        return alertRecordRepository.findByPropertyId(propertyId, pageable);
    }

    public Optional<AlertRecord> findById(Long id) {
        return alertRecordRepository.findById(id);
    }

    /**
     * Mark an alert acknowledged. Acknowledging twice keeps the first actor.
     */
    @Transactional
    public AlertRecord acknowledge(Long id, String actor, String ipAddress) {
        AlertRecord alert = alertRecordRepository.findById(id)
                .orElseThrow(() -> new AlertNotFoundException(id));
        if (alert.isAcknowledged()) {
            log.info("Alert {} already acknowledged by {}", id, alert.getAcknowledgedBy());
            return alert;
        }
        alert.setAcknowledgementStatus(AcknowledgementStatus.ACKNOWLEDGED);
        alert.setAcknowledgedBy(actor);
        alert.setAcknowledgedAt(OffsetDateTime.now(ZoneOffset.UTC));
        if (ipAddress != null && !ipAddress.isBlank() && alert.getAcknowledgedIp() == null) {
            alert.setAcknowledgedIp(ipAddress.trim());
        }
        AlertRecord saved = alertRecordRepository.save(alert);
        log.info("Alert {} acknowledged by {}", id, actor);
        return saved;
    }
}
