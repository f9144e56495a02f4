package org.pbxlink.alert.service.dispatch;

import lombok.extern.slf4j.Slf4j;
import org.pbxlink.alert.domain.model.AlertRecord;
import org.pbxlink.alert.domain.repository.AlertRecordRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Stamps the caller's source address onto an alert as its acknowledging IP.
 * Single attempt in its own transaction: a locked row, a concurrent writer or a storage
 * error means the stamp is skipped and the caller's transaction is left untouched.
 */
@Service
@Slf4j
public class AcknowledgementStamper {

    private final AlertRecordRepository alertRecordRepository;
    private final TransactionTemplate stampTransaction;

    public AcknowledgementStamper(AlertRecordRepository alertRecordRepository,
                                  PlatformTransactionManager transactionManager) {
        this.alertRecordRepository = alertRecordRepository;
        this.stampTransaction = new TransactionTemplate(transactionManager);
        this.stampTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public boolean stamp(AlertRecord alert, String ipAddress) {
        if (ipAddress == null || alert.getAcknowledgedIp() != null) {
            return false;
        }
        try {
            Boolean stamped = stampTransaction.execute(status -> tryStamp(alert, ipAddress));
            return Boolean.TRUE.equals(stamped);
        } catch (DataAccessException | TransactionException e) {
            log.debug("Acknowledging IP stamp skipped for alert {}: {}", alert.getId(), e.getMessage());
            return false;
        }
    }

    public boolean stamp(Long alertId, String ipAddress) {
        return alertRecordRepository.findById(alertId)
                .map(alert -> stamp(alert, ipAddress))
                .orElse(false);
    }

    private boolean tryStamp(AlertRecord alert, String ipAddress) {
        // NOWAIT row lock: a held lock fails fast instead of blocking the pipeline
        boolean current = alertRecordRepository.lockForStamp(alert.getId(), alert.getVersion())
                .filter(locked -> locked.getAcknowledgedIp() == null)
                .isPresent();
        if (!current || alertRecordRepository.stampAcknowledgedIp(alert.getId(), alert.getVersion(), ipAddress) == 0) {
            log.debug("Alert {} changed concurrently, acknowledging IP not stamped", alert.getId());
            return false;
        }
        log.debug("Stamped acknowledging IP {} on alert {}", ipAddress, alert.getId());
        return true;
    }
}
