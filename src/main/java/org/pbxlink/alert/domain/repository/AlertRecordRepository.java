package org.pbxlink.alert.domain.repository;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.pbxlink.alert.domain.model.AlertRecord;
import org.pbxlink.alert.domain.model.enums.AcknowledgementStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface AlertRecordRepository extends JpaRepository<AlertRecord, Long> {

    Optional<AlertRecord> findFirstByAlertTypeAndPropertyIdAndAcknowledgedIp(
            int alertType, Long propertyId, String acknowledgedIp);

    Optional<AlertRecord> findFirstByAlertTypeAndEventTimeAndExtensionAndPropertyId(
            int alertType, LocalDateTime eventTime, String extension, Long propertyId);

    Page<AlertRecord> findByPropertyId(Long propertyId, Pageable pageable);

    Page<AlertRecord> findByPropertyIdAndAcknowledgementStatus(
            Long propertyId, AcknowledgementStatus status, Pageable pageable);

    /**
     * Row lock for the acknowledging-IP stamp; fails immediately when another transaction holds it.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "0"))
    @Query("SELECT a FROM AlertRecord a WHERE a.id = :id AND a.version = :version")
    Optional<AlertRecord> lockForStamp(@Param("id") Long id, @Param("version") Long version);

    /**
     * Conditional update on the row version; returns 0 when another writer got there first.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE AlertRecord a SET a.acknowledgedIp = :ip, a.version = a.version + 1 "
            + "WHERE a.id = :id AND a.version = :version")
    int stampAcknowledgedIp(@Param("id") Long id, @Param("version") Long version, @Param("ip") String ip);
}
