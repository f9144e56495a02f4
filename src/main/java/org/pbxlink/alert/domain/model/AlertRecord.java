package org.pbxlink.alert.domain.model;

import jakarta.persistence.*;
import lombok.*;
import org.pbxlink.alert.domain.model.enums.AcknowledgementStatus;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;

/**
 * Emitted emergency alert: the pop-up console row and the anchor for deduplication.
 * The id comes from the shared alert sequence, not from the database.
 */
@Entity
@Table(name = "alert_record", uniqueConstraints = {
        @UniqueConstraint(name = "uk_alert_dedup_key", columnNames = "dedup_key")
}, indexes = {
        @Index(name = "ix_alert_natural_key", columnList = "alert_type, property_id, event_time, extension"),
        @Index(name = "ix_alert_ack_ip", columnList = "alert_type, property_id, acknowledged_ip")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertRecord {

    public static final int EMERGENCY_ALERT_TYPE = 9;

    @Id
    private Long id;

    @Version
    private Long version;

    @Column(name = "alert_type", nullable = false)
    private int alertType;

    @Column(name = "property_id", nullable = false)
    private Long propertyId;

    // property-local time, second precision
    @Column(name = "event_time", nullable = false)
    private LocalDateTime eventTime;

    @Column(nullable = false)
    private String extension;

    @Column(name = "source_ip")
    private String sourceIp;

    @Column(name = "room_number")
    private String roomNumber;

    @Column(name = "guest_name")
    private String guestName;

    private String subject;

    @Column(columnDefinition = "TEXT")
    private String body;

    @Column(name = "legacy_message", columnDefinition = "TEXT")
    private String legacyMessage;

    @Column(name = "raw_reference")
    private String rawReference;

    // natural key of the call; null for calls that are always alerted
    @Column(name = "dedup_key")
    private String dedupKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "acknowledgement_status", nullable = false)
    @Builder.Default
    private AcknowledgementStatus acknowledgementStatus = AcknowledgementStatus.PENDING;

    @Column(name = "acknowledged_by")
    private String acknowledgedBy;

    @Column(name = "acknowledged_at")
    private OffsetDateTime acknowledgedAt;

    @Column(name = "acknowledged_ip")
    private String acknowledgedIp;

    @Column(name = "created_at", nullable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now();

    public boolean isAcknowledged() {
        return acknowledgementStatus == AcknowledgementStatus.ACKNOWLEDGED;
    }
}
