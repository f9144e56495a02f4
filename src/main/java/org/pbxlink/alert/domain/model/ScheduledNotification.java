package org.pbxlink.alert.domain.model;

import jakarta.persistence.*;
import lombok.*;
import org.pbxlink.alert.domain.model.enums.DeliveryChannel;

import java.time.OffsetDateTime;

/**
 * Scheduled phone call or SMS picked up by the dialer.
 */
@Entity
@Table(name = "scheduled_notification")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduledNotification {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "alert_id", nullable = false)
    private Long alertId;

    @Column(name = "property_id", nullable = false)
    private Long propertyId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DeliveryChannel channel;

    @Column(nullable = false)
    private String destination;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String message;

    @Column(name = "scheduled_at", nullable = false)
    private OffsetDateTime scheduledAt;

    @Column(nullable = false)
    @Builder.Default
    private boolean delivered = false;
}
