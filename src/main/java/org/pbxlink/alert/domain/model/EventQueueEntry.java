package org.pbxlink.alert.domain.model;

import jakarta.persistence.*;
import lombok.*;
import org.pbxlink.alert.domain.model.enums.PublishStatus;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;

/**
 * Generic emergency event for external subscribers: the outbox for Kafka publishing.
 * Each row corresponds to exactly one message on the emergency events topic.
 */
@Entity
@Table(name = "event_queue_entry")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EventQueueEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "alert_id", nullable = false)
    private Long alertId;

    @Column(name = "property_id", nullable = false)
    private Long propertyId;

    @Column(name = "event_type", nullable = false)
    private String eventType;

    @Column(name = "room_number")
    private String roomNumber;

    @Column(nullable = false)
    private String extension;

    @Column(name = "guest_name")
    private String guestName;

    @Column(name = "alert_time", nullable = false)
    private LocalDateTime alertTime;

    @Column(name = "created_at", nullable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now();

    // Kafka publish tracking
    @Enumerated(EnumType.STRING)
    @Column(name = "publish_status", nullable = false)
    @Builder.Default
    private PublishStatus publishStatus = PublishStatus.PENDING;

    @Column(name = "published_at")
    private OffsetDateTime publishedAt;

    @Column(name = "kafka_topic")
    private String kafkaTopic;

    @Column(name = "kafka_partition")
    private Integer kafkaPartition;

    @Column(name = "kafka_offset")
    private Long kafkaOffset;
}
