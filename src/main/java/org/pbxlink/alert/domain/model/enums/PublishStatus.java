package org.pbxlink.alert.domain.model.enums;

/**
 * Kafka publish status for event_queue_entry records (outbox pattern).
 */
public enum PublishStatus {
    PENDING,
    PUBLISHED,
    FAILED
}
