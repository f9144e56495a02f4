package org.pbxlink.alert.service.dispatch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.pbxlink.alert.api.dto.EmergencyEventMessage;
import org.pbxlink.alert.domain.model.EventQueueEntry;
import org.pbxlink.alert.domain.model.enums.PublishStatus;
import org.pbxlink.alert.domain.repository.EventQueueEntryRepository;
import org.pbxlink.alert.kafka.EmergencyEventProducer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Publishes event_queue_entry rows to Kafka (outbox pattern) and retries the ones that failed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmergencyEventPublisher {

    private final EmergencyEventProducer emergencyEventProducer;
    private final EventQueueEntryRepository eventQueueEntryRepository;

    @Value("${pbx.alert.outbox.retry-max-age-minutes:60}")
    private int retryMaxAgeMinutes;

    public EmergencyEventMessage publish(EventQueueEntry entry) {
        EmergencyEventMessage message = toMessage(entry);

        try {
            RecordMetadata metadata = emergencyEventProducer.publish(message).join();

            entry.setPublishStatus(PublishStatus.PUBLISHED);
            entry.setPublishedAt(OffsetDateTime.now(ZoneOffset.UTC));
            entry.setKafkaTopic(metadata.topic());
            entry.setKafkaPartition(metadata.partition());
            entry.setKafkaOffset(metadata.offset());
            eventQueueEntryRepository.save(entry);

            return message;
        } catch (Exception e) {
            log.error("Kafka publish failed for event_queue_entry id={}: {}", entry.getId(), e.getMessage());
            entry.setPublishStatus(PublishStatus.FAILED);
            eventQueueEntryRepository.save(entry);
            throw e;
        }
    }

    /**
     * Scheduled retry of pending/failed event queue rows.
     */
    @Scheduled(fixedDelayString = "${pbx.alert.outbox.retry-interval-seconds:30}000")
    @Transactional
    public void retryPendingPublishes() {
        OffsetDateTime cutoff = OffsetDateTime.now(ZoneOffset.UTC).minusSeconds(30);
        OffsetDateTime maxAge = OffsetDateTime.now(ZoneOffset.UTC).minusMinutes(retryMaxAgeMinutes);

        List<EventQueueEntry> pending = new ArrayList<>(eventQueueEntryRepository
                .findByPublishStatusAndCreatedAtBefore(PublishStatus.PENDING, cutoff));
        pending.addAll(eventQueueEntryRepository
                .findByPublishStatusAndCreatedAtBefore(PublishStatus.FAILED, cutoff));

        for (EventQueueEntry entry : pending) {
            if (entry.getCreatedAt().isBefore(maxAge)) {
                log.warn("Event queue entry id={} exceeded max retry age, skipping", entry.getId());
                continue;
            }
            try {
                publish(entry);
                log.info("Successfully retried publish for event_queue_entry id={}", entry.getId());
            } catch (Exception e) {
                log.warn("Retry publish failed for event_queue_entry id={}: {}", entry.getId(), e.getMessage());
            }
        }
    }

    private EmergencyEventMessage toMessage(EventQueueEntry entry) {
        return EmergencyEventMessage.builder()
                .eventId(entry.getId())
                .alertId(entry.getAlertId())
                .eventType(entry.getEventType())
                .propertyId(entry.getPropertyId())
                .roomNumber(entry.getRoomNumber())
                .extension(entry.getExtension())
                .guestName(entry.getGuestName())
                .alertTime(entry.getAlertTime())
                .build();
    }
}
