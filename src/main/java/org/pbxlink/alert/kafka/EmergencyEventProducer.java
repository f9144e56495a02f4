package org.pbxlink.alert.kafka;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.pbxlink.alert.api.dto.EmergencyEventMessage;
import org.pbxlink.alert.api.exception.KafkaPublishException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes emergency events to the generic event topic.
 * Partition key is the property id to keep per-property ordering.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmergencyEventProducer {

    private final KafkaTemplate<String, EmergencyEventMessage> kafkaTemplate;

    @Value("${pbx.kafka.topics.emergency-events}")
    private String emergencyEventsTopic;

    /**
     * @return future with Kafka RecordMetadata on success
     */
    public CompletableFuture<RecordMetadata> publish(EmergencyEventMessage event) {
        String key = String.valueOf(event.getPropertyId());

        return kafkaTemplate.send(emergencyEventsTopic, key, event)
                .thenApply(result -> {
                    RecordMetadata metadata = result.getRecordMetadata();
                    log.info("Published emergency event {} to {}[{}]@{}",
                            event.getEventId(), metadata.topic(), metadata.partition(), metadata.offset());
                    return metadata;
                })
                .exceptionally(ex -> {
                    log.error("Failed to publish emergency event {} to Kafka", event.getEventId(), ex);
                    throw new KafkaPublishException(event, ex);
                });
    }
}
