package org.pbxlink.alert.api.exception;

import lombok.Getter;
import org.pbxlink.alert.api.dto.EmergencyEventMessage;

/**
 * Exception thrown when Kafka publish fails.
 */
@Getter
public class KafkaPublishException extends RuntimeException {

    private final transient EmergencyEventMessage event;

    public KafkaPublishException(EmergencyEventMessage event, Throwable cause) {
        super("Failed to publish emergency event " + event.getEventId() + " to Kafka", cause);
        this.event = event;
    }
}
