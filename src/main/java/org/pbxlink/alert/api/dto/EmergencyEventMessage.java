package org.pbxlink.alert.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * EmergencyEventMessage: the Kafka message published for generic emergency-event subscribers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EmergencyEventMessage {

    private Long eventId;
    private Long alertId;
    private String eventType;
    private Long propertyId;
    private String roomNumber;
    private String extension;
    private String guestName;
    private LocalDateTime alertTime;
}
