package org.pbxlink.alert.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AlertRecordDto {

    private Long id;
    private int alertType;
    private Long propertyId;
    private LocalDateTime eventTime;
    private String extension;
    private String roomNumber;
    private String guestName;
    private String subject;
    private String body;
    private String sourceIp;
    private String acknowledgementStatus;
    private String acknowledgedBy;
    private OffsetDateTime acknowledgedAt;
    private String acknowledgedIp;
    private OffsetDateTime createdAt;
}
