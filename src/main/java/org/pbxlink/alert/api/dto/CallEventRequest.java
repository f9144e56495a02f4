package org.pbxlink.alert.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Call-description record delivered by the PBX integration.
 * callStartTime is an ISO-8601 instant in UTC.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CallEventRequest {

    private String enterpriseId;

    private String groupId;

    private String userId;

    private String extension;

    private String phoneNumber;

    @NotBlank(message = "dialedDigits is required")
    @Size(max = 64, message = "dialedDigits must be at most 64 characters")
    private String dialedDigits;

    @NotBlank(message = "callStartTime is required")
    private String callStartTime;

    private String callerName;

    private String sourceIp;

    private String rawDataReference;
}
