package org.pbxlink.alert.service.model;

import lombok.Builder;
import lombok.Value;
import org.pbxlink.alert.api.dto.CallEventRequest;

import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * Immutable call-description record as consumed by the pipeline. Blank identifiers are null.
 */
@Value
@Builder(toBuilder = true)
public class CallEvent {

    String enterpriseId;
    String groupId;
    String userId;
    String extension;
    String phoneNumber;
    String dialedDigits;
    Instant callStartTime;
    String callerName;
    String sourceIp;
    String rawDataReference;

    /**
     * Build from a request that already passed validation.
     */
    public static CallEvent from(CallEventRequest request) {
        return CallEvent.builder()
                .enterpriseId(clean(request.getEnterpriseId()))
                .groupId(clean(request.getGroupId()))
                .userId(clean(request.getUserId()))
                .extension(clean(request.getExtension()))
                .phoneNumber(clean(request.getPhoneNumber()))
                .dialedDigits(clean(request.getDialedDigits()))
                .callStartTime(OffsetDateTime.parse(request.getCallStartTime().trim()).toInstant())
                .callerName(clean(request.getCallerName()))
                .sourceIp(clean(request.getSourceIp()))
                .rawDataReference(clean(request.getRawDataReference()))
                .build();
    }

    public boolean hasSourceIp() {
        return sourceIp != null;
    }

    private static String clean(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
