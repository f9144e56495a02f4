package org.pbxlink.alert.service;

import lombok.extern.slf4j.Slf4j;
import org.pbxlink.alert.api.dto.CallEventRequest;
import org.pbxlink.alert.api.exception.CallEventValidationException;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Validates an inbound call record: mandatory fields, timestamp format, identifier presence.
 */
@Component
@Slf4j
public class CallEventValidator {

    private static final int MAX_DIGITS_LENGTH = 64;

    /**
     * Validate the call record. Throws CallEventValidationException on failure.
     */
    public void validate(CallEventRequest request) {
        if (request == null) {
            throw new CallEventValidationException("Missing call record", "events");
        }
        if (request.getDialedDigits() == null || request.getDialedDigits().isBlank()) {
            throw new CallEventValidationException("Missing required field: 'dialedDigits'", "dialedDigits");
        }
        if (request.getDialedDigits().length() > MAX_DIGITS_LENGTH) {
            throw new CallEventValidationException(
                    "'dialedDigits' exceeds max length of " + MAX_DIGITS_LENGTH + " characters", "dialedDigits");
        }

        if (request.getCallStartTime() == null || request.getCallStartTime().isBlank()) {
            throw new CallEventValidationException("Missing required field: 'callStartTime'", "callStartTime");
        }
        try {
            OffsetDateTime.parse(request.getCallStartTime().trim());
        } catch (DateTimeParseException e) {
            throw new CallEventValidationException(
                    "'callStartTime' must be an ISO-8601 timestamp with offset, got '"
                            + request.getCallStartTime() + "'", "callStartTime");
        }

        // at least one identifier the resolver can work with
        if (isBlank(request.getEnterpriseId()) && isBlank(request.getGroupId()) && isBlank(request.getUserId())) {
            throw new CallEventValidationException(
                    "One of 'enterpriseId', 'groupId' or 'userId' is required", "enterpriseId");
        }

        log.debug("Call record validation passed for raw reference={}", request.getRawDataReference());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
