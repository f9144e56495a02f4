package org.pbxlink.alert.service;

import org.junit.jupiter.api.Test;
import org.pbxlink.alert.api.dto.CallEventRequest;
import org.pbxlink.alert.api.exception.CallEventValidationException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CallEventValidator.
 */
class CallEventValidatorTest {

    private final CallEventValidator validator = new CallEventValidator();

    private CallEventRequest.CallEventRequestBuilder valid() {
        return CallEventRequest.builder()
                .enterpriseId("ent-42")
                .groupId("ooma-emergency")
                .userId("user-100")
                .dialedDigits("911")
                .callStartTime("2024-03-01T12:00:00Z");
    }

    @Test
    void shouldAcceptValidCallRecord() {
        assertDoesNotThrow(() -> validator.validate(valid().build()));
    }

    @Test
    void shouldAcceptOffsetTimestamp() {
        assertDoesNotThrow(() -> validator.validate(valid().callStartTime("2024-03-01T07:00:00-05:00").build()));
    }

    @Test
    void shouldRejectMissingDialedDigits() {
        CallEventValidationException ex = assertThrows(
                CallEventValidationException.class,
                () -> validator.validate(valid().dialedDigits(" ").build()));
        assertEquals("dialedDigits", ex.getField());
    }

    @Test
    void shouldRejectOverlongDialedDigits() {
        CallEventValidationException ex = assertThrows(
                CallEventValidationException.class,
                () -> validator.validate(valid().dialedDigits("9".repeat(65)).build()));
        assertEquals("dialedDigits", ex.getField());
    }

    @Test
    void shouldRejectMissingCallStartTime() {
        CallEventValidationException ex = assertThrows(
                CallEventValidationException.class,
                () -> validator.validate(valid().callStartTime(null).build()));
        assertEquals("callStartTime", ex.getField());
    }

    @Test
    void shouldRejectTimestampWithoutOffset() {
        CallEventValidationException ex = assertThrows(
                CallEventValidationException.class,
                () -> validator.validate(valid().callStartTime("2024-03-01 12:00:00").build()));
        assertEquals("callStartTime", ex.getField());
    }

    @Test
    void shouldRejectRecordWithoutAnyIdentifier() {
        CallEventRequest request = valid().enterpriseId(null).groupId("").userId(null).build();

        CallEventValidationException ex = assertThrows(
                CallEventValidationException.class,
                () -> validator.validate(request));
        assertEquals("enterpriseId", ex.getField());
    }

    @Test
    void shouldAcceptUserIdAsOnlyIdentifier() {
        assertDoesNotThrow(() -> validator.validate(valid().enterpriseId(null).groupId(null).build()));
    }

    @Test
    void shouldRejectMissingRecord() {
        CallEventValidationException ex = assertThrows(
                CallEventValidationException.class,
                () -> validator.validate(null));
        assertEquals("events", ex.getField());
    }
}
