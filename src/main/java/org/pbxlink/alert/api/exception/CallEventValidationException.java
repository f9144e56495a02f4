package org.pbxlink.alert.api.exception;

import lombok.Getter;

/**
 * Exception thrown when an inbound call record is malformed.
 */
@Getter
public class CallEventValidationException extends RuntimeException {

    private final String field;

    public CallEventValidationException(String message, String field) {
        super(message);
        this.field = field;
    }
}
