package org.pbxlink.alert.api.exception;

import lombok.Getter;

/**
 * Exception thrown when the database already holds an alert for the same physical call.
 */
@Getter
public class DuplicateAlertException extends RuntimeException {

    private final String dedupKey;

    public DuplicateAlertException(String dedupKey, Throwable cause) {
        super("Duplicate alert: key=" + dedupKey, cause);
        this.dedupKey = dedupKey;
    }
}
