package org.pbxlink.alert.domain.model.enums;

/**
 * Acknowledgement state of an alert record shown on the pop-up console.
 */
public enum AcknowledgementStatus {
    PENDING,
    ACKNOWLEDGED
}
