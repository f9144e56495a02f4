package org.pbxlink.alert.service.model;

import lombok.Builder;
import lombok.Value;

/**
 * Composed alert message: subject and body for people, delimited string for legacy consumers.
 */
@Value
@Builder
public class NotificationPayload {

    Long alertId;
    String subject;
    String body;
    String shortMessage;
    String legacyMessage;
}
