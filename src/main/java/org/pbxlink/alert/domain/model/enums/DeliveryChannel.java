package org.pbxlink.alert.domain.model.enums;

/**
 * Channels an emergency alert can be fanned out to.
 */
public enum DeliveryChannel {
    EMAIL,
    PHONE,
    SMS
}
