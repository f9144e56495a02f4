package org.pbxlink.alert.domain.model.enums;

/**
 * Reason code reported for a finished pipeline run.
 */
public enum AlertOutcome {
    ALERTED(true),
    DUPLICATE(true),
    EXEMPT(true),
    NOTHING_TO_DO(true),
    PROPERTY_NOT_FOUND(false),
    PARTNER_PROPERTY_NOT_FOUND(false);

    private final boolean success;

    AlertOutcome(boolean success) {
        this.success = success;
    }

    public boolean isSuccess() {
        return success;
    }
}
