package org.pbxlink.alert.domain.model.enums;

/**
 * States a single call event passes through in the alert pipeline.
 * FAILED, EXEMPT, DUPLICATE, DONE and NOTHING_TO_DO are terminal.
 */
public enum PipelineState {
    RECEIVED,
    RESOLVING_PROPERTY,
    CHECKING_DUPLICATE,
    ENRICHING,
    DISPATCHING,
    FAILED,
    EXEMPT,
    DUPLICATE,
    DONE,
    NOTHING_TO_DO;

    public boolean isTerminal() {
        return this == FAILED || this == EXEMPT || this == DUPLICATE || this == DONE || this == NOTHING_TO_DO;
    }
}
