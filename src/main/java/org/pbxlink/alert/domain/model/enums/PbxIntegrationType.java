package org.pbxlink.alert.domain.model.enums;

/**
 * PBX integration a property is managed through.
 */
public enum PbxIntegrationType {
    NONE,
    BROADSOFT,
    OOMA,
    PEERLESS,
    DIRECT
}
