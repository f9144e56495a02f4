package org.pbxlink.alert.api.exception;

import lombok.Getter;

/**
 * Exception thrown when a named partner gateway delivers an enterprise code no property declares.
 */
@Getter
public class PartnerPropertyNotFoundException extends PropertyNotFoundException {

    private final String partner;
    private final String enterpriseId;

    public PartnerPropertyNotFoundException(String partner, String enterpriseId) {
        super("Partner property not found: partner=" + partner + ", enterprise=" + enterpriseId);
        this.partner = partner;
        this.enterpriseId = enterpriseId;
    }
}
