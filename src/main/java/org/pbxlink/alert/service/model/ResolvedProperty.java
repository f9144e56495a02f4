package org.pbxlink.alert.service.model;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Output of a property resolution strategy. The extension is the origination
 * extension after correction by the mapping tables, or null when unchanged.
 */
@Value
@AllArgsConstructor
public class ResolvedProperty {

    Long propertyId;
    String extension;
    String strategy;

    public static ResolvedProperty of(Long propertyId, String strategy) {
        return new ResolvedProperty(propertyId, null, strategy);
    }
}
