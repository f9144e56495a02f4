package org.pbxlink.alert.service.model;

import lombok.Builder;
import lombok.Value;
import org.pbxlink.alert.domain.model.Property;

import java.time.LocalDateTime;

/**
 * Call event with its resolved property and property-local time.
 */
@Value
@Builder(toBuilder = true)
public class NormalizedCallEvent {

    CallEvent event;
    Property property;
    String extension;
    LocalDateTime localTime;

    public Long getPropertyId() {
        return property.getId();
    }
}
