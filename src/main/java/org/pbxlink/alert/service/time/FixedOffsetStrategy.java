package org.pbxlink.alert.service.time;

import lombok.RequiredArgsConstructor;
import org.pbxlink.alert.domain.model.PropertyParameter;
import org.pbxlink.alert.service.PropertyParameterService;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Fixed hour difference configured for the property, added to the UTC time.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class FixedOffsetStrategy implements LocalTimeStrategy {

    private final PropertyParameterService propertyParameterService;

    @Override
    public String name() {
        return "fixed-offset";
    }

    @Override
    public Optional<LocalDateTime> toLocal(Instant utc, Long propertyId) {
        return propertyParameterService.findInt(propertyId, PropertyParameter.TIME_DIFFERENCE_HOURS)
                .map(hours -> LocalDateTime.ofInstant(utc, ZoneOffset.UTC).plusHours(hours));
    }
}
