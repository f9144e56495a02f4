package org.pbxlink.alert.service.time;

import lombok.RequiredArgsConstructor;
import org.pbxlink.alert.domain.repository.PropertyTimeZoneRepository;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Property time-zone record handed to the conversion service.
 */
@Component
@Order(1)
@RequiredArgsConstructor
public class ZoneTableStrategy implements LocalTimeStrategy {

    private final PropertyTimeZoneRepository propertyTimeZoneRepository;
    private final TimeZoneConversionService timeZoneConversionService;

    @Override
    public String name() {
        return "zone-table";
    }

    @Override
    public Optional<LocalDateTime> toLocal(Instant utc, Long propertyId) {
        return propertyTimeZoneRepository.findById(propertyId)
                .map(tz -> timeZoneConversionService.convert(utc, tz.getOffsetHours(), tz.getZoneReference()));
    }
}
