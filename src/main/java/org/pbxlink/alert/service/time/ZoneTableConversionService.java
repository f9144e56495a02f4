package org.pbxlink.alert.service.time;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Default conversion: the zone reference is read as an IANA zone id (DST-aware);
 * without a usable reference the whole-hour offset is applied.
 */
@Service
@Slf4j
public class ZoneTableConversionService implements TimeZoneConversionService {

    @Override
    public LocalDateTime convert(Instant utc, Integer offsetHours, String zoneReference) {
        if (utc == null) {
            return null;
        }
        if (zoneReference != null && !zoneReference.isBlank()) {
            try {
                return LocalDateTime.ofInstant(utc, ZoneId.of(zoneReference.trim()));
            } catch (DateTimeException e) {
                log.debug("Zone reference '{}' not usable: {}", zoneReference, e.getMessage());
            }
        }
        if (offsetHours != null) {
            try {
                return LocalDateTime.ofInstant(utc, ZoneOffset.ofHours(offsetHours));
            } catch (DateTimeException e) {
                log.debug("Offset {}h not usable: {}", offsetHours, e.getMessage());
            }
        }
        return null;
    }
}
