package org.pbxlink.alert.service.time;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Converts a UTC instant to a property's wall-clock time.
 */
public interface TimeZoneConversionService {

    /**
     * @param utc           call start time
     * @param offsetHours   whole-hour offset of the property, may be null
     * @param zoneReference time-zone table reference, may be null
     * @return the local time, or null when neither argument yields a conversion
     */
    LocalDateTime convert(Instant utc, Integer offsetHours, String zoneReference);
}
