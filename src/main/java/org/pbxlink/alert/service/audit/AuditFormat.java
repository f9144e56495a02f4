package org.pbxlink.alert.service.audit;

import lombok.Value;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Date rendering and field delimiter for one pipeline run's audit lines.
 * Created per invocation and handed to every audit call, so no shared formatter state is touched.
 */
@Value
public class AuditFormat {

    DateTimeFormatter formatter;
    ZoneId zone;
    String delimiter;

    public static AuditFormat of(String pattern, String zoneId, String delimiter) {
        return new AuditFormat(DateTimeFormatter.ofPattern(pattern), ZoneId.of(zoneId), delimiter);
    }
}
