package org.pbxlink.alert.service.audit;

import lombok.extern.slf4j.Slf4j;
import org.pbxlink.alert.service.model.CallEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.TemporalAccessor;
import java.util.StringJoiner;

/**
 * Writes the per-day emergency call audit trail.
 * Lines go to the {@value #AUDIT_LOGGER_NAME} logger, which logback-spring.xml routes to a
 * daily rolling file behind a non-blocking async appender.
 */
@Component
@Slf4j
public class AuditLogger {

    public static final String AUDIT_LOGGER_NAME = "pbx.alert.audit";

    public static final String STAGE_ENTRY = "Entry";
    public static final String STAGE_PROPERTY_NOT_FOUND = "Property not found";
    public static final String STAGE_PARTNER_NOT_FOUND = "Partner property not found";
    public static final String STAGE_EXEMPT = "Exempt number";
    public static final String STAGE_CONVERTED_TIME = "Converted time";
    public static final String STAGE_DUPLICATE = "Duplicate found";
    public static final String STAGE_ALERT_CREATED = "Alert created";
    public static final String STAGE_DISPATCH_FAILED = "Dispatch failed";

    private static final Logger AUDIT = LoggerFactory.getLogger(AUDIT_LOGGER_NAME);

    /**
     * Append one audit line. Failures are reported on the application log and never propagate.
     */
    public void record(AuditFormat format, String stage, Long propertyId, CallEvent event, String detail) {
        try {
            AUDIT.info(formatLine(format, Instant.now(), stage, propertyId, event, detail));
        } catch (RuntimeException e) {
            log.warn("Audit append failed for stage '{}': {}", stage, e.getMessage());
        }
    }

    public void record(AuditFormat format, String stage, Long propertyId, CallEvent event) {
        record(format, stage, propertyId, event, null);
    }

    String formatLine(AuditFormat format, Instant at, String stage, Long propertyId,
                      CallEvent event, String detail) {
        StringJoiner line = new StringJoiner(format.getDelimiter());
        line.add(render(format, at));
        line.add(stage);
        line.add(propertyId != null ? propertyId.toString() : "?");
        if (detail != null) {
            line.add(detail);
        }
        if (event != null) {
            line.add("enterprise=" + nullToEmpty(event.getEnterpriseId()));
            line.add("group=" + nullToEmpty(event.getGroupId()));
            line.add("user=" + nullToEmpty(event.getUserId()));
            line.add("ext=" + nullToEmpty(event.getExtension()));
            line.add("phone=" + nullToEmpty(event.getPhoneNumber()));
            line.add("digits=" + nullToEmpty(event.getDialedDigits()));
            line.add("start=" + (event.getCallStartTime() != null ? render(format, event.getCallStartTime()) : ""));
            line.add("caller=" + nullToEmpty(event.getCallerName()));
            line.add("ip=" + nullToEmpty(event.getSourceIp()));
            line.add("raw=" + nullToEmpty(event.getRawDataReference()));
        }
        return line.toString();
    }

    private String render(AuditFormat format, Instant instant) {
        TemporalAccessor zoned = instant.atZone(format.getZone());
        return format.getFormatter().format(zoned);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
