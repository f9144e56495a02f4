package org.pbxlink.alert.service.audit;

import org.junit.jupiter.api.Test;
import org.pbxlink.alert.service.model.CallEvent;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AuditLogger line formatting.
 */
class AuditLoggerTest {

    private static final Instant AT = Instant.parse("2024-03-01T12:00:07Z");

    private final AuditLogger auditLogger = new AuditLogger();

    private final CallEvent event = CallEvent.builder()
            .enterpriseId("ent-42")
            .groupId("ooma-emergency")
            .userId("user-100")
            .extension("100")
            .dialedDigits("911")
            .callStartTime(Instant.parse("2024-03-01T12:00:00Z"))
            .sourceIp("10.0.0.5")
            .build();

    @Test
    void shouldWriteTimestampStageAndPropertyFirst() {
        AuditFormat format = AuditFormat.of("yyyy-MM-dd HH:mm:ss", "UTC", "|");

        String line = auditLogger.formatLine(format, AT, AuditLogger.STAGE_ENTRY, 42L, event, null);

        assertTrue(line.startsWith("2024-03-01 12:00:07|Entry|42|enterprise=ent-42|group=ooma-emergency|"));
        assertTrue(line.contains("|digits=911|start=2024-03-01 12:00:00|"));
        assertTrue(line.endsWith("|ip=10.0.0.5|raw="));
    }

    @Test
    void shouldRenderTimesInConfiguredZone() {
        AuditFormat format = AuditFormat.of("dd/MM/yyyy HH:mm", "America/New_York", "|");

        String line = auditLogger.formatLine(format, AT, AuditLogger.STAGE_ENTRY, 42L, event, null);

        assertTrue(line.startsWith("01/03/2024 07:00|"));
        assertTrue(line.contains("start=01/03/2024 07:00"));
    }

    @Test
    void shouldMarkUnknownPropertyAndCarryDetail() {
        AuditFormat format = AuditFormat.of("yyyy-MM-dd HH:mm:ss", "UTC", ";");

        String line = auditLogger.formatLine(format, AT, AuditLogger.STAGE_CONVERTED_TIME, null, event,
                "local=2024-03-01 07:00:00");

        assertTrue(line.startsWith("2024-03-01 12:00:07;Converted time;?;local=2024-03-01 07:00:00;enterprise=ent-42"));
    }

    @Test
    void shouldRecordLineWithoutEvent() {
        AuditFormat format = AuditFormat.of("yyyy-MM-dd HH:mm:ss", "UTC", "|");

        assertDoesNotThrow(() -> auditLogger.record(format, AuditLogger.STAGE_ENTRY, 42L, null));
    }
}
