package org.pbxlink.alert.service.dispatch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.pbxlink.alert.domain.model.AlertRecord;
import org.pbxlink.alert.domain.model.EventQueueEntry;
import org.pbxlink.alert.domain.model.Property;
import org.pbxlink.alert.domain.model.ScheduledNotification;
import org.pbxlink.alert.domain.model.enums.AcknowledgementStatus;
import org.pbxlink.alert.domain.model.enums.DeliveryChannel;
import org.pbxlink.alert.domain.model.enums.PublishStatus;
import org.pbxlink.alert.domain.repository.AlertRecordRepository;
import org.pbxlink.alert.domain.repository.EmailQueueRepository;
import org.pbxlink.alert.domain.repository.EventQueueEntryRepository;
import org.pbxlink.alert.domain.repository.ScheduledNotificationRepository;
import org.pbxlink.alert.service.model.AlertContext;
import org.pbxlink.alert.service.model.CallEvent;
import org.pbxlink.alert.service.model.ChannelFlags;
import org.pbxlink.alert.service.model.NormalizedCallEvent;
import org.pbxlink.alert.service.model.NotificationPayload;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertWriterTest {

    @Mock private AlertRecordRepository alertRecordRepository;
    @Mock private EmailQueueRepository emailQueueRepository;
    @Mock private ScheduledNotificationRepository scheduledNotificationRepository;
    @Mock private EventQueueEntryRepository eventQueueEntryRepository;

    private AlertWriter writer;

    private final NormalizedCallEvent call = NormalizedCallEvent.builder()
            .event(CallEvent.builder()
                    .dialedDigits("911")
                    .callStartTime(Instant.parse("2024-03-01T12:00:00Z"))
                    .sourceIp("10.0.0.5")
                    .rawDataReference("raw-5501")
                    .build())
            .property(Property.builder().id(42L).name("Harbor View").build())
            .extension("100")
            .localTime(LocalDateTime.of(2024, 3, 1, 7, 0))
            .build();

    private final AlertContext context = AlertContext.builder()
            .roomNumber("100").guestName("Jane Doe").occupied(true).locationResolved(true).build();

    private final NotificationPayload payload = NotificationPayload.builder()
            .alertId(1001L).subject("911 Emergency Call - Harbor View").body("body").shortMessage("short")
            .legacyMessage("1001|42").build();

    @BeforeEach
    void setUp() {
        writer = new AlertWriter(alertRecordRepository, emailQueueRepository,
                scheduledNotificationRepository, eventQueueEntryRepository);
        lenient().when(alertRecordRepository.saveAndFlush(any(AlertRecord.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void shouldWriteDeliveryRecordsForEnabledChannels() {
        ChannelFlags channels = ChannelFlags.builder()
                .email(true).emailRecipients(List.of("a@x.example", "b@x.example"))
                .phone(false).phoneNumbers(List.of("5551000"))
                .sms(true).smsNumbers(List.of("5552000"))
                .popup(true)
                .build();

        DispatchResult result = writer.write(call, context, channels, payload, false, null);

        assertEquals(2, result.getEmailsQueued());
        assertEquals(0, result.getCallsScheduled());
        assertEquals(1, result.getSmsScheduled());
        verify(emailQueueRepository, times(2)).save(any());
        ArgumentCaptor<ScheduledNotification> captor = ArgumentCaptor.forClass(ScheduledNotification.class);
        verify(scheduledNotificationRepository).save(captor.capture());
        assertEquals(DeliveryChannel.SMS, captor.getValue().getChannel());
        assertEquals("short", captor.getValue().getMessage());
        verifyNoInteractions(eventQueueEntryRepository);
    }

    @Test
    void shouldStoreDedupKeyOnAlertRecord() {
        DispatchResult result = writer.write(call, context, ChannelFlags.builder().build(), payload, false,
                "9:42:key:2024-03-01T07:00:100");

        assertEquals("9:42:key:2024-03-01T07:00:100", result.getAlertRecord().getDedupKey());
    }

    @Test
    void shouldWriteNoDeliveryRowsWhenAlertKeyAlreadyStored() {
        doThrow(new DataIntegrityViolationException("uk_alert_dedup_key"))
                .when(alertRecordRepository).saveAndFlush(any(AlertRecord.class));
        ChannelFlags channels = ChannelFlags.builder()
                .email(true).emailRecipients(List.of("a@x.example"))
                .sms(true).smsNumbers(List.of("5552000"))
                .build();

        assertThrows(DataIntegrityViolationException.class, () ->
                writer.write(call, context, channels, payload, true, "9:42:key:2024-03-01T07:00:100"));

        verifyNoInteractions(emailQueueRepository, scheduledNotificationRepository, eventQueueEntryRepository);
    }

    @Test
    void shouldWritePendingAlertRecordWhenPopupEnabled() {
        DispatchResult result = writer.write(call, context, ChannelFlags.builder().popup(true).build(), payload, false, null);

        AlertRecord alert = result.getAlertRecord();
        assertEquals(1001L, alert.getId());
        assertEquals(AlertRecord.EMERGENCY_ALERT_TYPE, alert.getAlertType());
        assertEquals(LocalDateTime.of(2024, 3, 1, 7, 0), alert.getEventTime());
        assertEquals("10.0.0.5", alert.getSourceIp());
        assertNull(alert.getAcknowledgedIp());
        assertEquals(AcknowledgementStatus.PENDING, alert.getAcknowledgementStatus());
        assertFalse(alert.isAcknowledged());
    }

    @Test
    void shouldPreAcknowledgeAlertRecordWhenPopupDisabled() {
        DispatchResult result = writer.write(call, context, ChannelFlags.builder().popup(false).build(), payload, false, null);

        AlertRecord alert = result.getAlertRecord();
        assertTrue(alert.isAcknowledged());
        assertEquals(AlertWriter.AUTOMATED_ACTOR, alert.getAcknowledgedBy());
        assertNotNull(alert.getAcknowledgedAt());
        verify(alertRecordRepository).saveAndFlush(any(AlertRecord.class));
    }

    @Test
    void shouldQueueEmergencyEventWhenSubscribed() {
        when(eventQueueEntryRepository.save(any(EventQueueEntry.class))).thenAnswer(inv -> inv.getArgument(0));

        DispatchResult result = writer.write(call, context, ChannelFlags.builder().build(), payload, true, null);

        EventQueueEntry entry = result.getEventQueueEntry();
        assertNotNull(entry);
        assertEquals(1001L, entry.getAlertId());
        assertEquals(AlertWriter.EMERGENCY_EVENT_TYPE, entry.getEventType());
        assertEquals("100", entry.getRoomNumber());
        assertEquals("Jane Doe", entry.getGuestName());
        assertEquals(PublishStatus.PENDING, entry.getPublishStatus());
    }
}
