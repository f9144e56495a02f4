package org.pbxlink.alert.service.dispatch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pbxlink.alert.domain.model.AlertRecord;
import org.pbxlink.alert.domain.model.EmailQueueEntry;
import org.pbxlink.alert.domain.model.EventQueueEntry;
import org.pbxlink.alert.domain.model.ScheduledNotification;
import org.pbxlink.alert.domain.model.enums.AcknowledgementStatus;
import org.pbxlink.alert.domain.model.enums.DeliveryChannel;
import org.pbxlink.alert.domain.repository.AlertRecordRepository;
import org.pbxlink.alert.domain.repository.EmailQueueRepository;
import org.pbxlink.alert.domain.repository.EventQueueEntryRepository;
import org.pbxlink.alert.domain.repository.ScheduledNotificationRepository;
import org.pbxlink.alert.service.model.AlertContext;
import org.pbxlink.alert.service.model.ChannelFlags;
import org.pbxlink.alert.service.model.NormalizedCallEvent;
import org.pbxlink.alert.service.model.NotificationPayload;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Persists one alert with all of its delivery records in a single transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertWriter {

    public static final String AUTOMATED_ACTOR = "SYSTEM";
    public static final String EMERGENCY_EVENT_TYPE = "EMERGENCY_CALL";

    private final AlertRecordRepository alertRecordRepository;
    private final EmailQueueRepository emailQueueRepository;
    private final ScheduledNotificationRepository scheduledNotificationRepository;
    private final EventQueueEntryRepository eventQueueEntryRepository;

    @Transactional
    public DispatchResult write(NormalizedCallEvent call, AlertContext context, ChannelFlags channels,
                                NotificationPayload payload, boolean publishEvent, String dedupKey) {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        Long propertyId = call.getPropertyId();

        // Written and flushed first: a concurrent alert for the same call fails here on the
        // unique dedup key, before any delivery row exists.
        // The pop-up row is always written so later redeliveries can be matched against it;
        // with pop-ups off it is born acknowledged and nobody is paged.
        AlertRecord.AlertRecordBuilder record = AlertRecord.builder()
                .id(payload.getAlertId())
                .alertType(AlertRecord.EMERGENCY_ALERT_TYPE)
                .propertyId(propertyId)
                .eventTime(call.getLocalTime())
                .extension(call.getExtension())
                .sourceIp(call.getEvent().getSourceIp())
                .roomNumber(context.getRoomNumber())
                .guestName(context.displayName())
                .subject(payload.getSubject())
                .body(payload.getBody())
                .legacyMessage(payload.getLegacyMessage())
                .rawReference(call.getEvent().getRawDataReference())
                .dedupKey(dedupKey)
                .createdAt(now);
        if (!channels.isPopup()) {
            record.acknowledgementStatus(AcknowledgementStatus.ACKNOWLEDGED)
                    .acknowledgedBy(AUTOMATED_ACTOR)
                    .acknowledgedAt(now);
        }
        AlertRecord saved = alertRecordRepository.saveAndFlush(record.build());

        int emails = 0;
        if (channels.isEmail()) {
            for (String recipient : channels.getEmailRecipients()) {
                emailQueueRepository.save(EmailQueueEntry.builder()
                        .alertId(payload.getAlertId())
                        .propertyId(propertyId)
                        .recipient(recipient)
                        .subject(payload.getSubject())
                        .body(payload.getBody())
                        .queuedAt(now)
                        .build());
                emails++;
            }
            warnIfNoRecipients(DeliveryChannel.EMAIL, propertyId, channels.getEmailRecipients());
        }

        int calls = channels.isPhone()
                ? schedule(DeliveryChannel.PHONE, channels.getPhoneNumbers(), propertyId, payload, now) : 0;
        int sms = channels.isSms()
                ? schedule(DeliveryChannel.SMS, channels.getSmsNumbers(), propertyId, payload, now) : 0;

        EventQueueEntry eventEntry = null;
        if (publishEvent) {
            eventEntry = eventQueueEntryRepository.save(EventQueueEntry.builder()
                    .alertId(saved.getId())
                    .propertyId(propertyId)
                    .eventType(EMERGENCY_EVENT_TYPE)
                    .roomNumber(context.getRoomNumber())
                    .extension(call.getExtension())
                    .guestName(context.getGuestName())
                    .alertTime(call.getLocalTime())
                    .createdAt(now)
                    .build());
        }

        log.info("Alert {} written for property {}: emails={}, calls={}, sms={}, popup={}, event={}",
                saved.getId(), propertyId, emails, calls, sms, channels.isPopup(), eventEntry != null);

        return DispatchResult.builder()
                .alertRecord(saved)
                .eventQueueEntry(eventEntry)
                .channels(channels)
                .emailsQueued(emails)
                .callsScheduled(calls)
                .smsScheduled(sms)
                .build();
    }

    private int schedule(DeliveryChannel channel, List<String> destinations, Long propertyId,
                         NotificationPayload payload, OffsetDateTime now) {
        for (String destination : destinations) {
            scheduledNotificationRepository.save(ScheduledNotification.builder()
                    .alertId(payload.getAlertId())
                    .propertyId(propertyId)
                    .channel(channel)
                    .destination(destination)
                    .message(payload.getShortMessage())
                    .scheduledAt(now)
                    .build());
        }
        warnIfNoRecipients(channel, propertyId, destinations);
        return destinations.size();
    }

    private void warnIfNoRecipients(DeliveryChannel channel, Long propertyId, List<String> recipients) {
        if (recipients.isEmpty()) {
            log.warn("{} alerting enabled for property {} but no recipients configured", channel, propertyId);
        }
    }
}
