package org.pbxlink.alert.service.dispatch;

import org.pbxlink.alert.domain.model.Property;
import org.pbxlink.alert.service.model.AlertContext;
import org.pbxlink.alert.service.model.NormalizedCallEvent;
import org.pbxlink.alert.service.model.NotificationPayload;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.StringJoiner;

/**
 * Builds the human-readable alert text and the delimited legacy message.
 * Legacy field order: alertId, propertyId, propertyName, extension, room, guest,
 * localTime, dialedDigits, callerName, rawReference.
 */
@Component
public class NotificationComposer {

    static final String LEGACY_DELIMITER = "|";

    private final DateTimeFormatter timeFormatter;

    public NotificationComposer(@Value("${pbx.alert.notification.time-pattern:yyyy-MM-dd HH:mm:ss}") String timePattern) {
        this.timeFormatter = DateTimeFormatter.ofPattern(timePattern);
    }

    public NotificationPayload compose(long alertId, NormalizedCallEvent call, AlertContext context) {
        Property property = call.getProperty();
        String time = timeFormatter.format(call.getLocalTime());
        String room = context.getRoomNumber() != null ? context.getRoomNumber() : "";
        String digits = orEmpty(call.getEvent().getDialedDigits());

        String subject = digits + " Emergency Call - " + property.getName();

        StringBuilder body = new StringBuilder();
        body.append("An emergency call was placed at ").append(property.getName()).append(".\n\n");
        body.append("Property: ").append(property.getName()).append(" (").append(property.getId()).append(")\n");
        body.append("Extension: ").append(call.getExtension()).append('\n');
        body.append("Room: ").append(room.isEmpty() ? "-" : room).append('\n');
        body.append("Guest: ").append(context.displayName()).append('\n');
        body.append("Call time: ").append(time).append('\n');
        body.append("Number dialed: ").append(digits).append('\n');
        if (call.getEvent().getCallerName() != null) {
            body.append("Caller: ").append(call.getEvent().getCallerName()).append('\n');
        }
        body.append("Reference: ").append(orEmpty(call.getEvent().getRawDataReference())).append('\n');

        String shortMessage = digits + " call at " + property.getName()
                + ", ext " + call.getExtension()
                + (room.isEmpty() ? "" : ", room " + room)
                + ", " + context.displayName()
                + ", " + time;

        StringJoiner legacy = new StringJoiner(LEGACY_DELIMITER);
        legacy.add(Long.toString(alertId))
                .add(property.getId().toString())
                .add(sanitize(property.getName()))
                .add(sanitize(call.getExtension()))
                .add(sanitize(room))
                .add(sanitize(context.displayName()))
                .add(time)
                .add(sanitize(digits))
                .add(sanitize(call.getEvent().getCallerName()))
                .add(sanitize(call.getEvent().getRawDataReference()));

        return NotificationPayload.builder()
                .alertId(alertId)
                .subject(subject)
                .body(body.toString())
                .shortMessage(shortMessage)
                .legacyMessage(legacy.toString())
                .build();
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }

    // legacy consumers split on the delimiter
    private static String sanitize(String value) {
        return orEmpty(value).replace(LEGACY_DELIMITER, "/");
    }
}
