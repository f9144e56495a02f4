package org.pbxlink.alert.service.dispatch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pbxlink.alert.api.exception.DuplicateAlertException;
import org.pbxlink.alert.domain.model.AlertRecord;
import org.pbxlink.alert.domain.model.PropertyParameter;
import org.pbxlink.alert.service.PropertyParameterService;
import org.pbxlink.alert.service.model.AlertContext;
import org.pbxlink.alert.service.model.ChannelFlags;
import org.pbxlink.alert.service.model.NormalizedCallEvent;
import org.pbxlink.alert.service.model.NotificationPayload;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Fans an alert out over the property's configured channels.
 * Channel activation follows configuration only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    private final ChannelConfigResolver channelConfigResolver;
    private final AlertSequence alertSequence;
    private final NotificationComposer notificationComposer;
    private final PropertyParameterService propertyParameterService;
    private final AlertWriter alertWriter;
    private final EmergencyEventPublisher emergencyEventPublisher;
    private final AcknowledgementStamper acknowledgementStamper;

    /**
     * @param dedupKey natural key stored on the alert, or null when the call is always alerted
     * @throws DuplicateAlertException when another delivery already stored an alert under the key
     */
    public DispatchResult dispatch(NormalizedCallEvent call, AlertContext context, String dedupKey) {
        Long propertyId = call.getPropertyId();
        ChannelFlags channels = channelConfigResolver.resolve(propertyId, AlertRecord.EMERGENCY_ALERT_TYPE);
        long alertId = alertSequence.next();
        NotificationPayload payload = notificationComposer.compose(alertId, call, context);
        boolean subscribed = propertyParameterService.isEnabled(propertyId, PropertyParameter.EVENT_SUBSCRIBE);

        DispatchResult result;
        try {
            result = alertWriter.write(call, context, channels, payload, subscribed, dedupKey);
        } catch (DataIntegrityViolationException e) {
            if (dedupKey == null) {
                throw e;
            }
            log.info("Alert {} not written, key {} already stored by a concurrent delivery", alertId, dedupKey);
            throw new DuplicateAlertException(dedupKey, e);
        }

        if (result.getEventQueueEntry() != null) {
            try {
                emergencyEventPublisher.publish(result.getEventQueueEntry());
            } catch (Exception e) {
                // row stays FAILED in the outbox and is picked up by the scheduled retry
                log.warn("Emergency event for alert {} not published yet: {}", alertId, e.getMessage());
            }
        }

        if (call.getEvent().hasSourceIp()) {
            acknowledgementStamper.stamp(result.getAlertRecord(), call.getEvent().getSourceIp());
        }
        return result;
    }
}
