package org.pbxlink.alert.service.dispatch;

import lombok.Builder;
import lombok.Value;
import org.pbxlink.alert.domain.model.AlertRecord;
import org.pbxlink.alert.domain.model.EventQueueEntry;
import org.pbxlink.alert.service.model.ChannelFlags;

/**
 * What a dispatch persisted: the alert record, delivery counts and the optional event queue row.
 */
@Value
@Builder
public class DispatchResult {

    AlertRecord alertRecord;
    EventQueueEntry eventQueueEntry;
    ChannelFlags channels;
    int emailsQueued;
    int callsScheduled;
    int smsScheduled;
}
