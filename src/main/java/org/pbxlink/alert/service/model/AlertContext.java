package org.pbxlink.alert.service.model;

import lombok.Builder;
import lombok.Value;

/**
 * Human-readable location context of a call. Missing data is replaced by placeholders.
 */
@Value
@Builder
public class AlertContext {

    public static final String VACANT_ROOM = "Vacant Room";
    public static final String UNKNOWN_LOCATION = "Unknown Location";

    String primaryExtension;
    String roomNumber;
    String guestId;
    String guestName;
    String extensionName;
    boolean occupied;
    boolean locationResolved;

    /**
     * Name shown in notifications: guest, vacant-room marker, extension name or unknown location.
     */
    public String displayName() {
        if (guestName != null) {
            return guestName;
        }
        if (roomNumber != null) {
            return VACANT_ROOM;
        }
        if (extensionName != null) {
            return extensionName;
        }
        return UNKNOWN_LOCATION;
    }
}
