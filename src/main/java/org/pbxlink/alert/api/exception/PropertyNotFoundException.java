package org.pbxlink.alert.api.exception;

/**
 * Exception thrown when no resolution strategy maps a call to a property.
 */
public class PropertyNotFoundException extends RuntimeException {

    public PropertyNotFoundException(String enterpriseId, String groupId, String userId) {
        super("Property not found: enterprise=" + enterpriseId + ", group=" + groupId + ", user=" + userId);
    }

    protected PropertyNotFoundException(String message) {
        super(message);
    }
}
