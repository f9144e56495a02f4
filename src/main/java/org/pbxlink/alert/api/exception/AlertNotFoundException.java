package org.pbxlink.alert.api.exception;

public class AlertNotFoundException extends RuntimeException {

    public AlertNotFoundException(Long alertId) {
        super("Alert not found: id=" + alertId);
    }
}
