package org.pbxlink.alert.service.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Effective channel switches and recipients for one alert.
 */
@Value
@Builder
public class ChannelFlags {

    boolean email;
    boolean phone;
    boolean sms;
    boolean popup;

    @Builder.Default
    List<String> emailRecipients = List.of();

    @Builder.Default
    List<String> phoneNumbers = List.of();

    @Builder.Default
    List<String> smsNumbers = List.of();
}
