package org.pbxlink.alert.service.dispatch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pbxlink.alert.domain.model.AlertChannelConfig;
import org.pbxlink.alert.domain.repository.AlertChannelConfigRepository;
import org.pbxlink.alert.service.model.ChannelFlags;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Computes the effective channels for an alert type: property defaults first, then the
 * alert-type row replaces each channel flag and recipient list it sets.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChannelConfigResolver {

    private final AlertChannelConfigRepository alertChannelConfigRepository;

    public ChannelFlags resolve(Long propertyId, int alertType) {
        Optional<AlertChannelConfig> defaults = alertChannelConfigRepository.findByPropertyIdAndAlertTypeIsNull(propertyId);
        Optional<AlertChannelConfig> override = alertChannelConfigRepository.findByPropertyIdAndAlertType(propertyId, alertType);

        ChannelFlags flags = ChannelFlags.builder()
                .email(flag(defaults, override, AlertChannelConfig::getEmailEnabled))
                .phone(flag(defaults, override, AlertChannelConfig::getPhoneEnabled))
                .sms(flag(defaults, override, AlertChannelConfig::getSmsEnabled))
                .popup(flag(defaults, override, AlertChannelConfig::getPopupEnabled))
                .emailRecipients(recipients(defaults, override, AlertChannelConfig::getEmailRecipients))
                .phoneNumbers(recipients(defaults, override, AlertChannelConfig::getPhoneNumbers))
                .smsNumbers(recipients(defaults, override, AlertChannelConfig::getSmsNumbers))
                .build();
        log.debug("Channels for property {} type {}: {}", propertyId, alertType, flags);
        return flags;
    }

    private static boolean flag(Optional<AlertChannelConfig> defaults, Optional<AlertChannelConfig> override,
                                Function<AlertChannelConfig, Boolean> getter) {
        Boolean value = override.map(getter).orElse(null);
        if (value == null) {
            value = defaults.map(getter).orElse(null);
        }
        return Boolean.TRUE.equals(value);
    }

    private static List<String> recipients(Optional<AlertChannelConfig> defaults, Optional<AlertChannelConfig> override,
                                           Function<AlertChannelConfig, String> getter) {
        String value = override.map(getter).filter(v -> !v.isBlank()).orElse(null);
        if (value == null) {
            value = defaults.map(getter).filter(v -> !v.isBlank()).orElse(null);
        }
        if (value == null) {
            return List.of();
        }
        return Arrays.stream(value.split(";"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
