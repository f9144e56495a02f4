package org.pbxlink.alert.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pbxlink.alert.domain.model.PropertyParameter;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Optional;

/**
 * Suppresses alerts for dialed numbers listed in the property's (or the global) exemption parameter.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExemptionFilter {

    private final PropertyParameterService propertyParameterService;

    /**
     * @return true when the dialed digits are exempt and no alert must be generated
     */
    public boolean isExempt(Long propertyId, String dialedDigits) {
        if (dialedDigits == null || dialedDigits.isBlank()) {
            return false;
        }
        Optional<String> exemptList = propertyParameterService.find(propertyId, PropertyParameter.EXEMPT_NUMBERS);
        if (exemptList.isEmpty()) {
            return false;
        }
        String digits = dialedDigits.trim();
        boolean exempt = Arrays.stream(exemptList.get().split("[,;]"))
                .map(String::trim)
                .anyMatch(digits::equals);
        if (exempt) {
            log.info("Dialed number {} is exempt for property {}", digits, propertyId);
        }
        return exempt;
    }
}
