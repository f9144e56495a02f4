package org.pbxlink.alert.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pbxlink.alert.domain.model.PropertyParameter;
import org.pbxlink.alert.domain.repository.PropertyParameterRepository;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Reads property parameters, falling back to the global (property 0) value when the
 * property has none of its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PropertyParameterService {

    private final PropertyParameterRepository propertyParameterRepository;

    public Optional<String> find(Long propertyId, String name) {
        Optional<PropertyParameter> parameter = propertyParameterRepository.findByPropertyIdAndName(propertyId, name);
        if (parameter.isEmpty() && !Long.valueOf(PropertyParameter.GLOBAL_PROPERTY_ID).equals(propertyId)) {
            parameter = propertyParameterRepository.findByPropertyIdAndName(PropertyParameter.GLOBAL_PROPERTY_ID, name);
        }
        return parameter.map(PropertyParameter::getValue);
    }

    /**
     * Whole-number parameter; unparseable values are treated as absent.
     */
    public Optional<Integer> findInt(Long propertyId, String name) {
        return find(propertyId, name).flatMap(value -> {
            try {
                return Optional.of(Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                log.warn("Parameter {} of property {} is not a whole number: '{}'", name, propertyId, value);
                return Optional.empty();
            }
        });
    }

    public boolean isEnabled(Long propertyId, String name) {
        return find(propertyId, name)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("yes") || value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }
}
