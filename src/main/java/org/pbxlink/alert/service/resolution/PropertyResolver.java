package org.pbxlink.alert.service.resolution;

import lombok.extern.slf4j.Slf4j;
import org.pbxlink.alert.api.exception.PropertyNotFoundException;
import org.pbxlink.alert.domain.model.Property;
import org.pbxlink.alert.domain.repository.PropertyRepository;
import org.pbxlink.alert.service.model.CallEvent;
import org.pbxlink.alert.service.model.NormalizedCallEvent;
import org.pbxlink.alert.service.model.ResolvedProperty;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Maps a call's origination identifiers to exactly one property by walking the
 * ordered strategy chain.
 */
@Service
@Slf4j
public class PropertyResolver {

    private final List<PropertyResolutionStrategy> strategies;
    private final PropertyRepository propertyRepository;

    public PropertyResolver(List<PropertyResolutionStrategy> strategies, PropertyRepository propertyRepository) {
        this.strategies = strategies;
        this.propertyRepository = propertyRepository;
    }

    /**
     * @return the event bound to its property; local time is not yet set
     * @throws PropertyNotFoundException when no strategy resolves a known property
     */
    public NormalizedCallEvent resolve(CallEvent event) {
        for (PropertyResolutionStrategy strategy : strategies) {
            if (!strategy.appliesTo(event)) {
                continue;
            }
            Optional<ResolvedProperty> resolved = strategy.resolve(event);
            if (resolved.isPresent()) {
                return bind(event, resolved.get());
            }
            log.debug("Strategy '{}' did not resolve enterprise={}, user={}",
                    strategy.name(), event.getEnterpriseId(), event.getUserId());
        }
        throw new PropertyNotFoundException(event.getEnterpriseId(), event.getGroupId(), event.getUserId());
    }

    private NormalizedCallEvent bind(CallEvent event, ResolvedProperty resolved) {
        Property property = propertyRepository.findById(resolved.getPropertyId())
                .orElseThrow(() -> {
                    log.warn("Strategy '{}' returned unknown property {}", resolved.getStrategy(), resolved.getPropertyId());
                    return new PropertyNotFoundException(
                            event.getEnterpriseId(), event.getGroupId(), event.getUserId());
                });
        String extension = resolved.getExtension() != null ? resolved.getExtension() : event.getExtension();
        if (extension == null) {
            extension = "";
        }
        log.info("Resolved call to property {} via '{}' (extension={})",
                property.getId(), resolved.getStrategy(), extension);
        return NormalizedCallEvent.builder()
                .event(event)
                .property(property)
                .extension(extension)
                .build();
    }
}
