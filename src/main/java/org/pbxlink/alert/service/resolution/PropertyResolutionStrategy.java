package org.pbxlink.alert.service.resolution;

import org.pbxlink.alert.service.model.CallEvent;
import org.pbxlink.alert.service.model.ResolvedProperty;

import java.util.Optional;

/**
 * One step of the property resolution chain. Strategies are tried in order;
 * the first applicable one that yields a property wins.
 */
public interface PropertyResolutionStrategy {

    String name();

    boolean appliesTo(CallEvent event);

    /**
     * @return the resolved property, or empty to let the next strategy try
     */
    Optional<ResolvedProperty> resolve(CallEvent event);
}
