package org.pbxlink.alert.service.time;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * One step of the time normalization chain.
 */
public interface LocalTimeStrategy {

    String name();

    Optional<LocalDateTime> toLocal(Instant utc, Long propertyId);
}
