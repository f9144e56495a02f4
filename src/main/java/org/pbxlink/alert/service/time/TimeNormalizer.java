package org.pbxlink.alert.service.time;

import lombok.extern.slf4j.Slf4j;
import org.pbxlink.alert.service.model.NormalizedCallEvent;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Converts the call start time to property-local time. The strategies are tried in
 * order; when none yields a value the UTC wall-clock time is kept.
 */
@Service
@Slf4j
public class TimeNormalizer {

    private final List<LocalTimeStrategy> strategies;

    public TimeNormalizer(List<LocalTimeStrategy> strategies) {
        this.strategies = strategies;
    }

    public NormalizedCallEvent normalize(NormalizedCallEvent call) {
        return call.toBuilder()
                .localTime(toLocal(call.getEvent().getCallStartTime(), call.getPropertyId()))
                .build();
    }

    public LocalDateTime toLocal(Instant utc, Long propertyId) {
        for (LocalTimeStrategy strategy : strategies) {
            Optional<LocalDateTime> local = strategy.toLocal(utc, propertyId);
            if (local.isPresent()) {
                log.debug("Property {} local time {} via '{}'", propertyId, local.get(), strategy.name());
                return local.get().truncatedTo(ChronoUnit.SECONDS);
            }
        }
        log.info("No time conversion for property {}, keeping UTC", propertyId);
        return LocalDateTime.ofInstant(utc, ZoneOffset.UTC).truncatedTo(ChronoUnit.SECONDS);
    }
}
