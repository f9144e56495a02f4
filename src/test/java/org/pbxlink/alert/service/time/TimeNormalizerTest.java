package org.pbxlink.alert.service.time;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.pbxlink.alert.domain.model.Property;
import org.pbxlink.alert.domain.model.PropertyParameter;
import org.pbxlink.alert.domain.model.PropertyTimeZone;
import org.pbxlink.alert.domain.repository.PropertyParameterRepository;
import org.pbxlink.alert.domain.repository.PropertyTimeZoneRepository;
import org.pbxlink.alert.service.PropertyParameterService;
import org.pbxlink.alert.service.model.CallEvent;
import org.pbxlink.alert.service.model.NormalizedCallEvent;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TimeNormalizerTest {

    private static final Instant CALL_START = Instant.parse("2024-03-01T12:00:00.750Z");

    @Mock private PropertyTimeZoneRepository propertyTimeZoneRepository;
    @Mock private PropertyParameterRepository propertyParameterRepository;

    private TimeNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new TimeNormalizer(List.of(
                new ZoneTableStrategy(propertyTimeZoneRepository, new ZoneTableConversionService()),
                new FixedOffsetStrategy(new PropertyParameterService(propertyParameterRepository))));
    }

    private void timeDifference(long propertyId, String hours) {
        when(propertyParameterRepository.findByPropertyIdAndName(propertyId, PropertyParameter.TIME_DIFFERENCE_HOURS))
                .thenReturn(Optional.of(PropertyParameter.builder().propertyId(propertyId)
                        .name(PropertyParameter.TIME_DIFFERENCE_HOURS).value(hours).build()));
    }

    @Test
    void shouldPreferTimeZoneRecord() {
        when(propertyTimeZoneRepository.findById(42L)).thenReturn(Optional.of(
                PropertyTimeZone.builder().propertyId(42L).offsetHours(-5).zoneReference("America/New_York").build()));

        assertEquals(LocalDateTime.of(2024, 3, 1, 7, 0, 0), normalizer.toLocal(CALL_START, 42L));
    }

    @Test
    void shouldFallBackToFixedOffsetWhenZoneRecordIsUnusable() {
        when(propertyTimeZoneRepository.findById(42L)).thenReturn(Optional.of(
                PropertyTimeZone.builder().propertyId(42L).build()));
        timeDifference(42L, "-8");

        assertEquals(LocalDateTime.of(2024, 3, 1, 4, 0, 0), normalizer.toLocal(CALL_START, 42L));
    }

    @Test
    void shouldUseGlobalTimeDifference() {
        when(propertyParameterRepository.findByPropertyIdAndName(42L, PropertyParameter.TIME_DIFFERENCE_HOURS))
                .thenReturn(Optional.empty());
        timeDifference(PropertyParameter.GLOBAL_PROPERTY_ID, "2");

        assertEquals(LocalDateTime.of(2024, 3, 1, 14, 0, 0), normalizer.toLocal(CALL_START, 42L));
    }

    @Test
    void shouldKeepUtcWhenNothingConfigured() {
        assertEquals(LocalDateTime.of(2024, 3, 1, 12, 0, 0), normalizer.toLocal(CALL_START, 42L));
    }

    @Test
    void shouldIgnoreUnparseableTimeDifference() {
        timeDifference(42L, "minus five");

        assertEquals(LocalDateTime.of(2024, 3, 1, 12, 0, 0), normalizer.toLocal(CALL_START, 42L));
    }

    @Test
    void shouldProduceSameLocalTimeForSameInput() {
        when(propertyTimeZoneRepository.findById(42L)).thenReturn(Optional.of(
                PropertyTimeZone.builder().propertyId(42L).zoneReference("Europe/Madrid").build()));

        assertEquals(normalizer.toLocal(CALL_START, 42L), normalizer.toLocal(CALL_START, 42L));
    }

    @Test
    void shouldSetLocalTimeOnCall() {
        NormalizedCallEvent call = NormalizedCallEvent.builder()
                .event(CallEvent.builder().dialedDigits("911").callStartTime(CALL_START).build())
                .property(Property.builder().id(42L).build())
                .extension("100")
                .build();

        NormalizedCallEvent normalized = normalizer.normalize(call);

        assertNull(call.getLocalTime());
        assertEquals(LocalDateTime.of(2024, 3, 1, 12, 0, 0), normalized.getLocalTime());
        assertEquals("100", normalized.getExtension());
    }
}
