package org.pbxlink.alert.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.pbxlink.alert.domain.model.Extension;
import org.pbxlink.alert.domain.model.GuestStay;
import org.pbxlink.alert.domain.model.Room;
import org.pbxlink.alert.domain.repository.ExtensionRepository;
import org.pbxlink.alert.domain.repository.GuestStayRepository;
import org.pbxlink.alert.domain.repository.RoomRepository;
import org.pbxlink.alert.service.model.AlertContext;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContextEnricherTest {

    @Mock private ExtensionRepository extensionRepository;
    @Mock private RoomRepository roomRepository;
    @Mock private GuestStayRepository guestStayRepository;

    private ContextEnricher enricher;

    @BeforeEach
    void setUp() {
        enricher = new ContextEnricher(extensionRepository, roomRepository, guestStayRepository);
    }

    @Test
    void shouldResolveOccupiedRoom() {
        when(roomRepository.findFirstByPropertyIdAndExtensionOrderByIdAsc(42L, "100"))
                .thenReturn(Optional.of(Room.builder().propertyId(42L).roomNumber("100").extension("100").build()));
        when(guestStayRepository.findFirstByPropertyIdAndRoomNumberAndCheckedOutAtIsNullOrderByCheckedInAtDesc(42L, "100"))
                .thenReturn(Optional.of(GuestStay.builder().guestId("G-7").guestName("Jane Doe")
                        .checkedInAt(LocalDateTime.of(2024, 2, 28, 15, 0)).build()));

        AlertContext context = enricher.enrich(42L, "100");

        assertTrue(context.isLocationResolved());
        assertTrue(context.isOccupied());
        assertEquals("100", context.getRoomNumber());
        assertEquals("G-7", context.getGuestId());
        assertEquals("Jane Doe", context.displayName());
    }

    @Test
    void shouldMarkVacantRoom() {
        when(roomRepository.findFirstByPropertyIdAndExtensionOrderByIdAsc(42L, "100"))
                .thenReturn(Optional.of(Room.builder().roomNumber("100").build()));

        AlertContext context = enricher.enrich(42L, "100");

        assertTrue(context.isLocationResolved());
        assertFalse(context.isOccupied());
        assertEquals(AlertContext.VACANT_ROOM, context.displayName());
    }

    @Test
    void shouldFollowPrimaryExtensionToRoom() {
        when(extensionRepository.findByPropertyIdAndNumber(42L, "1001"))
                .thenReturn(Optional.of(Extension.builder().number("1001").primaryNumber("100").build()));
        when(roomRepository.findFirstByPropertyIdAndExtensionOrderByIdAsc(42L, "100"))
                .thenReturn(Optional.of(Room.builder().roomNumber("100").build()));

        AlertContext context = enricher.enrich(42L, "1001");

        assertEquals("100", context.getPrimaryExtension());
        assertEquals("100", context.getRoomNumber());
    }

    @Test
    void shouldUseExtensionNameWithoutRoom() {
        when(extensionRepository.findByPropertyIdAndNumber(42L, "500"))
                .thenReturn(Optional.of(Extension.builder().number("500").name("Pool Deck").build()));

        AlertContext context = enricher.enrich(42L, "500");

        assertTrue(context.isLocationResolved());
        assertNull(context.getRoomNumber());
        assertEquals("Pool Deck", context.displayName());
    }

    @Test
    void shouldReportUnknownLocationWhenNothingMatches() {
        AlertContext context = enricher.enrich(42L, "777");

        assertFalse(context.isLocationResolved());
        assertEquals(AlertContext.UNKNOWN_LOCATION, context.displayName());
    }

    @Test
    void shouldNotFailOnLookupError() {
        when(extensionRepository.findByPropertyIdAndNumber(any(), any()))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));

        AlertContext context = enricher.enrich(42L, "100");

        assertFalse(context.isLocationResolved());
        assertEquals("100", context.getPrimaryExtension());
        assertEquals(AlertContext.UNKNOWN_LOCATION, context.displayName());
    }
}
