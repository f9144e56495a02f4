package org.pbxlink.alert.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pbxlink.alert.domain.model.Extension;
import org.pbxlink.alert.domain.model.GuestStay;
import org.pbxlink.alert.domain.model.Room;
import org.pbxlink.alert.domain.repository.ExtensionRepository;
import org.pbxlink.alert.domain.repository.GuestStayRepository;
import org.pbxlink.alert.domain.repository.RoomRepository;
import org.pbxlink.alert.service.model.AlertContext;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves room, occupant and extension name for the calling extension.
 * Never fails: missing data degrades to placeholders, the alert goes out regardless.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContextEnricher {

    private final ExtensionRepository extensionRepository;
    private final RoomRepository roomRepository;
    private final GuestStayRepository guestStayRepository;

    public AlertContext enrich(Long propertyId, String extension) {
        try {
            return doEnrich(propertyId, extension);
        } catch (RuntimeException e) {
            log.warn("Context lookup failed for property {} extension {}: {}", propertyId, extension, e.getMessage());
            return AlertContext.builder()
                    .primaryExtension(extension)
                    .locationResolved(false)
                    .build();
        }
    }

    private AlertContext doEnrich(Long propertyId, String extension) {
        if (extension == null || extension.isBlank()) {
            return AlertContext.builder().primaryExtension(extension).locationResolved(false).build();
        }

        Optional<Extension> calling = extensionRepository.findByPropertyIdAndNumber(propertyId, extension);
        String primary = calling.map(Extension::getPrimaryNumber)
                .filter(p -> !p.isBlank())
                .orElse(extension);

        Optional<Room> room = roomRepository.findFirstByPropertyIdAndExtensionOrderByIdAsc(propertyId, primary);
        if (room.isPresent()) {
            String roomNumber = room.get().getRoomNumber();
            Optional<GuestStay> stay = guestStayRepository
                    .findFirstByPropertyIdAndRoomNumberAndCheckedOutAtIsNullOrderByCheckedInAtDesc(propertyId, roomNumber);
            AlertContext.AlertContextBuilder context = AlertContext.builder()
                    .primaryExtension(primary)
                    .roomNumber(roomNumber)
                    .locationResolved(true);
            if (stay.isPresent()) {
                context.guestId(stay.get().getGuestId())
                        .guestName(stay.get().getGuestName())
                        .occupied(true);
            }
            return context.build();
        }

        Optional<Extension> primaryExtension = primary.equals(extension)
                ? calling
                : extensionRepository.findByPropertyIdAndNumber(propertyId, primary);
        Optional<String> extensionName = primaryExtension.map(Extension::getName).filter(n -> !n.isBlank());
        if (extensionName.isPresent()) {
            return AlertContext.builder()
                    .primaryExtension(primary)
                    .extensionName(extensionName.get())
                    .locationResolved(true)
                    .build();
        }

        log.info("No location context for property {} extension {}", propertyId, extension);
        return AlertContext.builder().primaryExtension(primary).locationResolved(false).build();
    }
}
