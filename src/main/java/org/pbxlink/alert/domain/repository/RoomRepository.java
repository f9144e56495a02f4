package org.pbxlink.alert.domain.repository;

import org.pbxlink.alert.domain.model.Room;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface RoomRepository extends JpaRepository<Room, Long> {

    Optional<Room> findFirstByPropertyIdAndExtensionOrderByIdAsc(Long propertyId, String extension);
}
