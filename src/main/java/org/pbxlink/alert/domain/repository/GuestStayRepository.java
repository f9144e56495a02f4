package org.pbxlink.alert.domain.repository;

import org.pbxlink.alert.domain.model.GuestStay;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface GuestStayRepository extends JpaRepository<GuestStay, Long> {

    Optional<GuestStay> findFirstByPropertyIdAndRoomNumberAndCheckedOutAtIsNullOrderByCheckedInAtDesc(
            Long propertyId, String roomNumber);
}
