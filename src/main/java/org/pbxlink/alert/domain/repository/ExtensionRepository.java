package org.pbxlink.alert.domain.repository;

import org.pbxlink.alert.domain.model.Extension;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ExtensionRepository extends JpaRepository<Extension, Long> {

    Optional<Extension> findByPropertyIdAndNumber(Long propertyId, String number);
}
