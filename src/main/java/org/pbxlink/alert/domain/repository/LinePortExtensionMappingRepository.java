package org.pbxlink.alert.domain.repository;

import org.pbxlink.alert.domain.model.LinePortExtensionMapping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LinePortExtensionMappingRepository extends JpaRepository<LinePortExtensionMapping, Long> {

    Optional<LinePortExtensionMapping> findByLinePort(String linePort);
}
