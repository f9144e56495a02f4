package org.pbxlink.alert.domain.repository;

import org.pbxlink.alert.domain.model.PropertyTimeZone;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PropertyTimeZoneRepository extends JpaRepository<PropertyTimeZone, Long> {
}
