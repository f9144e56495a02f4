package org.pbxlink.alert.domain.repository;

import org.pbxlink.alert.domain.model.PropertyParameter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PropertyParameterRepository extends JpaRepository<PropertyParameter, Long> {

    Optional<PropertyParameter> findByPropertyIdAndName(Long propertyId, String name);
}
