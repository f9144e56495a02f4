package org.pbxlink.alert.domain.repository;

import org.pbxlink.alert.domain.model.AlertChannelConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AlertChannelConfigRepository extends JpaRepository<AlertChannelConfig, Long> {

    Optional<AlertChannelConfig> findByPropertyIdAndAlertTypeIsNull(Long propertyId);

    Optional<AlertChannelConfig> findByPropertyIdAndAlertType(Long propertyId, Integer alertType);
}
