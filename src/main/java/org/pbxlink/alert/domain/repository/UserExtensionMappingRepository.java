package org.pbxlink.alert.domain.repository;

import org.pbxlink.alert.domain.model.UserExtensionMapping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserExtensionMappingRepository extends JpaRepository<UserExtensionMapping, Long> {

    Optional<UserExtensionMapping> findByUserId(String userId);
}
