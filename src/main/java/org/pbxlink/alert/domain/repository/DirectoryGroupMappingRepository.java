package org.pbxlink.alert.domain.repository;

import org.pbxlink.alert.domain.model.DirectoryGroupMapping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DirectoryGroupMappingRepository extends JpaRepository<DirectoryGroupMapping, Long> {

    Optional<DirectoryGroupMapping> findFirstByGroupIdAndEnterpriseIdOrderByIdAsc(String groupId, String enterpriseId);

    Optional<DirectoryGroupMapping> findFirstByGroupIdAndEnterpriseIdIsNullOrderByIdAsc(String groupId);
}
