package org.pbxlink.alert.service.resolution;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pbxlink.alert.domain.model.DirectoryGroupMapping;
import org.pbxlink.alert.domain.repository.DirectoryGroupMappingRepository;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Company directory backed by the directory_group_mapping table.
 * An entry with an enterprise id wins over the group-wide entry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DirectoryCompanyLookup implements CompanyDirectory {

    private final DirectoryGroupMappingRepository directoryGroupMappingRepository;

    @Override
    public Optional<Long> findPropertyId(String groupId, String enterpriseId, String userId) {
        Optional<DirectoryGroupMapping> mapping = enterpriseId != null
                ? directoryGroupMappingRepository.findFirstByGroupIdAndEnterpriseIdOrderByIdAsc(groupId, enterpriseId)
                : Optional.empty();
        if (mapping.isEmpty()) {
            mapping = directoryGroupMappingRepository.findFirstByGroupIdAndEnterpriseIdIsNullOrderByIdAsc(groupId);
        }
        mapping.ifPresent(m -> log.debug("Directory resolved group={} enterprise={} to property {}",
                groupId, enterpriseId, m.getPropertyId()));
        return mapping.map(DirectoryGroupMapping::getPropertyId);
    }
}
