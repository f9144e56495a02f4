package org.pbxlink.alert.service.resolution;

import java.util.Optional;

/**
 * Authoritative company-number lookup for direct-integration partners.
 */
public interface CompanyDirectory {

    Optional<Long> findPropertyId(String groupId, String enterpriseId, String userId);
}
