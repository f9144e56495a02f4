package org.pbxlink.alert.domain.repository;

import org.pbxlink.alert.domain.model.PartnerAttribute;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PartnerAttributeRepository extends JpaRepository<PartnerAttribute, Long> {

    List<PartnerAttribute> findByPartnerIgnoreCaseOrderByIdAsc(String partner);

    Optional<PartnerAttribute> findFirstByEnterpriseCodeOrderByIdAsc(String enterpriseCode);
}
