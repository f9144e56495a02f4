package org.pbxlink.alert.service.resolution;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pbxlink.alert.api.exception.PartnerPropertyNotFoundException;
import org.pbxlink.alert.domain.repository.PartnerAttributeRepository;
import org.pbxlink.alert.service.model.CallEvent;
import org.pbxlink.alert.service.model.ResolvedProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Named partner gateway: the enterprise id must match the first declared enterprise code
 * of one of the partner's attribute rows. A miss ends the chain.
 */
@Component
@Order(2)
@RequiredArgsConstructor
@Slf4j
public class PartnerGatewayStrategy implements PropertyResolutionStrategy {

    private final GatewayGroups gatewayGroups;
    private final PartnerAttributeRepository partnerAttributeRepository;

    @Override
    public String name() {
        return "partner-gateway";
    }

    @Override
    public boolean appliesTo(CallEvent event) {
        return gatewayGroups.isPartnerGateway(event.getGroupId());
    }

    @Override
    public Optional<ResolvedProperty> resolve(CallEvent event) {
        String enterpriseId = event.getEnterpriseId();
        if (enterpriseId != null) {
            Optional<ResolvedProperty> match = partnerAttributeRepository
                    .findByPartnerIgnoreCaseOrderByIdAsc(gatewayGroups.getPartnerName()).stream()
                    .filter(attribute -> enterpriseId.equals(attribute.primaryEnterpriseCode()))
                    .findFirst()
                    .map(attribute -> ResolvedProperty.of(attribute.getPropertyId(), name()));
            if (match.isPresent()) {
                return match;
            }
        }
        log.warn("No {} property declares enterprise code '{}'", gatewayGroups.getPartnerName(), enterpriseId);
        throw new PartnerPropertyNotFoundException(gatewayGroups.getPartnerName(), enterpriseId);
    }
}
