package org.pbxlink.alert.service.resolution;

import lombok.RequiredArgsConstructor;
import org.pbxlink.alert.domain.repository.PartnerAttributeRepository;
import org.pbxlink.alert.service.model.CallEvent;
import org.pbxlink.alert.service.model.ResolvedProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Last resort: a partner attribute whose whole enterprise code equals the enterprise id.
 */
@Component
@Order(4)
@RequiredArgsConstructor
public class EnterpriseCodeStrategy implements PropertyResolutionStrategy {

    private final PartnerAttributeRepository partnerAttributeRepository;

    @Override
    public String name() {
        return "enterprise-code";
    }

    @Override
    public boolean appliesTo(CallEvent event) {
        return event.getEnterpriseId() != null;
    }

    @Override
    public Optional<ResolvedProperty> resolve(CallEvent event) {
        return partnerAttributeRepository.findFirstByEnterpriseCodeOrderByIdAsc(event.getEnterpriseId())
                .map(attribute -> ResolvedProperty.of(attribute.getPropertyId(), name()));
    }
}
