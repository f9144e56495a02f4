package org.pbxlink.alert.service.resolution;

import lombok.RequiredArgsConstructor;
import org.pbxlink.alert.service.model.CallEvent;
import org.pbxlink.alert.service.model.ResolvedProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Direct-integration partners: the company directory is authoritative.
 */
@Component
@Order(1)
@RequiredArgsConstructor
public class DirectIntegrationStrategy implements PropertyResolutionStrategy {

    private final GatewayGroups gatewayGroups;
    private final CompanyDirectory companyDirectory;

    @Override
    public String name() {
        return "direct-integration";
    }

    @Override
    public boolean appliesTo(CallEvent event) {
        return gatewayGroups.isDirectIntegration(event.getGroupId());
    }

    @Override
    public Optional<ResolvedProperty> resolve(CallEvent event) {
        return companyDirectory.findPropertyId(event.getGroupId(), event.getEnterpriseId(), event.getUserId())
                .map(id -> ResolvedProperty.of(id, name()));
    }
}
