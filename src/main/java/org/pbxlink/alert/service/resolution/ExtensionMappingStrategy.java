package org.pbxlink.alert.service.resolution;

import lombok.RequiredArgsConstructor;
import org.pbxlink.alert.domain.repository.LinePortExtensionMappingRepository;
import org.pbxlink.alert.domain.repository.UserExtensionMappingRepository;
import org.pbxlink.alert.service.model.CallEvent;
import org.pbxlink.alert.service.model.ResolvedProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * All other groups: the calling user id is looked up as a PBX user, then as a line port.
 */
@Component
@Order(3)
@RequiredArgsConstructor
public class ExtensionMappingStrategy implements PropertyResolutionStrategy {

    private final GatewayGroups gatewayGroups;
    private final UserExtensionMappingRepository userExtensionMappingRepository;
    private final LinePortExtensionMappingRepository linePortExtensionMappingRepository;

    @Override
    public String name() {
        return "extension-mapping";
    }

    @Override
    public boolean appliesTo(CallEvent event) {
        return event.getUserId() != null
                && !gatewayGroups.isDirectIntegration(event.getGroupId())
                && !gatewayGroups.isPartnerGateway(event.getGroupId());
    }

    @Override
    public Optional<ResolvedProperty> resolve(CallEvent event) {
        String userId = event.getUserId();
        return userExtensionMappingRepository.findByUserId(userId)
                .map(m -> new ResolvedProperty(m.getPropertyId(), m.getExtension(), name()))
                .or(() -> linePortExtensionMappingRepository.findByLinePort(userId)
                        .map(m -> new ResolvedProperty(m.getPropertyId(), m.getExtension(), name())));
    }
}
