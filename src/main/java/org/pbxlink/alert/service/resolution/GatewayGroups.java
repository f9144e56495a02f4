package org.pbxlink.alert.service.resolution;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Group identifiers that route calls through a specific resolution path.
 */
@Component
public class GatewayGroups {

    private final String emergencyGatewayGroup;
    private final String partnerGatewayGroup;
    private final String partnerName;
    private final Set<String> directIntegrationGroups;

    public GatewayGroups(
            @Value("${pbx.alert.groups.emergency-gateway:ooma-emergency}") String emergencyGatewayGroup,
            @Value("${pbx.alert.groups.partner-gateway:peerless-emergency}") String partnerGatewayGroup,
            @Value("${pbx.alert.groups.partner-name:PEERLESS}") String partnerName,
            @Value("${pbx.alert.groups.direct-integration:}") String directIntegrationGroups) {
        this.emergencyGatewayGroup = emergencyGatewayGroup;
        this.partnerGatewayGroup = partnerGatewayGroup;
        this.partnerName = partnerName;
        this.directIntegrationGroups = Arrays.stream(directIntegrationGroups.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isPartnerGateway(String groupId) {
        return groupId != null && groupId.equalsIgnoreCase(partnerGatewayGroup);
    }

    public boolean isEmergencyGateway(String groupId) {
        return groupId != null && groupId.equalsIgnoreCase(emergencyGatewayGroup);
    }

    /**
     * Direct-integration groups never shadow the two emergency gateway groups.
     */
    public boolean isDirectIntegration(String groupId) {
        return groupId != null
                && !isPartnerGateway(groupId)
                && !isEmergencyGateway(groupId)
                && directIntegrationGroups.contains(groupId);
    }

    public String getPartnerName() {
        return partnerName;
    }
}
