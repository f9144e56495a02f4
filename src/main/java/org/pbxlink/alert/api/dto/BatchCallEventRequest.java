package org.pbxlink.alert.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Zero or more call records as handed over by the PBX poller. Only the first is processed,
 * so only the first is validated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchCallEventRequest {

    @Builder.Default
    private List<CallEventRequest> events = new ArrayList<>();
}
