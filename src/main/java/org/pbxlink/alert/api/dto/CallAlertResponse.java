package org.pbxlink.alert.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.pbxlink.alert.domain.model.enums.AlertOutcome;
import org.pbxlink.alert.domain.model.enums.PipelineState;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;

/**
 * Result of one pipeline run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CallAlertResponse {

    private boolean success;
    private AlertOutcome outcome;
    private PipelineState finalState;
    private String reason;
    private Long propertyId;
    private Long alertId;
    private LocalDateTime localEventTime;
    private OffsetDateTime receivedAt;

    public boolean isDuplicate() {
        return outcome == AlertOutcome.DUPLICATE;
    }
}
