package org.pbxlink.alert.api.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pbxlink.alert.api.dto.AcknowledgeAlertRequest;
import org.pbxlink.alert.api.dto.AlertRecordDto;
import org.pbxlink.alert.api.dto.ApiResponse;
import org.pbxlink.alert.domain.model.AlertRecord;
import org.pbxlink.alert.service.AlertService;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Alert console endpoints: list, view and acknowledge emitted alerts.
 */
@RestController
@RequestMapping("/v1/alerts")
@RequiredArgsConstructor
@Slf4j
public class AlertController {

    private final AlertService alertService;

    @GetMapping
    public ResponseEntity<ApiResponse<Page<AlertRecordDto>>> listAlerts(
            @RequestParam Long propertyId,
            @RequestParam(defaultValue = "false") boolean unacknowledged,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {

        PageRequest pageRequest = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "eventTime"));
        Page<AlertRecordDto> alerts = alertService.listForProperty(propertyId, unacknowledged, pageRequest)
                .map(this::toDto);
        return ResponseEntity.ok(ApiResponse.success(alerts));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<AlertRecordDto>> getAlert(@PathVariable Long id) {
        return alertService.findById(id)
                .map(alert -> ResponseEntity.ok(ApiResponse.success(toDto(alert))))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/acknowledge")
    public ResponseEntity<ApiResponse<AlertRecordDto>> acknowledgeAlert(
            @PathVariable Long id,
            @Valid @RequestBody AcknowledgeAlertRequest request) {

        AlertRecord alert = alertService.acknowledge(id, request.getActor(), request.getIpAddress());
        return ResponseEntity.ok(ApiResponse.success(toDto(alert)));
    }

    private AlertRecordDto toDto(AlertRecord alert) {
        return AlertRecordDto.builder()
                .id(alert.getId())
                .alertType(alert.getAlertType())
                .propertyId(alert.getPropertyId())
                .eventTime(alert.getEventTime())
                .extension(alert.getExtension())
                .roomNumber(alert.getRoomNumber())
                .guestName(alert.getGuestName())
                .subject(alert.getSubject())
                .body(alert.getBody())
                .sourceIp(alert.getSourceIp())
                .acknowledgementStatus(alert.getAcknowledgementStatus().name())
                .acknowledgedBy(alert.getAcknowledgedBy())
                .acknowledgedAt(alert.getAcknowledgedAt())
                .acknowledgedIp(alert.getAcknowledgedIp())
                .createdAt(alert.getCreatedAt())
                .build();
    }
}
