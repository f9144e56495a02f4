package org.pbxlink.alert.api.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pbxlink.alert.api.dto.*;
import org.pbxlink.alert.service.CallAlertService;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * POST /v1/call-events: emergency call intake from the PBX integration.
 */
@RestController
@RequestMapping("/v1/call-events")
@RequiredArgsConstructor
@Slf4j
public class CallEventController {

    private final CallAlertService callAlertService;

    @PostMapping
    public ResponseEntity<ApiResponse<CallAlertResponse>> submitCallEvent(
            @Valid @RequestBody CallEventRequest request) {

        MDC.put("rawReference", request.getRawDataReference());
        MDC.put("enterpriseId", request.getEnterpriseId());
        MDC.put("extension", request.getExtension());

        try {
            log.info("Received call event: enterprise={}, group={}, user={}, ext={}, digits={}",
                    request.getEnterpriseId(), request.getGroupId(), request.getUserId(),
                    request.getExtension(), request.getDialedDigits());

            return toResponse(callAlertService.process(request));
        } finally {
            MDC.clear();
        }
    }

    /**
     * POST /v1/call-events/batch: hand-over of zero or more records; only the first is processed.
     */
    @PostMapping("/batch")
    public ResponseEntity<ApiResponse<CallAlertResponse>> submitBatch(
            @RequestBody BatchCallEventRequest request) {

        List<CallEventRequest> events = request.getEvents() != null ? request.getEvents() : List.of();
        log.info("Received hand-over of {} call records", events.size());
        return toResponse(callAlertService.processFirst(events));
    }

    private ResponseEntity<ApiResponse<CallAlertResponse>> toResponse(CallAlertResponse response) {
        HttpStatus status = response.isSuccess() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(ApiResponse.success(response));
    }
}
