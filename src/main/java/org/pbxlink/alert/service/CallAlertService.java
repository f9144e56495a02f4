package org.pbxlink.alert.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.pbxlink.alert.api.dto.CallAlertResponse;
import org.pbxlink.alert.api.dto.CallEventRequest;
import org.pbxlink.alert.api.exception.DuplicateAlertException;
import org.pbxlink.alert.api.exception.PartnerPropertyNotFoundException;
import org.pbxlink.alert.api.exception.PropertyNotFoundException;
import org.pbxlink.alert.domain.model.enums.AlertOutcome;
import org.pbxlink.alert.domain.model.enums.PipelineState;
import org.pbxlink.alert.service.audit.AuditFormat;
import org.pbxlink.alert.service.audit.AuditLogger;
import org.pbxlink.alert.service.dedup.DeduplicationGate;
import org.pbxlink.alert.service.dedup.DuplicateCheck;
import org.pbxlink.alert.service.dispatch.AcknowledgementStamper;
import org.pbxlink.alert.service.dispatch.DispatchResult;
import org.pbxlink.alert.service.dispatch.NotificationDispatcher;
import org.pbxlink.alert.service.model.AlertContext;
import org.pbxlink.alert.service.model.CallEvent;
import org.pbxlink.alert.service.model.NormalizedCallEvent;
import org.pbxlink.alert.service.resolution.PropertyResolver;
import org.pbxlink.alert.service.time.TimeNormalizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Main orchestrator: validate → resolve property → exemption → local time → deduplicate
 * → enrich → dispatch. Every terminal state is audited before the result is returned.
 */
@Service
@Slf4j
public class CallAlertService {

    private final CallEventValidator callEventValidator;
    private final PropertyResolver propertyResolver;
    private final ExemptionFilter exemptionFilter;
    private final TimeNormalizer timeNormalizer;
    private final DeduplicationGate deduplicationGate;
    private final ContextEnricher contextEnricher;
    private final NotificationDispatcher notificationDispatcher;
    private final AcknowledgementStamper acknowledgementStamper;
    private final AuditLogger auditLogger;

    private final String auditDatePattern;
    private final String auditZone;
    private final String auditDelimiter;

    // Metrics
    private final Timer pipelineTimer;
    private final MeterRegistry meterRegistry;

    public CallAlertService(
            CallEventValidator callEventValidator,
            PropertyResolver propertyResolver,
            ExemptionFilter exemptionFilter,
            TimeNormalizer timeNormalizer,
            DeduplicationGate deduplicationGate,
            ContextEnricher contextEnricher,
            NotificationDispatcher notificationDispatcher,
            AcknowledgementStamper acknowledgementStamper,
            AuditLogger auditLogger,
            @Value("${pbx.alert.audit.date-pattern:yyyy-MM-dd HH:mm:ss}") String auditDatePattern,
            @Value("${pbx.alert.audit.zone:UTC}") String auditZone,
            @Value("${pbx.alert.audit.delimiter:|}") String auditDelimiter,
            MeterRegistry meterRegistry) {
        this.callEventValidator = callEventValidator;
        this.propertyResolver = propertyResolver;
        this.exemptionFilter = exemptionFilter;
        this.timeNormalizer = timeNormalizer;
        this.deduplicationGate = deduplicationGate;
        this.contextEnricher = contextEnricher;
        this.notificationDispatcher = notificationDispatcher;
        this.acknowledgementStamper = acknowledgementStamper;
        this.auditLogger = auditLogger;
        this.auditDatePattern = auditDatePattern;
        this.auditZone = auditZone;
        this.auditDelimiter = auditDelimiter;
        this.meterRegistry = meterRegistry;
        this.pipelineTimer = Timer.builder("pbx.alert.pipeline.duration")
                .description("End-to-end emergency call processing latency")
                .register(meterRegistry);
    }

    /**
     * Process a single call record: the primary entry point.
     */
    public CallAlertResponse process(CallEventRequest request) {
        return pipelineTimer.record(() -> doProcess(request));
    }

    /**
     * Process what the PBX integration handed over: only the first record counts,
     * an empty hand-over means there is nothing to do.
     */
    public CallAlertResponse processFirst(List<CallEventRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            recordMetric(AlertOutcome.NOTHING_TO_DO);
            return CallAlertResponse.builder()
                    .success(true)
                    .outcome(AlertOutcome.NOTHING_TO_DO)
                    .finalState(PipelineState.NOTHING_TO_DO)
                    .reason("No call record received")
                    .receivedAt(OffsetDateTime.now(ZoneOffset.UTC))
                    .build();
        }
        if (requests.size() > 1) {
            log.info("Received {} call records, processing the first only", requests.size());
        }
        return process(requests.get(0));
    }

    private CallAlertResponse doProcess(CallEventRequest request) {
        OffsetDateTime receivedAt = OffsetDateTime.now(ZoneOffset.UTC);
        callEventValidator.validate(request);

        CallEvent event = CallEvent.from(request);
        AuditFormat audit = AuditFormat.of(auditDatePattern, auditZone, auditDelimiter);
        PipelineState state = transition(PipelineState.RECEIVED, PipelineState.RESOLVING_PROPERTY);

        // Step 1: property resolution: the only stage that can fail the run
        NormalizedCallEvent call;
        try {
            call = propertyResolver.resolve(event);
        } catch (PartnerPropertyNotFoundException e) {
            auditLogger.record(audit, AuditLogger.STAGE_PARTNER_NOT_FOUND, null, event);
            return finish(state, PipelineState.FAILED, AlertOutcome.PARTNER_PROPERTY_NOT_FOUND,
                    e.getMessage(), null, receivedAt);
        } catch (PropertyNotFoundException e) {
            auditLogger.record(audit, AuditLogger.STAGE_PROPERTY_NOT_FOUND, null, event);
            return finish(state, PipelineState.FAILED, AlertOutcome.PROPERTY_NOT_FOUND,
                    e.getMessage(), null, receivedAt);
        }
        Long propertyId = call.getPropertyId();
        auditLogger.record(audit, AuditLogger.STAGE_ENTRY, propertyId, event);

        // Step 2: exemption list
        if (exemptionFilter.isExempt(propertyId, event.getDialedDigits())) {
            auditLogger.record(audit, AuditLogger.STAGE_EXEMPT, propertyId, event);
            return finish(state, PipelineState.EXEMPT, AlertOutcome.EXEMPT,
                    "Dialed number " + event.getDialedDigits() + " is exempt", call, receivedAt);
        }

        // Step 3: property-local time
        call = timeNormalizer.normalize(call);
        auditLogger.record(audit, AuditLogger.STAGE_CONVERTED_TIME, propertyId, event,
                "local=" + audit.getFormatter().format(call.getLocalTime()));

        // Step 4: deduplication
        state = transition(state, PipelineState.CHECKING_DUPLICATE);
        DuplicateCheck check = deduplicationGate.check(call);
        if (check.isDuplicate()) {
            if (check.getMatchedAlertId() != null && event.hasSourceIp()) {
                acknowledgementStamper.stamp(check.getMatchedAlertId(), event.getSourceIp());
            }
            auditLogger.record(audit, AuditLogger.STAGE_DUPLICATE, propertyId, event,
                    "matcher=" + check.getMatcher());
            CallAlertResponse response = finish(state, PipelineState.DUPLICATE, AlertOutcome.DUPLICATE,
                    "Already alerted (" + check.getMatcher() + ")", call, receivedAt);
            response.setAlertId(check.getMatchedAlertId());
            return response;
        }

        // Step 5: context
        state = transition(state, PipelineState.ENRICHING);
        AlertContext context = contextEnricher.enrich(propertyId, call.getExtension());

        // Step 6: dispatch
        state = transition(state, PipelineState.DISPATCHING);
        DispatchResult result;
        try {
            result = notificationDispatcher.dispatch(call, context, check.getDedupKey());
        } catch (DuplicateAlertException e) {
            auditLogger.record(audit, AuditLogger.STAGE_DUPLICATE, propertyId, event, "matcher=dedup-key");
            return finish(state, PipelineState.DUPLICATE, AlertOutcome.DUPLICATE,
                    "Already alerted (dedup-key)", call, receivedAt);
        } catch (RuntimeException e) {
            deduplicationGate.release(check);
            auditLogger.record(audit, AuditLogger.STAGE_DISPATCH_FAILED, propertyId, event, e.getMessage());
            throw e;
        }
        Long alertId = result.getAlertRecord().getId();
        auditLogger.record(audit, AuditLogger.STAGE_ALERT_CREATED, propertyId, event, "alert=" + alertId);

        CallAlertResponse response = finish(state, PipelineState.DONE, AlertOutcome.ALERTED,
                "Alert " + alertId + " dispatched", call, receivedAt);
        response.setAlertId(alertId);
        return response;
    }

    private PipelineState transition(PipelineState from, PipelineState to) {
        log.debug("Pipeline {} -> {}", from, to);
        return to;
    }

    private CallAlertResponse finish(PipelineState from, PipelineState terminal, AlertOutcome outcome,
                                     String reason, NormalizedCallEvent call, OffsetDateTime receivedAt) {
        if (!terminal.isTerminal()) {
            throw new IllegalStateException("Pipeline cannot finish in non-terminal state " + terminal);
        }
        transition(from, terminal);
        recordMetric(outcome);
        if (outcome.isSuccess()) {
            log.info("Call processed: outcome={}, reason={}", outcome, reason);
        } else {
            log.warn("Call dropped: outcome={}, reason={}", outcome, reason);
        }
        return CallAlertResponse.builder()
                .success(outcome.isSuccess())
                .outcome(outcome)
                .finalState(terminal)
                .reason(reason)
                .propertyId(call != null ? call.getPropertyId() : null)
                .localEventTime(call != null ? call.getLocalTime() : null)
                .receivedAt(receivedAt)
                .build();
    }

    private void recordMetric(AlertOutcome outcome) {
        Counter.builder("pbx.alert.calls.processed")
                .tag("outcome", outcome.name().toLowerCase())
                .register(meterRegistry)
                .increment();
    }
}
