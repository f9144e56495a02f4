package org.pbxlink.alert.api.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.pbxlink.alert.api.dto.CallAlertResponse;
import org.pbxlink.alert.api.dto.CallEventRequest;
import org.pbxlink.alert.api.exception.CallEventValidationException;
import org.pbxlink.alert.api.exception.GlobalExceptionHandler;
import org.pbxlink.alert.domain.model.enums.AlertOutcome;
import org.pbxlink.alert.domain.model.enums.PipelineState;
import org.pbxlink.alert.service.CallAlertService;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class CallEventControllerTest {

    private static final String VALID_RECORD = "{\"enterpriseId\":\"ent-42\",\"groupId\":\"ooma-emergency\","
            + "\"userId\":\"user-100\",\"extension\":\"100\",\"dialedDigits\":\"911\","
            + "\"callStartTime\":\"2024-03-01T12:00:00Z\",\"sourceIp\":\"10.0.0.5\"}";

    @Mock
    private CallAlertService callAlertService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new CallEventController(callAlertService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static CallAlertResponse outcome(AlertOutcome outcome, PipelineState state) {
        return CallAlertResponse.builder()
                .success(outcome.isSuccess())
                .outcome(outcome)
                .finalState(state)
                .build();
    }

    @SuppressWarnings("unchecked")
    private List<CallEventRequest> handedOver() {
        ArgumentCaptor<List<CallEventRequest>> captor = ArgumentCaptor.forClass(List.class);
        verify(callAlertService).processFirst(captor.capture());
        return captor.getValue();
    }

    @Test
    void shouldProcessFirstRecordDespiteMalformedTrailingRecord() throws Exception {
        when(callAlertService.processFirst(any())).thenReturn(outcome(AlertOutcome.ALERTED, PipelineState.DONE));

        mockMvc.perform(post("/v1/call-events/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"events\":[" + VALID_RECORD + ",{\"userId\":\"x\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.outcome").value("ALERTED"));

        List<CallEventRequest> events = handedOver();
        assertEquals(2, events.size());
        assertEquals("911", events.get(0).getDialedDigits());
    }

    @Test
    void shouldTreatMissingEventListAsEmptyHandOver() throws Exception {
        when(callAlertService.processFirst(any()))
                .thenReturn(outcome(AlertOutcome.NOTHING_TO_DO, PipelineState.NOTHING_TO_DO));

        mockMvc.perform(post("/v1/call-events/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"events\":null}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.outcome").value("NOTHING_TO_DO"));

        assertTrue(handedOver().isEmpty());
    }

    @Test
    void shouldRejectMalformedFirstRecordOfHandOver() throws Exception {
        when(callAlertService.processFirst(any()))
                .thenThrow(new CallEventValidationException("dialedDigits is required", "dialedDigits"));

        mockMvc.perform(post("/v1/call-events/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"events\":[{\"userId\":\"x\"}," + VALID_RECORD + "]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.field").value("dialedDigits"));
    }

    @Test
    void shouldAnswerUnprocessableWhenCallIsDropped() throws Exception {
        when(callAlertService.process(any()))
                .thenReturn(outcome(AlertOutcome.PROPERTY_NOT_FOUND, PipelineState.FAILED));

        mockMvc.perform(post("/v1/call-events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_RECORD))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.data.outcome").value("PROPERTY_NOT_FOUND"));
    }

    @Test
    void shouldRejectSingleRecordWithoutDialedDigits() throws Exception {
        mockMvc.perform(post("/v1/call-events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"x\",\"callStartTime\":\"2024-03-01T12:00:00Z\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(callAlertService);
    }
}
