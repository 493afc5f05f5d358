package com.example.cruisesync.api.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.cruisesync.api.request.TraveltekWebhookRequest;
import com.example.cruisesync.application.service.WebhookIntakeService;
import com.example.cruisesync.application.service.WebhookOutcome;
import com.example.cruisesync.common.exception.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class WebhookControllerTest {

    private WebhookIntakeService webhookIntakeService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        webhookIntakeService = mock(WebhookIntakeService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new WebhookController(webhookIntakeService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void acceptedEventShouldAnswer202WithOutcome() throws Exception {
        when(webhookIntakeService.onWebhook(any(TraveltekWebhookRequest.class)))
                .thenReturn(WebhookOutcome.accepted(WebhookOutcome.REASON_STARTED, 4));

        mockMvc.perform(post("/api/v1/webhooks/traveltek")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"eventType\":\"cruiseline_pricing_updated\",\"lineId\":22,\"webhookId\":\"wh-1\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.data.accepted").value(true))
                .andExpect(jsonPath("$.data.reason").value("started"));
    }

    @Test
    void malformedBodyShouldStillAnswer202() throws Exception {
        mockMvc.perform(post("/api/v1/webhooks/traveltek")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"eventType\": \"cruiseline_pricing_updated\", \"lineId\": "))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.data.accepted").value(false))
                .andExpect(jsonPath("$.data.reason").value(WebhookOutcome.REASON_MALFORMED));

        verifyNoInteractions(webhookIntakeService);
    }

    @Test
    void intakeFailureShouldAnswer202NotAccepted() throws Exception {
        when(webhookIntakeService.onWebhook(any(TraveltekWebhookRequest.class)))
                .thenReturn(WebhookOutcome.rejected(WebhookOutcome.REASON_INTAKE_FAILED));

        mockMvc.perform(post("/api/v1/webhooks/traveltek")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"eventType\":\"cruiseline_pricing_updated\",\"lineId\":22}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.data.accepted").value(false));
    }
}
