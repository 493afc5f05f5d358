package com.example.cruisesync.api.controller;

import com.example.cruisesync.api.request.TraveltekWebhookRequest;
import com.example.cruisesync.api.response.ApiResponse;
import com.example.cruisesync.api.response.WebhookAckResponse;
import com.example.cruisesync.application.service.WebhookIntakeService;
import com.example.cruisesync.application.service.WebhookOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Always answers 202, including for unreadable bodies and intake failures; the outcome is in
 * the body. The vendor retries on anything else.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
public class WebhookController {

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    private final WebhookIntakeService webhookIntakeService;

    public WebhookController(WebhookIntakeService webhookIntakeService) {
        this.webhookIntakeService = webhookIntakeService;
    }

    @PostMapping("/traveltek")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public ApiResponse<WebhookAckResponse> traveltek(@RequestBody(required = false) TraveltekWebhookRequest request) {
        WebhookOutcome outcome = webhookIntakeService.onWebhook(request);
        return ApiResponse.success(new WebhookAckResponse(outcome.isAccepted(), outcome.getReason()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.ACCEPTED)
    public ApiResponse<WebhookAckResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.info("WEBHOOK_REJECTED reason=malformed_payload msg={}", e.getMostSpecificCause().getMessage());
        return ApiResponse.success(new WebhookAckResponse(false, WebhookOutcome.REASON_MALFORMED));
    }
}
