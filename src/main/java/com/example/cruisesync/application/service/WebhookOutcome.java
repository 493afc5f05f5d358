package com.example.cruisesync.application.service;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class WebhookOutcome {

    public static final String REASON_STARTED = "started";
    public static final String REASON_MERGED = "merged";
    public static final String REASON_DUPLICATE = "duplicate";
    public static final String REASON_INTAKE_FAILED = "intake failed, retry later";
    public static final String REASON_MALFORMED = "malformed payload";

    private boolean accepted;

    private String reason;

    /** Sailings flagged for a price refresh; zero for rejected and duplicate events. */
    private int markedCount;

    public static WebhookOutcome accepted(String reason, int markedCount) {
        return new WebhookOutcome(true, reason, markedCount);
    }

    public static WebhookOutcome rejected(String reason) {
        return new WebhookOutcome(false, reason, 0);
    }
}
