package com.example.cruisesync.api.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Vendor notification body. Field names follow both the documented camelCase form and the
 * lowercase form the vendor actually posts.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TraveltekWebhookRequest {

    @JsonAlias({"event", "event_type"})
    private String eventType;

    @JsonAlias({"lineid", "line_id"})
    private Integer lineId;

    private String timestamp;

    @JsonAlias({"webhook_id", "id"})
    private String webhookId;

    @JsonAlias("marketid")
    private Integer marketId;

    private String currency;
}
