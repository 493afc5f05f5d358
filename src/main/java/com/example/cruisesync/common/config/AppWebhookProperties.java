package com.example.cruisesync.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.webhook")
public class AppWebhookProperties {

    private List<String> acceptedEventTypes = new ArrayList<>(Arrays.asList(
            "cruiseline_pricing_updated",
            "cruises_live_pricing_updated"));

    public boolean accepts(String eventType) {
        if (eventType == null) {
            return false;
        }
        return acceptedEventTypes.stream().anyMatch(item -> item.equalsIgnoreCase(eventType.trim()));
    }
}
