package com.example.cruisesync.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BreakerStatusResponse {

    private String host;
    private String state;
    private int recentFailures;
    private long retryAfterMs;
    private long totalOpenings;
}
