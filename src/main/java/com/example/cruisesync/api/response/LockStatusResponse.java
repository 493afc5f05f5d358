package com.example.cruisesync.api.response;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LockStatusResponse {

    private int lineId;
    private boolean held;
    private String holderId;
    private Instant acquiredAt;
    private Instant expiresAt;
}
