package com.example.cruisesync.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.ftp")
public class AppFtpProperties {

    private String host;

    private int port = 21;

    private String username;

    private String password;

    private String rootPath = "/";

    private boolean passiveMode = true;

    /**
     * Fixed number of persistent FTP sessions shared by the whole process.
     */
    private int poolSize = 3;

    private int acquireTimeoutMs = 30000;

    private int connectTimeoutMs = 30000;

    /**
     * Socket and data-channel timeout applied to every list/retrieve call.
     */
    private int callTimeoutMs = 45000;

    private long sessionTtlMs = 600000L;

    private long idleTimeoutMs = 120000L;

    /**
     * Attempts per call, including reconnects. Clamped to 2..3.
     */
    private int maxAttempts = 3;

    private int retryBackoffMs = 500;

    private int breakerFailureThreshold = 5;

    private long breakerWindowMs = 60000L;

    private long breakerCoolDownMs = 60000L;

    public int boundedMaxAttempts() {
        return Math.max(2, Math.min(3, maxAttempts));
    }
}
