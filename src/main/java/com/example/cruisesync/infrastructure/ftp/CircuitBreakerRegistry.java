package com.example.cruisesync.infrastructure.ftp;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final Duration window;
    private final Duration coolDown;
    private final Clock clock;

    public CircuitBreakerRegistry(int failureThreshold, Duration window, Duration coolDown, Clock clock) {
        this.failureThreshold = failureThreshold;
        this.window = window;
        this.coolDown = coolDown;
        this.clock = clock;
    }

    public CircuitBreaker forHost(String host) {
        return breakers.computeIfAbsent(host,
                key -> new CircuitBreaker(key, failureThreshold, window, coolDown, clock));
    }

    public Optional<CircuitBreaker> find(String host) {
        return Optional.ofNullable(breakers.get(host));
    }

    public boolean reset(String host) {
        CircuitBreaker breaker = breakers.get(host);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }

    public Map<String, CircuitBreaker> all() {
        return Collections.unmodifiableMap(new TreeMap<>(breakers));
    }
}
