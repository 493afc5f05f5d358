package com.example.cruisesync.infrastructure.ftp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.example.cruisesync.domain.enumtype.CircuitState;
import com.example.cruisesync.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T00:00:00Z"));
        breaker = new CircuitBreaker("ftp.example.com", 3, Duration.ofSeconds(60), Duration.ofSeconds(30), clock);
    }

    @Test
    void shouldOpenAfterThresholdFailuresInsideWindow() {
        recordFailedCall();
        recordFailedCall();
        assertEquals(CircuitState.CLOSED, breaker.state());

        recordFailedCall();

        assertEquals(CircuitState.OPEN, breaker.state());
        assertNull(breaker.tryAcquire());
        assertEquals(Duration.ofSeconds(30), breaker.remainingCoolDown());
        assertEquals(1, breaker.totalOpenings());
    }

    @Test
    void failuresOutsideWindowShouldNotCount() {
        recordFailedCall();
        clock.advance(Duration.ofSeconds(61));
        recordFailedCall();
        recordFailedCall();

        assertEquals(CircuitState.CLOSED, breaker.state());
        assertEquals(2, breaker.recentFailureCount());
    }

    @Test
    void halfOpenShouldLetExactlyOneTrialThrough() {
        openBreaker();
        clock.advance(Duration.ofSeconds(30));

        assertEquals(CircuitState.HALF_OPEN, breaker.state());
        CircuitBreaker.Permit trial = breaker.tryAcquire();
        assertNotNull(trial);
        assertNull(breaker.tryAcquire());

        breaker.recordSuccess(trial);

        assertEquals(CircuitState.CLOSED, breaker.state());
        assertNotNull(breaker.tryAcquire());
    }

    @Test
    void failedTrialShouldReopenForAnotherCoolDown() {
        openBreaker();
        clock.advance(Duration.ofSeconds(31));
        CircuitBreaker.Permit trial = breaker.tryAcquire();

        breaker.recordFailure(trial);

        assertEquals(CircuitState.OPEN, breaker.state());
        assertEquals(2, breaker.totalOpenings());
        assertEquals(Duration.ofSeconds(30), breaker.remainingCoolDown());
    }

    @Test
    void releasedTrialShouldAllowAnotherTrial() {
        openBreaker();
        clock.advance(Duration.ofSeconds(30));
        CircuitBreaker.Permit trial = breaker.tryAcquire();

        breaker.release(trial);

        assertNotNull(breaker.tryAcquire());
    }

    @Test
    void resetShouldCloseImmediately() {
        openBreaker();

        breaker.reset();

        assertEquals(CircuitState.CLOSED, breaker.state());
        assertEquals(0, breaker.recentFailureCount());
        assertNotNull(breaker.tryAcquire());
    }

    @Test
    void verdictFromCallStartedBeforeOpeningShouldNotDecideTrial() {
        CircuitBreaker.Permit slowCall = breaker.tryAcquire();
        openBreaker();
        clock.advance(Duration.ofSeconds(30));
        CircuitBreaker.Permit trial = breaker.tryAcquire();

        breaker.recordSuccess(slowCall);
        assertEquals(CircuitState.HALF_OPEN, breaker.state());
        breaker.release(slowCall);
        assertNull(breaker.tryAcquire());

        breaker.recordFailure(trial);
        assertEquals(CircuitState.OPEN, breaker.state());
    }

    @Test
    void staleFailureShouldNotCountAfterReset() {
        CircuitBreaker.Permit slowCall = breaker.tryAcquire();
        openBreaker();
        breaker.reset();
        recordFailedCall();
        recordFailedCall();

        breaker.recordFailure(slowCall);

        assertEquals(2, breaker.recentFailureCount());
        assertEquals(CircuitState.CLOSED, breaker.state());
    }

    private void openBreaker() {
        recordFailedCall();
        recordFailedCall();
        recordFailedCall();
        assertEquals(CircuitState.OPEN, breaker.state());
    }

    private void recordFailedCall() {
        breaker.recordFailure(breaker.tryAcquire());
    }
}
