package com.example.cruisesync.infrastructure.ftp;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.cruisesync.domain.enumtype.CircuitState;
import com.example.cruisesync.support.MutableClock;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PooledRemoteFileClientTest {

    private static final String HOST = "ftp.example.com";
    private static final String PATH = "/2025/03/22/180/2145865.json";

    private MutableClock clock;
    private RemoteSessionFactory factory;
    private RemoteSession first;
    private RemoteSession second;
    private List<Long> sleeps;

    @BeforeEach
    void setUp() throws IOException {
        clock = new MutableClock(Instant.parse("2025-03-01T00:00:00Z"));
        factory = mock(RemoteSessionFactory.class);
        first = mock(RemoteSession.class);
        second = mock(RemoteSession.class);
        when(first.isConnected()).thenReturn(true);
        when(second.isConnected()).thenReturn(true);
        when(factory.host()).thenReturn(HOST);
        when(factory.open()).thenReturn(first, second);
        sleeps = new ArrayList<>();
    }

    @Test
    void transportFailureShouldBeRetriedOnFreshSession() throws IOException {
        byte[] payload = "{}".getBytes(StandardCharsets.UTF_8);
        when(first.retrieve(PATH)).thenThrow(new IOException("Connection reset"));
        when(second.retrieve(PATH)).thenReturn(payload);
        CircuitBreakerRegistry registry = registry(5);

        byte[] result = newClient(registry, 3).fetchFile(PATH);

        assertArrayEquals(payload, result);
        verify(first).close();
        assertEquals(Arrays.asList(100L), sleeps);
        assertEquals(1, registry.forHost(HOST).recentFailureCount());
    }

    @Test
    void shouldGiveUpAfterAttemptBudget() throws IOException {
        when(first.retrieve(PATH)).thenThrow(new IOException("timeout"));
        when(second.retrieve(PATH)).thenThrow(new IOException("timeout"));
        CircuitBreakerRegistry registry = registry(5);

        RemoteConnectionException error = assertThrows(RemoteConnectionException.class,
                () -> newClient(registry, 2).fetchFile(PATH));

        assertEquals(PATH, error.getPath());
        verify(factory, times(2)).open();
        assertEquals(2, registry.forHost(HOST).recentFailureCount());
    }

    @Test
    void missingFileShouldNotBeRetriedOrCountedAsFailure() throws IOException {
        when(first.retrieve(PATH)).thenThrow(new RemoteNotFoundException(PATH));
        CircuitBreakerRegistry registry = registry(5);

        assertThrows(RemoteNotFoundException.class, () -> newClient(registry, 3).fetchFile(PATH));

        verify(factory, times(1)).open();
        assertEquals(0, registry.forHost(HOST).recentFailureCount());
        assertEquals(0, sleeps.size());
    }

    @Test
    void breakerOpeningMidCallShouldStopRetries() throws IOException {
        when(first.list("/2025/03")).thenThrow(new IOException("Connection reset"));
        CircuitBreakerRegistry registry = registry(1);
        PooledRemoteFileClient client = newClient(registry, 3);

        assertThrows(CircuitOpenException.class, () -> client.listDirectory("/2025/03"));
        assertThrows(CircuitOpenException.class, () -> client.listDirectory("/2025/04"));

        verify(factory, times(1)).open();
        assertEquals(CircuitState.OPEN, registry.forHost(HOST).state());
    }

    @Test
    void authFailureShouldSurfaceWithoutRetry() throws IOException {
        when(factory.open()).thenThrow(new RemoteAuthException("530 Login incorrect", null));
        CircuitBreakerRegistry registry = registry(5);

        assertThrows(RemoteAuthException.class, () -> newClient(registry, 3).fetchFile(PATH));

        verify(factory, times(1)).open();
        assertEquals(CircuitState.CLOSED, registry.forHost(HOST).state());
    }

    @Test
    void reusedSessionThatLostLoginShouldBeReplacedTransparently() throws IOException {
        byte[] payload = "{}".getBytes(StandardCharsets.UTF_8);
        when(first.retrieve(PATH)).thenReturn(payload)
                .thenThrow(new RemoteAuthException("Session no longer authenticated", PATH));
        when(second.retrieve(PATH)).thenReturn(payload);
        CircuitBreakerRegistry registry = registry(5);
        PooledRemoteFileClient client = newClient(registry, 3);
        client.fetchFile(PATH);

        byte[] result = client.fetchFile(PATH);

        assertArrayEquals(payload, result);
        verify(first).close();
        verify(factory, times(2)).open();
        assertEquals(0, registry.forHost(HOST).recentFailureCount());
        assertEquals(CircuitState.CLOSED, registry.forHost(HOST).state());
        assertEquals(0, sleeps.size());
    }

    @Test
    void rejectedReloginAfterLostSessionShouldSurfaceAuthFailure() throws IOException {
        when(factory.open()).thenReturn(first).thenThrow(new RemoteAuthException("530 Login incorrect", null));
        when(first.retrieve(PATH)).thenReturn("{}".getBytes(StandardCharsets.UTF_8))
                .thenThrow(new RemoteAuthException("Session no longer authenticated", PATH));
        PooledRemoteFileClient client = newClient(registry(5), 3);
        client.fetchFile(PATH);

        assertThrows(RemoteAuthException.class, () -> client.fetchFile(PATH));

        verify(first).close();
        verify(factory, times(2)).open();
    }

    @Test
    void loginLostOnFreshSessionShouldSurfaceWithoutRetry() throws IOException {
        when(first.retrieve(PATH)).thenThrow(new RemoteAuthException("Session no longer authenticated", PATH));

        assertThrows(RemoteAuthException.class, () -> newClient(registry(5), 3).fetchFile(PATH));

        verify(factory, times(1)).open();
    }

    private CircuitBreakerRegistry registry(int threshold) {
        return new CircuitBreakerRegistry(threshold, Duration.ofSeconds(60), Duration.ofSeconds(60), clock);
    }

    private PooledRemoteFileClient newClient(CircuitBreakerRegistry registry, int maxAttempts) {
        RemoteSessionPool pool = new RemoteSessionPool(factory, 2, Duration.ofMillis(50), Duration.ofMinutes(10),
                Duration.ofMinutes(2), clock);
        return new PooledRemoteFileClient(pool, registry, HOST, maxAttempts, 100L, sleeps::add);
    }
}
