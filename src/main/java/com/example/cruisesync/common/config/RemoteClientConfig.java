package com.example.cruisesync.common.config;

import com.example.cruisesync.common.util.Sleeper;
import com.example.cruisesync.infrastructure.ftp.CircuitBreakerRegistry;
import com.example.cruisesync.infrastructure.ftp.FtpRemoteSessionFactory;
import com.example.cruisesync.infrastructure.ftp.PooledRemoteFileClient;
import com.example.cruisesync.infrastructure.ftp.RemoteFileClient;
import com.example.cruisesync.infrastructure.ftp.RemoteSessionFactory;
import com.example.cruisesync.infrastructure.ftp.RemoteSessionPool;
import java.time.Clock;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Process-wide remote access singletons: one session pool and one breaker registry.
 */
@Configuration
public class RemoteClientConfig {

    @Bean
    public RemoteSessionFactory remoteSessionFactory(AppFtpProperties properties) {
        return new FtpRemoteSessionFactory(properties);
    }

    @Bean(destroyMethod = "close")
    public RemoteSessionPool remoteSessionPool(RemoteSessionFactory factory, AppFtpProperties properties, Clock clock) {
        return new RemoteSessionPool(
                factory,
                Math.max(1, properties.getPoolSize()),
                Duration.ofMillis(properties.getAcquireTimeoutMs()),
                Duration.ofMillis(properties.getSessionTtlMs()),
                Duration.ofMillis(properties.getIdleTimeoutMs()),
                clock);
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(AppFtpProperties properties, Clock clock) {
        return new CircuitBreakerRegistry(
                properties.getBreakerFailureThreshold(),
                Duration.ofMillis(properties.getBreakerWindowMs()),
                Duration.ofMillis(properties.getBreakerCoolDownMs()),
                clock);
    }

    @Bean
    public RemoteFileClient remoteFileClient(RemoteSessionPool pool,
                                             CircuitBreakerRegistry registry,
                                             RemoteSessionFactory factory,
                                             AppFtpProperties properties) {
        return new PooledRemoteFileClient(
                pool,
                registry,
                factory.host(),
                properties.boundedMaxAttempts(),
                properties.getRetryBackoffMs(),
                Sleeper.THREAD);
    }
}
