package com.example.cruisesync.common.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskExecutionConfig {

    private ExecutorService syncTaskExecutor;
    private ExecutorService fileWorkerExecutor;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ExecutorService syncTaskExecutor(AppSyncProperties appSyncProperties) {
        int core = Math.max(1, Math.min(8, appSyncProperties.getTaskThreadCount()));
        this.syncTaskExecutor = new ThreadPoolExecutor(
                core,
                core,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(100),
                new NamedThreadFactory("sync-task-"),
                new ThreadPoolExecutor.AbortPolicy());
        return this.syncTaskExecutor;
    }

    /**
     * Runs the fetch/normalize/persist steps of one batch. The processor never submits
     * more than one batch worth of references, so the queue stays bounded by batch size.
     */
    @Bean
    public ExecutorService fileWorkerExecutor(AppSyncProperties appSyncProperties) {
        int workers = Math.max(1, appSyncProperties.getFileWorkerThreadCount());
        int queueSize = Math.max(20, appSyncProperties.getBatchSize() * Math.max(1, appSyncProperties.getTaskThreadCount()));
        this.fileWorkerExecutor = new ThreadPoolExecutor(
                workers,
                workers,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueSize),
                new NamedThreadFactory("sync-file-"),
                new ThreadPoolExecutor.CallerRunsPolicy());
        return this.fileWorkerExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (syncTaskExecutor != null) {
            syncTaskExecutor.shutdown();
        }
        if (fileWorkerExecutor != null) {
            fileWorkerExecutor.shutdown();
        }
    }

    private static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
