package com.bank.aml.config;

import io.micrometer.context.ContextExecutorService;
import io.micrometer.context.ContextSnapshotFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.support.ContextPropagatingTaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Named pools: one for deadline-bounded adjudication, one for {@code @Async} notifications.
 * Both carry the caller's observation and tracing context onto their worker threads.
 */
@Configuration
public class ExecutorConfig {

    public static final String ADJUDICATION_EXECUTOR = "adjudicationExecutor";
    public static final String NOTIFICATION_EXECUTOR = "notificationExecutor";

    @Bean(name = ADJUDICATION_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService adjudicationExecutor(TribunalConfig config) {
        AtomicInteger counter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(config.getAdjudicationThreads(), r -> {
            Thread t = new Thread(r, "adjudication-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        ContextSnapshotFactory snapshotFactory = ContextSnapshotFactory.builder().build();
        return ContextExecutorService.wrap(pool, () -> snapshotFactory.captureAll());
    }

    @Bean(name = NOTIFICATION_EXECUTOR)
    public Executor notificationExecutor(TribunalConfig config) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(config.getNotificationThreads());
        e.setMaxPoolSize(config.getNotificationThreads());
        e.setQueueCapacity(config.getNotificationQueueCapacity());
        e.setThreadNamePrefix("notification-");
        e.setTaskDecorator(new ContextPropagatingTaskDecorator());
        e.initialize();
        return e;
    }
}
