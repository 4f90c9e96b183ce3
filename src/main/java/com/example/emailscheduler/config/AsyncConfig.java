package com.example.emailscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Configuration for concurrent schedule execution and async alerting.
 * <p>
 * Group members run on a bounded pool of platform threads. Members beyond the
 * pool size queue until a thread frees up; no member is ever dropped.
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    /**
     * Executor running the members of a due group.
     */
    @Bean(name = "scheduleExecutor", destroyMethod = "shutdown")
    public ExecutorService scheduleExecutor(EmailSchedulerProperties properties) {
        log.info("Creating schedule executor with {} threads", properties.getExecutorPoolSize());

        var factory = new CustomizableThreadFactory("schedule-executor-");
        return Executors.newFixedThreadPool(properties.getExecutorPoolSize(), factory);
    }

    /**
     * Task executor for Spring's @Async annotation (Slack alerts).
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("async-alert-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Alert rejected from async executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        return executor;
    }
}
