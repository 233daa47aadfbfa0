package com.example.jobscheduler.config;

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
 * Configuration for sweep execution and async alerting.
 * <p>
 * The sweep executor runs due jobs of one sweep side by side; each job only
 * touches its own run and schedule rows, so no coordination is needed between them.
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    /**
     * Bounded pool for executing due jobs within a sweep.
     */
    @Bean(name = "sweepExecutor", destroyMethod = "shutdown")
    public ExecutorService sweepExecutor(JobSchedulerProperties properties) {
        var parallelism = properties.getSweepParallelism();
        log.info("Creating sweep executor with {} threads", parallelism);

        return Executors.newFixedThreadPool(parallelism, new CustomizableThreadFactory("job-executor-"));
    }

    /**
     * Task executor for Spring's @Async annotation (operator alerts).
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("async-alert-");
        executor.setRejectedExecutionHandler((r, e) -> log.warn("Alert rejected from async executor, dropping it"));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        return executor;
    }
}
