package com.gocars.ridesafety.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools of the safety core.
 *
 * safetyTaskScheduler      - per-session location polling, check-in prompts and deadlines,
 *                            incident location tracking. Tasks are cancelled through their
 *                            ScheduledFuture when a session stops or an incident resolves.
 * locationSamplingExecutor - runs LocationProvider calls so a slow provider can be abandoned
 *                            at the sample timeout instead of stalling the scheduler.
 * persistenceTaskExecutor  - fire-and-forget snapshot writes.
 *                            CallerRunsPolicy: if the queue is full the calling thread writes,
 *                            so snapshots are delayed rather than dropped.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean("safetyTaskScheduler")
    public ThreadPoolTaskScheduler safetyTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(8);
        scheduler.setThreadNamePrefix("ride-safety-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    @Bean("locationSamplingExecutor")
    public Executor locationSamplingExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("location-sample-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean("persistenceTaskExecutor")
    public Executor persistenceTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("safety-persist-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
