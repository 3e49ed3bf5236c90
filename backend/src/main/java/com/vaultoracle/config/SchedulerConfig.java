package com.vaultoracle.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler for the orchestrator: one-shot block check ticks and the delayed fatal exit. Cancelled ticks are
 * removed from the queue right away since every stop() cancels the pending one.
 */
@Configuration
@Slf4j
public class SchedulerConfig {

    public static final String SCHEDULER_POOL = "scheduler-pool";

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler schedulerPool() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(2);
        s.setThreadNamePrefix("scheduler-");
        s.setRemoveOnCancelPolicy(true);
        s.setErrorHandler(t -> log.error("Scheduled task failed: {}", t.getMessage(), t));
        s.setWaitForTasksToCompleteOnShutdown(false);
        s.initialize();
        return s;
    }
}
