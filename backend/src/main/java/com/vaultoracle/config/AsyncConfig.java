package com.vaultoracle.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated single-thread executor hosting the block worker. The worker loop occupies the thread for the lifetime
 * of the application, so nothing else may be submitted here.
 */
@Configuration
public class AsyncConfig {

    public static final String WORKER_EXECUTOR = "worker-executor";

    @Bean(name = WORKER_EXECUTOR)
    public ThreadPoolTaskExecutor workerExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setQueueCapacity(0);
        e.setThreadNamePrefix("block-worker-");
        e.setDaemon(true);
        e.initialize();
        return e;
    }
}
