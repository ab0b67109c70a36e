package com.tooldigest.research.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

@Configuration
@Slf4j
public class ExecutorConfig {

    /**
     * Research pipeline executor. One thread; the single slot queue covers a new run
     * submitted while the previous task is still returning after its terminal event.
     */
    @Bean(name = "researchExecutor")
    public ThreadPoolTaskExecutor researchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("research-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from researchExecutor: {}", r.toString());
            throw new RejectedExecutionException("Research executor is busy");
        });
        executor.initialize();
        return executor;
    }
}
