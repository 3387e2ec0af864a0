package com.geoinsight.backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools of the analysis pipeline. Job coordinators block while their
 * subtasks run, so the two never share a pool.
 */
@Configuration
@EnableConfigurationProperties(OrchestratorProperties.class)
public class AsyncConfig {

    public static final String COORDINATOR_EXECUTOR = "analysisCoordinatorExecutor";
    public static final String SUBTASK_EXECUTOR = "analysisSubtaskExecutor";

    @Bean(name = COORDINATOR_EXECUTOR)
    public ThreadPoolTaskExecutor analysisCoordinatorExecutor(OrchestratorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getCoordinatorPoolSize());
        executor.setMaxPoolSize(properties.getCoordinatorPoolSize());
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("analysis-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = SUBTASK_EXECUTOR)
    public ThreadPoolTaskExecutor analysisSubtaskExecutor(OrchestratorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getCorePoolSize());
        executor.setMaxPoolSize(properties.getMaxPoolSize());
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("subtask-");
        executor.initialize();
        return executor;
    }
}
