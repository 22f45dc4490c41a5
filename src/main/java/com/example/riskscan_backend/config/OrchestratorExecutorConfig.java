package com.example.riskscan_backend.config;

import com.example.riskscan_backend.service.orchestration.ModalityDependencyGraph;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool used by {@link com.example.riskscan_backend.service.orchestration.AnalysisScheduler}
 * to advance due requests, plus the modality dependency graph.
 */
@Configuration
@EnableConfigurationProperties(OrchestratorProperties.class)
public class OrchestratorExecutorConfig {

    @Bean(name = "orchestratorTaskExecutor")
    public ThreadPoolTaskExecutor orchestratorTaskExecutor(OrchestratorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getExecutorThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getExecutorQueueCapacity());
        executor.setThreadNamePrefix("orchestrator-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean
    public ModalityDependencyGraph modalityDependencyGraph() {
        return ModalityDependencyGraph.standard();
    }
}
