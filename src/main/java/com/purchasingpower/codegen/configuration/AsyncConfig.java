package com.purchasingpower.codegen.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for evaluating the candidates of one attempt in parallel. Spring
 * initializes and shuts it down with the context.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    public static final String CANDIDATE_EXECUTOR = "candidateExecutor";

    @Bean(name = CANDIDATE_EXECUTOR)
    public ThreadPoolTaskExecutor candidateExecutor(GenerationProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        int queueCapacity = Math.max(16, properties.getCandidatesPerAttempt() * 2);
        executor.setCorePoolSize(properties.getWorkerPoolSize());
        executor.setMaxPoolSize(properties.getWorkerPoolSize());

        // Candidates beyond the pool size wait for a free worker; a full queue rejects
        // and the orchestrator records the candidate as failed
        executor.setQueueCapacity(queueCapacity);

        executor.setThreadNamePrefix("candidate-eval-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        log.info("✅ Candidate executor configured: pool={}, queue={}",
                executor.getCorePoolSize(), queueCapacity);

        return executor;
    }
}
