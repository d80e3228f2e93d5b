package org.monitoring.configuration;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@RequiredArgsConstructor
public class ExecutorConfig {

    private final MonitoringProperties properties;

    /**
     * Runs inference calls so callers can bound them with a timeout.
     */
    @Bean(name = "inferenceExecutor")
    public ThreadPoolTaskExecutor inferenceExecutor() {
        int threads = Math.max(1, properties.getInference().getThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("inference-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
