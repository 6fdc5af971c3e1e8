package eu.virtualparadox.docindex.application.config;

import eu.virtualparadox.docindex.application.executor.IngestionExecutor;
import eu.virtualparadox.docindex.error.ConfigException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public IngestionExecutor ingestionExecutor(@Value("${docindex.ingest.pool-size:2}") final int poolSize) {
        if (poolSize < 1) {
            throw new ConfigException("docindex.ingest.pool-size must be at least 1, was " + poolSize);
        }
        IngestionExecutor executor = new IngestionExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("ingest-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
