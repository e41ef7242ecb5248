package eu.virtualparadox.companion.application.config;

import eu.virtualparadox.companion.application.executor.IngestionExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public IngestionExecutor ingestionExecutor(final ApplicationConfig config) {
        final ApplicationConfig.Ingestion ingestion = config.getIngestion();

        IngestionExecutor executor = new IngestionExecutor();
        executor.setCorePoolSize(ingestion.getThreads());
        executor.setMaxPoolSize(ingestion.getThreads());
        executor.setQueueCapacity(ingestion.getQueueCapacity());
        executor.setThreadNamePrefix("ingest-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
