package eu.virtualparadox.companion.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated pool for document ingestion, kept apart from the request threads.
 */
public class IngestionExecutor extends ThreadPoolTaskExecutor {
}
