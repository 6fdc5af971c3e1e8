package eu.virtualparadox.docindex.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for background indexing, kept as its own type so it can be injected unambiguously.
 */
public class IngestionExecutor extends ThreadPoolTaskExecutor {

}
