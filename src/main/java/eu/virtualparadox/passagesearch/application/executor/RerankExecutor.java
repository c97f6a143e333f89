package eu.virtualparadox.passagesearch.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Scores (query, chunk) pairs in parallel during the rerank stage.
 */
public class RerankExecutor extends ThreadPoolTaskExecutor {
}
