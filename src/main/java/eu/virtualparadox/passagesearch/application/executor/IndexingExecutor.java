package eu.virtualparadox.passagesearch.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs index build work: lexical index construction and embedding batches.
 */
public class IndexingExecutor extends ThreadPoolTaskExecutor {
}
