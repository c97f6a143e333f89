package eu.virtualparadox.passagesearch.application.config;

import eu.virtualparadox.passagesearch.application.executor.IndexingExecutor;
import eu.virtualparadox.passagesearch.application.executor.RerankExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public IndexingExecutor indexingExecutor() {
        final int threads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        IndexingExecutor executor = new IndexingExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Integer.MAX_VALUE); // unlimited queue
        executor.setThreadNamePrefix("index-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean
    public RerankExecutor rerankExecutor(final SearchProperties properties) {
        final int threads = properties.getRerank().getParallelism();
        RerankExecutor executor = new RerankExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("rerank-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
