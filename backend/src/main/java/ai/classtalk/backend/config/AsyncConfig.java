package ai.classtalk.backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools used off the request path.
 *
 * - analysisExecutor runs the four session-level analyzers concurrently during finalization
 * - alertExecutor fans alerts out to connected observers so a slow socket never blocks ingestion
 * - providerExecutor bounds the wait on the external transcript provider
 */
@Slf4j
@Configuration
@EnableAsync
public class AsyncConfig {

    @Value("${app.executor.analysis.pool-size:4}")
    private int analysisPoolSize;

    @Value("${app.executor.alert.pool-size:2}")
    private int alertPoolSize;

    @Value("${app.executor.alert.queue-capacity:1000}")
    private int alertQueueCapacity;

    @Value("${app.executor.provider.pool-size:2}")
    private int providerPoolSize;

    @Bean
    @Qualifier("analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor() {
        log.info("Configuring analysis executor with {} threads", analysisPoolSize);
        ThreadPoolTaskExecutor executor = newExecutor("analysis-", analysisPoolSize, 100);
        // Finalization waits on these futures; run inline rather than fail when saturated
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean
    @Qualifier("alertExecutor")
    public ThreadPoolTaskExecutor alertExecutor() {
        log.info("Configuring alert executor with {} threads, queue capacity {}", alertPoolSize, alertQueueCapacity);
        ThreadPoolTaskExecutor executor = newExecutor("alert-", alertPoolSize, alertQueueCapacity);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    @Bean
    @Qualifier("providerExecutor")
    public ThreadPoolTaskExecutor providerExecutor() {
        log.info("Configuring transcript provider executor with {} threads", providerPoolSize);
        ThreadPoolTaskExecutor executor = newExecutor("provider-", providerPoolSize, 50);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    private ThreadPoolTaskExecutor newExecutor(String prefix, int poolSize, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
