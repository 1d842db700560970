package com.phillippitts.speakermatch.config;

import com.phillippitts.speakermatch.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool that runs per-speaker scoring calls.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and should match the
 * scoring provider's concurrency allowance.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the bounded pool used by the fan-out orchestrator.
     *
     * <p>Pool sizing configured via {@code threadpool.scoring.*} properties:
     * <ul>
     *   <li>Core and max pool: default 8 - the cap on concurrent outbound provider calls</li>
     *   <li>Queue: default 500 tasks - catalog entries waiting for a free worker</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}
     * When the pool and queue are full, submission fails fast and the orchestrator scores the item
     * as a failure. The request thread never runs a provider call itself, so it stays free to
     * enforce the request deadline.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext from the request thread so that
     * per-speaker log lines carry the request ID.
     *
     * @return executor for speaker scoring
     */
    @Bean(name = "scoringExecutor")
    public Executor scoringExecutor() {
        ThreadPoolProperties.ScoringPoolProperties props = threadPoolProperties.getScoring();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
