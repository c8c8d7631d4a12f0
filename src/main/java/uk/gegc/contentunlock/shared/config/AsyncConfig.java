package uk.gegc.contentunlock.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools used outside the request threads.
 *
 * <ul>
 *   <li>{@code providerTaskExecutor} runs upstream provider attempts so they can be abandoned on timeout</li>
 *   <li>{@code sweepTaskExecutor} runs opportunistic reliability sweeps off the request path</li>
 * </ul>
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${async.provider.core-pool-size:4}")
    private int providerCorePoolSize;

    @Value("${async.provider.max-pool-size:8}")
    private int providerMaxPoolSize;

    @Value("${async.provider.queue-capacity:50}")
    private int providerQueueCapacity;

    @Value("${async.provider.keep-alive-seconds:60}")
    private int providerKeepAliveSeconds;

    @Value("${async.sweep.core-pool-size:1}")
    private int sweepCorePoolSize;

    @Value("${async.sweep.max-pool-size:2}")
    private int sweepMaxPoolSize;

    @Value("${async.sweep.queue-capacity:4}")
    private int sweepQueueCapacity;

    /**
     * Executor for provider calls (blueprint generation). Attempts are submitted here and
     * awaited with a hard timeout by the retry executor.
     */
    @Bean(name = "providerTaskExecutor")
    public ThreadPoolTaskExecutor providerTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(providerCorePoolSize);
        executor.setMaxPoolSize(providerMaxPoolSize);
        executor.setQueueCapacity(providerQueueCapacity);
        executor.setKeepAliveSeconds(providerKeepAliveSeconds);
        executor.setThreadNamePrefix("provider-");
        // Caller runs the task if the queue is full
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Provider Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                providerCorePoolSize, providerMaxPoolSize, providerQueueCapacity, providerKeepAliveSeconds);

        return executor;
    }

    /**
     * Small pool for opportunistic sweeps. Excess triggers are dropped; a sweep already
     * running is joined by the next caller.
     */
    @Bean(name = "sweepTaskExecutor")
    public ThreadPoolTaskExecutor sweepTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(sweepCorePoolSize);
        executor.setMaxPoolSize(sweepMaxPoolSize);
        executor.setQueueCapacity(sweepQueueCapacity);
        executor.setThreadNamePrefix("sweep-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Sweep Task Executor configured - Core: {}, Max: {}, Queue: {}",
                sweepCorePoolSize, sweepMaxPoolSize, sweepQueueCapacity);

        return executor;
    }
}
