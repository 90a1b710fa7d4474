package uk.gegc.adaptivequiz.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool used for content oracle calls so that each call can be bounded
 * by a timeout without blocking request threads indefinitely.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${async.oracle.core-pool-size:4}")
    private int oracleCorePoolSize;

    @Value("${async.oracle.max-pool-size:8}")
    private int oracleMaxPoolSize;

    @Value("${async.oracle.queue-capacity:50}")
    private int oracleQueueCapacity;

    @Value("${async.oracle.keep-alive-seconds:60}")
    private int oracleKeepAliveSeconds;

    @Bean(name = "oracleTaskExecutor")
    public ThreadPoolTaskExecutor oracleTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(oracleCorePoolSize);
        executor.setMaxPoolSize(oracleMaxPoolSize);
        executor.setQueueCapacity(oracleQueueCapacity);
        executor.setKeepAliveSeconds(oracleKeepAliveSeconds);
        executor.setThreadNamePrefix("oracle-");

        // Reject when saturated; running inline would escape the call timeout
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Oracle Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                oracleCorePoolSize, oracleMaxPoolSize, oracleQueueCapacity, oracleKeepAliveSeconds);

        return executor;
    }
}
