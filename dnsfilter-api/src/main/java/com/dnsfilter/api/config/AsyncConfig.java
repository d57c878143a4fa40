package com.dnsfilter.api.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for best-effort bookkeeping that must stay off the request path.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    public static final String TOKEN_USAGE_EXECUTOR = "tokenUsageExecutor";

    @Bean(name = TOKEN_USAGE_EXECUTOR)
    public ThreadPoolTaskExecutor tokenUsageExecutor(
            @Value("${dnsfilter.token-usage.pool-size:2}") int poolSize,
            @Value("${dnsfilter.token-usage.queue-capacity:1000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("token-usage-");
        // Saturated queue: drop the update, never block the caller.
        executor.setRejectedExecutionHandler((task, pool) ->
                log.warn("Token usage update dropped, executor queue is full"));
        executor.initialize();
        return executor;
    }
}
