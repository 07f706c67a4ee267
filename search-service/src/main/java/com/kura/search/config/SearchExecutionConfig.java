package com.kura.search.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(SearchProperties.class)
public class SearchExecutionConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService searchExecutor(
            @Value("${search.execution.pool-size:8}") int poolSize,
            @Value("${search.execution.queue-capacity:64}") int queueCapacity
    ) {
        return boundedExecutor(poolSize, queueCapacity);
    }

    /**
     * Fixed pool of daemon threads over a bounded queue. Submissions beyond
     * the queue are rejected rather than piling up behind slow backends.
     */
    static ThreadPoolExecutor boundedExecutor(int poolSize, int queueCapacity) {
        int threads = Math.max(2, poolSize);
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "search-backend-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(
                threads,
                threads,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                threadFactory,
                new ThreadPoolExecutor.AbortPolicy()
        );
    }
}
