package com.kura.search.config;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchExecutionConfigTest {

    @Test
    void rejectsWorkBeyondQueueCapacity() throws Exception {
        ThreadPoolExecutor executor = SearchExecutionConfig.boundedExecutor(2, 1);
        CountDownLatch started = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        Runnable blocking = () -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        };
        try {
            executor.execute(blocking);
            executor.execute(blocking);
            assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
            executor.execute(blocking);

            assertThatThrownBy(() -> executor.execute(blocking)).isInstanceOf(RejectedExecutionException.class);
            assertThat(executor.getQueue()).hasSize(1);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void usesDaemonThreadsAndAtLeastTwoWorkers() throws Exception {
        ThreadPoolExecutor executor = SearchExecutionConfig.boundedExecutor(1, 8);
        try {
            Boolean daemon = executor.submit(() -> Thread.currentThread().isDaemon()).get(2, TimeUnit.SECONDS);

            assertThat(daemon).isTrue();
            assertThat(executor.getCorePoolSize()).isEqualTo(2);
        } finally {
            executor.shutdownNow();
        }
    }
}
