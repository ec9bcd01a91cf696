package com.portfoliorisk.backend.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class AsyncConfigTest {

    @Autowired
    @Qualifier("priceFetchExecutor")
    private Executor priceFetchExecutor;

    @Autowired
    @Qualifier("riskComputeExecutor")
    private Executor riskComputeExecutor;

    @Test
    void priceFetchExecutorIsBoundedByConfiguredConcurrency() {
        assertThat(priceFetchExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) priceFetchExecutor;
        assertThat(executor.getCorePoolSize()).isEqualTo(16);
        assertThat(executor.getMaxPoolSize()).isEqualTo(16);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("price-fetch-");
        assertThat(executor.getQueueCapacity()).isEqualTo(500);
    }

    @Test
    void priceFetchExecutorNeverRunsMoreThanMaxConcurrency() throws Exception {
        MarketDataProperties properties = new MarketDataProperties();
        properties.getFetch().setMaxConcurrency(2);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new AsyncConfig().priceFetchExecutor(properties);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(8);
        try {
            for (int i = 0; i < 8; i++) {
                executor.execute(() -> {
                    peak.accumulateAndGet(running.incrementAndGet(), Math::max);
                    try {
                        Thread.sleep(50);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        running.decrementAndGet();
                        done.countDown();
                    }
                });
            }
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdown();
        }

        assertThat(peak.get()).isBetween(1, 2);
    }

    @Test
    void riskComputeExecutorIsBounded() {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) riskComputeExecutor;
        int processors = Runtime.getRuntime().availableProcessors();
        assertThat(executor.getCorePoolSize()).isEqualTo(Math.max(2, processors / 2));
        assertThat(executor.getMaxPoolSize()).isEqualTo(Math.max(4, processors));
        assertThat(executor.getThreadNamePrefix()).isEqualTo("risk-compute-");
        assertThat(executor.getQueueCapacity()).isEqualTo(100);
    }
}
