package com.imperium.auditrag.support;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LazyResourceTest {

    @Test
    void concurrentFirstUseInitialisesOnce() throws Exception {
        AtomicInteger initCount = new AtomicInteger();
        LazyResource<Object> resource = new LazyResource<>("model", () -> {
            initCount.incrementAndGet();
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new Object();
        });

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Object>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return resource.get();
                }));
            }
            start.countDown();
            Object first = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<Object> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS)).isSameAs(first);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(initCount).hasValue(1);
        assertThat(resource.isInitialized()).isTrue();
    }

    @Test
    void failedInitialisationIsRetried() {
        AtomicInteger attempts = new AtomicInteger();
        LazyResource<String> resource = new LazyResource<>("flaky", () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("not yet");
            }
            return "ready";
        });

        assertThatThrownBy(resource::get).isInstanceOf(IllegalStateException.class).hasMessage("not yet");
        assertThat(resource.isInitialized()).isFalse();
        assertThat(resource.get()).isEqualTo("ready");
        assertThat(attempts).hasValue(2);
    }

    @Test
    void nullResultIsRejected() {
        LazyResource<String> resource = new LazyResource<>("empty", () -> null);

        assertThatThrownBy(resource::get)
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("empty");
    }
}
