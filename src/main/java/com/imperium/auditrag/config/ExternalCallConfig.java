package com.imperium.auditrag.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 外部能力调用使用的有界线程池，配合 {@code TimedCall} 实现超时。
 * <p>
 * embedding 与 LLM 各用一个池：生成请求占满线程时，检索阶段的 embed 不会排在它们后面等待。
 */
@Configuration
public class ExternalCallConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService embeddingCallExecutor(
            @Value("${app.executor.embedding-threads:8}") int threads) {
        return newPool("embedding-call-", threads);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService generationCallExecutor(
            @Value("${app.executor.generation-threads:8}") int threads) {
        return newPool("generation-call-", threads);
    }

    private static ExecutorService newPool(String namePrefix, int threads) {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, namePrefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(Math.max(1, threads), factory);
    }
}
