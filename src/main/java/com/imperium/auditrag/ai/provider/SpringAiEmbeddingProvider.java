package com.imperium.auditrag.ai.provider;

import com.imperium.auditrag.exception.EmbeddingUnavailableException;
import com.imperium.auditrag.support.LazyResource;
import com.imperium.auditrag.support.TimedCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * 基于 Spring AI {@link EmbeddingModel} 的向量化实现。
 * <p>
 * EmbeddingModel 通过 {@link LazyResource} 懒加载，并发首次访问只解析一次 bean。
 * embed 与维度查询都会发起网络请求，二者都在 embedding 专用线程池上带超时执行；
 * 维度查询成功后缓存，失败不缓存。
 */
@Component
public class SpringAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingProvider.class);

    private final LazyResource<EmbeddingModel> model;
    private volatile Integer dimension;
    private final ExecutorService executor;
    private final Duration timeout;
    private final String modelName;

    public SpringAiEmbeddingProvider(ObjectProvider<EmbeddingModel> embeddingModelProvider,
            @Qualifier("embeddingCallExecutor") ExecutorService executor,
            @Value("${app.embedding.timeout:30s}") Duration timeout,
            @Value("${spring.ai.openai.embedding.options.model:unknown}") String modelName) {
        this.executor = executor;
        this.timeout = timeout;
        this.modelName = modelName;
        this.model = new LazyResource<>("embedding-model", () -> {
            EmbeddingModel resolved = embeddingModelProvider.getIfAvailable();
            if (resolved == null) {
                throw new IllegalStateException("No EmbeddingModel bean is configured");
            }
            log.info("Embedding model resolved: {}", modelName);
            return resolved;
        });
    }

    @Override
    public float[] embed(String text) throws EmbeddingUnavailableException {
        EmbeddingModel embeddingModel = resolveModel();
        float[] vector;
        try {
            vector = TimedCall.call(executor, () -> embeddingModel.embed(text), timeout);
        } catch (TimeoutException e) {
            throw new EmbeddingUnavailableException("Embedding timed out after " + TimedCall.describe(timeout), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new EmbeddingUnavailableException("Embedding call failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingUnavailableException("Embedding call interrupted", e);
        }
        if (vector == null || vector.length == 0) {
            throw new EmbeddingUnavailableException("Embedding model returned an empty vector");
        }
        return vector;
    }

    @Override
    public int dimension() throws EmbeddingUnavailableException {
        Integer cached = dimension;
        if (cached != null) {
            return cached;
        }
        EmbeddingModel embeddingModel = resolveModel();
        int dims;
        try {
            dims = TimedCall.call(executor, embeddingModel::dimensions, timeout);
        } catch (TimeoutException e) {
            throw new EmbeddingUnavailableException(
                    "Embedding dimension lookup timed out after " + TimedCall.describe(timeout), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new EmbeddingUnavailableException("Failed to determine embedding dimension: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingUnavailableException("Embedding dimension lookup interrupted", e);
        }
        // 并发探测得到的是同一个值，重复写入无妨
        dimension = dims;
        log.info("Embedding model loaded. Dimension: {}", dims);
        return dims;
    }

    @Override
    public String modelName() {
        return modelName;
    }

    private EmbeddingModel resolveModel() throws EmbeddingUnavailableException {
        try {
            return model.get();
        } catch (RuntimeException e) {
            log.error("Failed to load embedding model: {}", e.getMessage());
            throw new EmbeddingUnavailableException("Embedding model could not be initialized: " + e.getMessage(), e);
        }
    }
}
