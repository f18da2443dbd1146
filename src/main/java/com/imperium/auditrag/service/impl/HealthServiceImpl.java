package com.imperium.auditrag.service.impl;

import com.imperium.auditrag.ai.provider.AnswerGenerator;
import com.imperium.auditrag.ai.provider.EmbeddingProvider;
import com.imperium.auditrag.exception.EmbeddingUnavailableException;
import com.imperium.auditrag.model.dto.response.HealthResponse;
import com.imperium.auditrag.service.HealthService;
import com.imperium.auditrag.store.VectorStoreGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * embedding 模型不可用 → unhealthy；LLM 或向量库任一不可达 → degraded；否则 healthy。
 */
@Service
public class HealthServiceImpl implements HealthService {

    private static final Logger log = LoggerFactory.getLogger(HealthServiceImpl.class);

    private final EmbeddingProvider embeddingProvider;
    private final VectorStoreGateway vectorStore;
    private final AnswerGenerator answerGenerator;

    public HealthServiceImpl(EmbeddingProvider embeddingProvider,
            VectorStoreGateway vectorStore,
            AnswerGenerator answerGenerator) {
        this.embeddingProvider = embeddingProvider;
        this.vectorStore = vectorStore;
        this.answerGenerator = answerGenerator;
    }

    @Override
    public HealthResponse check() {
        boolean generatorAvailable = answerGenerator.isAvailable();
        boolean storeAvailable = vectorStore.isReachable();

        Integer dimension = null;
        try {
            dimension = embeddingProvider.dimension();
        } catch (EmbeddingUnavailableException e) {
            log.error("Health check failed: {}", e.getMessage());
        }

        String status;
        if (dimension == null) {
            status = HealthResponse.UNHEALTHY;
        } else if (generatorAvailable && storeAvailable) {
            status = HealthResponse.HEALTHY;
        } else {
            status = HealthResponse.DEGRADED;
        }

        return HealthResponse.builder()
                .status(status)
                .generatorAvailable(generatorAvailable)
                .storeAvailable(storeAvailable)
                .embeddingModel(embeddingProvider.modelName())
                .embeddingDimension(dimension)
                .build();
    }
}
