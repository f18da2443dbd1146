package com.imperium.auditrag.service.impl;

import com.imperium.auditrag.ai.provider.EmbeddingProvider;
import com.imperium.auditrag.exception.ExternalCapabilityException;
import com.imperium.auditrag.exception.PipelineFailureKind;
import com.imperium.auditrag.exception.StoreUnavailableException;
import com.imperium.auditrag.model.rag.Hit;
import com.imperium.auditrag.model.rag.StageOutcome;
import com.imperium.auditrag.service.RetrievalService;
import com.imperium.auditrag.store.QdrantFilters;
import com.imperium.auditrag.store.QdrantPayloads;
import com.imperium.auditrag.store.VectorStoreGateway;
import io.qdrant.client.grpc.Points.Filter;
import io.qdrant.client.grpc.Points.ScoredPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 检索实现：EmbeddingProvider 向量化 → 过滤条件翻译 → Qdrant 检索 → 转换为 {@link Hit}。
 * <p>
 * 向量库处于断开状态（包括首次使用前）时，检索前恰好尝试一次重连；重连失败直接返回空结果。
 */
@Service
public class RetrievalServiceImpl implements RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalServiceImpl.class);

    private final EmbeddingProvider embeddingProvider;
    private final VectorStoreGateway vectorStore;

    public RetrievalServiceImpl(EmbeddingProvider embeddingProvider, VectorStoreGateway vectorStore) {
        this.embeddingProvider = embeddingProvider;
        this.vectorStore = vectorStore;
    }

    @Override
    public List<Hit> retrieve(String query, int k, Map<String, ?> filter) {
        return retrieveWithOutcome(query, k, filter).value();
    }

    @Override
    public StageOutcome<List<Hit>> retrieveWithOutcome(String query, int k, Map<String, ?> filter) {
        try {
            return StageOutcome.ok(doRetrieve(query, k, filter));
        } catch (ExternalCapabilityException e) {
            log.error("Error retrieving documents: {}", e.getMessage());
            return StageOutcome.degraded(List.of(), e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error retrieving documents", e);
            return StageOutcome.degraded(List.of(), PipelineFailureKind.RETRIEVAL_UNAVAILABLE,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private List<Hit> doRetrieve(String query, int k, Map<String, ?> filter) throws ExternalCapabilityException {
        if (!vectorStore.isConnected()) {
            log.warn("Qdrant client not available, attempting to reconnect...");
            if (!vectorStore.reconnect()) {
                throw new StoreUnavailableException("Reconnect to Qdrant failed");
            }
            log.info("Successfully reconnected to Qdrant");
        }

        float[] embedding = embeddingProvider.embed(query);
        Filter nativeFilter = QdrantFilters.toFilter(filter);
        List<ScoredPoint> points = vectorStore.search(toList(embedding), k, nativeFilter);

        List<Hit> hits = new ArrayList<>(points.size());
        for (ScoredPoint point : points) {
            hits.add(QdrantPayloads.toHit(point));
        }
        log.info("Retrieved {} documents for query: {}", hits.size(), abbreviate(query, 50));
        return hits;
    }

    private static List<Float> toList(float[] vector) {
        List<Float> list = new ArrayList<>(vector.length);
        for (float v : vector) {
            list.add(v);
        }
        return list;
    }

    static String abbreviate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }
}
