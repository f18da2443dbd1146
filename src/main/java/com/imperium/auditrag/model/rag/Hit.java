package com.imperium.auditrag.model.rag;

import java.util.Objects;

/**
 * 一条检索命中：向量库 point id、相似度（越大越相关）与元数据载荷。
 */
public record Hit(
        String id,
        double score,
        HitPayload payload
) {
    public Hit {
        Objects.requireNonNull(id, "id");
        payload = payload != null ? payload : HitPayload.empty();
    }
}
