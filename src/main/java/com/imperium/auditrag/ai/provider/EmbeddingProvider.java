package com.imperium.auditrag.ai.provider;

import com.imperium.auditrag.exception.EmbeddingUnavailableException;

/**
 * 文本向量化能力：把文本映射为固定维度的向量。
 * <p>
 * 实现需保证底层模型在进程内只初始化一次，初始化后可被并发请求共享。
 */
public interface EmbeddingProvider {

    /**
     * @param text 查询文本
     * @return 固定维度 D 的向量
     * @throws EmbeddingUnavailableException 模型无法初始化、调用失败或超时
     */
    float[] embed(String text) throws EmbeddingUnavailableException;

    /** 向量维度 D；首次调用会触发模型初始化 */
    int dimension() throws EmbeddingUnavailableException;

    /** 配置的模型名，用于健康检查展示 */
    String modelName();
}
