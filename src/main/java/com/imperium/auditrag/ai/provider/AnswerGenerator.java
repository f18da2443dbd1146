package com.imperium.auditrag.ai.provider;

import com.imperium.auditrag.exception.GenerationTimeoutException;
import com.imperium.auditrag.exception.GenerationUnavailableException;

/**
 * LLM 生成能力：输入提示词，返回生成文本。每次调用是独立的网络往返，带超时。
 */
public interface AnswerGenerator {

    /**
     * @throws GenerationTimeoutException     超过超时时间
     * @throws GenerationUnavailableException 传输失败或返回无法解析为文本
     */
    String generate(String prompt, int maxTokens, double temperature)
            throws GenerationTimeoutException, GenerationUnavailableException;

    /** LLM 端点是否可达（健康检查用，不发起生成） */
    boolean isAvailable();
}
