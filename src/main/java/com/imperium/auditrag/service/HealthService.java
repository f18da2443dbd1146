package com.imperium.auditrag.service;

import com.imperium.auditrag.model.dto.response.HealthResponse;

/**
 * 依赖健康探测：embedding 模型、向量库与 LLM 端点。
 */
public interface HealthService {

    HealthResponse check();
}
