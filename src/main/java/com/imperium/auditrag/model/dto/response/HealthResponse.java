package com.imperium.auditrag.model.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 健康检查响应。status 取值 healthy | degraded | unhealthy。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "服务健康状态")
public class HealthResponse {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";
    public static final String UNHEALTHY = "unhealthy";

    @Schema(description = "healthy | degraded | unhealthy")
    private String status;

    @JsonProperty("generator_available")
    @Schema(description = "LLM 端点是否可达")
    private boolean generatorAvailable;

    @JsonProperty("store_available")
    @Schema(description = "Qdrant 是否可达")
    private boolean storeAvailable;

    @JsonProperty("embedding_model")
    @Schema(description = "embedding 模型名")
    private String embeddingModel;

    @JsonProperty("embedding_dimension")
    @Schema(description = "embedding 维度；模型无法加载时为 null")
    private Integer embeddingDimension;
}
