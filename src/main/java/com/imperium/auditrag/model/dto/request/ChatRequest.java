package com.imperium.auditrag.model.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.Map;

/**
 * 问答请求，对应 POST /api/chat。
 */
@Data
@Schema(description = "问答请求")
public class ChatRequest {

    @NotBlank(message = "Query cannot be empty")
    @Schema(description = "问题文本", example = "What was the total amount paid to vendor ACME in March?")
    private String query;

    /** 可选，默认 6，范围 1~50 */
    @Min(value = 1, message = "k must be between 1 and 50")
    @Max(value = 50, message = "k must be between 1 and 50")
    @Schema(description = "检索条数", example = "6")
    private Integer k;

    /** 可选，未传时使用 app.rag.verify-numbers-default */
    @JsonProperty("verify_numbers")
    @Schema(description = "是否校验回答中的数值")
    private Boolean verifyNumbers;

    /** 可选，字段 → 标量值的等值过滤，如 {"collection": "payments"} */
    @Schema(description = "元数据等值过滤")
    private Map<String, Object> filter;
}
