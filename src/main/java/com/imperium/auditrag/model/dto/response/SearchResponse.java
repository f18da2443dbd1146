package com.imperium.auditrag.model.dto.response;

import com.imperium.auditrag.model.rag.Hit;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 原始检索接口响应。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "原始检索结果")
public class SearchResponse {

    @Schema(description = "原样回显的问题文本")
    private String query;

    @Schema(description = "按相似度降序的命中")
    private List<Hit> results;

    @Schema(description = "命中条数")
    private int count;
}
