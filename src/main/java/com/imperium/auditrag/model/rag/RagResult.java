package com.imperium.auditrag.model.rag;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 问答最终结果。字段名与既有调用方（api-services）约定一致。
 * <p>
 * 不变式：retrievalCount == hits.size()，sources 与 hits 的 id 一一对应且顺序相同。
 * 只有流水线整体失败时 error 才非空。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RagResult(
        String answer,
        List<String> sources,
        List<Hit> hits,
        @JsonProperty("retrieval_count") int retrievalCount,
        String query,
        String error
) {
    public RagResult {
        hits = hits == null ? List.of() : List.copyOf(hits);
        sources = sources == null ? List.of() : List.copyOf(sources);
        if (retrievalCount != hits.size()) {
            throw new IllegalStateException("retrievalCount " + retrievalCount + " != hits " + hits.size());
        }
        if (!sources.equals(hits.stream().map(Hit::id).toList())) {
            throw new IllegalStateException("sources must be the ids of hits in order");
        }
    }

    /** 正常（或局部降级）完成的结果 */
    public static RagResult answered(String answer, List<Hit> hits, String query) {
        List<Hit> copy = List.copyOf(hits);
        return new RagResult(answer, copy.stream().map(Hit::id).toList(), copy, copy.size(), query, null);
    }

    /** 检索为空的终止结果；不是错误 */
    public static RagResult noInformation(String answer, String query) {
        return new RagResult(answer, List.of(), List.of(), 0, query, null);
    }

    /** 流水线整体失败 */
    public static RagResult failed(String answer, String query, String error) {
        return new RagResult(answer, List.of(), List.of(), 0, query, error);
    }
}
