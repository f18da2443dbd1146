package com.imperium.auditrag.service;

import com.imperium.auditrag.model.rag.Hit;
import com.imperium.auditrag.model.rag.StageOutcome;

import java.util.List;
import java.util.Map;

/**
 * 检索：问题文本 → 向量 → 向量库最近邻 → 按相似度降序的命中列表。
 * <p>
 * 从不向调用方抛出异常；任何内部失败都降级为空列表，只体现在日志中。
 * 调用方应把「空」当作正常结果处理（需要单独的用户提示），而不是「没有出错」。
 */
public interface RetrievalService {

    /**
     * @param query  问题文本
     * @param k      返回条数上限
     * @param filter 字段 → 值的等值过滤，可为 null
     * @return 命中列表，失败时为空列表
     */
    List<Hit> retrieve(String query, int k, Map<String, ?> filter);

    /**
     * 与 {@link #retrieve} 相同，但额外给出失败类型，便于编排器区分「无匹配」与「检索不可用」的日志。
     */
    StageOutcome<List<Hit>> retrieveWithOutcome(String query, int k, Map<String, ?> filter);
}
