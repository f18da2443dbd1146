package com.imperium.auditrag.model.rag;

/**
 * 纳入证据块的一条条目。
 *
 * @param sourceIndex  从 1 开始的来源序号，与纳入顺序一致
 * @param hitId        对应命中的 id
 * @param renderedText 渲染后的条目文本（标题行 + 正文）
 */
public record ContextEntry(
        int sourceIndex,
        String hitId,
        String renderedText
) {}
