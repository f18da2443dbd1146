package com.imperium.auditrag.model.rag;

import java.util.List;

/**
 * 发送给 LLM 的最终提示词，以及被纳入证据块的条目（用于日志与测试）。
 */
public record RagPrompt(
        String text,
        List<ContextEntry> entries
) {
    public RagPrompt {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
