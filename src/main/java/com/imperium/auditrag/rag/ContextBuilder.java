package com.imperium.auditrag.rag;

import com.imperium.auditrag.model.rag.ContextEntry;
import com.imperium.auditrag.model.rag.Hit;
import com.imperium.auditrag.model.rag.HitPayload;
import com.imperium.auditrag.model.rag.RagPrompt;
import com.imperium.auditrag.policy.ContextBudgetPolicy;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 把检索命中拼成有长度上限的证据块，并套入固定的问答指令模板。
 * <p>
 * 选取规则是严格贪心：按排名依次纳入，一旦某条会使累计长度（不含分隔符）超过预算就停止，
 * 不会跳过它去纳入后面更短的条目；首条无论多长都会纳入。
 * 纯格式化，不做任何 IO。
 */
@Component
public class ContextBuilder {

    static final String ENTRY_SEPARATOR = "\n\n";

    /**
     * 模板中的四条约束不可删减：只依据上下文、信息不足时明确说不知道、
     * 列出所用来源序号、引用的数值与上下文保持一致（NumericVerifier 依赖后两条）。
     */
    private static final PromptTemplate RAG_PROMPT_TEMPLATE = new PromptTemplate("""
            You are an expert AI Audit Assistant. Use ONLY the CONTEXT below to answer the QUESTION.

            If the answer is not present in the context, reply "I don't know" or "The information is not available in the provided context."

            CONTEXT:
            {context}

            QUESTION:
            {query}

            INSTRUCTIONS:
            - Answer concisely and accurately based ONLY on the context provided
            - If you reference numbers, amounts, or dates, ensure they match the context exactly
            - At the end, list the source numbers you used (e.g., "Sources: [Source 1, Source 2]")
            - If the context doesn't contain relevant information, say so clearly

            RESPONSE:
            """);

    private final int defaultMaxContextChars;

    public ContextBuilder(
            @Value("${app.rag.max-context-chars:" + ContextBudgetPolicy.DEFAULT_MAX_CONTEXT_CHARS + "}") int defaultMaxContextChars) {
        this.defaultMaxContextChars = defaultMaxContextChars;
    }

    public RagPrompt buildPrompt(String query, List<Hit> hits) {
        return buildPrompt(query, hits, defaultMaxContextChars);
    }

    public RagPrompt buildPrompt(String query, List<Hit> hits, int maxContextChars) {
        List<ContextEntry> admitted = selectEntries(hits, maxContextChars);

        List<String> parts = new ArrayList<>(admitted.size());
        for (ContextEntry entry : admitted) {
            parts.add(entry.renderedText());
        }
        String context = String.join(ENTRY_SEPARATOR, parts);

        String text = RAG_PROMPT_TEMPLATE.render(Map.of(
                "context", context,
                "query", query));
        return new RagPrompt(text, admitted);
    }

    /**
     * 按排名贪心纳入条目，序号从 1 连续递增。
     */
    List<ContextEntry> selectEntries(List<Hit> hits, int maxContextChars) {
        List<ContextEntry> admitted = new ArrayList<>();
        if (hits == null) {
            return admitted;
        }
        int currentLength = 0;
        for (Hit hit : hits) {
            int ordinal = admitted.size() + 1;
            String rendered = renderEntry(ordinal, hit);
            if (!admitted.isEmpty() && currentLength + rendered.length() > maxContextChars) {
                break;
            }
            admitted.add(new ContextEntry(ordinal, hit.id(), rendered));
            currentLength += rendered.length();
        }
        return admitted;
    }

    /**
     * 渲染单条：标题行 {@code [Source n] id:xxx amount: ..., date: ...}，换行后接正文。
     */
    static String renderEntry(int ordinal, Hit hit) {
        HitPayload payload = hit.payload();
        StringBuilder entry = new StringBuilder()
                .append("[Source ").append(ordinal).append("] id:").append(hit.id());
        String metadata = metadataAnnotation(payload);
        if (!metadata.isEmpty()) {
            entry.append(' ').append(metadata);
        }
        entry.append('\n').append(payload.bodyText());
        return entry.toString();
    }

    /**
     * amount、date、account_id、transaction_id、collection 中存在的字段，按固定顺序 {@code key: value} 逗号拼接。
     */
    static String metadataAnnotation(HitPayload payload) {
        List<String> parts = new ArrayList<>();
        for (String field : HitPayload.METADATA_FIELDS) {
            Optional<String> value = payload.text(field);
            value.ifPresent(v -> parts.add(field + ": " + v));
        }
        return String.join(", ", parts);
    }
}
