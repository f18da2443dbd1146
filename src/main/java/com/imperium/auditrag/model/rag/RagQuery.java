package com.imperium.auditrag.model.rag;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次问答请求，构造后不可变。
 *
 * @param text          问题文本，trim 后不能为空
 * @param topK          检索条数，必须为正
 * @param filter        字段 → 标量值的等值过滤条件，可为空
 * @param verifyNumbers 是否对回答做数值校验
 */
public record RagQuery(
        String text,
        int topK,
        Map<String, Object> filter,
        boolean verifyNumbers
) {
    public RagQuery {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Query cannot be empty");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive, got " + topK);
        }
        if (filter != null) {
            filter.forEach(RagQuery::requireScalar);
        }
        filter = filter == null || filter.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(filter));
    }

    /** 过滤值只能是字符串、数字、布尔或 null；嵌套对象与数组无法表达为等值条件 */
    private static void requireScalar(String field, Object value) {
        if (value instanceof Map || value instanceof Collection || (value != null && value.getClass().isArray())) {
            throw new IllegalArgumentException("Filter value for '" + field + "' must be a scalar");
        }
    }

    public static RagQuery of(String text, int topK) {
        return new RagQuery(text, topK, null, true);
    }
}
