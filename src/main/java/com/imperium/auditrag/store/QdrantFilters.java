package com.imperium.auditrag.store;

import io.qdrant.client.grpc.Points.Condition;
import io.qdrant.client.grpc.Points.Filter;
import io.qdrant.client.grpc.Points.Range;
import org.springframework.lang.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

import static io.qdrant.client.ConditionFactory.isNull;
import static io.qdrant.client.ConditionFactory.match;
import static io.qdrant.client.ConditionFactory.matchKeyword;
import static io.qdrant.client.ConditionFactory.range;

/**
 * 将请求中的字段 → 值映射翻译为 Qdrant 原生过滤条件。
 * <p>
 * 每个键值对都成为 {@code must} 中的一个等值条件（AND 关系）；空或 null 映射表示不限制。
 */
public final class QdrantFilters {

    private QdrantFilters() {
    }

    /**
     * @return Qdrant Filter；filter 为空时返回 null
     */
    @Nullable
    public static Filter toFilter(@Nullable Map<String, ?> filter) {
        if (filter == null || filter.isEmpty()) {
            return null;
        }
        Filter.Builder builder = Filter.newBuilder();
        filter.forEach((field, value) -> builder.addMust(toCondition(field, value)));
        return builder.build();
    }

    static Condition toCondition(String field, @Nullable Object value) {
        if (value == null) {
            return isNull(field);
        }
        if (value instanceof String s) {
            return matchKeyword(field, s);
        }
        if (value instanceof Boolean b) {
            return match(field, b);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return match(field, ((Number) value).longValue());
        }
        if (value instanceof BigInteger big) {
            return match(field, big.longValueExact());
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            double d = ((Number) value).doubleValue();
            // Qdrant 的 match 不支持浮点，用上下界相同的 range 表达等值
            return range(field, Range.newBuilder().setGte(d).setLte(d).build());
        }
        if (value instanceof Map || value instanceof Iterable || value.getClass().isArray()) {
            throw new IllegalArgumentException("Filter value for '" + field + "' must be a scalar");
        }
        return matchKeyword(field, String.valueOf(value));
    }
}
