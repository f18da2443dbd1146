package com.imperium.auditrag.model.rag;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 检索命中的元数据载荷。
 * <p>
 * 各来源集合（journal_entries、payments、trades ...）字段并不统一，任何字段都可能缺失。
 * 这里对流水线实际读取的少数字段提供类型化访问，其余字段原样保留在 {@link #extras()} 中。
 * JSON 序列化时输出为普通 map。
 */
public final class HitPayload {

    public static final String TEXT = "text";
    public static final String NARRATION = "narration";
    public static final String DESCRIPTION = "description";
    public static final String CONTENT = "content";
    public static final String AMOUNT = "amount";
    public static final String DATE = "date";
    public static final String ACCOUNT_ID = "account_id";
    public static final String TRANSACTION_ID = "transaction_id";
    public static final String COLLECTION = "collection";

    /** 正文字段优先级 */
    public static final List<String> BODY_TEXT_FIELDS = List.of(TEXT, NARRATION, DESCRIPTION, CONTENT);

    /** 元数据标注字段及其固定顺序 */
    public static final List<String> METADATA_FIELDS = List.of(AMOUNT, DATE, ACCOUNT_ID, TRANSACTION_ID, COLLECTION);

    private static final HitPayload EMPTY = new HitPayload(Collections.emptyMap());

    private final Map<String, Object> fields;

    private HitPayload(Map<String, Object> fields) {
        this.fields = fields;
    }

    @JsonCreator
    public static HitPayload of(Map<String, ?> fields) {
        if (fields == null || fields.isEmpty()) {
            return EMPTY;
        }
        return new HitPayload(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    public static HitPayload empty() {
        return EMPTY;
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return fields;
    }

    public Optional<Object> get(String field) {
        return Optional.ofNullable(fields.get(field));
    }

    /**
     * 字段存在且渲染后非空白时返回其文本形式。
     */
    public Optional<String> text(String field) {
        return get(field).map(HitPayload::render).filter(s -> !s.isBlank());
    }

    public Optional<Object> amount() {
        return get(AMOUNT);
    }

    /**
     * 按 text → narration → description → content 取第一个非空字段，都没有时返回空串。
     */
    public String bodyText() {
        for (String field : BODY_TEXT_FIELDS) {
            Optional<String> value = text(field);
            if (value.isPresent()) {
                return value.get();
            }
        }
        return "";
    }

    /** 正文与元数据以外的其余字段 */
    public Map<String, Object> extras() {
        Map<String, Object> rest = new LinkedHashMap<>(fields);
        BODY_TEXT_FIELDS.forEach(rest::remove);
        METADATA_FIELDS.forEach(rest::remove);
        return Collections.unmodifiableMap(rest);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * 标量值的文本形式；浮点数不使用科学计数法（1.0E7 → 10000000）。
     */
    public static String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double d && Double.isFinite(d)) {
            return BigDecimal.valueOf(d).toPlainString();
        }
        if (value instanceof Float f && Float.isFinite(f)) {
            return new BigDecimal(Float.toString(f)).toPlainString();
        }
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HitPayload other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "HitPayload" + fields;
    }
}
