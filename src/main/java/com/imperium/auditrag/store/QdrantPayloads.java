package com.imperium.auditrag.store;

import com.imperium.auditrag.model.rag.Hit;
import com.imperium.auditrag.model.rag.HitPayload;
import io.qdrant.client.grpc.JsonWithInt.Value;
import io.qdrant.client.grpc.Points.PointId;
import io.qdrant.client.grpc.Points.ScoredPoint;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Qdrant 原生命中 → 流水线 {@link Hit} 的转换。
 */
public final class QdrantPayloads {

    private QdrantPayloads() {
    }

    public static Hit toHit(ScoredPoint point) {
        return new Hit(pointId(point.getId()), point.getScore(), HitPayload.of(toJavaMap(point.getPayloadMap())));
    }

    /** 数字 id 输出十进制字符串，UUID id 原样输出 */
    public static String pointId(PointId id) {
        if (id == null) {
            return "";
        }
        return switch (id.getPointIdOptionsCase()) {
            case NUM -> Long.toUnsignedString(id.getNum());
            case UUID -> id.getUuid();
            default -> "";
        };
    }

    static Map<String, Object> toJavaMap(Map<String, Value> payload) {
        if (payload == null || payload.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        payload.forEach((key, value) -> result.put(key, toJava(value)));
        return result;
    }

    static Object toJava(Value value) {
        if (value == null) {
            return null;
        }
        return switch (value.getKindCase()) {
            case INTEGER_VALUE -> value.getIntegerValue();
            case DOUBLE_VALUE -> value.getDoubleValue();
            case STRING_VALUE -> value.getStringValue();
            case BOOL_VALUE -> value.getBoolValue();
            case STRUCT_VALUE -> toJavaMap(value.getStructValue().getFieldsMap());
            case LIST_VALUE -> {
                List<Object> items = new ArrayList<>();
                for (Value item : value.getListValue().getValuesList()) {
                    items.add(toJava(item));
                }
                yield items;
            }
            default -> null;
        };
    }
}
