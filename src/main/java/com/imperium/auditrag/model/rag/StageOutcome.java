package com.imperium.auditrag.model.rag;

import com.imperium.auditrag.exception.PipelineFailureKind;

import java.util.Objects;

/**
 * 单个流水线阶段的结果：值 + 失败类型。
 * 降级时 value 是该阶段的兜底值（如空命中列表），detail 记录原因供日志使用。
 */
public record StageOutcome<T>(
        T value,
        PipelineFailureKind kind,
        String detail
) {
    public StageOutcome {
        Objects.requireNonNull(kind, "kind");
    }

    public static <T> StageOutcome<T> ok(T value) {
        return new StageOutcome<>(value, PipelineFailureKind.NONE, null);
    }

    public static <T> StageOutcome<T> degraded(T fallbackValue, PipelineFailureKind kind, String detail) {
        return new StageOutcome<>(fallbackValue, kind, detail);
    }

    public boolean isDegraded() {
        return kind != PipelineFailureKind.NONE;
    }
}
