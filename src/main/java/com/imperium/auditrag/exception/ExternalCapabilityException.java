package com.imperium.auditrag.exception;

import java.util.Objects;

/**
 * 外部能力（embedding、向量库、LLM）调用失败的基类，携带对应的失败类型。
 */
public abstract class ExternalCapabilityException extends Exception {

    private final PipelineFailureKind kind;

    protected ExternalCapabilityException(PipelineFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public PipelineFailureKind getKind() {
        return kind;
    }
}
