package com.imperium.auditrag.exception;

/**
 * Embedding 模型无法初始化或调用失败。
 */
public class EmbeddingUnavailableException extends ExternalCapabilityException {

    public EmbeddingUnavailableException(String message) {
        super(PipelineFailureKind.RETRIEVAL_UNAVAILABLE, message, null);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(PipelineFailureKind.RETRIEVAL_UNAVAILABLE, message, cause);
    }
}
