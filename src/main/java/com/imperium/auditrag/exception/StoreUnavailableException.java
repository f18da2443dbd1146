package com.imperium.auditrag.exception;

/**
 * 向量库连接或查询失败。
 */
public class StoreUnavailableException extends ExternalCapabilityException {

    public StoreUnavailableException(String message) {
        super(PipelineFailureKind.RETRIEVAL_UNAVAILABLE, message, null);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(PipelineFailureKind.RETRIEVAL_UNAVAILABLE, message, cause);
    }
}
