package com.imperium.auditrag.exception;

/**
 * LLM 调用超过超时时间。
 */
public class GenerationTimeoutException extends ExternalCapabilityException {

    public GenerationTimeoutException(String message) {
        super(PipelineFailureKind.GENERATION_FAILURE, message, null);
    }

    public GenerationTimeoutException(String message, Throwable cause) {
        super(PipelineFailureKind.GENERATION_FAILURE, message, cause);
    }
}
