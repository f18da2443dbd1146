package com.imperium.auditrag.exception;

/**
 * LLM 传输失败，或返回内容无法解析为文本。
 */
public class GenerationUnavailableException extends ExternalCapabilityException {

    public GenerationUnavailableException(String message) {
        super(PipelineFailureKind.GENERATION_FAILURE, message, null);
    }

    public GenerationUnavailableException(String message, Throwable cause) {
        super(PipelineFailureKind.GENERATION_FAILURE, message, cause);
    }
}
