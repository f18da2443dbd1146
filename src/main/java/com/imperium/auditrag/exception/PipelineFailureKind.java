package com.imperium.auditrag.exception;

/**
 * RAG 流水线中可枚举的失败/降级类型。
 * <p>
 * 除 {@link #FATAL} 外都在所属阶段就地恢复，不会让请求失败。
 */
public enum PipelineFailureKind {

    /** 无失败 */
    NONE,

    /** embedding 或向量库失败，降级为空检索结果 */
    RETRIEVAL_UNAVAILABLE,

    /** LLM 超时、传输错误或返回无法解析/为空，降级为兜底回答 */
    GENERATION_FAILURE,

    /** 数值校验器自身出错，跳过校验 */
    VERIFICATION_INCONCLUSIVE,

    /** 回答中的数值无法在证据中找到，追加提示 */
    NUMERIC_MISMATCH,

    /** 逃逸出所有局部恢复的错误，唯一会设置 RagResult.error 的情况 */
    FATAL
}
