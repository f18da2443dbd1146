package com.imperium.auditrag.policy;

/**
 * 上下文预算策略：证据块最大字符数（不含分隔符），以及单次检索条数的默认值与上限。
 */
public final class ContextBudgetPolicy {

    /** 证据块最大字符数；仅限制第二条及以后的条目，首条总会被纳入 */
    public static final int DEFAULT_MAX_CONTEXT_CHARS = 2_000;

    /** 请求未指定 k 时的检索条数 */
    public static final int DEFAULT_TOP_K = 6;

    /** 单次检索条数上限 */
    public static final int MAX_TOP_K = 50;

    /**
     * 解析请求中的 k：null 或非正数回落到默认值，超过上限则截断。
     */
    public static int resolveTopK(Integer requested, int defaultValue) {
        if (requested == null || requested <= 0) {
            return defaultValue;
        }
        return Math.min(requested, MAX_TOP_K);
    }

    private ContextBudgetPolicy() {}
}
